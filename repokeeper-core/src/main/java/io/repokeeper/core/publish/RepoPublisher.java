package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.repokeeper.core.repository.ModelValidator;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.core.task.TaskDetail;
import io.repokeeper.spi.PackageFile;
import io.repokeeper.spi.PackagePool;
import io.repokeeper.spi.Progress;
import io.repokeeper.spi.PublishEngine;
import io.repokeeper.spi.PublishRequest;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the files of a publish point through the {@link PublishEngine}.
 */
public class RepoPublisher
{
    private static final Logger logger = LoggerFactory.getLogger(RepoPublisher.class);

    private final PublishEngine engine;
    private final PackagePool pool;
    private final SourceStore sourceStore;
    private final PublishedStorageManager storages;

    @Inject
    public RepoPublisher(PublishEngine engine, PackagePool pool, SourceStore sourceStore, PublishedStorageManager storages)
    {
        this.engine = engine;
        this.pool = pool;
        this.sourceStore = sourceStore;
        this.storages = storages;
    }

    /**
     * Publishes every component of repo from the current content of its
     * sources. Returns repo with the architectures that were published, which
     * are derived from the packages when repo lists none.
     */
    public PublishedRepo publish(PublishedRepo repo, Optional<Signer> signer, boolean forceOverwrite,
            Progress progress, TaskDetail detail)
        throws ResourceNotFoundException, IOException, SignerException
    {
        ImmutableMap.Builder<String, List<PackageFile>> components = ImmutableMap.builder();
        int total = 0;
        int refreshed = 0;
        for (Map.Entry<String, UUID> pair : repo.getSources().entrySet()) {
            PublishSource source = sourceStore.getSource(repo.getSourceKind(), pair.getValue());
            progress.printf("Loading packages of %s %s for component %s...",
                    source.getKind(), source.getName(), pair.getKey());
            List<PackageFile> packages = source.loadComplete(sourceStore);
            components.put(pair.getKey(), packages);
            total += packages.size();
            if (!source.isImmutable()) {
                refreshed++;
            }
        }
        Map<String, List<PackageFile>> packagesByComponent = components.build();
        detail.set("total_packages", total);
        // mutable sources are published with whatever they contain now
        detail.set("refreshed_sources", refreshed);

        List<String> architectures = repo.getArchitectures();
        if (architectures.isEmpty()) {
            architectures = guessArchitectures(packagesByComponent);
        }

        PublishedRepo published = ImmutablePublishedRepo.builder()
            .from(repo)
            .architectures(architectures)
            .build();

        logger.info("Publishing {}/{} with components {}", published.getStoragePrefix(),
                published.getDistribution(), published.getComponents());

        PublishRequest request = PublishRequest.builder()
            .storage(storages.getStorage(published.getStorage()))
            .pool(pool)
            .prefix(published.getPrefix())
            .distribution(published.getDistribution())
            .components(packagesByComponent)
            .architectures(published.getArchitectures())
            .label(published.getLabel())
            .origin(published.getOrigin())
            .notAutomatic(published.getNotAutomatic())
            .butAutomaticUpgrades(published.getButAutomaticUpgrades())
            .skipContents(published.getSkipContents())
            .skipBz2(published.getSkipBz2())
            .acquireByHash(published.getAcquireByHash())
            .multiDist(published.getMultiDist())
            .forceOverwrite(forceOverwrite)
            .signer(signer)
            .build();
        engine.publish(request, progress);

        return published;
    }

    private static List<String> guessArchitectures(Map<String, List<PackageFile>> components)
    {
        TreeSet<String> architectures = new TreeSet<>();
        for (List<PackageFile> packages : components.values()) {
            for (PackageFile pkg : packages) {
                if (!pkg.getArchitecture().equals("all") && !pkg.getArchitecture().equals("source")) {
                    architectures.add(pkg.getArchitecture());
                }
            }
        }
        ModelValidator.builder()
            .check("architectures", null, !architectures.isEmpty(),
                    "unable to figure out list of architectures, please supply explicit list")
            .validate("published repository", components.keySet());
        return ImmutableList.copyOf(architectures);
    }
}
