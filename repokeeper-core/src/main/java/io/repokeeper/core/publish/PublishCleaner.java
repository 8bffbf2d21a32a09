package io.repokeeper.core.publish;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.spi.PackageFile;
import io.repokeeper.spi.Progress;
import io.repokeeper.spi.PublishEngine;
import io.repokeeper.spi.PublishedStorage;
import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes published files that no publish point references any more.
 *
 * Publish points under the same (storage, prefix) share the pool directory,
 * so a pool file is kept as long as any of them references it.
 */
public class PublishCleaner
{
    private static final Logger logger = LoggerFactory.getLogger(PublishCleaner.class);

    private final PublishedRepoStore repoStore;
    private final SourceStore sourceStore;
    private final PublishEngine engine;
    private final PublishedStorageManager storages;

    @Inject
    public PublishCleaner(PublishedRepoStore repoStore, SourceStore sourceStore,
            PublishEngine engine, PublishedStorageManager storages)
    {
        this.repoStore = repoStore;
        this.sourceStore = sourceStore;
        this.engine = engine;
        this.storages = storages;
    }

    /**
     * Deletes the pool files of components that are not referenced by any
     * stored publish point under the prefix of repo. Returns the number of
     * removed files.
     */
    public int cleanupPrefixComponentFiles(PublishedRepo repo, Collection<String> components, Progress progress)
        throws IOException, ResourceNotFoundException
    {
        if (components.isEmpty()) {
            return 0;
        }
        PublishedStorage storage = storages.getStorage(repo.getStorage());
        progress.printf("Cleaning up prefix %s components %s...",
                repo.getStoragePrefix(), String.join(", ", components));

        Set<String> referenced = new HashSet<>();
        for (StoredPublishedRepo other : repoStore.getPublishedReposByPrefix(repo.getStorage(), repo.getPrefix())) {
            for (Map.Entry<String, UUID> pair : other.getSources().entrySet()) {
                if (!components.contains(pair.getKey())) {
                    continue;
                }
                PublishSource source = sourceStore.getSource(other.getSourceKind(), pair.getValue());
                for (PackageFile pkg : source.loadComplete(sourceStore)) {
                    referenced.add(engine.poolPath(other.getDistribution(), pair.getKey(), other.getMultiDist(), pkg));
                }
            }
        }

        Set<String> directories = new TreeSet<>();
        for (String component : components) {
            directories.add(engine.poolDirectory(repo.getDistribution(), component, false));
            if (repo.getMultiDist()) {
                directories.add(engine.poolDirectory(repo.getDistribution(), component, true));
            }
        }

        int removed = 0;
        for (String directory : directories) {
            for (String file : storage.filelist(join(repo.getPrefix(), directory))) {
                String path = directory + "/" + file;
                if (!referenced.contains(path)) {
                    storage.remove(join(repo.getPrefix(), path));
                    removed++;
                }
            }
        }
        logger.debug("Removed {} unreferenced files from {}", removed, repo.getStoragePrefix());
        progress.printf("Removed %d unreferenced files", removed);
        return removed;
    }

    /**
     * Removes the indexes of components that are no longer bound to repo.
     */
    public void removeComponentIndexes(PublishedRepo repo, Collection<String> components, Progress progress)
        throws IOException, ResourceNotFoundException
    {
        PublishedStorage storage = storages.getStorage(repo.getStorage());
        for (String component : components) {
            storage.removeDirs(join(repo.getPrefix(), engine.distsDirectory(repo.getDistribution(), component)), progress);
        }
    }

    /**
     * Removes the files of a publish point that is about to be dropped.
     *
     * When no other publish point shares the prefix, the whole dists and pool
     * trees go. Otherwise only dists/&lt;distribution&gt; and the pool
     * directories of components the others do not use.
     */
    public void removePublishedFiles(PublishedRepo repo, List<? extends PublishedRepo> others, Progress progress)
        throws IOException, ResourceNotFoundException
    {
        PublishedStorage storage = storages.getStorage(repo.getStorage());
        if (others.isEmpty()) {
            progress.printf("Removing %s...", join(repo.getPrefix(), "dists"));
            storage.removeDirs(join(repo.getPrefix(), "dists"), progress);
            progress.printf("Removing %s...", join(repo.getPrefix(), "pool"));
            storage.removeDirs(join(repo.getPrefix(), "pool"), progress);
            return;
        }

        String dists = join(repo.getPrefix(), engine.distsDirectory(repo.getDistribution()));
        progress.printf("Removing %s...", dists);
        storage.removeDirs(dists, progress);

        Set<String> shared = new HashSet<>(sharedComponents(repo, others));
        for (String component : repo.getComponents()) {
            if (repo.getMultiDist()) {
                // per-distribution pool directories are never shared
                storage.removeDirs(join(repo.getPrefix(), engine.poolDirectory(repo.getDistribution(), component, true)), progress);
            }
            if (!shared.contains(component)) {
                storage.removeDirs(join(repo.getPrefix(), engine.poolDirectory(repo.getDistribution(), component, false)), progress);
            }
        }
    }

    /**
     * Components of repo that are also bound in one of others.
     */
    public static List<String> sharedComponents(PublishedRepo repo, List<? extends PublishedRepo> others)
    {
        Set<String> shared = new LinkedHashSet<>();
        for (String component : repo.getComponents()) {
            for (PublishedRepo other : others) {
                if (other.getSources().containsKey(component)) {
                    shared.add(component);
                    break;
                }
            }
        }
        return ImmutableList.copyOf(shared);
    }

    static String join(String prefix, String path)
    {
        if (prefix.equals(".")) {
            return path;
        }
        return prefix + "/" + path;
    }
}
