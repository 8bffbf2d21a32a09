package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.repokeeper.client.api.RestPublishCreateRequest;
import io.repokeeper.client.api.RestPublishRemoveRequest;
import io.repokeeper.client.api.RestPublishUpdateRequest;
import io.repokeeper.client.api.RestPublishedRepo;
import io.repokeeper.client.api.RestSigningOptions;
import io.repokeeper.client.api.RestSourceBinding;
import io.repokeeper.commons.guava.ThrowablesUtil;
import io.repokeeper.core.database.PersistenceException;
import io.repokeeper.core.repository.ModelValidator;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceKeys;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceKind;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.core.task.TaskDetail;
import io.repokeeper.core.task.TaskFailedException;
import io.repokeeper.core.task.TaskHandle;
import io.repokeeper.core.task.TaskResult;
import io.repokeeper.core.task.TaskScheduler;
import io.repokeeper.core.task.TaskStatus;
import io.repokeeper.spi.Progress;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations on publish points.
 *
 * Requests are validated and their sources resolved before a task is
 * submitted, so malformed requests fail immediately. Everything that reads
 * or writes published files or the stored publish point runs in a task
 * holding the resource keys of the operation, and starts by reloading the
 * publish point from the store.
 *
 * With async set, or when a task runs longer than {@code api.sync_timeout},
 * the response is ACCEPTED with the task to poll.
 */
public class PublishApi
{
    private static final Logger logger = LoggerFactory.getLogger(PublishApi.class);

    public static final String DEFAULT_COMPONENT = "main";
    public static final String DEFAULT_DISTRIBUTION = "unstable";

    private final TaskScheduler scheduler;
    private final PublishedRepoStore repoStore;
    private final SourceStore sourceStore;
    private final RepoPublisher publisher;
    private final PublishCleaner cleaner;
    private final PublishSigners signers;
    private final PublishConfig config;

    @Inject
    public PublishApi(TaskScheduler scheduler, PublishedRepoStore repoStore, SourceStore sourceStore,
            RepoPublisher publisher, PublishCleaner cleaner, PublishSigners signers, PublishConfig config)
    {
        this.scheduler = scheduler;
        this.repoStore = repoStore;
        this.sourceStore = sourceStore;
        this.publisher = publisher;
        this.cleaner = cleaner;
        this.signers = signers;
        this.config = config;
    }

    public List<RestPublishedRepo> list()
    {
        ImmutableList.Builder<RestPublishedRepo> builder = ImmutableList.builder();
        for (StoredPublishedRepo repo : repoStore.getPublishedRepos()) {
            builder.add(RestModels.publishedRepo(repo, sourceStore));
        }
        return builder.build();
    }

    public RestPublishedRepo get(String prefixParam, String distribution)
        throws ResourceNotFoundException
    {
        PublishPrefix prefix = PublishPrefix.parse(prefixParam);
        return RestModels.publishedRepo(
                repoStore.getPublishedRepo(prefix.getStorage(), prefix.getPrefix(), distribution),
                sourceStore);
    }

    public PublishResponse create(String prefixParam, RestPublishCreateRequest request, boolean async)
        throws ResourceNotFoundException, TaskFailedException, InterruptedException
    {
        PublishPrefix prefix = PublishPrefix.parse(prefixParam);

        Optional<SourceKind> kind = SourceKind.fromName(request.getSourceKind());
        ModelValidator.builder()
            .check("Sources", null, !request.getSources().isEmpty(), "unable to publish: sources are empty")
            .check("SourceKind", request.getSourceKind(), kind.isPresent(), "unknown SourceKind")
            .validate("publish request", request);

        Map<String, PublishSource> bindings = resolveBindings(kind.get(), request.getSources(), "unable to publish: ");

        String distribution;
        if (request.getDistribution().isPresent() && !request.getDistribution().get().isEmpty()) {
            distribution = request.getDistribution().get();
        }
        else {
            distribution = defaultDistribution(bindings);
        }

        // checks prefix, distribution and component names
        PublishedRepo draft = ImmutablePublishedRepo.builder()
            .uuid(UUID.randomUUID())
            .storage(prefix.getStorage())
            .prefix(prefix.getPrefix())
            .distribution(distribution)
            .sourceKind(kind.get())
            .sources(sourceUuids(bindings))
            .architectures(request.getArchitectures())
            .label(request.getLabel())
            .origin(request.getOrigin())
            .notAutomatic(request.getNotAutomatic())
            .butAutomaticUpgrades(request.getButAutomaticUpgrades())
            .skipContents(request.getSkipContents().or(config.getSkipContents()))
            .skipBz2(request.getSkipBz2().or(config.getSkipBz2()))
            .acquireByHash(request.getAcquireByHash().or(false))
            .multiDist(request.getMultiDist())
            .build();

        Optional<Signer> signer = getSigner(request.getSigning());

        String taskName = String.format(Locale.ENGLISH, "Publish %s: %s",
                kind.get().getName(), String.join(", ", sourceNames(bindings)));

        TaskHandle handle = scheduler.submit(taskName,
                ResourceKeys.forCreate(draft.getStorage(), draft.getPrefix(), draft.getDistribution(), bindings.values()),
                (progress, detail) -> {
                    // duplicates are detected here, under the key of the publish point
                    Optional<StoredPublishedRepo> duplicate = repoStore.findPublishedRepo(
                            draft.getStorage(), draft.getPrefix(), draft.getDistribution());
                    if (duplicate.isPresent()) {
                        throw new ResourceConflictException("prefix/distribution already used by another published repo: "
                                + describe(duplicate.get()));
                    }

                    PublishedRepo published = publish(draft, signer, request.getForceOverwrite(),
                            progress, detail, "unable to publish: ");
                    StoredPublishedRepo stored = store(() -> repoStore.addPublishedRepo(published));

                    logger.info("Published {}", describe(stored));
                    return TaskResult.of(TaskStatus.CREATED, RestModels.publishedRepo(stored, sourceStore));
                });
        return respond(handle, async);
    }

    public PublishResponse update(String prefixParam, String distribution, RestPublishUpdateRequest request, boolean async)
        throws ResourceNotFoundException, TaskFailedException, InterruptedException
    {
        PublishPrefix prefix = PublishPrefix.parse(prefixParam);
        StoredPublishedRepo current = getPublishedRepo(prefix, distribution, "unable to update: ");

        SourceBindings bindings = SourceBindings.fromUpdate(request);
        ModelValidator.builder()
            .check("Snapshots", null, !(bindings.isLegacyInput() && current.getSourceKind() == SourceKind.LOCAL),
                    "snapshots shouldn't be given when updating local repo")
            .validate("publish update request", request);

        Map<String, PublishSource> resolved;
        if (bindings.isRefresh()) {
            resolved = boundSources(current, "unable to update: ");
        }
        else {
            resolved = resolveBindings(current.getSourceKind(), bindings.getBindings(), "unable to update: ");
        }

        // fails on invalid bindings before anything is scheduled
        SourceDelta preview = applyBindings(current, bindings, resolved);

        Optional<Signer> signer = getSigner(request.getSigning());
        boolean skipCleanup = request.getSkipCleanup().or(false);

        String taskName = String.format(Locale.ENGLISH, "Update published %s (%s): %s",
                current.getSourceKind().getName(),
                String.join(" ", preview.getRepo().getComponents()),
                String.join(", ", sourceNames(resolved)));

        TaskHandle handle = scheduler.submit(taskName,
                ResourceKeys.forUpdate(current.getStorage(), current.getPrefix(), current.getDistribution(), resolved.values()),
                (progress, detail) -> {
                    StoredPublishedRepo fresh = repoStore.getPublishedRepo(
                            current.getStorage(), current.getPrefix(), current.getDistribution());
                    bindings.warnIfLegacy(progress);

                    SourceDelta delta = applyBindings(fresh, bindings, resolved);
                    PublishedRepo changed = ImmutablePublishedRepo.builder()
                        .from(delta.getRepo())
                        .skipContents(request.getSkipContents().or(fresh.getSkipContents()))
                        .skipBz2(request.getSkipBz2().or(fresh.getSkipBz2()))
                        .acquireByHash(request.getAcquireByHash().or(fresh.getAcquireByHash()))
                        .multiDist(request.getMultiDist().or(fresh.getMultiDist()))
                        .build();

                    PublishedRepo published = publish(changed, signer, request.getForceOverwrite(),
                            progress, detail, "unable to update: ");
                    StoredPublishedRepo stored = store(() -> repoStore.updatePublishedRepo(published));

                    if (!skipCleanup) {
                        cleanup(stored, delta.getTouched(), delta.getRemoved(), progress, detail);
                    }

                    logger.info("Updated {}: removed={} updated={} added={}", describe(stored),
                            delta.getRemoved(), delta.getUpdated(), delta.getAdded());
                    return TaskResult.of(TaskStatus.OK, RestModels.publishedRepo(stored, sourceStore));
                });
        return respond(handle, async);
    }

    public PublishResponse removeComponents(String prefixParam, String distribution, RestPublishRemoveRequest request, boolean async)
        throws ResourceNotFoundException, TaskFailedException, InterruptedException
    {
        PublishPrefix prefix = PublishPrefix.parse(prefixParam);
        List<String> components = request.getComponents();
        ModelValidator.builder()
            .checkNotEmpty("Components", components)
            .checkUnique("Components", components)
            .validate("component removal request", request);

        StoredPublishedRepo current = getPublishedRepo(prefix, distribution, "unable to update: ");
        try {
            // every name is checked before the task runs
            current.removeComponents(components);
        }
        catch (ResourceNotFoundException ex) {
            throw new ResourceNotFoundException("unable to update: " + ex.getMessage());
        }

        Optional<Signer> signer = getSigner(request.getSigning());
        boolean skipCleanup = request.getSkipCleanup().or(false);

        String taskName = String.format(Locale.ENGLISH, "Remove components '%s' from publish %s (%s)",
                String.join(",", components), current.getStoragePrefix(), current.getDistribution());

        TaskHandle handle = scheduler.submit(taskName,
                ResourceKeys.forPublishPoint(current.getStorage(), current.getPrefix(), current.getDistribution()),
                (progress, detail) -> {
                    StoredPublishedRepo fresh = repoStore.getPublishedRepo(
                            current.getStorage(), current.getPrefix(), current.getDistribution());

                    SourceDelta delta = fresh.removeComponents(components);
                    PublishedRepo changed = ImmutablePublishedRepo.builder()
                        .from(delta.getRepo())
                        .multiDist(request.getMultiDist().or(fresh.getMultiDist()))
                        .build();

                    PublishedRepo published = publish(changed, signer, request.getForceOverwrite(),
                            progress, detail, "unable to update: ");
                    StoredPublishedRepo stored = store(() -> repoStore.updatePublishedRepo(published));

                    if (!skipCleanup) {
                        cleanup(stored, delta.getRemoved(), delta.getRemoved(), progress, detail);
                    }

                    logger.info("Removed components {} from {}", delta.getRemoved(), describe(stored));
                    return TaskResult.of(TaskStatus.OK, RestModels.publishedRepo(stored, sourceStore));
                });
        return respond(handle, async);
    }

    /**
     * Deletes a publish point.
     *
     * Without force, a failure to remove published files fails the task and
     * keeps the publish point. With skipCleanup, published files are left in
     * place.
     */
    public PublishResponse drop(String prefixParam, String distribution, boolean force, boolean skipCleanup, boolean async)
        throws ResourceNotFoundException, InterruptedException
    {
        PublishPrefix prefix = PublishPrefix.parse(prefixParam);
        StoredPublishedRepo current = getPublishedRepo(prefix, distribution, "unable to drop: ");

        String taskName = String.format(Locale.ENGLISH, "Delete published %s (%s)",
                current.getStoragePrefix(), current.getDistribution());

        TaskHandle handle = scheduler.submit(taskName,
                ResourceKeys.forPublishPoint(current.getStorage(), current.getPrefix(), current.getDistribution()),
                (progress, detail) -> {
                    StoredPublishedRepo fresh = repoStore.getPublishedRepo(
                            current.getStorage(), current.getPrefix(), current.getDistribution());
                    List<StoredPublishedRepo> others = new ArrayList<>();
                    for (StoredPublishedRepo repo : repoStore.getPublishedReposByPrefix(fresh.getStorage(), fresh.getPrefix())) {
                        if (!repo.getUuid().equals(fresh.getUuid())) {
                            others.add(repo);
                        }
                    }

                    if (!skipCleanup) {
                        try {
                            cleaner.removePublishedFiles(fresh, others, progress);
                        }
                        catch (IOException ex) {
                            if (!force) {
                                throw new TaskFailedException(TaskStatus.INTERNAL_ERROR,
                                        "unable to drop: published files removal failed, use force to override: "
                                        + ThrowablesUtil.messageOf(ex), ex);
                            }
                            warnCleanupFailure(fresh, ex, progress, detail);
                        }
                    }

                    store(() -> {
                        repoStore.deletePublishedRepo(fresh.getUuid());
                        return fresh;
                    });

                    if (!skipCleanup) {
                        List<String> shared = PublishCleaner.sharedComponents(fresh, others);
                        cleanup(fresh, shared, ImmutableList.of(), progress, detail);
                    }

                    logger.info("Dropped {}", describe(fresh));
                    progress.printf("Published repository %s has been removed", describe(fresh));
                    return TaskResult.ofStatus(TaskStatus.OK);
                });
        return respond(handle, async);
    }

    /**
     * Reads a boolean query flag. "1", "true" and "yes" are true.
     */
    public static boolean parseFlag(String value)
    {
        if (value == null) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ENGLISH)) {
        case "1":
        case "true":
        case "yes":
            return true;
        default:
            return false;
        }
    }

    private StoredPublishedRepo getPublishedRepo(PublishPrefix prefix, String distribution, String errorPrefix)
        throws ResourceNotFoundException
    {
        try {
            return repoStore.getPublishedRepo(prefix.getStorage(), prefix.getPrefix(), distribution);
        }
        catch (ResourceNotFoundException ex) {
            throw new ResourceNotFoundException(errorPrefix + ex.getMessage());
        }
    }

    // component -> source, in request order
    private Map<String, PublishSource> resolveBindings(SourceKind kind, List<RestSourceBinding> bindings, String errorPrefix)
        throws ResourceNotFoundException
    {
        Map<String, PublishSource> resolved = new LinkedHashMap<>();
        ModelValidator validator = ModelValidator.builder();
        for (RestSourceBinding binding : bindings) {
            PublishSource source;
            try {
                source = sourceStore.getSourceByName(kind, binding.getName());
            }
            catch (ResourceNotFoundException ex) {
                throw new ResourceNotFoundException(errorPrefix + ex.getMessage());
            }
            String component = binding.getComponent().isEmpty()
                ? source.getDefaultComponent().or(DEFAULT_COMPONENT)
                : binding.getComponent();
            validator.check("Sources", component, !resolved.containsKey(component), "duplicate component name");
            resolved.put(component, source);
        }
        validator.validate("source bindings", bindings);
        return resolved;
    }

    private Map<String, PublishSource> boundSources(PublishedRepo repo, String errorPrefix)
        throws ResourceNotFoundException
    {
        Map<String, PublishSource> bound = new LinkedHashMap<>();
        for (Map.Entry<String, UUID> pair : repo.getSources().entrySet()) {
            try {
                bound.put(pair.getKey(), sourceStore.getSource(repo.getSourceKind(), pair.getValue()));
            }
            catch (ResourceNotFoundException ex) {
                throw new ResourceNotFoundException(errorPrefix + ex.getMessage());
            }
        }
        return bound;
    }

    private static SourceDelta applyBindings(PublishedRepo repo, SourceBindings bindings, Map<String, PublishSource> resolved)
    {
        if (bindings.isRefresh()) {
            return repo.refreshAll();
        }
        return repo.updateSources(resolved);
    }

    private static String defaultDistribution(Map<String, PublishSource> bindings)
    {
        for (PublishSource source : bindings.values()) {
            if (source.getDefaultDistribution().isPresent()) {
                return source.getDefaultDistribution().get();
            }
        }
        return DEFAULT_DISTRIBUTION;
    }

    private static SortedMap<String, UUID> sourceUuids(Map<String, PublishSource> bindings)
    {
        SortedMap<String, UUID> uuids = new TreeMap<>();
        for (Map.Entry<String, PublishSource> pair : bindings.entrySet()) {
            uuids.put(pair.getKey(), pair.getValue().getUuid());
        }
        return uuids;
    }

    private static List<String> sourceNames(Map<String, PublishSource> bindings)
    {
        List<String> names = new ArrayList<>();
        for (PublishSource source : bindings.values()) {
            names.add(source.getName());
        }
        return names;
    }

    private Optional<Signer> getSigner(RestSigningOptions options)
        throws TaskFailedException
    {
        try {
            return signers.getSigner(options);
        }
        catch (SignerException ex) {
            throw new TaskFailedException(TaskStatus.INTERNAL_ERROR,
                    "unable to initialize GPG signer: " + ex.getMessage(), ex);
        }
    }

    private PublishedRepo publish(PublishedRepo repo, Optional<Signer> signer, boolean forceOverwrite,
            Progress progress, TaskDetail detail, String errorPrefix)
        throws ResourceNotFoundException, TaskFailedException
    {
        try {
            return publisher.publish(repo, signer, forceOverwrite, progress, detail);
        }
        catch (IOException | SignerException ex) {
            throw new TaskFailedException(TaskStatus.INTERNAL_ERROR, errorPrefix + ThrowablesUtil.messageOf(ex), ex);
        }
    }

    private interface StoreAction<T>
    {
        T run()
            throws ResourceConflictException, ResourceNotFoundException;
    }

    // published files are not rolled back when this fails; publishing again with ForceOverwrite recovers
    private static <T> T store(StoreAction<T> action)
        throws ResourceConflictException, ResourceNotFoundException, TaskFailedException
    {
        try {
            return action.run();
        }
        catch (PersistenceException ex) {
            throw new TaskFailedException(TaskStatus.INTERNAL_ERROR, "unable to save to DB: " + ex.getMessage(), ex);
        }
    }

    private void cleanup(PublishedRepo repo, List<String> components, List<String> removedComponents,
            Progress progress, TaskDetail detail)
    {
        try {
            cleaner.cleanupPrefixComponentFiles(repo, components, progress);
            cleaner.removeComponentIndexes(repo, removedComponents, progress);
        }
        catch (IOException | ResourceNotFoundException ex) {
            warnCleanupFailure(repo, ex, progress, detail);
        }
    }

    private static void warnCleanupFailure(PublishedRepo repo, Exception ex, Progress progress, TaskDetail detail)
    {
        String message = "cleanup of " + describe(repo) + " failed: " + ThrowablesUtil.messageOf(ex);
        logger.warn("Cleanup of {} failed", describe(repo), ex);
        progress.print("Warning: " + message);
        detail.addWarning(message);
    }

    private static String describe(PublishedRepo repo)
    {
        return repo.getStoragePrefix() + "/" + repo.getDistribution();
    }

    private PublishResponse respond(TaskHandle handle, boolean async)
        throws InterruptedException
    {
        if (!async) {
            Optional<TaskResult> result = handle.await(config.getSyncTimeout());
            if (result.isPresent()) {
                return finished(handle, result.get());
            }
            logger.debug("Task {} ({}) is still running after {}", handle.getId(), handle.getName(), config.getSyncTimeout());
        }
        return PublishResponse.builder()
            .status(TaskStatus.ACCEPTED)
            .task(RestModels.task(handle))
            .build();
    }

    private static PublishResponse finished(TaskHandle handle, TaskResult result)
    {
        ImmutablePublishResponse.Builder builder = PublishResponse.builder()
            .status(result.getStatus())
            .task(RestModels.task(handle))
            .error(result.getError());
        if (result.getValue().isPresent() && result.getValue().get() instanceof RestPublishedRepo) {
            builder.publishedRepo((RestPublishedRepo) result.getValue().get());
        }
        return builder.build();
    }
}
