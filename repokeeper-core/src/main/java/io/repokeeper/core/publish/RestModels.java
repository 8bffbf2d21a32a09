package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import io.repokeeper.client.api.ImmutableRestPublishedRepo;
import io.repokeeper.client.api.RestPublishedRepo;
import io.repokeeper.client.api.RestSourceBinding;
import io.repokeeper.client.api.RestTask;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.core.task.TaskHandle;
import io.repokeeper.core.task.TaskResult;
import java.util.Map;
import java.util.UUID;

public final class RestModels
{
    private RestModels()
    { }

    public static RestTask task(TaskHandle handle)
    {
        Optional<TaskResult> result = handle.getResult();
        return RestTask.builder()
            .id(handle.getId())
            .name(handle.getName())
            .state(handle.getState().name())
            .createdAt(handle.getCreatedAt())
            .startedAt(handle.getStartedAt())
            .finishedAt(handle.getFinishedAt())
            .error(result.isPresent() ? result.get().getError() : Optional.<String>absent())
            .warnings(handle.getWarnings())
            .build();
    }

    public static RestPublishedRepo publishedRepo(PublishedRepo repo, SourceStore sourceStore)
    {
        ImmutableRestPublishedRepo.Builder builder = RestPublishedRepo.builder()
            .storage(repo.getStorage())
            .prefix(repo.getPrefix())
            .distribution(repo.getDistribution())
            .sourceKind(repo.getSourceKind().getName())
            .architectures(repo.getArchitectures())
            .label(repo.getLabel())
            .origin(repo.getOrigin())
            .notAutomatic(repo.getNotAutomatic())
            .butAutomaticUpgrades(repo.getButAutomaticUpgrades())
            .skipContents(repo.getSkipContents())
            .skipBz2(repo.getSkipBz2())
            .acquireByHash(repo.getAcquireByHash())
            .multiDist(repo.getMultiDist());
        for (Map.Entry<String, UUID> pair : repo.getSources().entrySet()) {
            builder.addSources(RestSourceBinding.of(pair.getKey(), sourceName(repo, pair.getValue(), sourceStore)));
        }
        return builder.build();
    }

    private static String sourceName(PublishedRepo repo, UUID uuid, SourceStore sourceStore)
    {
        try {
            return sourceStore.getSource(repo.getSourceKind(), uuid).getName();
        }
        catch (ResourceNotFoundException ex) {
            // the source was deleted after publishing
            return uuid.toString();
        }
    }
}
