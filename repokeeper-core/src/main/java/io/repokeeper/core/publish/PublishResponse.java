package io.repokeeper.core.publish;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.repokeeper.client.api.RestPublishedRepo;
import io.repokeeper.client.api.RestTask;
import io.repokeeper.core.task.TaskStatus;
import org.immutables.value.Value;

/**
 * Outcome of a publish operation.
 *
 * ACCEPTED carries the task only: the caller asked for an asynchronous run or
 * the task did not finish within the synchronous timeout.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePublishResponse.class)
public interface PublishResponse
{
    @JsonProperty("Status")
    TaskStatus getStatus();

    @JsonProperty("PublishedRepo")
    Optional<RestPublishedRepo> getPublishedRepo();

    @JsonProperty("Task")
    Optional<RestTask> getTask();

    @JsonProperty("Error")
    Optional<String> getError();

    static ImmutablePublishResponse.Builder builder()
    {
        return ImmutablePublishResponse.builder();
    }
}
