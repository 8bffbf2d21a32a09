package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.time.Instant;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestTask.class)
public interface RestTask
{
    @JsonProperty("ID")
    long getId();

    @JsonProperty("Name")
    String getName();

    // PENDING, RUNNING, SUCCEEDED or FAILED
    @JsonProperty("State")
    String getState();

    @JsonProperty("CreatedAt")
    Instant getCreatedAt();

    @JsonProperty("StartedAt")
    Optional<Instant> getStartedAt();

    @JsonProperty("FinishedAt")
    Optional<Instant> getFinishedAt();

    @JsonProperty("Error")
    Optional<String> getError();

    @JsonProperty("Warnings")
    List<String> getWarnings();

    static ImmutableRestTask.Builder builder()
    {
        return ImmutableRestTask.builder();
    }
}
