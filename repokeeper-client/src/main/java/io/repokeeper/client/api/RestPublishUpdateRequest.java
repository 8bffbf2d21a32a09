package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.util.List;
import org.immutables.value.Value;

/**
 * Updates a publish point.
 *
 * When neither Sources nor Snapshots is given, every bound component is
 * re-published from its current source.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestPublishUpdateRequest.class)
public interface RestPublishUpdateRequest
{
    @JsonProperty("Sources")
    Optional<List<RestSourceBinding>> getSources();

    /**
     * Older form of Sources. Ignored when Sources is given.
     */
    @Deprecated
    @JsonProperty("Snapshots")
    Optional<List<RestSourceBinding>> getSnapshots();

    @Value.Default
    @JsonProperty("ForceOverwrite")
    default boolean getForceOverwrite()
    {
        return false;
    }

    @Value.Default
    @JsonProperty("Signing")
    default RestSigningOptions getSigning()
    {
        return RestSigningOptions.defaults();
    }

    @JsonProperty("SkipContents")
    Optional<Boolean> getSkipContents();

    @JsonProperty("SkipBz2")
    Optional<Boolean> getSkipBz2();

    @JsonProperty("SkipCleanup")
    Optional<Boolean> getSkipCleanup();

    @JsonProperty("AcquireByHash")
    Optional<Boolean> getAcquireByHash();

    // absent keeps the value of the publish point
    @JsonProperty("MultiDist")
    Optional<Boolean> getMultiDist();

    static ImmutableRestPublishUpdateRequest.Builder builder()
    {
        return ImmutableRestPublishUpdateRequest.builder();
    }
}
