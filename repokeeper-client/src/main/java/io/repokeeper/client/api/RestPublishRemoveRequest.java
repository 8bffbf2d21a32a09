package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestPublishRemoveRequest.class)
public interface RestPublishRemoveRequest
{
    @JsonProperty("Components")
    List<String> getComponents();

    @Value.Default
    @JsonProperty("Signing")
    default RestSigningOptions getSigning()
    {
        return RestSigningOptions.defaults();
    }

    // keep unreferenced files in pool/<component> and dists/<distribution>/<component>
    @JsonProperty("SkipCleanup")
    Optional<Boolean> getSkipCleanup();

    // absent keeps the value of the publish point
    @JsonProperty("MultiDist")
    Optional<Boolean> getMultiDist();

    @Value.Default
    @JsonProperty("ForceOverwrite")
    default boolean getForceOverwrite()
    {
        return false;
    }

    static ImmutableRestPublishRemoveRequest.Builder builder()
    {
        return ImmutableRestPublishRemoveRequest.builder();
    }
}
