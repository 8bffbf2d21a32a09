package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestPublishCreateRequest.class)
public interface RestPublishCreateRequest
{
    // "snapshot" or "local"
    @JsonProperty("SourceKind")
    String getSourceKind();

    @JsonProperty("Sources")
    List<RestSourceBinding> getSources();

    @JsonProperty("Distribution")
    Optional<String> getDistribution();

    @JsonProperty("Label")
    Optional<String> getLabel();

    @JsonProperty("Origin")
    Optional<String> getOrigin();

    @JsonProperty("NotAutomatic")
    Optional<String> getNotAutomatic();

    @JsonProperty("ButAutomaticUpgrades")
    Optional<String> getButAutomaticUpgrades();

    @Value.Default
    @JsonProperty("ForceOverwrite")
    default boolean getForceOverwrite()
    {
        return false;
    }

    @JsonProperty("SkipContents")
    Optional<Boolean> getSkipContents();

    @JsonProperty("SkipBz2")
    Optional<Boolean> getSkipBz2();

    @JsonProperty("Architectures")
    List<String> getArchitectures();

    @Value.Default
    @JsonProperty("Signing")
    default RestSigningOptions getSigning()
    {
        return RestSigningOptions.defaults();
    }

    @JsonProperty("AcquireByHash")
    Optional<Boolean> getAcquireByHash();

    @Value.Default
    @JsonProperty("MultiDist")
    default boolean getMultiDist()
    {
        return false;
    }

    static ImmutableRestPublishCreateRequest.Builder builder()
    {
        return ImmutableRestPublishCreateRequest.builder();
    }
}
