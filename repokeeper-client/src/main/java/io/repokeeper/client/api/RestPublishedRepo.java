package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
@JsonDeserialize(as = ImmutableRestPublishedRepo.class)
public interface RestPublishedRepo
{
    @JsonProperty("Storage")
    String getStorage();

    @JsonProperty("Prefix")
    String getPrefix();

    @JsonProperty("Distribution")
    String getDistribution();

    @JsonProperty("SourceKind")
    String getSourceKind();

    @JsonProperty("Sources")
    List<RestSourceBinding> getSources();

    @JsonProperty("Architectures")
    List<String> getArchitectures();

    @JsonProperty("Label")
    Optional<String> getLabel();

    @JsonProperty("Origin")
    Optional<String> getOrigin();

    @JsonProperty("NotAutomatic")
    Optional<String> getNotAutomatic();

    @JsonProperty("ButAutomaticUpgrades")
    Optional<String> getButAutomaticUpgrades();

    @JsonProperty("SkipContents")
    boolean getSkipContents();

    @JsonProperty("SkipBz2")
    boolean getSkipBz2();

    @JsonProperty("AcquireByHash")
    boolean getAcquireByHash();

    @JsonProperty("MultiDist")
    boolean getMultiDist();

    static ImmutableRestPublishedRepo.Builder builder()
    {
        return ImmutableRestPublishedRepo.builder();
    }
}
