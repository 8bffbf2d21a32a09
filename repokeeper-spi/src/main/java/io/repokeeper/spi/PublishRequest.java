package io.repokeeper.spi;

import com.google.common.base.Optional;
import java.util.List;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Everything a PublishEngine needs to write one distribution.
 */
@Value.Immutable
public interface PublishRequest
{
    PublishedStorage getStorage();

    PackagePool getPool();

    String getPrefix();

    String getDistribution();

    // component name -> packages, in component order
    Map<String, List<PackageFile>> getComponents();

    List<String> getArchitectures();

    Optional<String> getLabel();

    Optional<String> getOrigin();

    Optional<String> getNotAutomatic();

    Optional<String> getButAutomaticUpgrades();

    boolean getSkipContents();

    boolean getSkipBz2();

    boolean getAcquireByHash();

    boolean getMultiDist();

    boolean getForceOverwrite();

    // absent when signing is skipped
    Optional<Signer> getSigner();

    static ImmutablePublishRequest.Builder builder()
    {
        return ImmutablePublishRequest.builder();
    }
}
