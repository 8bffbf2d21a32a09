package io.repokeeper.spi;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public interface SigningOptions
{
    Optional<String> getGpgKey();

    Optional<String> getKeyring();

    Optional<String> getSecretKeyring();

    @Value.Redacted
    Optional<String> getPassphrase();

    Optional<String> getPassphraseFile();

    // never prompt for a passphrase
    @Value.Default
    default boolean getBatch()
    {
        return true;
    }

    static ImmutableSigningOptions.Builder builder()
    {
        return ImmutableSigningOptions.builder();
    }
}
