package io.repokeeper.client.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * GPG options shared by the publish requests.
 */
@Value.Immutable
@JsonDeserialize(as = ImmutableRestSigningOptions.class)
public interface RestSigningOptions
{
    /**
     * Set to true to publish without Release.gpg and InRelease.
     */
    @Value.Default
    @JsonProperty("Skip")
    default boolean getSkip()
    {
        return false;
    }

    /**
     * Key name, local to the service user.
     */
    @JsonProperty("GpgKey")
    Optional<String> getGpgKey();

    /**
     * Public keyring file name, local to the service user.
     */
    @JsonProperty("Keyring")
    Optional<String> getKeyring();

    /**
     * Secret keyring file name. Only meaningful for gpg1.
     */
    @Deprecated
    @JsonProperty("SecretKeyring")
    Optional<String> getSecretKeyring();

    @Value.Redacted
    @JsonProperty("Passphrase")
    Optional<String> getPassphrase();

    @JsonProperty("PassphraseFile")
    Optional<String> getPassphraseFile();

    static RestSigningOptions defaults()
    {
        return builder().build();
    }

    static RestSigningOptions skip()
    {
        return builder().skip(true).build();
    }

    static ImmutableRestSigningOptions.Builder builder()
    {
        return ImmutableRestSigningOptions.builder();
    }
}
