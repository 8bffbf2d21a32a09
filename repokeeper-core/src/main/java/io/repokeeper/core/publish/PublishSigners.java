package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.repokeeper.client.api.RestSigningOptions;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import io.repokeeper.spi.SignerFactory;
import io.repokeeper.spi.SigningOptions;

public class PublishSigners
{
    private final SignerFactory factory;

    @Inject
    public PublishSigners(SignerFactory factory)
    {
        this.factory = factory;
    }

    /**
     * Builds and initializes a signer. Absent when signing is skipped.
     */
    @SuppressWarnings("deprecation")
    public Optional<Signer> getSigner(RestSigningOptions options)
        throws SignerException
    {
        if (options.getSkip()) {
            return Optional.absent();
        }
        Signer signer = factory.newSigner(SigningOptions.builder()
                .gpgKey(options.getGpgKey())
                .keyring(options.getKeyring())
                .secretKeyring(options.getSecretKeyring())
                .passphrase(options.getPassphrase())
                .passphraseFile(options.getPassphraseFile())
                .batch(true)
                .build());
        signer.init();
        return Optional.of(signer);
    }
}
