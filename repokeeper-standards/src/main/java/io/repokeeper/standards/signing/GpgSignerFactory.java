package io.repokeeper.standards.signing;

import com.google.inject.Inject;
import io.repokeeper.client.config.Config;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerFactory;
import io.repokeeper.spi.SigningOptions;

public class GpgSignerFactory
        implements SignerFactory
{
    private final String gpgCommand;

    @Inject
    public GpgSignerFactory(Config systemConfig)
    {
        this.gpgCommand = systemConfig.get("signing.gpg_command", String.class, "gpg");
    }

    @Override
    public Signer newSigner(SigningOptions options)
    {
        return new GpgSigner(gpgCommand, options);
    }
}
