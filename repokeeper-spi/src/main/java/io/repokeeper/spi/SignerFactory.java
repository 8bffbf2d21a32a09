package io.repokeeper.spi;

public interface SignerFactory
{
    Signer newSigner(SigningOptions options);
}
