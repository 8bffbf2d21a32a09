package io.repokeeper.spi;

import java.nio.file.Path;

public interface Signer
{
    /**
     * Checks that the key is usable. Called once before the signer is handed
     * to a publish task.
     */
    void init()
        throws SignerException;

    // Release -> Release.gpg
    void detachedSign(Path source, Path signature)
        throws SignerException;

    // Release -> InRelease
    void clearSign(Path source, Path destination)
        throws SignerException;
}
