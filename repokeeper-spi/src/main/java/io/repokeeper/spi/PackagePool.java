package io.repokeeper.spi;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Content-addressed store of package files shared by every publish point.
 */
public interface PackagePool
{
    /**
     * Copies a file into the pool and returns its pool path. Importing the same
     * content twice returns the same path.
     */
    String importFile(Path source, String basename, String md5)
        throws IOException;

    InputStream open(String poolPath)
        throws IOException;

    long size(String poolPath)
        throws IOException;
}
