package io.repokeeper.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Backend holding published repository trees.
 *
 * Paths are relative to the backend root and use '/' as separator, e.g.
 * "debian/dists/stable/Release".
 */
public interface PublishedStorage
{
    String getName();

    /**
     * Stores a local file at path, replacing an existing file.
     */
    void putFile(String path, Path sourceFile)
        throws IOException;

    /**
     * Places a pool file at publishedDirectory/fileName.
     *
     * An existing file with the same size and checksum is left as is. An
     * existing file with different content is replaced only when force is set,
     * otherwise PublishedFileConflictException is thrown.
     */
    void linkFromPool(String publishedDirectory, String fileName,
            PackagePool pool, String poolPath, String sha256, boolean force)
        throws IOException;

    boolean fileExists(String path)
        throws IOException;

    /**
     * Lists files under prefix recursively. Returned paths are relative to prefix.
     */
    List<String> filelist(String prefix)
        throws IOException;

    void remove(String path)
        throws IOException;

    void removeDirs(String path, Progress progress)
        throws IOException;
}
