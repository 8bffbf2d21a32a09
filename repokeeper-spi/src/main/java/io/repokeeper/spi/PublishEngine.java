package io.repokeeper.spi;

import java.io.IOException;

/**
 * Renders a distribution (indexes, Release files, signatures) and links its
 * package files into the published pool.
 *
 * The engine owns the on-disk layout. Paths returned by the layout methods
 * are relative to the publish prefix.
 */
public interface PublishEngine
{
    void publish(PublishRequest request, Progress progress)
        throws IOException, SignerException;

    /**
     * Directory holding the published pool files of a component.
     */
    String poolDirectory(String distribution, String component, boolean multiDist);

    /**
     * Path of a package file inside the published pool.
     */
    String poolPath(String distribution, String component, boolean multiDist, PackageFile pkg);

    /**
     * Directory holding the indexes of a component.
     */
    String distsDirectory(String distribution, String component);

    /**
     * Directory holding everything written for a distribution except pool files.
     */
    String distsDirectory(String distribution);
}
