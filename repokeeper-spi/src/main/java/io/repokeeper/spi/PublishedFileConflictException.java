package io.repokeeper.spi;

import java.io.IOException;

/**
 * A published file already exists with different content.
 */
public class PublishedFileConflictException
        extends IOException
{
    public PublishedFileConflictException(String message)
    {
        super(message);
    }
}
