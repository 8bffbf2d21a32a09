package io.repokeeper.core.repository;

/**
 * An exception thrown when a required resource (published repository, snapshot,
 * local repository, component, task) does not exist.
 *
 * This exception is deterministic.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }

    public ResourceNotFoundException(Throwable cause)
    {
        super(cause);
    }
}
