package io.repokeeper.core.database;

/**
 * A database operation failed for a reason other than a missing or
 * conflicting resource.
 */
public class PersistenceException
        extends RuntimeException
{
    public PersistenceException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
