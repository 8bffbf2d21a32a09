package io.repokeeper.core.task;

/**
 * Thrown by a task body to fail with a specific status.
 */
public class TaskFailedException
        extends Exception
{
    private final TaskStatus status;

    public TaskFailedException(TaskStatus status, String message)
    {
        super(message);
        this.status = status;
    }

    public TaskFailedException(TaskStatus status, String message, Throwable cause)
    {
        super(message, cause);
        this.status = status;
    }

    public TaskStatus getStatus()
    {
        return status;
    }
}
