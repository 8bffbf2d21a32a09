package io.repokeeper.core.task;

public enum TaskState
{
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isDone()
    {
        return this == SUCCEEDED || this == FAILED;
    }
}
