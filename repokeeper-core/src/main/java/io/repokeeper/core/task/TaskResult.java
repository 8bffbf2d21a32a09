package io.repokeeper.core.task;

import com.google.common.base.Optional;
import org.immutables.value.Value;

@Value.Immutable
public abstract class TaskResult
{
    public abstract TaskStatus getStatus();

    public abstract Optional<Object> getValue();

    // set when the task failed
    public abstract Optional<String> getError();

    public boolean isSuccess()
    {
        return !getError().isPresent();
    }

    public static TaskResult of(TaskStatus status, Object value)
    {
        return ImmutableTaskResult.builder()
            .status(status)
            .value(Optional.fromNullable(value))
            .build();
    }

    public static TaskResult ofStatus(TaskStatus status)
    {
        return ImmutableTaskResult.builder()
            .status(status)
            .build();
    }

    public static TaskResult failure(TaskStatus status, String message)
    {
        return ImmutableTaskResult.builder()
            .status(status)
            .error(message)
            .build();
    }
}
