package io.repokeeper.core.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.repokeeper.core.repository.ModelValidationException;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;

/**
 * Outcome classification of an operation. Codes are HTTP compatible.
 */
public enum TaskStatus
{
    OK(200),
    CREATED(201),
    ACCEPTED(202),
    BAD_REQUEST(400),
    NOT_FOUND(404),
    CONFLICT(409),
    INTERNAL_ERROR(500);

    private final int code;

    private TaskStatus(int code)
    {
        this.code = code;
    }

    @JsonValue
    public int getCode()
    {
        return code;
    }

    public boolean isSuccess()
    {
        return code < 300;
    }

    @JsonCreator
    public static TaskStatus of(int code)
    {
        for (TaskStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }

    public static TaskStatus ofException(Throwable ex)
    {
        if (ex instanceof TaskFailedException) {
            return ((TaskFailedException) ex).getStatus();
        }
        else if (ex instanceof ModelValidationException) {
            return BAD_REQUEST;
        }
        else if (ex instanceof ResourceNotFoundException) {
            return NOT_FOUND;
        }
        else if (ex instanceof ResourceConflictException) {
            return CONFLICT;
        }
        return INTERNAL_ERROR;
    }
}
