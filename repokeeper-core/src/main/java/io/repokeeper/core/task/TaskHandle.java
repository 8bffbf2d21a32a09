package io.repokeeper.core.task;

import com.google.common.base.Optional;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.repokeeper.client.config.Config;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A submitted task. State changes are made by {@link TaskScheduler} only.
 */
public class TaskHandle
{
    private final long id;
    private final String name;
    private final SortedSet<String> resourceKeys;
    private final Instant createdAt;
    private final TaskOutput output;
    private final TaskDetail detail;
    private final SettableFuture<TaskResult> future = SettableFuture.create();

    private volatile TaskState state = TaskState.PENDING;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    TaskHandle(long id, String name, SortedSet<String> resourceKeys, Instant createdAt, Config initialDetail)
    {
        this.id = id;
        this.name = name;
        this.resourceKeys = resourceKeys;
        this.createdAt = createdAt;
        this.output = new TaskOutput(id);
        this.detail = new TaskDetail(initialDetail);
    }

    public long getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    public SortedSet<String> getResourceKeys()
    {
        return resourceKeys;
    }

    public TaskState getState()
    {
        return state;
    }

    public Instant getCreatedAt()
    {
        return createdAt;
    }

    public Optional<Instant> getStartedAt()
    {
        return Optional.fromNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt()
    {
        return Optional.fromNullable(finishedAt);
    }

    public List<String> getOutput()
    {
        return output.getLines();
    }

    public Config getDetail()
    {
        return detail.getValues();
    }

    public List<String> getWarnings()
    {
        return detail.getWarnings();
    }

    public boolean isDone()
    {
        return state.isDone();
    }

    /**
     * Result of a finished task, absent while pending or running.
     */
    public Optional<TaskResult> getResult()
    {
        if (!future.isDone()) {
            return Optional.absent();
        }
        return Optional.of(getDoneResult());
    }

    public ListenableFuture<TaskResult> getFuture()
    {
        return future;
    }

    /**
     * Waits for completion. Returns absent if the task is still running when
     * the timeout elapses.
     */
    public Optional<TaskResult> await(Duration timeout)
        throws InterruptedException
    {
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        }
        catch (TimeoutException ex) {
            return Optional.absent();
        }
        catch (ExecutionException ex) {
            // the future is only completed by set()
            throw new IllegalStateException(ex.getCause());
        }
    }

    public TaskResult await()
        throws InterruptedException
    {
        try {
            return future.get();
        }
        catch (ExecutionException ex) {
            throw new IllegalStateException(ex.getCause());
        }
    }

    TaskOutput getOutputSink()
    {
        return output;
    }

    TaskDetail getDetailRecord()
    {
        return detail;
    }

    void markRunning()
    {
        startedAt = Instant.now();
        state = TaskState.RUNNING;
    }

    void complete(TaskResult result)
    {
        finishedAt = Instant.now();
        state = result.isSuccess() ? TaskState.SUCCEEDED : TaskState.FAILED;
        future.set(result);
    }

    private TaskResult getDoneResult()
    {
        try {
            return future.get();
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
        catch (ExecutionException ex) {
            throw new IllegalStateException(ex.getCause());
        }
    }

    @Override
    public String toString()
    {
        return "Task{id=" + id + ", name=" + name + ", state=" + state + "}";
    }
}
