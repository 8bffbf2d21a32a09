package io.repokeeper.core.task;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.repokeeper.client.config.Config;
import io.repokeeper.client.config.ConfigFactory;
import io.repokeeper.commons.guava.ThrowablesUtil;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs task bodies on a thread pool, serializing tasks whose resource keys
 * intersect.
 *
 * Tasks with disjoint key sets run concurrently up to
 * {@code task.max_concurrency}. Tasks sharing a key run one at a time in
 * submission order. Keys are released when the body returns or throws.
 */
public class TaskScheduler
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ConfigFactory cf;
    private final ExecutorService executor;

    private final ResourceLockManager locks = new ResourceLockManager();
    private final TreeMap<Long, TaskHandle> tasks = new TreeMap<>();
    private final Map<Long, TaskBody> pendingBodies = new HashMap<>();
    private long lastTaskId = 0;
    private boolean closed = false;

    @Inject
    public TaskScheduler(TaskSchedulerConfig config, ConfigFactory cf)
    {
        this.cf = cf;
        this.executor = Executors.newFixedThreadPool(
                config.getMaxConcurrency(),
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("task-%d")
                .build()
                );
    }

    public TaskHandle submit(String name, SortedSet<String> resourceKeys, TaskBody body)
    {
        TaskHandle handle;
        boolean runnable;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("Task scheduler is already closed");
            }
            long id = ++lastTaskId;
            handle = new TaskHandle(id, name, ImmutableSortedSet.copyOfSorted(resourceKeys), Instant.now(), cf.create());
            tasks.put(id, handle);
            pendingBodies.put(id, body);
            runnable = locks.admit(id, handle.getResourceKeys());
        }
        logger.debug("Submitted task {} ({}) with keys {}", handle.getId(), name, handle.getResourceKeys());
        if (runnable) {
            start(handle);
        }
        return handle;
    }

    /**
     * Submits a task and waits up to timeout for it. The returned handle is
     * still running if it did not finish in time.
     */
    public TaskHandle runSync(String name, SortedSet<String> resourceKeys, TaskBody body, Duration timeout)
        throws InterruptedException
    {
        TaskHandle handle = submit(name, resourceKeys, body);
        handle.await(timeout);
        return handle;
    }

    public synchronized List<TaskHandle> listTasks()
    {
        return ImmutableList.copyOf(tasks.values());
    }

    public synchronized TaskHandle getTask(long id)
        throws ResourceNotFoundException
    {
        TaskHandle handle = tasks.get(id);
        if (handle == null) {
            throw new ResourceNotFoundException("Task id=" + id + " not found");
        }
        return handle;
    }

    public List<String> getTaskOutput(long id)
        throws ResourceNotFoundException
    {
        return getTask(id).getOutput();
    }

    public Config getTaskDetail(long id)
        throws ResourceNotFoundException
    {
        return getTask(id).getDetail();
    }

    /**
     * Value returned by a finished task. Absent while the task runs, when it
     * failed, or when it returned no value.
     */
    public Optional<Object> getTaskReturnValue(long id)
        throws ResourceNotFoundException
    {
        Optional<TaskResult> result = getTask(id).getResult();
        if (!result.isPresent()) {
            return Optional.absent();
        }
        return result.get().getValue();
    }

    public TaskHandle waitForTask(long id)
        throws ResourceNotFoundException, InterruptedException
    {
        TaskHandle handle = getTask(id);
        handle.await();
        return handle;
    }

    /**
     * Waits until every task submitted so far is finished.
     */
    public void waitForAllTasks()
        throws InterruptedException
    {
        for (TaskHandle handle : listTasks()) {
            handle.await();
        }
    }

    public synchronized TaskHandle deleteTask(long id)
        throws ResourceNotFoundException, ResourceConflictException
    {
        TaskHandle handle = getTask(id);
        if (!handle.isDone()) {
            throw new ResourceConflictException("Task id=" + id + " is still " + handle.getState().name().toLowerCase());
        }
        tasks.remove(id);
        return handle;
    }

    /**
     * Removes every finished task and returns the number of removed tasks.
     */
    public synchronized int clearFinishedTasks()
    {
        int count = 0;
        Iterator<TaskHandle> it = tasks.values().iterator();
        while (it.hasNext()) {
            if (it.next().isDone()) {
                it.remove();
                count++;
            }
        }
        return count;
    }

    private void start(TaskHandle handle)
    {
        try {
            executor.execute(() -> run(handle));
        }
        catch (RejectedExecutionException ex) {
            logger.warn("Task {} ({}) is dropped because the scheduler is closed", handle.getId(), handle.getName());
            synchronized (this) {
                pendingBodies.remove(handle.getId());
            }
            finish(handle, TaskResult.failure(TaskStatus.INTERNAL_ERROR, "task scheduler is closed"));
        }
    }

    private void run(TaskHandle handle)
    {
        TaskBody body;
        synchronized (this) {
            body = pendingBodies.remove(handle.getId());
        }
        handle.markRunning();
        logger.debug("Running task {} ({})", handle.getId(), handle.getName());

        TaskResult result;
        try {
            result = body.run(handle.getOutputSink(), handle.getDetailRecord());
            if (result == null) {
                result = TaskResult.ofStatus(TaskStatus.OK);
            }
        }
        catch (Throwable ex) {
            TaskStatus status = TaskStatus.ofException(ex);
            if (status == TaskStatus.INTERNAL_ERROR) {
                logger.error("Task {} ({}) failed", handle.getId(), handle.getName(), ex);
            }
            else {
                logger.info("Task {} ({}) failed: {}", handle.getId(), handle.getName(), ThrowablesUtil.messageOf(ex));
            }
            handle.getOutputSink().print("Task failed: " + ThrowablesUtil.messageOf(ex));
            result = TaskResult.failure(status, ThrowablesUtil.messageOf(ex));
        }

        finish(handle, result);
    }

    private void finish(TaskHandle handle, TaskResult result)
    {
        List<TaskHandle> nextHandles = new ArrayList<>();
        synchronized (this) {
            for (long id : locks.release(handle.getId())) {
                nextHandles.add(tasks.get(id));
            }
        }
        handle.complete(result);
        logger.debug("Task {} ({}) finished with {}", handle.getId(), handle.getName(), handle.getState());

        for (TaskHandle nextHandle : nextHandles) {
            start(nextHandle);
        }
    }

    @Override
    public void close()
    {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                logger.warn("Some tasks didn't finish within 30 seconds. Interrupting them.");
                executor.shutdownNow();
            }
        }
        catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
