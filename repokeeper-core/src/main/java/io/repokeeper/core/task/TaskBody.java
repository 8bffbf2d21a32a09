package io.repokeeper.core.task;

import io.repokeeper.spi.Progress;

@FunctionalInterface
public interface TaskBody
{
    /**
     * Runs with every resource key of the task held.
     *
     * A thrown exception fails the task. Its status is taken from
     * {@link TaskStatus#ofException(Throwable)}.
     */
    TaskResult run(Progress progress, TaskDetail detail)
        throws Exception;
}
