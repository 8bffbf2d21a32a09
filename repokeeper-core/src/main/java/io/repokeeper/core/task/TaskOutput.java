package io.repokeeper.core.task;

import com.google.common.collect.ImmutableList;
import io.repokeeper.spi.Progress;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only output log of a task.
 */
public class TaskOutput
        implements Progress
{
    private static final Logger logger = LoggerFactory.getLogger(TaskOutput.class);

    private final long taskId;
    private final List<String> lines = new ArrayList<>();

    public TaskOutput(long taskId)
    {
        this.taskId = taskId;
    }

    @Override
    public void print(String message)
    {
        logger.debug("task {}: {}", taskId, message);
        synchronized (lines) {
            lines.add(message);
        }
    }

    public List<String> getLines()
    {
        synchronized (lines) {
            return ImmutableList.copyOf(lines);
        }
    }
}
