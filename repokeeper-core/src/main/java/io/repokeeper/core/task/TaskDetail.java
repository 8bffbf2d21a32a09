package io.repokeeper.core.task;

import com.google.common.collect.ImmutableList;
import io.repokeeper.client.config.Config;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable, structured status of a running task. Readers get copies.
 */
public class TaskDetail
{
    private final Config values;
    private final List<String> warnings = new ArrayList<>();

    public TaskDetail(Config initial)
    {
        this.values = initial.deepCopy();
    }

    public synchronized TaskDetail set(String key, Object value)
    {
        values.set(key, value);
        return this;
    }

    public synchronized TaskDetail addWarning(String warning)
    {
        warnings.add(warning);
        return this;
    }

    public synchronized Config getValues()
    {
        return values.deepCopy();
    }

    public synchronized List<String> getWarnings()
    {
        return ImmutableList.copyOf(warnings);
    }
}
