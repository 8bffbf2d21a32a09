package io.repokeeper.core.task;

import io.repokeeper.client.config.Config;
import org.immutables.value.Value;

@Value.Immutable
public interface TaskSchedulerConfig
{
    // number of task bodies that may run at the same time
    int getMaxConcurrency();

    static int defaultMaxConcurrency()
    {
        return Runtime.getRuntime().availableProcessors() * 2;
    }

    static ImmutableTaskSchedulerConfig.Builder defaultBuilder()
    {
        return ImmutableTaskSchedulerConfig.builder()
            .maxConcurrency(defaultMaxConcurrency());
    }

    static TaskSchedulerConfig convertFrom(Config config)
    {
        int maxConcurrency = config.get("task.max_concurrency", int.class, defaultMaxConcurrency());
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("task.max_concurrency must be larger than 0: " + maxConcurrency);
        }
        return defaultBuilder()
            .maxConcurrency(maxConcurrency)
            .build();
    }
}
