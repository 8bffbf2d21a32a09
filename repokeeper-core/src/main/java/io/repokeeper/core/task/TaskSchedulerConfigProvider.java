package io.repokeeper.core.task;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.repokeeper.client.config.Config;

public class TaskSchedulerConfigProvider
    implements Provider<TaskSchedulerConfig>
{
    private final TaskSchedulerConfig config;

    @Inject
    public TaskSchedulerConfigProvider(Config systemConfig)
    {
        this.config = TaskSchedulerConfig.convertFrom(systemConfig);
    }

    @Override
    public TaskSchedulerConfig get()
    {
        return config;
    }
}
