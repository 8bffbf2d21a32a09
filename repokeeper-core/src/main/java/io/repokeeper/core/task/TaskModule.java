package io.repokeeper.core.task;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;

public class TaskModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(TaskSchedulerConfig.class).toProvider(TaskSchedulerConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(TaskScheduler.class).in(Scopes.SINGLETON);
    }
}
