package io.repokeeper.core;

import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import com.google.inject.util.Modules;
import io.repokeeper.client.api.JacksonTimeModule;
import io.repokeeper.client.config.Config;
import io.repokeeper.client.config.ConfigElement;
import io.repokeeper.client.config.ConfigFactory;
import io.repokeeper.core.database.DataSourceProvider;
import io.repokeeper.core.database.DatabaseModule;
import io.repokeeper.core.publish.PublishApi;
import io.repokeeper.core.publish.PublishModule;
import io.repokeeper.core.task.TaskModule;
import io.repokeeper.core.task.TaskScheduler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Builds the object graph of an in-process publishing service.
 *
 * <pre>
 * try (RepoKeeperEmbed embed = new RepoKeeperEmbed.Bootstrap()
 *         .setSystemConfig(systemConfig)
 *         .initialize()) {
 *     embed.getPublishApi().list();
 * }
 * </pre>
 */
public class RepoKeeperEmbed
        implements AutoCloseable
{
    public static class Bootstrap
    {
        private final List<Function<? super List<Module>, ? extends Iterable<? extends Module>>> moduleOverrides = new ArrayList<>();
        private ConfigElement systemConfig = ConfigElement.empty();
        private boolean withExtensionLoader = true;

        public Bootstrap addModules(Module... additionalModules)
        {
            return addModules(Arrays.asList(additionalModules));
        }

        public Bootstrap addModules(Iterable<? extends Module> additionalModules)
        {
            final List<Module> copy = ImmutableList.copyOf(additionalModules);
            return overrideModules(modules -> Iterables.concat(modules, copy));
        }

        public Bootstrap overrideModules(Function<? super List<Module>, ? extends Iterable<? extends Module>> function)
        {
            moduleOverrides.add(function);
            return this;
        }

        public Bootstrap overrideModulesWith(Module... overridingModules)
        {
            return overrideModulesWith(Arrays.asList(overridingModules));
        }

        public Bootstrap overrideModulesWith(Iterable<? extends Module> overridingModules)
        {
            return overrideModules(modules -> ImmutableList.of(Modules.override(modules).with(overridingModules)));
        }

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        // set false to leave PublishEngine, PackagePool and SignerFactory to added modules
        public Bootstrap withExtensionLoader(boolean v)
        {
            this.withExtensionLoader = v;
            return this;
        }

        public RepoKeeperEmbed initialize()
        {
            List<Module> modules = standardModules(systemConfig);
            for (Function<? super List<Module>, ? extends Iterable<? extends Module>> override : moduleOverrides) {
                modules = ImmutableList.copyOf(override.apply(modules));
            }
            return new RepoKeeperEmbed(Guice.createInjector(modules));
        }

        private List<Module> standardModules(ConfigElement systemConfig)
        {
            ImmutableList.Builder<Module> builder = ImmutableList.builder();
            builder.addAll(Arrays.asList(
                    new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JacksonTimeModule()),
                    new DatabaseModule(),
                    new TaskModule(),
                    new PublishModule(),
                    (binder) -> {
                        binder.bind(ConfigElement.class).toInstance(systemConfig);
                        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
                        binder.bind(Config.class).toProvider(SystemConfigProvider.class).in(Scopes.SINGLETON);
                    }
                ));
            if (withExtensionLoader) {
                builder.add(new ExtensionServiceLoaderModule());
            }
            return builder.build();
        }
    }

    public static class SystemConfigProvider
            implements Provider<Config>
    {
        private final Config systemConfig;

        @Inject
        public SystemConfigProvider(ConfigElement ce, ConfigFactory cf)
        {
            this.systemConfig = ce.toConfig(cf);
        }

        @Override
        public Config get()
        {
            return systemConfig;
        }
    }

    private final Injector injector;

    RepoKeeperEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public PublishApi getPublishApi()
    {
        return injector.getInstance(PublishApi.class);
    }

    public TaskScheduler getTaskScheduler()
    {
        return injector.getInstance(TaskScheduler.class);
    }

    @Override
    public void close()
    {
        // running tasks may still use the database
        injector.getInstance(TaskScheduler.class).close();
        injector.getInstance(DataSourceProvider.class).close();
    }
}
