package io.repokeeper.core.publish;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.repokeeper.spi.PublishedStorageFactory;

/**
 * Publish operations. PublishEngine, PackagePool and SignerFactory are bound
 * by an extension.
 */
public class PublishModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        Multibinder.newSetBinder(binder, PublishedStorageFactory.class);
        binder.bind(PublishConfig.class).toProvider(PublishConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(PublishedStorageManager.class).in(Scopes.SINGLETON);
        binder.bind(PublishSigners.class).in(Scopes.SINGLETON);
        binder.bind(RepoPublisher.class).in(Scopes.SINGLETON);
        binder.bind(PublishCleaner.class).in(Scopes.SINGLETON);
        binder.bind(PublishApi.class).in(Scopes.SINGLETON);
    }
}
