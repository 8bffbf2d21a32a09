package io.repokeeper.standards;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.Multibinder;
import io.repokeeper.spi.PackagePool;
import io.repokeeper.spi.PublishEngine;
import io.repokeeper.spi.PublishedStorageFactory;
import io.repokeeper.spi.SignerFactory;
import io.repokeeper.standards.publish.StandardPublishEngine;
import io.repokeeper.standards.signing.GpgSignerFactory;
import io.repokeeper.standards.storage.LocalPackagePool;
import io.repokeeper.standards.storage.LocalPublishedStorageFactory;

public class PublishStandardsModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(PublishEngine.class).to(StandardPublishEngine.class).in(Scopes.SINGLETON);
        binder.bind(PackagePool.class).to(LocalPackagePool.class).in(Scopes.SINGLETON);
        binder.bind(SignerFactory.class).to(GpgSignerFactory.class).in(Scopes.SINGLETON);
        Multibinder.newSetBinder(binder, PublishedStorageFactory.class)
            .addBinding().to(LocalPublishedStorageFactory.class);
    }
}
