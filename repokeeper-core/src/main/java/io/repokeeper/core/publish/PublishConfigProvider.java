package io.repokeeper.core.publish;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.repokeeper.client.config.Config;

public class PublishConfigProvider
    implements Provider<PublishConfig>
{
    private final PublishConfig config;

    @Inject
    public PublishConfigProvider(Config systemConfig)
    {
        this.config = PublishConfig.convertFrom(systemConfig);
    }

    @Override
    public PublishConfig get()
    {
        return config;
    }
}
