package io.repokeeper.core.publish;

import io.repokeeper.client.config.Config;
import java.time.Duration;
import org.immutables.value.Value;

@Value.Immutable
public interface PublishConfig
{
    // used when a create request omits SkipContents
    boolean getSkipContents();

    // used when a create request omits SkipBz2
    boolean getSkipBz2();

    // how long a synchronous request waits before it gets the running task back
    Duration getSyncTimeout();

    static ImmutablePublishConfig.Builder defaultBuilder()
    {
        return ImmutablePublishConfig.builder()
            .skipContents(false)
            .skipBz2(false)
            .syncTimeout(Duration.ofSeconds(300));
    }

    static PublishConfig convertFrom(Config config)
    {
        long syncTimeout = config.get("api.sync_timeout", long.class, 300L);
        if (syncTimeout <= 0) {
            throw new IllegalArgumentException("api.sync_timeout must be larger than 0: " + syncTimeout);
        }
        return defaultBuilder()
            .skipContents(config.get("publish.skip_contents", boolean.class, false))
            .skipBz2(config.get("publish.skip_bz2", boolean.class, false))
            .syncTimeout(Duration.ofSeconds(syncTimeout))
            .build();
    }
}
