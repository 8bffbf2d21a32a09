package io.repokeeper.core.publish;

import java.time.Instant;
import org.immutables.value.Value;

@Value.Immutable
public abstract class StoredPublishedRepo
        extends PublishedRepo
{
    public abstract long getId();

    public abstract Instant getCreatedAt();

    public abstract Instant getUpdatedAt();
}
