package io.repokeeper.core.repository;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import java.time.Instant;
import java.util.UUID;
import org.immutables.value.Value;

/**
 * Fixed set of packages. Content never changes after creation.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSnapshot.class)
@JsonDeserialize(as = ImmutableSnapshot.class)
public abstract class Snapshot
        implements PublishSource
{
    public abstract Optional<String> getDescription();

    public abstract Instant getCreatedAt();

    @Override
    public SourceKind getKind()
    {
        return SourceKind.SNAPSHOT;
    }

    @Override
    public String resourceKey()
    {
        return ResourceKeys.snapshot(getUuid());
    }

    @Override
    public boolean isImmutable()
    {
        return true;
    }

    @Override
    public Optional<String> getDefaultDistribution()
    {
        return Optional.absent();
    }

    @Override
    public Optional<String> getDefaultComponent()
    {
        return Optional.absent();
    }

    public static ImmutableSnapshot.Builder builder()
    {
        return ImmutableSnapshot.builder();
    }

    public static Snapshot of(String name)
    {
        return builder()
            .uuid(UUID.randomUUID())
            .name(name)
            .createdAt(Instant.now())
            .build();
    }
}
