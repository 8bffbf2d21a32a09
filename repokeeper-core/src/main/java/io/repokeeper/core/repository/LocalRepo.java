package io.repokeeper.core.repository;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import java.time.Instant;
import java.util.UUID;
import org.immutables.value.Value;

/**
 * Package collection that is modified in place.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLocalRepo.class)
@JsonDeserialize(as = ImmutableLocalRepo.class)
public abstract class LocalRepo
        implements PublishSource
{
    public abstract Optional<String> getComment();

    @Override
    public abstract Optional<String> getDefaultDistribution();

    @Override
    public abstract Optional<String> getDefaultComponent();

    public abstract Instant getCreatedAt();

    @Override
    public SourceKind getKind()
    {
        return SourceKind.LOCAL;
    }

    @Override
    public String resourceKey()
    {
        return ResourceKeys.localRepo(getUuid());
    }

    @Override
    public boolean isImmutable()
    {
        return false;
    }

    public static ImmutableLocalRepo.Builder builder()
    {
        return ImmutableLocalRepo.builder();
    }

    public static LocalRepo of(String name)
    {
        return builder()
            .uuid(UUID.randomUUID())
            .name(name)
            .createdAt(Instant.now())
            .build();
    }
}
