package io.repokeeper.core.repository;

import com.google.common.base.Optional;
import io.repokeeper.spi.PackageFile;
import java.util.List;
import java.util.UUID;

/**
 * Something that can be bound to a component of a published repository.
 */
public interface PublishSource
{
    UUID getUuid();

    String getName();

    SourceKind getKind();

    /**
     * Key used to serialize tasks that read or modify this source.
     */
    String resourceKey();

    /**
     * True if the package list never changes once created. Publishing a
     * mutable source again picks up its current packages.
     */
    boolean isImmutable();

    Optional<String> getDefaultDistribution();

    Optional<String> getDefaultComponent();

    default List<PackageFile> loadComplete(SourceStore store)
    {
        return store.getPackages(getUuid());
    }
}
