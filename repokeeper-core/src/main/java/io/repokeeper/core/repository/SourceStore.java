package io.repokeeper.core.repository;

import io.repokeeper.spi.PackageFile;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Registry of snapshots, local repositories and the packages they reference.
 */
public interface SourceStore
{
    /**
     * Registers a snapshot of already registered packages.
     */
    Snapshot addSnapshot(Snapshot snapshot, Collection<String> packageKeys)
        throws ResourceConflictException, ResourceNotFoundException;

    Snapshot getSnapshotByName(String name)
        throws ResourceNotFoundException;

    LocalRepo addLocalRepo(LocalRepo repo)
        throws ResourceConflictException;

    LocalRepo getLocalRepoByName(String name)
        throws ResourceNotFoundException;

    void addLocalRepoPackages(UUID localRepoUuid, Collection<String> packageKeys)
        throws ResourceNotFoundException;

    void removeLocalRepoPackages(UUID localRepoUuid, Collection<String> packageKeys)
        throws ResourceNotFoundException;

    PublishSource getSource(SourceKind kind, UUID uuid)
        throws ResourceNotFoundException;

    PublishSource getSourceByName(SourceKind kind, String name)
        throws ResourceNotFoundException;

    // registering the same key twice is a no-op
    void putPackage(PackageFile pkg);

    /**
     * Packages currently referenced by a source, ordered by key.
     */
    List<PackageFile> getPackages(UUID sourceUuid);
}
