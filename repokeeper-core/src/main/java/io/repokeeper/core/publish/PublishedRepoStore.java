package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import java.util.List;
import java.util.UUID;

public interface PublishedRepoStore
{
    List<StoredPublishedRepo> getPublishedRepos();

    StoredPublishedRepo getPublishedRepo(String storage, String prefix, String distribution)
        throws ResourceNotFoundException;

    Optional<StoredPublishedRepo> findPublishedRepo(String storage, String prefix, String distribution);

    /**
     * Every publish point sharing the pool of (storage, prefix).
     */
    List<StoredPublishedRepo> getPublishedReposByPrefix(String storage, String prefix);

    List<StoredPublishedRepo> getPublishedReposBySource(UUID sourceUuid);

    /**
     * Fails with ResourceConflictException if (storage, prefix, distribution) is taken.
     */
    StoredPublishedRepo addPublishedRepo(PublishedRepo repo)
        throws ResourceConflictException;

    /**
     * Replaces the record with the same uuid.
     */
    StoredPublishedRepo updatePublishedRepo(PublishedRepo repo)
        throws ResourceNotFoundException;

    void deletePublishedRepo(UUID uuid)
        throws ResourceNotFoundException;
}
