package io.repokeeper.core.publish;

import io.repokeeper.client.config.Config;
import io.repokeeper.spi.PublishedStorage;
import io.repokeeper.spi.PublishedStorageFactory;
import java.util.HashMap;
import java.util.Map;

/**
 * Stands in for the filesystem storage type. Storages are kept by name so
 * tests can look at what was published.
 */
public class InMemoryStorageFactory
        implements PublishedStorageFactory
{
    private final Map<String, InMemoryPublishedStorage> storages = new HashMap<>();

    @Override
    public String getType()
    {
        return PublishedStorageManager.DEFAULT_STORAGE_TYPE;
    }

    @Override
    public synchronized PublishedStorage newStorage(String name, Config config)
    {
        return getStorage(name);
    }

    // "" is the default storage
    public synchronized InMemoryPublishedStorage getStorage(String name)
    {
        return storages.computeIfAbsent(name, InMemoryPublishedStorage::new);
    }
}
