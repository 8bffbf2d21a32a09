package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import io.repokeeper.client.config.Config;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.spi.PublishedStorage;
import io.repokeeper.spi.PublishedStorageFactory;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves storage names of publish points to storage backends.
 *
 * "" is the default filesystem storage rooted at {@code publish.root_dir}.
 * "&lt;type&gt;:&lt;name&gt;" is configured by the
 * {@code publish.storage.&lt;name&gt;.} keys.
 */
public class PublishedStorageManager
{
    private static final Logger logger = LoggerFactory.getLogger(PublishedStorageManager.class);

    public static final String DEFAULT_STORAGE_TYPE = "filesystem";

    private final Map<String, PublishedStorageFactory> registry;
    private final Config systemConfig;
    private final Map<String, PublishedStorage> storages = new HashMap<>();

    @Inject
    public PublishedStorageManager(Set<PublishedStorageFactory> factories, Config systemConfig)
    {
        ImmutableMap.Builder<String, PublishedStorageFactory> builder = ImmutableMap.builder();
        for (PublishedStorageFactory factory : factories) {
            builder.put(factory.getType(), factory);
        }
        this.registry = builder.build();
        this.systemConfig = systemConfig;
    }

    public synchronized PublishedStorage getStorage(String storage)
        throws ResourceNotFoundException
    {
        PublishedStorage cached = storages.get(storage);
        if (cached != null) {
            return cached;
        }
        PublishedStorage created = create(storage);
        storages.put(storage, created);
        return created;
    }

    private PublishedStorage create(String storage)
        throws ResourceNotFoundException
    {
        String type;
        String name;
        Config config;
        if (storage.isEmpty()) {
            type = DEFAULT_STORAGE_TYPE;
            name = "";
            config = systemConfig.getFactory().create();
            config.setOptional("root_dir", systemConfig.getOptional("publish.root_dir", String.class));
        }
        else {
            int i = storage.indexOf(':');
            if (i <= 0 || i == storage.length() - 1) {
                throw new ResourceNotFoundException("published storage " + storage + " is not configured");
            }
            type = storage.substring(0, i);
            name = storage.substring(i + 1);
            config = systemConfig.extractPrefixed("publish.storage." + name + ".");
            Optional<String> configuredType = config.getOptional("type", String.class);
            if (config.isEmpty() || (configuredType.isPresent() && !configuredType.get().equals(type))) {
                throw new ResourceNotFoundException("published storage " + storage + " is not configured");
            }
        }

        PublishedStorageFactory factory = registry.get(type);
        if (factory == null) {
            throw new ResourceNotFoundException("published storage " + storage + " has unknown type " + type);
        }
        logger.debug("Creating {} published storage '{}'", type, name);
        return factory.newStorage(name, config);
    }
}
