package io.repokeeper.spi;

import io.repokeeper.client.config.Config;

public interface PublishedStorageFactory
{
    String getType();

    /**
     * Creates a backend. config holds the "publish.storage.&lt;name&gt;." keys
     * with the prefix stripped.
     */
    PublishedStorage newStorage(String name, Config config);
}
