package io.repokeeper.standards.storage;

import io.repokeeper.client.config.Config;
import io.repokeeper.spi.PublishedStorage;
import io.repokeeper.spi.PublishedStorageFactory;
import java.nio.file.FileSystems;

public class LocalPublishedStorageFactory
        implements PublishedStorageFactory
{
    @Override
    public String getType()
    {
        return "filesystem";
    }

    @Override
    public PublishedStorage newStorage(String name, Config config)
    {
        String rootDir = config.get("root_dir", String.class, "public");
        return new LocalPublishedStorage(name, FileSystems.getDefault().getPath(rootDir));
    }
}
