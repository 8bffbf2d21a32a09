package io.repokeeper.core.publish;

import io.repokeeper.spi.PackagePool;
import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

public class InMemoryPackagePool
        implements PackagePool
{
    private final Map<String, byte[]> files = new HashMap<>();

    @Override
    public synchronized String importFile(Path source, String basename, String md5)
        throws IOException
    {
        String poolPath = md5.substring(0, 2) + "/" + md5.substring(2, 4) + "/" + basename;
        files.put(poolPath, Files.readAllBytes(source));
        return poolPath;
    }

    @Override
    public synchronized InputStream open(String poolPath)
        throws IOException
    {
        return new ByteArrayInputStream(get(poolPath));
    }

    @Override
    public synchronized long size(String poolPath)
        throws IOException
    {
        return get(poolPath).length;
    }

    private byte[] get(String poolPath)
        throws FileNotFoundException
    {
        byte[] data = files.get(poolPath);
        if (data == null) {
            throw new FileNotFoundException(poolPath);
        }
        return data;
    }
}
