package io.repokeeper.standards.storage;

import com.google.inject.Inject;
import io.repokeeper.client.config.Config;
import io.repokeeper.spi.PackagePool;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Package pool in a local directory ({@code pool.dir}). Files are stored at
 * &lt;md5[0:2]&gt;/&lt;md5[2:4]&gt;/&lt;basename&gt;.
 */
public class LocalPackagePool
        implements PackagePool
{
    private static final Logger logger = LoggerFactory.getLogger(LocalPackagePool.class);

    private final Path root;

    @Inject
    public LocalPackagePool(Config systemConfig)
    {
        this(FileSystems.getDefault().getPath(systemConfig.get("pool.dir", String.class, "pool")));
    }

    public LocalPackagePool(Path root)
    {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot()
    {
        return root;
    }

    @Override
    public String importFile(Path source, String basename, String md5)
        throws IOException
    {
        if (md5.length() < 4 || basename.isEmpty() || basename.contains("/")) {
            throw new IllegalArgumentException("Invalid pool file: " + basename + " (md5 " + md5 + ")");
        }
        String poolPath = md5.substring(0, 2) + "/" + md5.substring(2, 4) + "/" + basename;
        Path dest = resolve(poolPath);
        long size = Files.size(source);
        if (Files.exists(dest) && Files.size(dest) == size) {
            return poolPath;
        }

        Files.createDirectories(dest.getParent());
        Path temp = Files.createTempFile(dest.getParent(), "." + basename, ".tmp");
        try {
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Imported {} into pool as {}", source, poolPath);
        return poolPath;
    }

    @Override
    public InputStream open(String poolPath)
        throws IOException
    {
        return Files.newInputStream(resolve(poolPath));
    }

    @Override
    public long size(String poolPath)
        throws IOException
    {
        return Files.size(resolve(poolPath));
    }

    public Path resolve(String poolPath)
    {
        Path path = root.resolve(poolPath).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Invalid pool path: " + poolPath);
        }
        return path;
    }
}
