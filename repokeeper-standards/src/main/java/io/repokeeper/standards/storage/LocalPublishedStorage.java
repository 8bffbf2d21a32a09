package io.repokeeper.standards.storage;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import io.repokeeper.spi.PackagePool;
import io.repokeeper.spi.Progress;
import io.repokeeper.spi.PublishedFileConflictException;
import io.repokeeper.spi.PublishedStorage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Published tree in a local directory, typically served by a web server.
 *
 * Pool files are hard-linked from a {@link LocalPackagePool} on the same
 * filesystem and copied otherwise. Files are replaced by rename so readers
 * never see a partially written file.
 */
public class LocalPublishedStorage
        implements PublishedStorage
{
    private static final Logger logger = LoggerFactory.getLogger(LocalPublishedStorage.class);

    private final String name;
    private final Path root;

    public LocalPublishedStorage(String name, Path root)
    {
        this.name = name;
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String getName()
    {
        return name;
    }

    public Path getRoot()
    {
        return root;
    }

    @Override
    public void putFile(String path, Path sourceFile)
        throws IOException
    {
        Path dest = resolve(path);
        Files.createDirectories(dest.getParent());
        Path temp = tempFileFor(dest);
        try {
            Files.copy(sourceFile, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public void linkFromPool(String publishedDirectory, String fileName,
            PackagePool pool, String poolPath, String sha256, boolean force)
        throws IOException
    {
        Path dest = resolve(publishedDirectory + "/" + fileName);
        if (Files.exists(dest)) {
            if (Files.size(dest) == pool.size(poolPath) && sha256Of(dest).equals(sha256)) {
                return;
            }
            if (!force) {
                throw new PublishedFileConflictException(String.format(
                            "error putting file to %s: file already exists and is different", dest));
            }
            logger.warn("Overwriting published file {} with different content", dest);
        }

        Files.createDirectories(dest.getParent());
        Path temp = tempFileFor(dest);
        try {
            Files.delete(temp);
            if (!tryLink(pool, poolPath, temp)) {
                try (InputStream in = pool.open(poolPath)) {
                    Files.copy(in, temp);
                }
            }
            Files.move(temp, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public boolean fileExists(String path)
    {
        return Files.exists(resolve(path));
    }

    @Override
    public List<String> filelist(String prefix)
        throws IOException
    {
        Path dir = resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return ImmutableList.of();
        }
        List<String> files = new ArrayList<>();
        try (Stream<Path> stream = Files.walk(dir)) {
            stream.filter(Files::isRegularFile).forEach(path -> files.add(relativize(dir, path)));
        }
        Collections.sort(files);
        return files;
    }

    @Override
    public void remove(String path)
        throws IOException
    {
        Files.deleteIfExists(resolve(path));
    }

    @Override
    public void removeDirs(String path, Progress progress)
        throws IOException
    {
        Path dir = resolve(path);
        if (!Files.exists(dir)) {
            return;
        }
        logger.debug("Removing directory {}", dir);
        MoreFiles.deleteRecursively(dir);
    }

    private boolean tryLink(PackagePool pool, String poolPath, Path link)
    {
        if (!(pool instanceof LocalPackagePool)) {
            return false;
        }
        try {
            Files.createLink(link, ((LocalPackagePool) pool).resolve(poolPath));
            return true;
        }
        catch (UnsupportedOperationException | IOException ex) {
            // pool and published tree on different filesystems
            logger.debug("Hard link of {} failed, copying: {}", poolPath, ex.toString());
            return false;
        }
    }

    private Path resolve(String path)
    {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Invalid published path: " + path);
        }
        return resolved;
    }

    private static Path tempFileFor(Path dest)
        throws IOException
    {
        return Files.createTempFile(dest.getParent(), "." + dest.getFileName(), ".tmp");
    }

    private static String relativize(Path dir, Path file)
    {
        return dir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    static String sha256Of(Path file)
        throws IOException
    {
        HashCode hash = MoreFiles.asByteSource(file).hash(Hashing.sha256());
        return hash.toString();
    }
}
