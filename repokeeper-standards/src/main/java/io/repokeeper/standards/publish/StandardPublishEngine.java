package io.repokeeper.standards.publish;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.inject.Inject;
import io.repokeeper.spi.PackageFile;
import io.repokeeper.spi.Progress;
import io.repokeeper.spi.PublishEngine;
import io.repokeeper.spi.PublishRequest;
import io.repokeeper.spi.PublishedStorage;
import io.repokeeper.spi.Signer;
import io.repokeeper.spi.SignerException;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes a Debian-style repository tree.
 *
 * <pre>
 * &lt;prefix&gt;/dists/&lt;distribution&gt;/Release, Release.gpg, InRelease
 * &lt;prefix&gt;/dists/&lt;distribution&gt;/&lt;component&gt;/binary-&lt;arch&gt;/Packages[.gz|.bz2]
 * &lt;prefix&gt;/pool/&lt;component&gt;/&lt;subdir&gt;/&lt;source&gt;/&lt;file&gt;
 * </pre>
 *
 * subdir is the first letter of the source package name, or its first four
 * letters for "lib*" packages. With multiDist the pool directory is
 * pool/&lt;distribution&gt;/&lt;component&gt;.
 *
 * Indexes are rendered into a local work directory first. Component indexes
 * are uploaded before the Release files that reference them.
 */
public class StandardPublishEngine
        implements PublishEngine
{
    private static final Logger logger = LoggerFactory.getLogger(StandardPublishEngine.class);

    private static final Set<String> GENERATED_FIELDS = ImmutableSet.of(
            "Package", "Version", "Architecture", "Source",
            "Filename", "Size", "MD5sum", "SHA1", "SHA256");

    private static final List<String> RELEASE_FILES = ImmutableList.of("Release", "Release.gpg", "InRelease");

    private final Clock clock;

    @Inject
    public StandardPublishEngine()
    {
        this(Clock.systemUTC());
    }

    public StandardPublishEngine(Clock clock)
    {
        this.clock = clock;
    }

    @Override
    public void publish(PublishRequest request, Progress progress)
        throws IOException, SignerException
    {
        linkPoolFiles(request, progress);

        Path work = Files.createTempDirectory("repokeeper-publish-");
        try {
            progress.print("Generating metadata files...");
            List<String> indexes = writeIndexes(request, work);
            writeRelease(request, work, indexes);
            if (request.getSigner().isPresent()) {
                progress.print("Signing file 'Release' with gpg...");
                sign(request.getSigner().get(), work);
            }
            progress.print("Finalizing metadata files...");
            upload(request, work);
        }
        finally {
            MoreFiles.deleteRecursively(work, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        logger.debug("Published {} to {}", distsDirectory(request.getDistribution()), request.getStorage().getName());
    }

    @Override
    public String poolDirectory(String distribution, String component, boolean multiDist)
    {
        if (multiDist) {
            return "pool/" + distribution + "/" + component;
        }
        return "pool/" + component;
    }

    @Override
    public String poolPath(String distribution, String component, boolean multiDist, PackageFile pkg)
    {
        return poolDirectory(distribution, component, multiDist)
            + "/" + sourceSubdirectory(pkg.getSource())
            + "/" + pkg.getSource()
            + "/" + pkg.getFilename();
    }

    @Override
    public String distsDirectory(String distribution, String component)
    {
        return distsDirectory(distribution) + "/" + component;
    }

    @Override
    public String distsDirectory(String distribution)
    {
        return "dists/" + distribution;
    }

    static String sourceSubdirectory(String source)
    {
        if (source.startsWith("lib") && source.length() > 3) {
            return source.substring(0, 4);
        }
        return source.substring(0, 1);
    }

    private void linkPoolFiles(PublishRequest request, Progress progress)
        throws IOException
    {
        PublishedStorage storage = request.getStorage();
        for (Map.Entry<String, List<PackageFile>> pair : request.getComponents().entrySet()) {
            progress.printf("Linking files for component %s...", pair.getKey());
            for (PackageFile pkg : pair.getValue()) {
                if (!isPublished(request, pkg)) {
                    continue;
                }
                String path = poolPath(request.getDistribution(), pair.getKey(), request.getMultiDist(), pkg);
                String directory = path.substring(0, path.lastIndexOf('/'));
                storage.linkFromPool(join(request.getPrefix(), directory), pkg.getFilename(),
                        request.getPool(), pkg.getPoolPath(), pkg.getSha256(), request.getForceOverwrite());
            }
        }
    }

    private static boolean isPublished(PublishRequest request, PackageFile pkg)
    {
        return pkg.getArchitecture().equals("all") || request.getArchitectures().contains(pkg.getArchitecture());
    }

    // returns index paths relative to the work directory
    private List<String> writeIndexes(PublishRequest request, Path work)
        throws IOException
    {
        List<String> indexes = new ArrayList<>();
        for (Map.Entry<String, List<PackageFile>> pair : request.getComponents().entrySet()) {
            String component = pair.getKey();
            for (String arch : binaryArchitectures(request)) {
                String dir = component + "/binary-" + arch;
                Files.createDirectories(work.resolve(dir));

                byte[] packages = renderPackages(request, component, arch, pair.getValue()).getBytes(UTF_8);
                Files.write(work.resolve(dir + "/Packages"), packages);
                indexes.add(dir + "/Packages");

                try (OutputStream out = new GzipCompressorOutputStream(Files.newOutputStream(work.resolve(dir + "/Packages.gz")))) {
                    out.write(packages);
                }
                indexes.add(dir + "/Packages.gz");

                if (!request.getSkipBz2()) {
                    try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(work.resolve(dir + "/Packages.bz2")))) {
                        out.write(packages);
                    }
                    indexes.add(dir + "/Packages.bz2");
                }

                StringBuilder release = new StringBuilder();
                release.append("Archive: ").append(request.getDistribution()).append('\n');
                release.append("Architecture: ").append(arch).append('\n');
                release.append("Component: ").append(component).append('\n');
                release.append("Origin: ").append(origin(request)).append('\n');
                release.append("Label: ").append(label(request)).append('\n');
                Files.write(work.resolve(dir + "/Release"), release.toString().getBytes(UTF_8));
                indexes.add(dir + "/Release");

                if (request.getAcquireByHash()) {
                    writeByHash(work, dir, ImmutableList.of("Packages", "Packages.gz", "Packages.bz2"));
                }
            }
        }
        return indexes;
    }

    private static List<String> binaryArchitectures(PublishRequest request)
    {
        return request.getArchitectures().stream()
            .filter(arch -> !arch.equals("source"))
            .collect(Collectors.toList());
    }

    private String renderPackages(PublishRequest request, String component, String arch, List<PackageFile> packages)
    {
        StringBuilder sb = new StringBuilder();
        for (PackageFile pkg : packages) {
            if (!pkg.getArchitecture().equals(arch) && !pkg.getArchitecture().equals("all")) {
                continue;
            }
            sb.append("Package: ").append(pkg.getName()).append('\n');
            sb.append("Version: ").append(pkg.getVersion()).append('\n');
            sb.append("Architecture: ").append(pkg.getArchitecture()).append('\n');
            if (!pkg.getSource().equals(pkg.getName())) {
                sb.append("Source: ").append(pkg.getSource()).append('\n');
            }
            for (Map.Entry<String, String> field : pkg.getControlFields().entrySet()) {
                if (!GENERATED_FIELDS.contains(field.getKey())) {
                    sb.append(field.getKey()).append(": ").append(field.getValue()).append('\n');
                }
            }
            sb.append("Filename: ").append(poolPath(request.getDistribution(), component, request.getMultiDist(), pkg)).append('\n');
            sb.append("Size: ").append(pkg.getSize()).append('\n');
            sb.append("MD5sum: ").append(pkg.getMd5()).append('\n');
            sb.append("SHA1: ").append(pkg.getSha1()).append('\n');
            sb.append("SHA256: ").append(pkg.getSha256()).append('\n');
            sb.append('\n');
        }
        return sb.toString();
    }

    @SuppressWarnings("deprecation")
    private static void writeByHash(Path work, String dir, List<String> names)
        throws IOException
    {
        for (String name : names) {
            Path file = work.resolve(dir + "/" + name);
            if (!Files.exists(file)) {
                continue;
            }
            copyByHash(file, work.resolve(dir + "/by-hash/MD5Sum"), MoreFiles.asByteSource(file).hash(Hashing.md5()).toString());
            copyByHash(file, work.resolve(dir + "/by-hash/SHA1"), MoreFiles.asByteSource(file).hash(Hashing.sha1()).toString());
            copyByHash(file, work.resolve(dir + "/by-hash/SHA256"), MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString());
        }
    }

    private static void copyByHash(Path file, Path dir, String hash)
        throws IOException
    {
        Files.createDirectories(dir);
        Files.copy(file, dir.resolve(hash), StandardCopyOption.REPLACE_EXISTING);
    }

    @SuppressWarnings("deprecation")
    private void writeRelease(PublishRequest request, Path work, List<String> indexes)
        throws IOException
    {
        List<String> md5 = new ArrayList<>();
        List<String> sha1 = new ArrayList<>();
        List<String> sha256 = new ArrayList<>();
        for (String index : indexes) {
            Path file = work.resolve(index);
            long size = Files.size(file);
            md5.add(checksumLine(MoreFiles.asByteSource(file).hash(Hashing.md5()).toString(), size, index));
            sha1.add(checksumLine(MoreFiles.asByteSource(file).hash(Hashing.sha1()).toString(), size, index));
            sha256.add(checksumLine(MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString(), size, index));
        }

        try (Writer out = Files.newBufferedWriter(work.resolve("Release"), UTF_8)) {
            out.write("Origin: " + origin(request) + "\n");
            out.write("Label: " + label(request) + "\n");
            out.write("Suite: " + request.getDistribution() + "\n");
            out.write("Codename: " + request.getDistribution() + "\n");
            if (request.getNotAutomatic().isPresent()) {
                out.write("NotAutomatic: " + request.getNotAutomatic().get() + "\n");
            }
            if (request.getButAutomaticUpgrades().isPresent()) {
                out.write("ButAutomaticUpgrades: " + request.getButAutomaticUpgrades().get() + "\n");
            }
            if (request.getAcquireByHash()) {
                out.write("Acquire-By-Hash: yes\n");
            }
            out.write("Date: " + DateTimeFormatter.RFC_1123_DATE_TIME.format(clock.instant().atZone(ZoneOffset.UTC)) + "\n");
            out.write("Architectures: " + String.join(" ", binaryArchitectures(request)) + "\n");
            out.write("Components: " + String.join(" ", request.getComponents().keySet()) + "\n");
            out.write("Description: Generated by repokeeper\n");
            writeChecksums(out, "MD5Sum", md5);
            writeChecksums(out, "SHA1", sha1);
            writeChecksums(out, "SHA256", sha256);
        }
    }

    private static String checksumLine(String hash, long size, String path)
    {
        return String.format(Locale.ENGLISH, " %s %16d %s", hash, size, path);
    }

    private static void writeChecksums(Writer out, String name, List<String> lines)
        throws IOException
    {
        out.write(name + ":\n");
        for (String line : lines) {
            out.write(line + "\n");
        }
    }

    private static void sign(Signer signer, Path work)
        throws SignerException
    {
        Path release = work.resolve("Release");
        signer.detachedSign(release, work.resolve("Release.gpg"));
        signer.clearSign(release, work.resolve("InRelease"));
    }

    private void upload(PublishRequest request, Path work)
        throws IOException
    {
        String dists = join(request.getPrefix(), distsDirectory(request.getDistribution()));
        List<Path> files;
        try (Stream<Path> stream = Files.walk(work)) {
            files = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        // Release files last
        for (Path file : files) {
            String relative = relativize(work, file);
            if (!RELEASE_FILES.contains(relative)) {
                request.getStorage().putFile(dists + "/" + relative, file);
            }
        }
        for (String name : RELEASE_FILES) {
            Path file = work.resolve(name);
            if (Files.exists(file)) {
                request.getStorage().putFile(dists + "/" + name, file);
            }
        }
        if (!request.getSigner().isPresent()) {
            // signatures of an earlier signed publish no longer match
            request.getStorage().remove(dists + "/Release.gpg");
            request.getStorage().remove(dists + "/InRelease");
        }
    }

    private static String origin(PublishRequest request)
    {
        return request.getOrigin().or(defaultOriginLabel(request));
    }

    private static String label(PublishRequest request)
    {
        return request.getLabel().or(defaultOriginLabel(request));
    }

    private static String defaultOriginLabel(PublishRequest request)
    {
        if (request.getPrefix().equals(".")) {
            return request.getDistribution();
        }
        return request.getPrefix() + " " + request.getDistribution();
    }

    private static String relativize(Path dir, Path file)
    {
        return dir.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    static String join(String prefix, String path)
    {
        if (prefix.equals(".")) {
            return path;
        }
        return prefix + "/" + path;
    }
}
