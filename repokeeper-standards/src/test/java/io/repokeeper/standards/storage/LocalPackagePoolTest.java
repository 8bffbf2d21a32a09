package io.repokeeper.standards.storage;

import com.google.common.io.ByteStreams;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.repokeeper.core.database.DatabaseTestingUtils.createConfigFactory;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class LocalPackagePoolTest
{
    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path poolDir;
    private LocalPackagePool pool;

    @Before
    public void setUp()
        throws Exception
    {
        poolDir = tempFolder.newFolder("pool").toPath();
        pool = new LocalPackagePool(createConfigFactory().create().set("pool.dir", poolDir.toString()));
    }

    @Test
    public void importsByChecksumPrefix()
        throws Exception
    {
        Path file = tempFolder.newFile("upload.deb").toPath();
        Files.write(file, "hello".getBytes(UTF_8));

        String poolPath = pool.importFile(file, "hello_1.0_amd64.deb", "5d41402abc4b2a76b9719d911017c592");
        assertThat(poolPath, is("5d/41/hello_1.0_amd64.deb"));
        assertThat(Files.exists(poolDir.resolve("5d/41/hello_1.0_amd64.deb")), is(true));
        assertThat(pool.size(poolPath), is(5L));
        try (InputStream in = pool.open(poolPath)) {
            assertThat(new String(ByteStreams.toByteArray(in), UTF_8), is("hello"));
        }

        // importing again is a no-op
        assertThat(pool.importFile(file, "hello_1.0_amd64.deb", "5d41402abc4b2a76b9719d911017c592"), is(poolPath));
    }

    @Test
    public void rejectsPathsOutsideThePool()
    {
        try {
            pool.resolve("../etc/passwd");
            fail();
        }
        catch (IllegalArgumentException ex) {
        }
    }
}
