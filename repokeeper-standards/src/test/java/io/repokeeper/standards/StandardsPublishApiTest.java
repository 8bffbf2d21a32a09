package io.repokeeper.standards;

import com.google.common.collect.ImmutableList;
import io.repokeeper.client.api.RestPublishCreateRequest;
import io.repokeeper.client.api.RestPublishRemoveRequest;
import io.repokeeper.client.api.RestPublishedRepo;
import io.repokeeper.client.api.RestSigningOptions;
import io.repokeeper.client.api.RestSourceBinding;
import io.repokeeper.client.config.Config;
import io.repokeeper.client.config.ConfigElement;
import io.repokeeper.core.RepoKeeperEmbed;
import io.repokeeper.core.publish.PublishApi;
import io.repokeeper.core.publish.PublishResponse;
import io.repokeeper.core.repository.Snapshot;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.core.task.TaskStatus;
import io.repokeeper.spi.PackageFile;
import io.repokeeper.spi.PackagePool;
import io.repokeeper.spi.PublishEngine;
import io.repokeeper.standards.publish.StandardPublishEngine;
import io.repokeeper.standards.storage.LocalPackagePool;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static io.repokeeper.core.database.DatabaseTestingUtils.createConfigFactory;
import static io.repokeeper.standards.PoolFixtures.importPackage;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class StandardsPublishApiTest
{
    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private Path work;
    private Path publicDir;
    private Path wwwDir;
    private RepoKeeperEmbed embed;
    private PublishApi api;
    private SourceStore sourceStore;
    private PackagePool pool;

    @Before
    public void setUp()
        throws Exception
    {
        work = tempFolder.newFolder("work").toPath();
        publicDir = tempFolder.newFolder("public").toPath();
        wwwDir = tempFolder.newFolder("www").toPath();
        Config systemConfig = createConfigFactory().create()
            .set("publish.root_dir", publicDir.toString())
            .set("publish.storage.www.type", "filesystem")
            .set("publish.storage.www.root_dir", wwwDir.toString())
            .set("pool.dir", tempFolder.newFolder("pool").toString());

        embed = new RepoKeeperEmbed.Bootstrap()
            .setSystemConfig(ConfigElement.copyOf(systemConfig))
            .initialize();
        api = embed.getPublishApi();
        sourceStore = embed.getInjector().getInstance(SourceStore.class);
        pool = embed.getInjector().getInstance(PackagePool.class);
    }

    @After
    public void destroy()
    {
        embed.close();
    }

    @Test
    public void loadsStandardExtension()
    {
        assertThat(pool, instanceOf(LocalPackagePool.class));
        assertThat(embed.getInjector().getInstance(PublishEngine.class), instanceOf(StandardPublishEngine.class));
    }

    @Test
    public void publishesToDefaultStorage()
        throws Exception
    {
        snapshot("snap1",
                importPackage(pool, work, "hello", "1.0", "amd64"),
                importPackage(pool, work, "extra", "0.1", "amd64"));
        snapshot("snap2", importPackage(pool, work, "world", "2.0", "all"));

        PublishResponse response = api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);
        assertThat(response.getStatus(), is(TaskStatus.CREATED));
        RestPublishedRepo repo = response.getPublishedRepo().get();
        assertThat(repo.getStorage(), is(""));

        assertThat(Files.exists(publicDir.resolve("debian/pool/main/h/hello/hello_1.0_amd64.deb")), is(true));
        assertThat(Files.exists(publicDir.resolve("debian/pool/contrib/w/world/world_2.0_all.deb")), is(true));
        assertThat(read(publicDir.resolve("debian/dists/bookworm/Release")), containsString("Components: contrib main\n"));

        RestPublishRemoveRequest remove = RestPublishRemoveRequest.builder()
            .components(ImmutableList.of("contrib"))
            .signing(RestSigningOptions.skip())
            .build();
        assertThat(api.removeComponents("debian", "bookworm", remove, false).getStatus(), is(TaskStatus.OK));
        assertThat(Files.exists(publicDir.resolve("debian/pool/contrib/w/world/world_2.0_all.deb")), is(false));
        assertThat(Files.exists(publicDir.resolve("debian/dists/bookworm/contrib")), is(false));
        assertThat(read(publicDir.resolve("debian/dists/bookworm/Release")), containsString("Components: main\n"));

        assertThat(api.drop("debian", "bookworm", false, false, false).getStatus(), is(TaskStatus.OK));
        assertThat(Files.exists(publicDir.resolve("debian/dists/bookworm")), is(false));
        assertThat(Files.exists(publicDir.resolve("debian/pool")), is(false));
    }

    @Test
    public void publishesToNamedStorage()
        throws Exception
    {
        snapshot("snap1", importPackage(pool, work, "hello", "1.0", "amd64"));

        PublishResponse response = api.create("filesystem:www:.", request("stable", RestSourceBinding.of("main", "snap1")), false);
        assertThat(response.getStatus(), is(TaskStatus.CREATED));
        assertThat(response.getPublishedRepo().get().getStorage(), is("filesystem:www"));

        assertThat(Files.exists(wwwDir.resolve("pool/main/h/hello/hello_1.0_amd64.deb")), is(true));
        assertThat(read(wwwDir.resolve("dists/stable/Release")), containsString("Label: stable\n"));
        assertThat(Files.exists(publicDir.resolve("dists")), is(false));
    }

    private Snapshot snapshot(String name, PackageFile... packages)
        throws Exception
    {
        List<String> keys = new ArrayList<>();
        for (PackageFile pkg : packages) {
            sourceStore.putPackage(pkg);
            keys.add(pkg.getKey());
        }
        return sourceStore.addSnapshot(Snapshot.of(name), keys);
    }

    private static RestPublishCreateRequest request(String distribution, RestSourceBinding... sources)
    {
        return RestPublishCreateRequest.builder()
            .sourceKind("snapshot")
            .addSources(sources)
            .distribution(distribution)
            .signing(RestSigningOptions.skip())
            .build();
    }

    private static String read(Path path)
        throws Exception
    {
        return new String(Files.readAllBytes(path), UTF_8);
    }
}
