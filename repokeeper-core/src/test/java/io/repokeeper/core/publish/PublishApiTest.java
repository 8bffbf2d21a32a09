package io.repokeeper.core.publish;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.repokeeper.client.api.RestPublishCreateRequest;
import io.repokeeper.client.api.RestPublishRemoveRequest;
import io.repokeeper.client.api.RestPublishUpdateRequest;
import io.repokeeper.client.api.RestPublishedRepo;
import io.repokeeper.client.api.RestSigningOptions;
import io.repokeeper.client.api.RestSourceBinding;
import io.repokeeper.core.RepoKeeperEmbed;
import io.repokeeper.core.database.PersistenceException;
import io.repokeeper.core.repository.LocalRepo;
import io.repokeeper.core.repository.ModelValidationException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.Snapshot;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.core.task.TaskFailedException;
import io.repokeeper.core.task.TaskHandle;
import io.repokeeper.core.task.TaskStatus;
import io.repokeeper.spi.PackageFile;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.repokeeper.core.repository.PackageFixtures.pkg;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class PublishApiTest
{
    private static final String HELLO_POOL = "debian/pool/main/h/hello/hello_1.0_amd64.deb";

    private InMemoryPublishExtension extension;
    private RepoKeeperEmbed embed;
    private PublishApi api;
    private SourceStore sourceStore;
    private InMemoryPublishedStorage storage;

    private final PackageFile hello = pkg("hello", "1.0", "amd64");
    private final PackageFile world = pkg("world", "2.0", "all");
    private final PackageFile extra = pkg("extra", "0.1", "amd64");

    @Before
    public void setUp()
    {
        extension = new InMemoryPublishExtension();
        embed = new RepoKeeperEmbed.Bootstrap()
            .withExtensionLoader(false)
            .addModules(extension.getModules())
            .initialize();
        api = embed.getPublishApi();
        sourceStore = embed.getInjector().getInstance(SourceStore.class);
        storage = extension.getStorageFactory().getStorage("");
    }

    @After
    public void destroy()
    {
        embed.close();
    }

    @Test
    public void createPublishesAndLists()
        throws Exception
    {
        snapshot("snap1", hello, world);

        PublishResponse response = api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        assertThat(response.getStatus(), is(TaskStatus.CREATED));
        RestPublishedRepo repo = response.getPublishedRepo().get();
        assertThat(repo.getPrefix(), is("debian"));
        assertThat(repo.getDistribution(), is("bookworm"));
        assertThat(repo.getArchitectures(), contains("amd64"));
        assertThat(repo.getSources(), contains(RestSourceBinding.of("main", "snap1")));
        assertThat(response.getTask().get().getState(), is("SUCCEEDED"));

        assertThat(storage.getFiles(), hasItem(HELLO_POOL));
        assertThat(storage.getFiles(), hasItem("debian/pool/main/w/world/world_2.0_all.deb"));
        assertThat(storage.getFiles(), hasItem("debian/dists/bookworm/main/binary-amd64/Packages"));
        assertThat(storage.getFiles(), hasItem("debian/dists/bookworm/Release"));
        assertThat(storage.getFiles(), not(hasItem("debian/dists/bookworm/InRelease")));

        assertThat(api.list(), contains(repo));
        assertThat(api.get("debian", "bookworm"), is(repo));
    }

    @Test
    public void createSignsRelease()
        throws Exception
    {
        snapshot("snap1", hello);

        RestPublishCreateRequest request = RestPublishCreateRequest.builder()
            .from(request("bookworm", RestSourceBinding.of("main", "snap1")))
            .signing(RestSigningOptions.builder().gpgKey("A0546A43624A8331").build())
            .build();
        assertThat(api.create("debian", request, false).getStatus(), is(TaskStatus.CREATED));

        assertThat(storage.getContent("debian/dists/bookworm/Release.gpg").get(), is(FakeSignerFactory.SIGNATURE));
        assertThat(storage.getContent("debian/dists/bookworm/InRelease").get(), startsWith(FakeSignerFactory.CLEARSIGN_HEADER));
        assertThat(extension.getSignerFactory().getLastOptions().get().getGpgKey().get(), is("A0546A43624A8331"));
        assertThat(extension.getSignerFactory().getLastOptions().get().getBatch(), is(true));
    }

    @Test
    public void signerInitFailureRejectsRequest()
        throws Exception
    {
        snapshot("snap1", hello);
        extension.getSignerFactory().setFailInit(true);

        RestPublishCreateRequest request = RestPublishCreateRequest.builder()
            .from(request("bookworm", RestSourceBinding.of("main", "snap1")))
            .signing(RestSigningOptions.defaults())
            .build();
        try {
            api.create("debian", request, false);
            fail();
        }
        catch (TaskFailedException ex) {
            assertThat(ex.getStatus(), is(TaskStatus.INTERNAL_ERROR));
            assertThat(ex.getMessage(), startsWith("unable to initialize GPG signer: "));
        }
        assertThat(api.list(), is(empty()));
        assertThat(storage.getFiles(), is(empty()));
    }

    @Test
    public void duplicateCreateConflicts()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        PublishResponse response = api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap2")), false);
        assertThat(response.getStatus(), is(TaskStatus.CONFLICT));
        assertThat(response.getError().get(),
                is("prefix/distribution already used by another published repo: debian/bookworm"));
        assertThat(response.getTask().get().getState(), is("FAILED"));

        assertThat(api.get("debian", "bookworm").getSources(), contains(RestSourceBinding.of("main", "snap1")));
        assertThat(storage.getFiles(), not(hasItem("debian/pool/main/e/extra/extra_0.1_amd64.deb")));
    }

    @Test
    public void concurrentCreatesOfSamePointConflict()
        throws Exception
    {
        snapshot("snap1", hello);
        RestPublishCreateRequest request = request("bookworm", RestSourceBinding.of("main", "snap1"));

        ExecutorService executor = Executors.newFixedThreadPool(10);
        List<Future<PublishResponse>> futures = new ArrayList<>();
        try {
            Callable<PublishResponse> create = () -> api.create("debian", request, false);
            for (int i = 0; i < 10; i++) {
                futures.add(executor.submit(create));
            }
            int created = 0;
            int conflicts = 0;
            for (Future<PublishResponse> future : futures) {
                TaskStatus status = future.get().getStatus();
                if (status == TaskStatus.CREATED) {
                    created++;
                }
                else if (status == TaskStatus.CONFLICT) {
                    conflicts++;
                }
            }
            assertThat(created, is(1));
            assertThat(conflicts, is(9));
        }
        finally {
            executor.shutdownNow();
        }
        assertThat(api.list(), hasSize(1));
    }

    @Test
    public void storeFailureIsInternalError()
        throws Exception
    {
        PublishedRepoStore failingStore = mock(PublishedRepoStore.class);
        when(failingStore.findPublishedRepo(anyString(), anyString(), anyString())).thenReturn(Optional.absent());
        when(failingStore.addPublishedRepo(any(PublishedRepo.class)))
            .thenThrow(new PersistenceException("connection lost", new SQLException("connection lost")));

        RepoKeeperEmbed failing = new RepoKeeperEmbed.Bootstrap()
            .withExtensionLoader(false)
            .addModules(extension.getModules())
            .overrideModulesWith((binder) -> binder.bind(PublishedRepoStore.class).toInstance(failingStore))
            .initialize();
        try {
            SourceStore failingSources = failing.getInjector().getInstance(SourceStore.class);
            failingSources.putPackage(hello);
            failingSources.addSnapshot(Snapshot.of("snap1"), ImmutableList.of(hello.getKey()));

            PublishResponse response = failing.getPublishApi()
                .create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);
            assertThat(response.getStatus(), is(TaskStatus.INTERNAL_ERROR));
            assertThat(response.getError().get(), is("unable to save to DB: connection lost"));
            assertThat(response.getTask().get().getState(), is("FAILED"));
        }
        finally {
            failing.close();
        }
    }

    @Test
    public void createValidatesRequest()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);

        try {
            api.create("debian", request("bookworm", RestSourceBinding.of("main", "nope")), false);
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), is("unable to publish: Resource does not exist: snapshot named nope"));
        }

        try {
            api.create("debian", request("bookworm",
                        RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("main", "snap2")), false);
            fail();
        }
        catch (ModelValidationException ex) {
            assertThat(ex.getMessage(), containsString("duplicate component name"));
        }

        try {
            api.create("debian", request("bookworm"), false);
            fail();
        }
        catch (ModelValidationException ex) {
            assertThat(ex.getMessage(), containsString("unable to publish: sources are empty"));
        }

        try {
            api.create("../debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);
            fail();
        }
        catch (ModelValidationException ex) {
            assertThat(ex.getMessage(), containsString("prefix"));
        }
        assertThat(api.list(), is(empty()));
    }

    @Test
    public void architecturesMustBeKnown()
        throws Exception
    {
        snapshot("snap1", world);

        PublishResponse response = api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);
        assertThat(response.getStatus(), is(TaskStatus.BAD_REQUEST));
        assertThat(response.getError().get(),
                containsString("unable to figure out list of architectures, please supply explicit list"));
        assertThat(api.list(), is(empty()));
    }

    @Test
    public void conflictingPoolFileNeedsForceOverwrite()
        throws Exception
    {
        PackageFile rebuilt = PackageFile.builder()
            .from(hello)
            .md5("0123456789abcdef0123456789abcdef")
            .sha256("rebuilt")
            .build();
        snapshot("snap1", hello);
        snapshot("snap2", rebuilt);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        PublishResponse response = api.create("debian", request("trixie", RestSourceBinding.of("main", "snap2")), false);
        assertThat(response.getStatus(), is(TaskStatus.INTERNAL_ERROR));
        assertThat(response.getError().get(), startsWith("unable to publish: "));
        assertThat(response.getError().get(), containsString("already exists and is different"));

        RestPublishCreateRequest forced = RestPublishCreateRequest.builder()
            .from(request("trixie", RestSourceBinding.of("main", "snap2")))
            .forceOverwrite(true)
            .build();
        assertThat(api.create("debian", forced, false).getStatus(), is(TaskStatus.CREATED));
        assertThat(storage.getContent(HELLO_POOL).get(), is("pool:rebuilt"));
    }

    @Test
    public void asyncCreateIsAccepted()
        throws Exception
    {
        snapshot("snap1", hello);

        PublishResponse response = api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), true);
        assertThat(response.getStatus(), is(TaskStatus.ACCEPTED));
        assertThat(response.getPublishedRepo().isPresent(), is(false));
        assertThat(response.getTask().get().getName(), is("Publish snapshot: snap1"));

        TaskHandle handle = embed.getTaskScheduler().waitForTask(response.getTask().get().getId());
        assertThat(handle.getResult().get().getStatus(), is(TaskStatus.CREATED));
        assertThat(api.list(), hasSize(1));
    }

    @Test
    public void updateRemovesOmittedComponents()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);
        assertThat(storage.getFiles(), hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb"));

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .sources(ImmutableList.of(RestSourceBinding.of("main", "snap1")))
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.update("debian", "bookworm", update, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getPublishedRepo().get().getSources(), contains(RestSourceBinding.of("main", "snap1")));
        assertThat(storage.getFiles(), not(hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb")));
        assertThat(storage.getFiles(), not(hasItem("debian/dists/bookworm/contrib/binary-amd64/Packages")));
        assertThat(storage.getFiles(), hasItem(HELLO_POOL));
    }

    @Test
    public void updateCleanupFailureIsWarning()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);
        storage.setFailRemovals(true);

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .sources(ImmutableList.of(RestSourceBinding.of("main", "snap1")))
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.update("debian", "bookworm", update, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getTask().get().getWarnings(), hasSize(1));
        assertThat(response.getTask().get().getWarnings().get(0), startsWith("cleanup of debian/bookworm failed: "));
        assertThat(api.get("debian", "bookworm").getSources(), contains(RestSourceBinding.of("main", "snap1")));
    }

    @Test
    public void updateKeepsMultiDistWhenOmitted()
        throws Exception
    {
        PackageFile hello2 = pkg("hello", "2.0", "amd64");
        snapshot("snap1", hello);
        snapshot("snap2", hello2);
        RestPublishCreateRequest create = RestPublishCreateRequest.builder()
            .from(request("bookworm", RestSourceBinding.of("main", "snap1")))
            .multiDist(true)
            .build();
        api.create("debian", create, false);
        assertThat(storage.getFiles(), hasItem("debian/pool/bookworm/main/h/hello/hello_1.0_amd64.deb"));

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .sources(ImmutableList.of(RestSourceBinding.of("main", "snap2")))
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.update("debian", "bookworm", update, false);

        assertThat(response.getPublishedRepo().get().getMultiDist(), is(true));
        assertThat(storage.getFiles(), hasItem("debian/pool/bookworm/main/h/hello/hello_2.0_amd64.deb"));
        assertThat(storage.getFiles(), not(hasItem("debian/pool/main/h/hello/hello_2.0_amd64.deb")));
    }

    @Test
    public void updateSwitchesSnapshot()
        throws Exception
    {
        PackageFile hello2 = pkg("hello", "2.0", "amd64");
        snapshot("snap1", hello);
        snapshot("snap2", hello2);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .sources(ImmutableList.of(RestSourceBinding.of("main", "snap2")))
            .signing(RestSigningOptions.skip())
            .skipContents(true)
            .build();
        PublishResponse response = api.update("debian", "bookworm", update, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getPublishedRepo().get().getSkipContents(), is(true));
        assertThat(storage.getFiles(), hasItem("debian/pool/main/h/hello/hello_2.0_amd64.deb"));
        assertThat(storage.getFiles(), not(hasItem(HELLO_POOL)));
    }

    @Test
    public void updateWithSkipCleanupKeepsFiles()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .sources(ImmutableList.of(RestSourceBinding.of("main", "snap1")))
            .signing(RestSigningOptions.skip())
            .skipCleanup(true)
            .build();
        assertThat(api.update("debian", "bookworm", update, false).getStatus(), is(TaskStatus.OK));
        assertThat(storage.getFiles(), hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb"));
    }

    @Test
    @SuppressWarnings("deprecation")
    public void legacySnapshotsAreAcceptedWithWarning()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        RestPublishUpdateRequest update = RestPublishUpdateRequest.builder()
            .snapshots(ImmutableList.of(RestSourceBinding.of("main", "snap2")))
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.update("debian", "bookworm", update, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getPublishedRepo().get().getSources(), contains(RestSourceBinding.of("main", "snap2")));
        assertThat(embed.getTaskScheduler().getTaskOutput(response.getTask().get().getId()),
                hasItem("Warning: Snapshots is deprecated, use Sources instead"));
    }

    @Test
    public void updateUnknownRepoIsNotFound()
        throws Exception
    {
        try {
            api.update("debian", "nope", RestPublishUpdateRequest.builder().build(), false);
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), startsWith("unable to update: "));
        }
    }

    @Test
    @SuppressWarnings("deprecation")
    public void localRepoIsRefreshedFromCurrentContent()
        throws Exception
    {
        PackageFile hello11 = pkg("hello", "1.1", "amd64");
        sourceStore.putPackage(hello);
        sourceStore.putPackage(hello11);
        LocalRepo local = sourceStore.addLocalRepo(LocalRepo.builder()
                .from(LocalRepo.of("local1"))
                .defaultDistribution("sid")
                .defaultComponent("contrib")
                .build());
        sourceStore.addLocalRepoPackages(local.getUuid(), ImmutableList.of(hello.getKey()));

        RestPublishCreateRequest create = RestPublishCreateRequest.builder()
            .sourceKind("local")
            .addSources(RestSourceBinding.builder().name("local1").build())
            .signing(RestSigningOptions.skip())
            .build();
        RestPublishedRepo created = api.create("ppa/team", create, false).getPublishedRepo().get();
        assertThat(created.getDistribution(), is("sid"));
        assertThat(created.getSources(), contains(RestSourceBinding.of("contrib", "local1")));
        assertThat(storage.getFiles(), hasItem("ppa/team/pool/contrib/h/hello/hello_1.0_amd64.deb"));

        sourceStore.addLocalRepoPackages(local.getUuid(), ImmutableList.of(hello11.getKey()));
        sourceStore.removeLocalRepoPackages(local.getUuid(), ImmutableList.of(hello.getKey()));

        RestPublishUpdateRequest refresh = RestPublishUpdateRequest.builder()
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse refreshed = api.update("ppa/team", "sid", refresh, false);
        assertThat(refreshed.getStatus(), is(TaskStatus.OK));
        assertThat(embed.getTaskScheduler().getTaskDetail(refreshed.getTask().get().getId())
                .get("refreshed_sources", int.class), is(1));
        assertThat(storage.getFiles(), hasItem("ppa/team/pool/contrib/h/hello/hello_1.1_amd64.deb"));
        assertThat(storage.getFiles(), not(hasItem("ppa/team/pool/contrib/h/hello/hello_1.0_amd64.deb")));

        RestPublishUpdateRequest legacy = RestPublishUpdateRequest.builder()
            .snapshots(ImmutableList.of(RestSourceBinding.of("contrib", "local1")))
            .build();
        try {
            api.update("ppa/team", "sid", legacy, false);
            fail();
        }
        catch (ModelValidationException ex) {
            assertThat(ex.getMessage(), containsString("snapshots shouldn't be given when updating local repo"));
        }
    }

    @Test
    public void removeComponentsCleansUp()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);

        RestPublishRemoveRequest remove = RestPublishRemoveRequest.builder()
            .addComponents("contrib")
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.removeComponents("debian", "bookworm", remove, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getTask().get().getName(), is("Remove components 'contrib' from publish debian (bookworm)"));
        assertThat(response.getPublishedRepo().get().getSources(), contains(RestSourceBinding.of("main", "snap1")));
        assertThat(storage.getFiles(), not(hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb")));
        assertThat(storage.getFiles(), not(hasItem("debian/dists/bookworm/contrib/binary-amd64/Packages")));
        assertThat(storage.getFiles(), hasItem(HELLO_POOL));
    }

    @Test
    public void removeComponentsCleanupFailureIsWarning()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);
        storage.setFailRemovals(true);

        RestPublishRemoveRequest remove = RestPublishRemoveRequest.builder()
            .addComponents("contrib")
            .signing(RestSigningOptions.skip())
            .build();
        PublishResponse response = api.removeComponents("debian", "bookworm", remove, false);

        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(response.getTask().get().getWarnings(), hasSize(1));
        assertThat(response.getTask().get().getWarnings().get(0), startsWith("cleanup of debian/bookworm failed: "));
        assertThat(response.getPublishedRepo().get().getSources(), contains(RestSourceBinding.of("main", "snap1")));
        assertThat(storage.getFiles(), hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb"));
    }

    @Test
    public void removeUnknownComponentChangesNothing()
        throws Exception
    {
        snapshot("snap1", hello);
        snapshot("snap2", extra);
        api.create("debian", request("bookworm",
                    RestSourceBinding.of("main", "snap1"), RestSourceBinding.of("contrib", "snap2")), false);

        RestPublishRemoveRequest remove = RestPublishRemoveRequest.builder()
            .addComponents("contrib", "missing")
            .signing(RestSigningOptions.skip())
            .build();
        try {
            api.removeComponents("debian", "bookworm", remove, false);
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(),
                    is("unable to update: component missing does not exist in published repository debian/bookworm"));
        }
        assertThat(api.get("debian", "bookworm").getSources(), hasSize(2));
        assertThat(storage.getFiles(), hasItem("debian/pool/contrib/e/extra/extra_0.1_amd64.deb"));
    }

    @Test
    public void removeEveryComponentIsRejected()
        throws Exception
    {
        snapshot("snap1", hello);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        RestPublishRemoveRequest remove = RestPublishRemoveRequest.builder()
            .addComponents("main")
            .build();
        try {
            api.removeComponents("debian", "bookworm", remove, false);
            fail();
        }
        catch (ModelValidationException ex) {
        }
        assertThat(api.list(), hasSize(1));
    }

    @Test
    public void dropRemovesEverything()
        throws Exception
    {
        snapshot("snap1", hello);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        PublishResponse response = api.drop("debian", "bookworm", false, false, false);
        assertThat(response.getStatus(), is(TaskStatus.OK));
        assertThat(api.list(), is(empty()));
        assertThat(storage.getFiles(), is(empty()));
    }

    @Test
    public void dropWithSkipCleanupKeepsFiles()
        throws Exception
    {
        snapshot("snap1", hello);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);

        assertThat(api.drop("debian", "bookworm", false, true, false).getStatus(), is(TaskStatus.OK));
        assertThat(api.list(), is(empty()));
        assertThat(storage.getFiles(), hasItem(HELLO_POOL));
        assertThat(storage.getFiles(), hasItem("debian/dists/bookworm/Release"));
    }

    @Test
    public void dropKeepsFilesSharedWithOtherDistributions()
        throws Exception
    {
        snapshot("snap1", hello);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);
        api.create("debian", request("trixie", RestSourceBinding.of("main", "snap1")), false);

        assertThat(api.drop("debian", "bookworm", false, false, false).getStatus(), is(TaskStatus.OK));

        assertThat(storage.getFiles(), not(hasItem("debian/dists/bookworm/Release")));
        assertThat(storage.getFiles(), hasItem("debian/dists/trixie/Release"));
        assertThat(storage.getFiles(), hasItem(HELLO_POOL));
        assertThat(api.list(), hasSize(1));
    }

    @Test
    public void dropFailsWhenFilesCannotBeRemoved()
        throws Exception
    {
        snapshot("snap1", hello);
        api.create("debian", request("bookworm", RestSourceBinding.of("main", "snap1")), false);
        storage.setFailRemovals(true);

        PublishResponse failed = api.drop("debian", "bookworm", false, false, false);
        assertThat(failed.getStatus(), is(TaskStatus.INTERNAL_ERROR));
        assertThat(failed.getError().get(), startsWith("unable to drop: published files removal failed, use force to override: "));
        assertThat(api.list(), hasSize(1));

        PublishResponse forced = api.drop("debian", "bookworm", true, false, false);
        assertThat(forced.getStatus(), is(TaskStatus.OK));
        assertThat(forced.getTask().get().getWarnings(), hasSize(1));
        assertThat(forced.getTask().get().getWarnings().get(0), startsWith("cleanup of debian/bookworm failed: "));
        assertThat(api.list(), is(empty()));
    }

    @Test
    public void dropUnknownRepoIsNotFound()
        throws Exception
    {
        try {
            api.drop("debian", "nope", false, false, false);
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), startsWith("unable to drop: "));
        }
    }

    @Test
    public void parsesFlags()
    {
        assertThat(PublishApi.parseFlag("1"), is(true));
        assertThat(PublishApi.parseFlag("Yes"), is(true));
        assertThat(PublishApi.parseFlag("true"), is(true));
        assertThat(PublishApi.parseFlag("0"), is(false));
        assertThat(PublishApi.parseFlag(""), is(false));
        assertThat(PublishApi.parseFlag(null), is(false));
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
}
