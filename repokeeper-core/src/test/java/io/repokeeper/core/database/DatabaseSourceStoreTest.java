package io.repokeeper.core.database;

import com.google.common.collect.ImmutableList;
import io.repokeeper.core.repository.LocalRepo;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.Snapshot;
import io.repokeeper.core.repository.SourceKind;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.spi.PackageFile;
import java.util.UUID;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.repokeeper.core.database.DatabaseTestingUtils.setupDatabase;
import static io.repokeeper.core.repository.PackageFixtures.pkg;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class DatabaseSourceStoreTest
{
    private DatabaseFactory factory;
    private SourceStore store;

    @Before
    public void setUp()
    {
        factory = setupDatabase();
        store = factory.getSourceStore();
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void snapshotsKeepTheirPackages()
        throws Exception
    {
        PackageFile hello = pkg("hello", "1.0", "amd64");
        PackageFile world = pkg("world", "2.0", "all");
        store.putPackage(hello);
        store.putPackage(world);
        // registering the same package again is a no-op
        store.putPackage(hello);

        Snapshot snapshot = store.addSnapshot(Snapshot.of("snap1"), ImmutableList.of(world.getKey(), hello.getKey()));

        Snapshot loaded = store.getSnapshotByName("snap1");
        assertThat(loaded.getUuid(), is(snapshot.getUuid()));
        assertThat(store.getPackages(snapshot.getUuid()), contains(world, hello));

        PublishSource source = store.getSource(SourceKind.SNAPSHOT, snapshot.getUuid());
        assertThat(source, instanceOf(Snapshot.class));
        assertThat(source.getName(), is("snap1"));
    }

    @Test
    public void snapshotNamesAreUnique()
        throws Exception
    {
        store.addSnapshot(Snapshot.of("snap1"), ImmutableList.of());
        try {
            store.addSnapshot(Snapshot.of("snap1"), ImmutableList.of());
            fail();
        }
        catch (ResourceConflictException ex) {
            assertThat(ex.getMessage(), is("Resource already exists: snapshot named snap1"));
        }
    }

    @Test
    public void snapshotOfUnknownPackageIsRejected()
        throws Exception
    {
        try {
            store.addSnapshot(Snapshot.of("snap1"), ImmutableList.of("Pamd64 missing 1.0 00"));
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), is("Resource does not exist: package Pamd64 missing 1.0 00"));
        }
        // the whole snapshot is rolled back
        try {
            store.getSnapshotByName("snap1");
            fail();
        }
        catch (ResourceNotFoundException ex) {
        }
    }

    @Test
    public void writesSucceedAfterCommitAndRollback()
        throws Exception
    {
        PackageFile hello = pkg("hello", "1.0", "amd64");
        store.putPackage(hello);
        store.addSnapshot(Snapshot.of("snap1"), ImmutableList.of(hello.getKey()));
        try {
            store.addSnapshot(Snapshot.of("snap2"), ImmutableList.of("Pamd64 missing 1.0 00"));
            fail();
        }
        catch (ResourceNotFoundException ex) {
        }
        Snapshot snap3 = store.addSnapshot(Snapshot.of("snap3"), ImmutableList.of(hello.getKey()));

        assertThat(store.getSnapshotByName("snap1").getName(), is("snap1"));
        assertThat(store.getPackages(snap3.getUuid()), contains(hello));
    }

    @Test
    public void localRepoPackagesChangeInPlace()
        throws Exception
    {
        PackageFile hello = pkg("hello", "1.0", "amd64");
        PackageFile hello2 = pkg("hello", "1.1", "amd64");
        store.putPackage(hello);
        store.putPackage(hello2);

        LocalRepo repo = store.addLocalRepo(LocalRepo.builder()
                .from(LocalRepo.of("local1"))
                .defaultDistribution("bookworm")
                .defaultComponent("contrib")
                .build());

        store.addLocalRepoPackages(repo.getUuid(), ImmutableList.of(hello.getKey()));
        assertThat(store.getPackages(repo.getUuid()), contains(hello));

        store.addLocalRepoPackages(repo.getUuid(), ImmutableList.of(hello2.getKey(), hello.getKey()));
        store.removeLocalRepoPackages(repo.getUuid(), ImmutableList.of(hello.getKey()));
        assertThat(store.getPackages(repo.getUuid()), contains(hello2));

        LocalRepo loaded = (LocalRepo) store.getSourceByName(SourceKind.LOCAL, "local1");
        assertThat(loaded.getDefaultDistribution().get(), is("bookworm"));
        assertThat(loaded.getDefaultComponent().get(), is("contrib"));
    }

    @Test
    public void notFounds()
        throws Exception
    {
        try {
            store.getSource(SourceKind.LOCAL, UUID.randomUUID());
            fail();
        }
        catch (ResourceNotFoundException ex) {
        }
        try {
            store.getSourceByName(SourceKind.SNAPSHOT, "nope");
            fail();
        }
        catch (ResourceNotFoundException ex) {
            assertThat(ex.getMessage(), is("Resource does not exist: snapshot named nope"));
        }
        try {
            store.addLocalRepoPackages(UUID.randomUUID(), ImmutableList.of());
            fail();
        }
        catch (ResourceNotFoundException ex) {
        }
        assertThat(store.getPackages(UUID.randomUUID()), is(empty()));
    }
}
