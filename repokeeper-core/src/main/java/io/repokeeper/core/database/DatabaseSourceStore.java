package io.repokeeper.core.database;

import com.google.inject.Inject;
import io.repokeeper.core.repository.ImmutableLocalRepo;
import io.repokeeper.core.repository.ImmutableSnapshot;
import io.repokeeper.core.repository.LocalRepo;
import io.repokeeper.core.repository.PublishSource;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.Snapshot;
import io.repokeeper.core.repository.SourceKind;
import io.repokeeper.core.repository.SourceStore;
import io.repokeeper.spi.ImmutablePackageFile;
import io.repokeeper.spi.PackageFile;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public class DatabaseSourceStore
        extends BasicDatabaseStoreManager<DatabaseSourceStore.Dao>
        implements SourceStore
{
    private final JsonColumnMapper jcm;

    @Inject
    public DatabaseSourceStore(DatabaseConfig config, TransactionManager tm, JsonColumnMapper jcm)
    {
        super(config.getType(), dao(config.getType()), tm);
        this.jcm = jcm;
    }

    private static Class<? extends Dao> dao(String type)
    {
        switch (type) {
            case "postgresql":
                return PgDao.class;
            case "h2":
                return H2Dao.class;
            default:
                throw new IllegalArgumentException("Unknown database type: " + type);
        }
    }

    @Override
    public Snapshot addSnapshot(Snapshot snapshot, Collection<String> packageKeys)
        throws ResourceConflictException, ResourceNotFoundException
    {
        return this.<Snapshot, ResourceConflictException, ResourceNotFoundException>transaction((handle, dao) -> {
            catchConflict(() ->
                    dao.insertSnapshot(snapshot.getUuid().toString(), snapshot.getName(),
                        snapshot.getDescription().orNull(), snapshot.getCreatedAt()),
                    "snapshot named %s", snapshot.getName());
            addSourcePackages(dao, snapshot.getUuid(), packageKeys);
            return snapshot;
        }, ResourceConflictException.class, ResourceNotFoundException.class);
    }

    @Override
    public Snapshot getSnapshotByName(String name)
        throws ResourceNotFoundException
    {
        return requiredResource(
                (handle, dao) -> dao.getSnapshotByName(name),
                "snapshot named %s", name);
    }

    @Override
    public LocalRepo addLocalRepo(LocalRepo repo)
        throws ResourceConflictException
    {
        return transaction((handle, dao) -> {
            catchConflict(() ->
                    dao.insertLocalRepo(repo.getUuid().toString(), repo.getName(),
                        repo.getComment().orNull(),
                        repo.getDefaultDistribution().orNull(), repo.getDefaultComponent().orNull(),
                        repo.getCreatedAt()),
                    "local repository named %s", repo.getName());
            return repo;
        }, ResourceConflictException.class);
    }

    @Override
    public LocalRepo getLocalRepoByName(String name)
        throws ResourceNotFoundException
    {
        return requiredResource(
                (handle, dao) -> dao.getLocalRepoByName(name),
                "local repository named %s", name);
    }

    @Override
    public void addLocalRepoPackages(UUID localRepoUuid, Collection<String> packageKeys)
        throws ResourceNotFoundException
    {
        transaction((handle, dao) -> {
            requiredResource(dao.getLocalRepoByUuid(localRepoUuid.toString()),
                    "local repository uuid=%s", localRepoUuid);
            addSourcePackages(dao, localRepoUuid, packageKeys);
            return null;
        }, ResourceNotFoundException.class);
    }

    @Override
    public void removeLocalRepoPackages(UUID localRepoUuid, Collection<String> packageKeys)
        throws ResourceNotFoundException
    {
        transaction((handle, dao) -> {
            requiredResource(dao.getLocalRepoByUuid(localRepoUuid.toString()),
                    "local repository uuid=%s", localRepoUuid);
            for (String key : packageKeys) {
                dao.deleteSourcePackage(localRepoUuid.toString(), key);
            }
            return null;
        }, ResourceNotFoundException.class);
    }

    private void addSourcePackages(Dao dao, UUID sourceUuid, Collection<String> packageKeys)
        throws ResourceNotFoundException
    {
        for (String key : packageKeys) {
            if (dao.countPackages(key) == 0) {
                throw new ResourceNotFoundException("Resource does not exist: package " + key);
            }
            dao.insertSourcePackageIfNotExists(sourceUuid.toString(), key);
        }
    }

    @Override
    public PublishSource getSource(SourceKind kind, UUID uuid)
        throws ResourceNotFoundException
    {
        switch (kind) {
        case SNAPSHOT:
            return requiredResource(
                    (handle, dao) -> dao.getSnapshotByUuid(uuid.toString()),
                    "snapshot uuid=%s", uuid);
        case LOCAL:
            return requiredResource(
                    (handle, dao) -> dao.getLocalRepoByUuid(uuid.toString()),
                    "local repository uuid=%s", uuid);
        default:
            throw new AssertionError("Unknown source kind: " + kind);
        }
    }

    @Override
    public PublishSource getSourceByName(SourceKind kind, String name)
        throws ResourceNotFoundException
    {
        switch (kind) {
        case SNAPSHOT:
            return getSnapshotByName(name);
        case LOCAL:
            return getLocalRepoByName(name);
        default:
            throw new AssertionError("Unknown source kind: " + kind);
        }
    }

    @Override
    public void putPackage(PackageFile pkg)
    {
        autoCommit((handle, dao) ->
                dao.insertPackageIfNotExists(pkg.getKey(), pkg.getName(), pkg.getVersion(),
                    pkg.getArchitecture(), pkg.getSource(), pkg.getFilename(), pkg.getPoolPath(),
                    pkg.getSize(), pkg.getMd5(), pkg.getSha1(), pkg.getSha256(),
                    jcm.toText(pkg.getControlFields())));
    }

    @Override
    public List<PackageFile> getPackages(UUID sourceUuid)
    {
        return autoCommit((handle, dao) -> dao.getPackages(sourceUuid.toString()));
    }

    public interface Dao
    {
        @SqlUpdate("insert into snapshots (uuid, name, description, created_at)" +
                " values (:uuid, :name, :description, :createdAt)")
        int insertSnapshot(@Bind("uuid") String uuid, @Bind("name") String name,
                @Bind("description") String description, @Bind("createdAt") Instant createdAt);

        @SqlQuery("select * from snapshots where name = :name")
        Snapshot getSnapshotByName(@Bind("name") String name);

        @SqlQuery("select * from snapshots where uuid = :uuid")
        Snapshot getSnapshotByUuid(@Bind("uuid") String uuid);

        @SqlUpdate("insert into local_repos (uuid, name, comment, default_distribution, default_component, created_at)" +
                " values (:uuid, :name, :comment, :defaultDistribution, :defaultComponent, :createdAt)")
        int insertLocalRepo(@Bind("uuid") String uuid, @Bind("name") String name,
                @Bind("comment") String comment,
                @Bind("defaultDistribution") String defaultDistribution, @Bind("defaultComponent") String defaultComponent,
                @Bind("createdAt") Instant createdAt);

        @SqlQuery("select * from local_repos where name = :name")
        LocalRepo getLocalRepoByName(@Bind("name") String name);

        @SqlQuery("select * from local_repos where uuid = :uuid")
        LocalRepo getLocalRepoByUuid(@Bind("uuid") String uuid);

        @SqlQuery("select p.* from packages p" +
                " join source_packages s on s.package_key = p.package_key" +
                " where s.source_uuid = :sourceUuid" +
                " order by p.package_key")
        List<PackageFile> getPackages(@Bind("sourceUuid") String sourceUuid);

        @SqlQuery("select count(*) from packages where package_key = :packageKey")
        int countPackages(@Bind("packageKey") String packageKey);

        @SqlUpdate("delete from source_packages" +
                " where source_uuid = :sourceUuid and package_key = :packageKey")
        int deleteSourcePackage(@Bind("sourceUuid") String sourceUuid, @Bind("packageKey") String packageKey);

        int insertSourcePackageIfNotExists(String sourceUuid, String packageKey);

        int insertPackageIfNotExists(String packageKey, String name, String version,
                String architecture, String sourceName, String filename, String poolPath,
                long size, String md5, String sha1, String sha256, String controlFields);
    }

    public interface PgDao
            extends Dao
    {
        @Override
        @SqlUpdate("insert into source_packages (source_uuid, package_key)" +
                " values (:sourceUuid, :packageKey)" +
                " on conflict (source_uuid, package_key) do nothing")
        int insertSourcePackageIfNotExists(@Bind("sourceUuid") String sourceUuid, @Bind("packageKey") String packageKey);

        @Override
        @SqlUpdate("insert into packages" +
                " (package_key, name, package_version, architecture, source_name, filename, pool_path," +
                " file_size, md5, sha1, sha256, control_fields)" +
                " values (:packageKey, :name, :version, :architecture, :sourceName, :filename, :poolPath," +
                " :size, :md5, :sha1, :sha256, :controlFields)" +
                " on conflict (package_key) do nothing")
        int insertPackageIfNotExists(@Bind("packageKey") String packageKey, @Bind("name") String name, @Bind("version") String version,
                @Bind("architecture") String architecture, @Bind("sourceName") String sourceName,
                @Bind("filename") String filename, @Bind("poolPath") String poolPath,
                @Bind("size") long size, @Bind("md5") String md5, @Bind("sha1") String sha1, @Bind("sha256") String sha256,
                @Bind("controlFields") String controlFields);
    }

    public interface H2Dao
            extends Dao
    {
        @Override
        @SqlUpdate("merge into source_packages (source_uuid, package_key)" +
                " key (source_uuid, package_key)" +
                " values (:sourceUuid, :packageKey)")
        int insertSourcePackageIfNotExists(@Bind("sourceUuid") String sourceUuid, @Bind("packageKey") String packageKey);

        // package keys include the md5 of the file, so rows with the same key hold the same values
        @Override
        @SqlUpdate("merge into packages" +
                " (package_key, name, package_version, architecture, source_name, filename, pool_path," +
                " file_size, md5, sha1, sha256, control_fields)" +
                " key (package_key)" +
                " values (:packageKey, :name, :version, :architecture, :sourceName, :filename, :poolPath," +
                " :size, :md5, :sha1, :sha256, :controlFields)")
        int insertPackageIfNotExists(@Bind("packageKey") String packageKey, @Bind("name") String name, @Bind("version") String version,
                @Bind("architecture") String architecture, @Bind("sourceName") String sourceName,
                @Bind("filename") String filename, @Bind("poolPath") String poolPath,
                @Bind("size") long size, @Bind("md5") String md5, @Bind("sha1") String sha1, @Bind("sha256") String sha256,
                @Bind("controlFields") String controlFields);
    }

    static class SnapshotMapper
            implements RowMapper<Snapshot>
    {
        @Override
        public Snapshot map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableSnapshot.builder()
                .uuid(getUuid(r, "uuid"))
                .name(r.getString("name"))
                .description(getOptionalString(r, "description"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .build();
        }
    }

    static class LocalRepoMapper
            implements RowMapper<LocalRepo>
    {
        @Override
        public LocalRepo map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutableLocalRepo.builder()
                .uuid(getUuid(r, "uuid"))
                .name(r.getString("name"))
                .comment(getOptionalString(r, "comment"))
                .defaultDistribution(getOptionalString(r, "default_distribution"))
                .defaultComponent(getOptionalString(r, "default_component"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .build();
        }
    }

    static class PackageFileMapper
            implements RowMapper<PackageFile>
    {
        private final JsonColumnMapper jcm;

        PackageFileMapper(JsonColumnMapper jcm)
        {
            this.jcm = jcm;
        }

        @Override
        public PackageFile map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return ImmutablePackageFile.builder()
                .name(r.getString("name"))
                .version(r.getString("package_version"))
                .architecture(r.getString("architecture"))
                .source(r.getString("source_name"))
                .filename(r.getString("filename"))
                .poolPath(r.getString("pool_path"))
                .size(r.getLong("file_size"))
                .md5(r.getString("md5"))
                .sha1(r.getString("sha1"))
                .sha256(r.getString("sha256"))
                .controlFields(jcm.stringMapFromResultSet(r, "control_fields"))
                .build();
        }
    }
}
