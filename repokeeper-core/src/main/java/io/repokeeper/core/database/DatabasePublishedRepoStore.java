package io.repokeeper.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.repokeeper.core.publish.ImmutableStoredPublishedRepo;
import io.repokeeper.core.publish.PublishedRepo;
import io.repokeeper.core.publish.PublishedRepoStore;
import io.repokeeper.core.publish.StoredPublishedRepo;
import io.repokeeper.core.repository.ResourceConflictException;
import io.repokeeper.core.repository.ResourceNotFoundException;
import io.repokeeper.core.repository.SourceKind;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class DatabasePublishedRepoStore
        extends BasicDatabaseStoreManager<DatabasePublishedRepoStore.Dao>
        implements PublishedRepoStore
{
    private final JsonColumnMapper jcm;

    @Inject
    public DatabasePublishedRepoStore(DatabaseConfig config, TransactionManager tm, JsonColumnMapper jcm)
    {
        super(config.getType(), Dao.class, tm);
        this.jcm = jcm;
    }

    @Override
    public List<StoredPublishedRepo> getPublishedRepos()
    {
        return autoCommit((handle, dao) -> withSources(dao, dao.getPublishedRepos()));
    }

    @Override
    public StoredPublishedRepo getPublishedRepo(String storage, String prefix, String distribution)
        throws ResourceNotFoundException
    {
        return requiredResource(
                findPublishedRepo(storage, prefix, distribution).orNull(),
                "published repository storage=%s, prefix=%s, distribution=%s", storage, prefix, distribution);
    }

    @Override
    public Optional<StoredPublishedRepo> findPublishedRepo(String storage, String prefix, String distribution)
    {
        return autoCommit((handle, dao) -> {
            PublishedRepoRow row = dao.getPublishedRepo(storage, prefix, distribution);
            if (row == null) {
                return Optional.<StoredPublishedRepo>absent();
            }
            return Optional.of(withSources(dao, row));
        });
    }

    @Override
    public List<StoredPublishedRepo> getPublishedReposByPrefix(String storage, String prefix)
    {
        return autoCommit((handle, dao) -> withSources(dao, dao.getPublishedReposByPrefix(storage, prefix)));
    }

    @Override
    public List<StoredPublishedRepo> getPublishedReposBySource(UUID sourceUuid)
    {
        return autoCommit((handle, dao) -> withSources(dao, dao.getPublishedReposBySource(sourceUuid.toString())));
    }

    @Override
    public StoredPublishedRepo addPublishedRepo(PublishedRepo repo)
        throws ResourceConflictException
    {
        return transaction((handle, dao) -> {
            long id = catchConflict(() ->
                    dao.insertPublishedRepo(
                        repo.getUuid().toString(),
                        repo.getStorage(), repo.getPrefix(), repo.getDistribution(),
                        repo.getSourceKind().getName(),
                        jcm.toText(repo.getArchitectures()),
                        repo.getLabel().orNull(), repo.getOrigin().orNull(),
                        repo.getNotAutomatic().orNull(), repo.getButAutomaticUpgrades().orNull(),
                        repo.getSkipContents(), repo.getSkipBz2(),
                        repo.getAcquireByHash(), repo.getMultiDist()),
                    "published repository %s/%s", repo.getStoragePrefix(), repo.getDistribution());
            insertSources(dao, id, repo);
            return withSources(dao, dao.getPublishedRepoById(id));
        }, ResourceConflictException.class);
    }

    @Override
    public StoredPublishedRepo updatePublishedRepo(PublishedRepo repo)
        throws ResourceNotFoundException
    {
        return transaction((handle, dao) -> {
            PublishedRepoRow row = requiredResource(
                    dao.lockPublishedRepoByUuid(repo.getUuid().toString()),
                    "published repository uuid=%s", repo.getUuid());
            dao.updatePublishedRepo(row.id,
                    jcm.toText(repo.getArchitectures()),
                    repo.getLabel().orNull(), repo.getOrigin().orNull(),
                    repo.getNotAutomatic().orNull(), repo.getButAutomaticUpgrades().orNull(),
                    repo.getSkipContents(), repo.getSkipBz2(),
                    repo.getAcquireByHash(), repo.getMultiDist());
            dao.deleteSources(row.id);
            insertSources(dao, row.id, repo);
            return withSources(dao, dao.getPublishedRepoById(row.id));
        }, ResourceNotFoundException.class);
    }

    @Override
    public void deletePublishedRepo(UUID uuid)
        throws ResourceNotFoundException
    {
        transaction((handle, dao) -> {
            PublishedRepoRow row = requiredResource(
                    dao.lockPublishedRepoByUuid(uuid.toString()),
                    "published repository uuid=%s", uuid);
            dao.deleteSources(row.id);
            dao.deletePublishedRepo(row.id);
            return null;
        }, ResourceNotFoundException.class);
    }

    private static void insertSources(Dao dao, long id, PublishedRepo repo)
    {
        for (Map.Entry<String, UUID> pair : repo.getSources().entrySet()) {
            dao.insertSource(id, pair.getKey(), pair.getValue().toString());
        }
    }

    private static List<StoredPublishedRepo> withSources(Dao dao, List<PublishedRepoRow> rows)
    {
        ImmutableList.Builder<StoredPublishedRepo> builder = ImmutableList.builder();
        for (PublishedRepoRow row : rows) {
            builder.add(withSources(dao, row));
        }
        return builder.build();
    }

    private static StoredPublishedRepo withSources(Dao dao, PublishedRepoRow row)
    {
        for (SourceBindingRow binding : dao.getSources(row.id)) {
            row.builder.putSources(binding.component, binding.sourceUuid);
        }
        return row.builder.build();
    }

    public interface Dao
    {
        @SqlQuery("select * from published_repos" +
                " order by storage, prefix, distribution")
        List<PublishedRepoRow> getPublishedRepos();

        @SqlQuery("select * from published_repos" +
                " where storage = :storage and prefix = :prefix and distribution = :distribution")
        PublishedRepoRow getPublishedRepo(@Bind("storage") String storage, @Bind("prefix") String prefix, @Bind("distribution") String distribution);

        @SqlQuery("select * from published_repos" +
                " where id = :id")
        PublishedRepoRow getPublishedRepoById(@Bind("id") long id);

        @SqlQuery("select * from published_repos" +
                " where uuid = :uuid" +
                " for update")
        PublishedRepoRow lockPublishedRepoByUuid(@Bind("uuid") String uuid);

        @SqlQuery("select * from published_repos" +
                " where storage = :storage and prefix = :prefix" +
                " order by distribution")
        List<PublishedRepoRow> getPublishedReposByPrefix(@Bind("storage") String storage, @Bind("prefix") String prefix);

        @SqlQuery("select * from published_repos r" +
                " where exists (" +
                    "select * from published_sources s" +
                    " where s.published_repo_id = r.id and s.source_uuid = :sourceUuid" +
                ")" +
                " order by storage, prefix, distribution")
        List<PublishedRepoRow> getPublishedReposBySource(@Bind("sourceUuid") String sourceUuid);

        @SqlQuery("select * from published_sources" +
                " where published_repo_id = :id" +
                " order by component")
        List<SourceBindingRow> getSources(@Bind("id") long id);

        @SqlUpdate("insert into published_repos" +
                " (uuid, storage, prefix, distribution, source_kind, architectures," +
                " label, origin, not_automatic, but_automatic_upgrades," +
                " skip_contents, skip_bz2, acquire_by_hash, multi_dist, created_at, updated_at)" +
                " values (:uuid, :storage, :prefix, :distribution, :sourceKind, :architectures," +
                " :label, :origin, :notAutomatic, :butAutomaticUpgrades," +
                " :skipContents, :skipBz2, :acquireByHash, :multiDist, now(), now())")
        @GetGeneratedKeys("id")
        long insertPublishedRepo(@Bind("uuid") String uuid,
                @Bind("storage") String storage, @Bind("prefix") String prefix, @Bind("distribution") String distribution,
                @Bind("sourceKind") String sourceKind, @Bind("architectures") String architectures,
                @Bind("label") String label, @Bind("origin") String origin,
                @Bind("notAutomatic") String notAutomatic, @Bind("butAutomaticUpgrades") String butAutomaticUpgrades,
                @Bind("skipContents") boolean skipContents, @Bind("skipBz2") boolean skipBz2,
                @Bind("acquireByHash") boolean acquireByHash, @Bind("multiDist") boolean multiDist);

        @SqlUpdate("update published_repos" +
                " set architectures = :architectures," +
                " label = :label, origin = :origin," +
                " not_automatic = :notAutomatic, but_automatic_upgrades = :butAutomaticUpgrades," +
                " skip_contents = :skipContents, skip_bz2 = :skipBz2," +
                " acquire_by_hash = :acquireByHash, multi_dist = :multiDist," +
                " updated_at = now()" +
                " where id = :id")
        int updatePublishedRepo(@Bind("id") long id, @Bind("architectures") String architectures,
                @Bind("label") String label, @Bind("origin") String origin,
                @Bind("notAutomatic") String notAutomatic, @Bind("butAutomaticUpgrades") String butAutomaticUpgrades,
                @Bind("skipContents") boolean skipContents, @Bind("skipBz2") boolean skipBz2,
                @Bind("acquireByHash") boolean acquireByHash, @Bind("multiDist") boolean multiDist);

        @SqlUpdate("delete from published_repos where id = :id")
        int deletePublishedRepo(@Bind("id") long id);

        @SqlUpdate("insert into published_sources (published_repo_id, component, source_uuid)" +
                " values (:id, :component, :sourceUuid)")
        int insertSource(@Bind("id") long id, @Bind("component") String component, @Bind("sourceUuid") String sourceUuid);

        @SqlUpdate("delete from published_sources where published_repo_id = :id")
        int deleteSources(@Bind("id") long id);
    }

    public static class PublishedRepoRow
    {
        final long id;
        final ImmutableStoredPublishedRepo.Builder builder;

        PublishedRepoRow(long id, ImmutableStoredPublishedRepo.Builder builder)
        {
            this.id = id;
            this.builder = builder;
        }
    }

    public static class SourceBindingRow
    {
        final String component;
        final UUID sourceUuid;

        SourceBindingRow(String component, UUID sourceUuid)
        {
            this.component = component;
            this.sourceUuid = sourceUuid;
        }
    }

    static class PublishedRepoRowMapper
            implements RowMapper<PublishedRepoRow>
    {
        private final JsonColumnMapper jcm;

        PublishedRepoRowMapper(JsonColumnMapper jcm)
        {
            this.jcm = jcm;
        }

        @Override
        public PublishedRepoRow map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            long id = r.getLong("id");
            ImmutableStoredPublishedRepo.Builder builder = ImmutableStoredPublishedRepo.builder()
                .id(id)
                .uuid(getUuid(r, "uuid"))
                .storage(r.getString("storage"))
                .prefix(r.getString("prefix"))
                .distribution(r.getString("distribution"))
                .sourceKind(SourceKind.of(r.getString("source_kind")))
                .architectures(jcm.stringListFromResultSet(r, "architectures"))
                .label(getOptionalString(r, "label"))
                .origin(getOptionalString(r, "origin"))
                .notAutomatic(getOptionalString(r, "not_automatic"))
                .butAutomaticUpgrades(getOptionalString(r, "but_automatic_upgrades"))
                .skipContents(r.getBoolean("skip_contents"))
                .skipBz2(r.getBoolean("skip_bz2"))
                .acquireByHash(r.getBoolean("acquire_by_hash"))
                .multiDist(r.getBoolean("multi_dist"))
                .createdAt(getTimestampInstant(r, "created_at"))
                .updatedAt(getTimestampInstant(r, "updated_at"));
            return new PublishedRepoRow(id, builder);
        }
    }

    static class SourceBindingRowMapper
            implements RowMapper<SourceBindingRow>
    {
        @Override
        public SourceBindingRow map(ResultSet r, StatementContext ctx)
                throws SQLException
        {
            return new SourceBindingRow(r.getString("component"), getUuid(r, "source_uuid"));
        }
    }
}
