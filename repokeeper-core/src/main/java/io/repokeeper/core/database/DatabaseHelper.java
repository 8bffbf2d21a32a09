package io.repokeeper.core.database;

import org.jdbi.v3.core.Handles;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.h2.H2DatabasePlugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

public class DatabaseHelper
{
    private DatabaseHelper()
    { }

    public static Jdbi createJdbi(DataSource ds, JsonColumnMapper jcm)
    {
        Jdbi jdbi = Jdbi.create(ds);
        // ThreadLocalTransactionManager ends transactions before closing handles
        jdbi.getConfig(Handles.class).setForceEndTransactions(false);
        jdbi.installPlugin(new SqlObjectPlugin());
        if (ds.getClass().getCanonicalName().startsWith("org.h2")) {
            jdbi.installPlugin(new H2DatabasePlugin());
        }
        else {
            jdbi.installPlugin(new PostgresPlugin());
        }
        jdbi.registerRowMapper(new DatabasePublishedRepoStore.PublishedRepoRowMapper(jcm));
        jdbi.registerRowMapper(new DatabasePublishedRepoStore.SourceBindingRowMapper());
        jdbi.registerRowMapper(new DatabaseSourceStore.SnapshotMapper());
        jdbi.registerRowMapper(new DatabaseSourceStore.LocalRepoMapper());
        jdbi.registerRowMapper(new DatabaseSourceStore.PackageFileMapper(jcm));
        return jdbi;
    }
}
