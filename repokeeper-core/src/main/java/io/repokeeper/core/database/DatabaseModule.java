package io.repokeeper.core.database;

import com.google.inject.Binder;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.google.inject.Provider;
import com.google.inject.Scopes;
import io.repokeeper.core.publish.PublishedRepoStore;
import io.repokeeper.core.repository.SourceStore;
import org.jdbi.v3.core.Jdbi;

import javax.sql.DataSource;

public class DatabaseModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(DatabaseConfig.class).toProvider(DatabaseConfigProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(DataSource.class).toProvider(DataSourceProvider.class).in(Scopes.SINGLETON);
        binder.bind(AutoMigrator.class).in(Scopes.SINGLETON);
        binder.bind(JsonColumnMapper.class).in(Scopes.SINGLETON);
        binder.bind(Jdbi.class).toProvider(JdbiProvider.class).in(Scopes.SINGLETON);
        binder.bind(TransactionManager.class).to(ThreadLocalTransactionManager.class).in(Scopes.SINGLETON);
        binder.bind(PublishedRepoStore.class).to(DatabasePublishedRepoStore.class).in(Scopes.SINGLETON);
        binder.bind(SourceStore.class).to(DatabaseSourceStore.class).in(Scopes.SINGLETON);
    }

    public static class AutoMigrator
    {
        private final DataSource ds;
        private final DatabaseConfig config;
        private boolean done;

        @Inject
        public AutoMigrator(DataSource ds, DatabaseConfig config)
        {
            this.ds = ds;
            this.config = config;
        }

        public synchronized void migrate()
        {
            if (!done && config.getAutoMigrate()) {
                new DatabaseMigrator(Jdbi.create(ds), config).migrate();
            }
            done = true;
        }
    }

    public static class JdbiProvider
            implements Provider<Jdbi>
    {
        private final Jdbi jdbi;

        @Inject
        public JdbiProvider(DataSource ds, AutoMigrator migrator, JsonColumnMapper jcm)
        {
            // migrate before any store gets a Jdbi
            migrator.migrate();
            this.jdbi = DatabaseHelper.createJdbi(ds, jcm);
        }

        @Override
        public Jdbi get()
        {
            return jdbi;
        }
    }
}
