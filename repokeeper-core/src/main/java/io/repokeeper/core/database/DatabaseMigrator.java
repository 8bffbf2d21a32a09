package io.repokeeper.core.database;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.repokeeper.core.database.migrate.Migration;
import io.repokeeper.core.database.migrate.MigrationContext;
import io.repokeeper.core.database.migrate.Migration_20231106140212_CreateSourceTables;
import io.repokeeper.core.database.migrate.Migration_20231120093547_CreatePublishedRepos;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class DatabaseMigrator
{
    private static final Logger logger = LoggerFactory.getLogger(DatabaseMigrator.class);

    private final List<Migration> migrations = Stream.of(new Migration[] {
        new Migration_20231106140212_CreateSourceTables(),
        new Migration_20231120093547_CreatePublishedRepos(),
    })
    .sorted(Comparator.comparing(m -> m.getVersion()))
    .collect(Collectors.toList());

    private final Jdbi dbi;
    private final String databaseType;

    @Inject
    public DatabaseMigrator(Jdbi dbi, DatabaseConfig config)
    {
        this(dbi, config.getType());
    }

    DatabaseMigrator(Jdbi dbi, String databaseType)
    {
        this.dbi = dbi;
        this.databaseType = databaseType;
    }

    public String getSchemaVersion()
    {
        try (Handle handle = dbi.open()) {
            return handle.createQuery("select name from schema_migrations order by name desc limit 1")
                .mapTo(String.class)
                .one();
        }
    }

    public int migrate()
    {
        int numApplied = 0;
        MigrationContext context = new MigrationContext(databaseType);
        Set<String> appliedSet;
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                createSchemaMigrationsTable(handle, context);
            }
            appliedSet = getAppliedMigrationNames(handle);
        }
        for (Migration m : migrations) {
            if (appliedSet.add(m.getVersion())) {
                if (applyMigrationIfNotDone(context, m)) {
                    numApplied++;
                }
            }
        }
        if (numApplied > 0) {
            if (context.isPostgres()) {
                logger.info("{} migrations applied.", numApplied);
            }
            else {
                logger.debug("{} migrations applied.", numApplied);
            }
        }
        return numApplied;
    }

    // synchronized so that multiple threads don't run the same migration on the same database
    private synchronized boolean applyMigrationIfNotDone(MigrationContext context, Migration m)
    {
        try (Handle handle = dbi.open()) {
            return handle.inTransaction((h) -> {
                if (context.isPostgres()) {
                    // lock tables not to run migration concurrently from another process
                    h.execute("LOCK TABLE schema_migrations IN EXCLUSIVE MODE");
                    if (checkIfMigrationApplied(h, m.getVersion())) {
                        return false;
                    }
                    logger.info("Applying database migration:" + m.getVersion());
                }
                else {
                    logger.debug("Applying database migration:" + m.getVersion());
                }
                applyMigration(m, h, context);
                return true;
            });
        }
    }

    public List<Migration> getApplicableMigrations()
    {
        List<Migration> applicableMigrations = new ArrayList<>();
        try (Handle handle = dbi.open()) {
            if (!existsSchemaMigrationsTable(handle)) {
                return new ArrayList<>(migrations);
            }
            Set<String> appliedSet = getAppliedMigrationNames(handle);
            for (Migration m : migrations) {
                if (!appliedSet.contains(m.getVersion())) {
                    applicableMigrations.add(m);
                }
            }
        }
        return applicableMigrations;
    }

    private Set<String> getAppliedMigrationNames(Handle handle)
    {
        return new HashSet<>(
                handle.createQuery("select name from schema_migrations")
                .mapTo(String.class)
                .list());
    }

    private boolean checkIfMigrationApplied(Handle handle, String name)
    {
        return handle.createQuery("select name from schema_migrations where name = :name limit 1")
            .bind("name", name)
            .mapTo(String.class)
            .findFirst()
            .isPresent();
    }

    private void createSchemaMigrationsTable(Handle handle, MigrationContext context)
    {
        handle.execute(
                context.newCreateTableBuilder("schema_migrations")
                .addString("name", "not null")
                .addTimestamp("created_at", "not null")
                .build());
    }

    private boolean existsSchemaMigrationsTable(Handle handle)
    {
        try {
            handle.createQuery("select name from schema_migrations limit 1")
                    .mapTo(String.class)
                    .list();
            return true;
        }
        catch (RuntimeException re) {
            return false;
        }
    }

    @VisibleForTesting
    void applyMigration(Migration m, Handle handle, MigrationContext context)
    {
        m.migrate(handle, context);
        handle.execute("insert into schema_migrations (name, created_at) values (?, now())", m.getVersion());
    }

    @VisibleForTesting
    List<Migration> getMigrations()
    {
        return migrations;
    }
}
