package io.repokeeper.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20231106140212_CreateSourceTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // snapshots
        handle.execute(
                context.newCreateTableBuilder("snapshots")
                .addLongId("id")
                .addString("uuid", "not null")
                .addString("name", "not null")
                .addLongText("description", "")
                .addTimestamp("created_at", "not null")
                .build());
        handle.execute("create unique index snapshots_on_uuid on snapshots (uuid)");
        handle.execute("create unique index snapshots_on_name on snapshots (name)");

        // local_repos
        handle.execute(
                context.newCreateTableBuilder("local_repos")
                .addLongId("id")
                .addString("uuid", "not null")
                .addString("name", "not null")
                .addLongText("comment", "")
                .addString("default_distribution", "")
                .addString("default_component", "")
                .addTimestamp("created_at", "not null")
                .build());
        handle.execute("create unique index local_repos_on_uuid on local_repos (uuid)");
        handle.execute("create unique index local_repos_on_name on local_repos (name)");

        // packages
        handle.execute(
                context.newCreateTableBuilder("packages")
                .addLongId("id")
                .addString("package_key", "not null")
                .addString("name", "not null")
                .addString("package_version", "not null")
                .addString("architecture", "not null")
                .addString("source_name", "not null")
                .addString("filename", "not null")
                .addString("pool_path", "not null")
                .addLong("file_size", "not null")
                .addString("md5", "not null")
                .addString("sha1", "not null")
                .addString("sha256", "not null")
                .addLongText("control_fields", "not null")
                .build());
        handle.execute("create unique index packages_on_package_key on packages (package_key)");

        // source_packages
        handle.execute(
                context.newCreateTableBuilder("source_packages")
                .addString("source_uuid", "not null")
                .addString("package_key", "not null")
                .build());
        handle.execute("create unique index source_packages_on_source_uuid_and_package_key on source_packages (source_uuid, package_key)");
    }
}
