package io.repokeeper.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20231120093547_CreatePublishedRepos
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // published_repos
        handle.execute(
                context.newCreateTableBuilder("published_repos")
                .addLongId("id")
                .addString("uuid", "not null")
                .addString("storage", "not null")  // "" is the default filesystem storage
                .addString("prefix", "not null")
                .addString("distribution", "not null")
                .addString("source_kind", "not null")
                .addLongText("architectures", "not null")
                .addString("label", "")
                .addString("origin", "")
                .addString("not_automatic", "")
                .addString("but_automatic_upgrades", "")
                .addBoolean("skip_contents", "not null")
                .addBoolean("skip_bz2", "not null")
                .addBoolean("acquire_by_hash", "not null")
                .addBoolean("multi_dist", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create unique index published_repos_on_storage_and_prefix_and_distribution on published_repos (storage, prefix, distribution)");
        handle.execute("create unique index published_repos_on_uuid on published_repos (uuid)");

        // published_sources
        handle.execute(
                context.newCreateTableBuilder("published_sources")
                .addLong("published_repo_id", "not null references published_repos (id) on delete cascade")
                .addString("component", "not null")
                .addString("source_uuid", "not null")
                .build());
        handle.execute("create unique index published_sources_on_published_repo_id_and_component on published_sources (published_repo_id, component)");
        handle.execute("create index published_sources_on_source_uuid on published_sources (source_uuid)");
    }
}
