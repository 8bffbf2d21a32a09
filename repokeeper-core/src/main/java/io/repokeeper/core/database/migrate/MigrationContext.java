package io.repokeeper.core.database.migrate;

public class MigrationContext
{
    private final String databaseType;

    public MigrationContext(String databaseType)
    {
        this.databaseType = databaseType;
    }

    public boolean isPostgres()
    {
        return databaseType.equals("postgresql");
    }

    public CreateTableBuilder newCreateTableBuilder(String tableName)
    {
        return new CreateTableBuilder(isPostgres(), tableName);
    }
}
