package io.repokeeper.core.database;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import io.repokeeper.client.config.Config;
import io.repokeeper.client.config.ConfigException;
import org.immutables.value.Value;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

@Value.Immutable
public interface DatabaseConfig
{
    // "h2" or "postgresql". "memory" in the system config is h2 without a path.
    String getType();

    Optional<String> getPath();

    Map<String, String> getOptions();

    Optional<RemoteDatabaseConfig> getRemoteDatabaseConfig();

    boolean getAutoMigrate();

    ////
    // HikariCP config params
    //

    int getConnectionTimeout();  // seconds

    int getIdleTimeout();  // seconds

    int getMaximumPoolSize();

    int getMinimumPoolSize();

    int getValidationTimeout();  // seconds

    static ImmutableDatabaseConfig.Builder builder()
    {
        return ImmutableDatabaseConfig.builder();
    }

    static DatabaseConfig convertFrom(Config config)
    {
        ImmutableDatabaseConfig.Builder builder = builder();

        String type = config.get("database.type", String.class, "memory");
        switch (type) {
        case "h2":
            builder.type("h2");
            builder.path(Optional.of(config.get("database.path", String.class)));
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "memory":
            builder.type("h2");
            builder.path(Optional.absent());
            builder.remoteDatabaseConfig(Optional.absent());
            break;
        case "postgresql":
            builder.type("postgresql");
            builder.remoteDatabaseConfig(Optional.of(
                RemoteDatabaseConfig.builder()
                    .user(config.get("database.user", String.class))
                    .password(config.get("database.password", String.class, ""))
                    .host(config.get("database.host", String.class))
                    .port(config.getOptional("database.port", Integer.class))
                    .database(config.get("database.database", String.class))
                    .loginTimeout(config.get("database.loginTimeout", int.class, 30))
                    .socketTimeout(config.get("database.socketTimeout", int.class, 1800))
                    .ssl(config.get("database.ssl", boolean.class, false))
                    .sslmode(config.getOptional("database.sslmode", String.class))
                    .build()));
            break;
        default:
            throw new ConfigException("Unknown database.type: " + type);
        }

        builder.connectionTimeout(config.get("database.connectionTimeout", int.class, 30));
        builder.idleTimeout(config.get("database.idleTimeout", int.class, 600));
        builder.validationTimeout(config.get("database.validationTimeout", int.class, 5));

        int maximumPoolSize = config.get("database.maximumPoolSize", int.class,
                Runtime.getRuntime().availableProcessors() * 4);
        builder.maximumPoolSize(maximumPoolSize);
        builder.minimumPoolSize(config.get("database.minimumPoolSize", int.class, maximumPoolSize));

        // database.opts.* to options
        ImmutableMap.Builder<String, String> options = ImmutableMap.builder();
        Config opts = config.extractPrefixed("database.opts.");
        for (String key : opts.getKeys()) {
            options.put(key, opts.get(key, String.class));
        }
        builder.options(options.build());

        builder.autoMigrate(config.get("database.migrate", boolean.class, true));

        return builder.build();
    }

    static String buildJdbcUrl(DatabaseConfig config)
    {
        switch (config.getType()) {
        case "h2":
            if (config.getPath().isPresent()) {
                Path dir = FileSystems.getDefault().getPath(config.getPath().get());
                try {
                    Files.createDirectories(dir);
                }
                catch (IOException ex) {
                    throw new ConfigException(ex);
                }
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:%s",
                        dir.resolve("repokeeper").toAbsolutePath().toString());  // h2 requires absolute path
            }
            else {
                return String.format(Locale.ENGLISH,
                        "jdbc:h2:mem:repokeeper-%s",
                        UUID.randomUUID());
            }

        case "postgresql":
            {
                if (!config.getRemoteDatabaseConfig().isPresent()) {
                    throw new IllegalArgumentException("Database type is postgresql but remoteDatabaseConfig is not set unexpectedly");
                }
                RemoteDatabaseConfig remote = config.getRemoteDatabaseConfig().get();
                if (remote.getPort().isPresent()) {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s:%d/%s",
                            remote.getHost(), remote.getPort().get(), remote.getDatabase());
                }
                else {
                    return String.format(Locale.ENGLISH,
                            "jdbc:postgresql://%s/%s",
                            remote.getHost(), remote.getDatabase());
                }
            }

        default:
            throw new ConfigException("Unsupported database type: " + config.getType());
        }
    }

    static Properties buildJdbcProperties(DatabaseConfig config)
    {
        Properties props = new Properties();
        Optional<RemoteDatabaseConfig> rc = config.getRemoteDatabaseConfig();

        if (rc.isPresent()) {
            props.setProperty("loginTimeout", Integer.toString(rc.get().getLoginTimeout())); // seconds
            props.setProperty("socketTimeout", Integer.toString(rc.get().getSocketTimeout())); // seconds
            props.setProperty("tcpKeepAlive", "true");
            props.setProperty("user", rc.get().getUser());
            props.setProperty("password", rc.get().getPassword());
            if (rc.get().getSsl()) {
                props.setProperty("ssl", "true");
                if (rc.get().getSslmode().isPresent()) {
                    props.setProperty("sslmode", rc.get().getSslmode().get());
                }
            }
        }

        for (Map.Entry<String, String> pair : config.getOptions().entrySet()) {
            props.setProperty(pair.getKey(), pair.getValue());
        }

        return props;
    }

    static String getDriverClassName(String databaseType)
    {
        switch (databaseType) {
        case "h2":
            return "org.h2.Driver";
        case "postgresql":
            return "org.postgresql.Driver";
        default:
            throw new ConfigException("Unsupported database type: " + databaseType);
        }
    }

    static boolean isPostgres(String databaseType)
    {
        return databaseType.equals("postgresql");
    }
}
