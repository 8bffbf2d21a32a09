package io.repokeeper.core.database;

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.repokeeper.commons.guava.ThrowablesUtil;
import org.h2.jdbcx.JdbcDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;

public class DataSourceProvider
        implements Provider<DataSource>, AutoCloseable
{
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final DatabaseConfig config;
    private DataSource ds;
    private AutoCloseable closer;

    @Inject
    public DataSourceProvider(DatabaseConfig config)
    {
        this.config = config;
    }

    @Override
    public synchronized DataSource get()
    {
        if (ds == null) {
            switch (config.getType()) {
            case "h2":
                // h2 database doesn't need connection pool
                createSimpleDataSource();
                break;
            default:
                createPooledDataSource();
                break;
            }
        }
        return ds;
    }

    private void createSimpleDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        // An in-memory H2 database is dropped when its last connection is
        // closed. One connection is held until close() so that the data lives
        // as long as this provider.
        JdbcDataSource ds = new JdbcDataSource();
        ds.setUrl(url + ";DB_CLOSE_ON_EXIT=FALSE");

        logger.debug("Using database URL {}", url);

        try {
            this.closer = ds.getConnection();
        }
        catch (SQLException ex) {
            throw ThrowablesUtil.propagate(ex);
        }
        this.ds = ds;
    }

    private void createPooledDataSource()
    {
        String url = DatabaseConfig.buildJdbcUrl(config);

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(url);
        hikari.setDriverClassName(DatabaseConfig.getDriverClassName(config.getType()));
        hikari.setDataSourceProperties(DatabaseConfig.buildJdbcProperties(config));

        hikari.setConnectionTimeout(config.getConnectionTimeout() * 1000L);
        hikari.setIdleTimeout(config.getIdleTimeout() * 1000L);
        hikari.setValidationTimeout(config.getValidationTimeout() * 1000L);
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumPoolSize());

        // connectionTestQuery is left unset. ThreadLocalTransactionManager.commit
        // relies on Connection.isValid returning false after a failed statement.

        logger.debug("Using database URL {}", hikari.getJdbcUrl());

        HikariDataSource ds = new HikariDataSource(hikari);
        this.ds = ds;
        this.closer = ds;
    }

    @Override
    public synchronized void close()
    {
        if (ds != null) {
            try {
                closer.close();
            }
            catch (Exception ex) {
                throw ThrowablesUtil.propagate(ex);
            }
            ds = null;
            closer = null;
        }
    }
}
