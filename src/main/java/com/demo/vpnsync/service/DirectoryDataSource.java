package com.demo.vpnsync.service;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Directory connections from a HikariCP pool.
 *
 * <p>The pool is created without an initial connection attempt, so the service starts while the
 * database is down; reads fail with {@link DirectoryException} until it is back.
 */
public class DirectoryDataSource implements DirectoryConnectionFactory, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryDataSource.class);

    static final String POOL_NAME = "VpnSyncDirectoryPool";
    static final long IDLE_TIMEOUT_MS = 300000;
    static final long MAX_LIFETIME_MS = 1800000;

    private final HikariDataSource dataSource;

    public DirectoryDataSource(String jdbcUrl, String username, String password,
                               int maxPoolSize, int minIdle, long connectionTimeoutMs) {
        this(poolConfig(jdbcUrl, username, password, maxPoolSize, minIdle, connectionTimeoutMs));
    }

    DirectoryDataSource(HikariConfig config) {
        this.dataSource = new HikariDataSource(config);
        logger.info("Directory pool {} created for {} (max {} connections)",
            config.getPoolName(), config.getJdbcUrl(), config.getMaximumPoolSize());
    }

    static HikariConfig poolConfig(String jdbcUrl, String username, String password,
                                   int maxPoolSize, int minIdle, long connectionTimeoutMs) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);

        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(Math.min(minIdle, maxPoolSize));
        config.setConnectionTimeout(connectionTimeoutMs);
        config.setIdleTimeout(IDLE_TIMEOUT_MS);
        config.setMaxLifetime(MAX_LIFETIME_MS);
        // Read-only projection; never start a transaction
        config.setReadOnly(true);
        config.setInitializationFailTimeout(-1);

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "50");

        config.setPoolName(POOL_NAME);
        return config;
    }

    @Override
    public Connection open() throws SQLException {
        return dataSource.getConnection();
    }

    public String getPoolStats() {
        if (dataSource.getHikariPoolMXBean() == null) {
            return "Pool not initialized";
        }
        return String.format("Active: %d, Idle: %d, Total: %d, Waiting: %d",
            dataSource.getHikariPoolMXBean().getActiveConnections(),
            dataSource.getHikariPoolMXBean().getIdleConnections(),
            dataSource.getHikariPoolMXBean().getTotalConnections(),
            dataSource.getHikariPoolMXBean().getThreadsAwaitingConnection());
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            logger.info("Closing directory pool ({})", getPoolStats());
            dataSource.close();
        }
    }
}
