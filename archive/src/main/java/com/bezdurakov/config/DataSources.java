package com.bezdurakov.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.tinylog.Logger;

/** Builds the pooled data source the archive runs on. */
public final class DataSources {

  public static final String POOL_NAME = "GameArchivePool";

  private DataSources() {
    // Utility class
  }

  /**
   * Sets up and configures the HikariCP connection pool.
   *
   * @param databaseConfig the connection settings
   * @return A configured HikariDataSource for database connections
   */
  public static HikariDataSource create(DatabaseConfig databaseConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(databaseConfig.jdbcUrl());
    if (databaseConfig.username() != null) {
      config.setUsername(databaseConfig.username());
    }
    if (databaseConfig.password() != null) {
      config.setPassword(databaseConfig.password());
    }
    config.setMaximumPoolSize(databaseConfig.maximumPoolSize());
    config.setMinimumIdle(Math.min(2, databaseConfig.maximumPoolSize()));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName(POOL_NAME);
    if (databaseConfig.isSqlite()) {
      // Off by default in SQLite, whatever URL was supplied.
      config.addDataSourceProperty("foreign_keys", "true");
    } else {
      config.addDataSourceProperty("cachePrepStmts", "true");
      config.addDataSourceProperty("prepStmtCacheSize", "250");
      config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
    }

    Logger.info("Initializing database connection pool: {}", databaseConfig.toSecureString());
    return new HikariDataSource(config);
  }
}
