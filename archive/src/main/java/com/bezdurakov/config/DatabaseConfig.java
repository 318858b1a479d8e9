package com.bezdurakov.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.nio.file.Path;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Connection settings for the archive database.
 *
 * <p>Only the JDBC URL is required. SQLite needs no credentials; PostgreSQL deployments supply a
 * user and password alongside the URL.
 *
 * @param jdbcUrl The JDBC URL, e.g. {@code jdbc:postgresql://localhost:5432/bez_durakov}
 * @param username The database user, or null when the driver needs none
 * @param password The database password, or null when the driver needs none
 * @param maximumPoolSize Upper bound on pooled connections
 */
public record DatabaseConfig(
    String jdbcUrl,
    @Nullable String username,
    @Nullable String password,
    int maximumPoolSize) {

  public static final String DEFAULT_DATABASE_FILE = "bez_durakov.db";
  public static final int DEFAULT_POOL_SIZE = 10;

  static final String ENV_URL = "DB_URL";
  static final String ENV_USER = "DB_USER";
  static final String ENV_PASSWORD = "DB_PASSWORD";
  static final String ENV_POOL_SIZE = "DB_POOL_SIZE";

  public DatabaseConfig {
    checkArgument(!Strings.isNullOrEmpty(jdbcUrl), "jdbcUrl must be set");
    checkArgument(maximumPoolSize > 0, "maximumPoolSize must be positive: %s", maximumPoolSize);
  }

  /** Settings for a URL that needs no credentials. */
  public static DatabaseConfig forUrl(String jdbcUrl) {
    return new DatabaseConfig(jdbcUrl, null, null, DEFAULT_POOL_SIZE);
  }

  /** Settings for a SQLite database file with foreign key enforcement switched on. */
  public static DatabaseConfig sqliteFile(Path databaseFile) {
    return forUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath() + "?foreign_keys=on");
  }

  /**
   * Reads settings from the process environment. Without {@code DB_URL} the archive uses the
   * SQLite file {@value #DEFAULT_DATABASE_FILE} in the working directory.
   */
  public static DatabaseConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  static DatabaseConfig fromEnvironment(Map<String, String> env) {
    String url = env.get(ENV_URL);
    if (Strings.isNullOrEmpty(url)) {
      return sqliteFile(Path.of(DEFAULT_DATABASE_FILE));
    }
    String poolSize = env.get(ENV_POOL_SIZE);
    int maximumPoolSize;
    try {
      maximumPoolSize =
          Strings.isNullOrEmpty(poolSize) ? DEFAULT_POOL_SIZE : Integer.parseInt(poolSize.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(ENV_POOL_SIZE + " is not a number: " + poolSize, e);
    }
    return new DatabaseConfig(
        url,
        Strings.emptyToNull(env.get(ENV_USER)),
        Strings.emptyToNull(env.get(ENV_PASSWORD)),
        maximumPoolSize);
  }

  public DatabaseConfig withCredentials(String username, String password) {
    return new DatabaseConfig(jdbcUrl, username, password, maximumPoolSize);
  }

  public DatabaseConfig withMaximumPoolSize(int maximumPoolSize) {
    return new DatabaseConfig(jdbcUrl, username, password, maximumPoolSize);
  }

  public boolean isSqlite() {
    return jdbcUrl.startsWith("jdbc:sqlite:");
  }

  /**
   * Returns a string representation of this object without the password, safe for logs.
   *
   * @return A string containing the configuration with the password omitted
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl())
        .add("username", username())
        .add("maximumPoolSize", maximumPoolSize())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
