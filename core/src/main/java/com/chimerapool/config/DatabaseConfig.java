package com.chimerapool.config;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.zaxxer.hikari.HikariConfig;
import java.util.Map;

/**
 * Configuration record for the PostgreSQL connection pool.
 *
 * @param dbUrl The JDBC URL, e.g. {@code jdbc:postgresql://localhost:5432/chimera_pool}
 * @param dbUser The database user
 * @param dbPassword The database password
 * @param maxPoolSize The maximum number of pooled connections
 */
public record DatabaseConfig(String dbUrl, String dbUser, String dbPassword, int maxPoolSize) {

  public static final int DEFAULT_MAX_POOL_SIZE = 10;

  /**
   * Reads {@code DB_URL} (required), {@code DB_USER}, {@code DB_PASSWORD} and {@code
   * DB_MAX_POOL_SIZE} from the environment.
   */
  public static StatusOr<DatabaseConfig> fromEnvironment(Map<String, String> env) {
    String url = env.get("DB_URL");
    if (Strings.isNullOrEmpty(url)) {
      return StatusOr.ofStatus(Status.invalidArgument("DB_URL is required"));
    }
    int poolSize = DEFAULT_MAX_POOL_SIZE;
    String rawPoolSize = env.get("DB_MAX_POOL_SIZE");
    if (!Strings.isNullOrEmpty(rawPoolSize)) {
      try {
        poolSize = Integer.parseInt(rawPoolSize.trim());
      } catch (NumberFormatException e) {
        return StatusOr.ofStatus(Status.invalidArgument("DB_MAX_POOL_SIZE must be an integer"));
      }
      if (poolSize < 1) {
        return StatusOr.ofStatus(Status.invalidArgument("DB_MAX_POOL_SIZE must be positive"));
      }
    }
    return StatusOr.ofValue(
        new DatabaseConfig(url, env.get("DB_USER"), env.get("DB_PASSWORD"), poolSize));
  }

  /** Builds the HikariCP pool configuration. */
  public HikariConfig toHikariConfig() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dbUrl);
    config.setUsername(dbUser);
    config.setPassword(dbPassword);
    config.setMaximumPoolSize(maxPoolSize);
    config.setMinimumIdle(Math.min(2, maxPoolSize));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("ChimeraPoolAuth");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    return config;
  }

  /** Returns a string representation of this object without the password. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("dbUrl", dbUrl)
        .add("dbUser", dbUser)
        .add("maxPoolSize", maxPoolSize)
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}
