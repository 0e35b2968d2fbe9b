package com.chimerapool.db.util;

import com.chimerapool.common.status.Status;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Helper class for setting up PostgreSQL test containers. Provides consistent initialization for
 * all database tests.
 */
public final class PostgresTestHelper {

  private PostgresTestHelper() {}

  /**
   * Creates a PostgreSQL container for the given database name. The container is not started.
   *
   * @param databaseName The name to use for the test database
   * @return A configured PostgreSQLContainer ready to start
   */
  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"))
        .withDatabaseName(databaseName)
        .withUsername("chimera")
        .withPassword("chimera");
  }

  /** Creates a small connection pool against a running container. */
  public static HikariDataSource createDataSource(PostgreSQLContainer<?> container) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(container.getJdbcUrl());
    config.setUsername(container.getUsername());
    config.setPassword(container.getPassword());
    config.setMaximumPoolSize(8);
    config.setPoolName("ChimeraPoolAuthTest");
    return new HikariDataSource(config);
  }

  /**
   * Applies the production schema script to the database.
   *
   * @throws IllegalStateException if the schema cannot be applied
   */
  public static void initializeSchema(HikariDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      Status status = DbUtil.applySchema(conn);
      if (status.isError()) {
        throw new IllegalStateException(status.toString(), status.getCause());
      }
    }
  }

  /** Removes every user row. */
  public static void truncateUsers(HikariDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection();
        var stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE users RESTART IDENTITY");
    }
  }
}
