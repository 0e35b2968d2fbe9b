package com.chimerapool;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.chimerapool.config.AuthConfig;
import com.chimerapool.config.DatabaseConfig;
import com.chimerapool.db.JdbcUserRepository;
import com.chimerapool.db.UserRepository;
import com.chimerapool.db.util.DbUtil;
import com.chimerapool.operations.SystemInitOperation;
import com.chimerapool.security.PasswordHasher;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Map;
import org.tinylog.Logger;

/**
 * Prepares the PostgreSQL schema and bootstraps the first super admin.
 *
 * <p>Configuration comes from the environment the services run with: {@code JWT_SECRET} and
 * {@code BCRYPT_COST} (see {@link AuthConfig}), {@code DB_URL}, {@code DB_USER}, {@code
 * DB_PASSWORD} and {@code DB_MAX_POOL_SIZE} (see {@link DatabaseConfig}), and {@code
 * INIT_ADMIN_USERNAME}, {@code INIT_ADMIN_EMAIL} and {@code INIT_ADMIN_PASSWORD} for the
 * bootstrap account. A generated password is printed to standard output once.
 *
 * <p>Exit codes: 0 on success or when already initialized, 1 on a database or bootstrap
 * failure, 2 on invalid configuration.
 */
public class Main {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_BAD_CONFIG = 2;

  private static final String DEFAULT_ADMIN_USERNAME = "admin";
  private static final String DEFAULT_ADMIN_EMAIL = "admin@chimerapool.io";

  private final HikariDataSource dataSource;
  private final UserRepository userRepository;
  private final PasswordHasher passwordHasher;
  private final Clock clock;

  Main(AuthConfig authConfig, DatabaseConfig databaseConfig, Clock clock) {
    Logger.info("Configured auth: {}", authConfig.toSecureString());
    Logger.info("Initializing database connection pool: {}", databaseConfig.toSecureString());
    this.dataSource = new HikariDataSource(databaseConfig.toHikariConfig());
    this.userRepository = new JdbcUserRepository(dataSource, clock);
    this.passwordHasher = authConfig.newPasswordHasher();
    this.clock = clock;
  }

  Status applySchema() {
    try (Connection conn = dataSource.getConnection()) {
      return DbUtil.applySchema(conn);
    } catch (SQLException e) {
      return Status.internal("Failed to connect to the database", e);
    }
  }

  SystemInitOperation.InitResult initializeSystem(Map<String, String> env) {
    return new SystemInitOperation(userRepository, passwordHasher, clock)
        .execute(
            env.getOrDefault("INIT_ADMIN_USERNAME", DEFAULT_ADMIN_USERNAME),
            env.getOrDefault("INIT_ADMIN_EMAIL", DEFAULT_ADMIN_EMAIL),
            env.get("INIT_ADMIN_PASSWORD"));
  }

  void close() {
    dataSource.close();
  }

  /**
   * Runs the bootstrap against the given environment.
   *
   * @return the process exit code
   */
  static int run(Map<String, String> env, Clock clock) {
    StatusOr<AuthConfig> authConfigOr = AuthConfig.fromEnvironment(env);
    StatusOr<DatabaseConfig> databaseConfigOr = DatabaseConfig.fromEnvironment(env);
    if (authConfigOr.isNotOk() || databaseConfigOr.isNotOk()) {
      Status error =
          authConfigOr.isNotOk() ? authConfigOr.getStatus() : databaseConfigOr.getStatus();
      Logger.error("Invalid configuration: {}", error.getMessage());
      return EXIT_BAD_CONFIG;
    }

    Main main;
    try {
      main = new Main(authConfigOr.getValue(), databaseConfigOr.getValue(), clock);
    } catch (RuntimeException e) {
      // HikariCP throws unchecked exceptions when the pool cannot be created.
      Logger.error(e, "Failed to initialize the database connection pool.");
      return EXIT_FAILURE;
    }

    try {
      Status schema = main.applySchema();
      if (schema.isError()) {
        Logger.error(schema.getCause(), "Schema setup failed: {}", schema.getMessage());
        return EXIT_FAILURE;
      }
      SystemInitOperation.InitResult result = main.initializeSystem(env);
      if (!result.isSuccess()) {
        Logger.error("System initialization failed: {}", result.errorMessage());
        return EXIT_FAILURE;
      }
      if (result.generatedPassword() != null) {
        System.out.println("Generated super admin password: " + result.generatedPassword());
      }
      return EXIT_OK;
    } finally {
      main.close();
    }
  }

  public static void main(String[] args) {
    System.exit(run(System.getenv(), Clock.systemUTC()));
  }
}
