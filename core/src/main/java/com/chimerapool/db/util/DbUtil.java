package com.chimerapool.db.util;

import com.chimerapool.common.status.Status;
import com.chimerapool.common.status.StatusOr;
import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** Utility methods for database operations. */
public final class DbUtil {

  /** Classpath location of the schema script. */
  public static final String SCHEMA_RESOURCE = "db/01-schema.sql";

  /** SQLSTATE reported by PostgreSQL for a unique constraint violation. */
  public static final String UNIQUE_VIOLATION = "23505";

  private DbUtil() {
    // Utility class, no instances
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Gets an Instant from a timestamp column using column name. */
  @Nonnull
  public static StatusOr<Instant> getInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(timestamp.toInstant());
    } catch (SQLException e) {
      return StatusOr.ofException("Failed to read column " + columnName, e);
    }
  }

  /** Returns true if the exception reports a unique constraint violation. */
  public static boolean isUniqueViolation(SQLException e) {
    return UNIQUE_VIOLATION.equals(e.getSQLState());
  }

  /**
   * Returns true if a unique violation names the given constraint. The driver puts the
   * constraint name in the message.
   */
  public static boolean violatesConstraint(SQLException e, String constraintName) {
    return isUniqueViolation(e)
        && e.getMessage() != null
        && e.getMessage().contains(constraintName);
  }

  /**
   * Creates the tables and indexes if they do not exist yet.
   *
   * @param conn an open JDBC connection
   * @return OK, or INTERNAL if the script cannot be read or executed
   */
  @Nonnull
  public static Status applySchema(Connection conn) {
    String script;
    try {
      URL url = Resources.getResource(SCHEMA_RESOURCE);
      script = Resources.toString(url, StandardCharsets.UTF_8);
    } catch (IOException | IllegalArgumentException e) {
      return Status.internal("Schema script not readable: " + SCHEMA_RESOURCE, e);
    }
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(script);
      Logger.info("Database schema is up to date.");
      return Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to apply database schema", e);
    }
  }
}
