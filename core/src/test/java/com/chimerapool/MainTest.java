package com.chimerapool;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MainTest {

  private static final String SECRET = "0123456789abcdef0123456789abcdef";

  @Test
  void testMissingSecretIsBadConfig() {
    int exitCode = Main.run(Map.of("DB_URL", "jdbc:postgresql://localhost/x"), Clock.systemUTC());

    assertEquals(Main.EXIT_BAD_CONFIG, exitCode);
  }

  @Test
  void testMissingDatabaseUrlIsBadConfig() {
    int exitCode = Main.run(Map.of("JWT_SECRET", SECRET), Clock.systemUTC());

    assertEquals(Main.EXIT_BAD_CONFIG, exitCode);
  }

  @Test
  void testPoolCreationFailureExitsWithFailure() {
    // No JDBC driver accepts this URL, so HikariCP fails while building the pool.
    Map<String, String> env = Map.of("JWT_SECRET", SECRET, "DB_URL", "jdbc:nosuchdb://nowhere/x");

    int exitCode = Main.run(env, Clock.systemUTC());

    assertEquals(Main.EXIT_FAILURE, exitCode);
  }
}
