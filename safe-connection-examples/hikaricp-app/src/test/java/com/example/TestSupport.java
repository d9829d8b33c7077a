package com.example;

import java.sql.DriverManager;
import java.sql.SQLException;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;

/** Test-only utilities for integration tests to reduce duplication. */
public final class TestSupport {
  private TestSupport() {}

  /** Simple Docker availability probe using Testcontainers. */
  public static boolean dockerAvailable() {
    try {
      DockerClientFactory.instance().client();
      return true;
    } catch (final Throwable t) {
      return false;
    }
  }

  /**
   * Terminates a server session from a separate admin connection and waits until PostgreSQL no
   * longer lists it.
   */
  public static void terminateBackend(final PostgreSQLContainer<?> postgres, final int pid)
      throws SQLException, InterruptedException {
    try (final var admin =
            DriverManager.getConnection(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        var terminate = admin.prepareStatement("SELECT pg_terminate_backend(?)");
        var check = admin.prepareStatement("SELECT COUNT(*) FROM pg_stat_activity WHERE pid = ?")) {
      terminate.setInt(1, pid);
      terminate.execute();

      check.setInt(1, pid);
      for (int i = 0; i < 50; i++) {
        try (var rs = check.executeQuery()) {
          rs.next();
          if (rs.getInt(1) == 0) return;
        }
        Thread.sleep(100L);
      }
      throw new IllegalStateException("Backend " + pid + " still alive");
    }
  }
}
