package com.example;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.safeconnection.core.LivenessProbe;
import com.example.safeconnection.core.Retry;
import com.example.safeconnection.core.SafeConnection;
import java.sql.SQLException;

/** Demo application that keeps one connection open for its whole life and survives server drops. */
public class App {

  private static final System.Logger logger = System.getLogger(App.class.getName());

  private final SafeConnection conn;

  /**
   * Constructs the application with a single SafeConnection that is reused for all later calls to
   * {@link #getString()}.
   *
   * @param jdbcUrl PostgreSQL JDBC URL
   * @param username database user
   * @param password database password
   */
  public App(final String jdbcUrl, final String username, final String password) {
    this.conn =
        SafeConnection.builder()
            .dsn(jdbcUrl, username, password)
            .retryPolicy(Retry.Policy.fixed(5, 1_000L))
            .livenessProbe(LivenessProbe.query("SELECT 1", 2))
            .attribute("x_safe_application", "hikaricp-app")
            .build();
  }

  /**
   * Entry point. Connects with the settings from {@code DB_URL}, {@code DB_USER} and {@code
   * DB_PASSWORD} and prints the DB time.
   *
   * @param args CLI args (unused)
   * @throws Exception on unexpected failures
   */
  public static void main(String[] args) throws Exception {
    final var app =
        new App(
            System.getenv().getOrDefault("DB_URL", "jdbc:postgresql://localhost:5432/postgres"),
            System.getenv().getOrDefault("DB_USER", "postgres"),
            System.getenv().getOrDefault("DB_PASSWORD", "postgres"));
    try {
      logger.log(DEBUG, "DB Time = %s".formatted(app.getString()));
    } finally {
      app.shutdown();
    }
  }

  /**
   * Queries the database for the current time. A dropped server session is replaced before the
   * query runs.
   *
   * @return the time string returned by the database
   * @throws SQLException if the query fails
   */
  public String getString() throws SQLException {
    try (final var stmt = conn.createStatement();
        var rs = stmt.executeQuery("SELECT NOW()")) {
      rs.next();
      return rs.getString(1);
    }
  }

  /**
   * Returns the server process id of the session currently behind the connection.
   *
   * @return PostgreSQL backend pid
   * @throws SQLException if the query fails
   */
  public int getBackendPid() throws SQLException {
    try (final var stmt = conn.createStatement();
        var rs = stmt.executeQuery("SELECT pg_backend_pid()")) {
      rs.next();
      return rs.getInt(1);
    }
  }

  /** Exposes the connection for callers that run their own statements or transactions. */
  public SafeConnection connection() {
    return conn;
  }

  /** Closes the connection. */
  public void shutdown() {
    try {
      conn.close();
    } catch (final SQLException e) {
      logger.log(WARNING, "Failed to close connection", e);
    }
  }
}
