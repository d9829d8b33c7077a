package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.DEBUG;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;

/**
 * Cheap round trip that tells whether a physical connection is still usable.
 *
 * <p>A probe never throws. Any failure while probing means "not alive" and only drives a
 * reconnect.
 */
@FunctionalInterface
public interface LivenessProbe {

  /**
   * Checks the connection.
   *
   * @param connection physical connection to check
   * @return false if the connection is closed, inactive or the round trip failed
   */
  boolean isAlive(Connection connection);

  /**
   * Probe based on {@link Connection#isClosed()} and {@link Connection#isValid(int)}.
   *
   * @param timeoutSeconds validation timeout passed to the driver, 0 for none
   * @return driver validation probe
   */
  static LivenessProbe validating(final int timeoutSeconds) {
    if (timeoutSeconds < 0) throw new IllegalArgumentException("timeoutSeconds must be >= 0");
    return connection -> {
      try {
        return !connection.isClosed() && connection.isValid(timeoutSeconds);
      } catch (final Exception e) {
        Probes.LOGGER.log(DEBUG, "Validation probe failed: {0}", e.getMessage());
        return false;
      }
    };
  }

  /**
   * Probe that runs a validation query, for drivers whose {@code isValid} is unreliable.
   *
   * <p>Only a connection-class failure, or a connection the driver reports closed afterwards,
   * counts as dead. Other errors, such as a statement refused because the open transaction was
   * aborted, mean the server answered and the connection is alive.
   *
   * @param sql validation statement, for example {@code SELECT 1}
   * @param timeoutSeconds query timeout, 0 for none
   * @return query probe
   */
  static LivenessProbe query(final String sql, final int timeoutSeconds) {
    Objects.requireNonNull(sql, "sql");
    if (timeoutSeconds < 0) throw new IllegalArgumentException("timeoutSeconds must be >= 0");
    return connection -> {
      try {
        if (connection.isClosed()) return false;
        try (final var stmt = connection.createStatement()) {
          stmt.setQueryTimeout(timeoutSeconds);
          stmt.execute(sql);
          return true;
        }
      } catch (final SQLException e) {
        if (Probes.connectionLost(e) || Probes.closedAfterFailure(connection)) {
          Probes.LOGGER.log(DEBUG, "Validation query failed: {0}", e.getMessage());
          return false;
        }
        Probes.LOGGER.log(
            DEBUG, "Validation query refused, connection still answers: {0}", e.getMessage());
        return true;
      } catch (final RuntimeException e) {
        Probes.LOGGER.log(DEBUG, "Validation query failed: {0}", e.getMessage());
        return false;
      }
    };
  }

  /** Logger holder. */
  final class Probes {
    private static final System.Logger LOGGER = System.getLogger(LivenessProbe.class.getName());

    private Probes() {}

    /** Connection exception classes, SQLState 08 and the 57P operator-intervention shutdowns. */
    static boolean connectionLost(final SQLException e) {
      if (e instanceof SQLNonTransientConnectionException
          || e instanceof SQLTransientConnectionException) return true;
      final var sqlState = e.getSQLState();
      return sqlState != null && (sqlState.startsWith("08") || sqlState.startsWith("57P"));
    }

    static boolean closedAfterFailure(final Connection connection) {
      try {
        return connection.isClosed();
      } catch (final SQLException e) {
        LOGGER.log(DEBUG, "isClosed() failed after validation query: {0}", e.getMessage());
        return true;
      }
    }
  }
}
