package com.example.safeconnection.core;

import java.sql.SQLNonTransientConnectionException;

/**
 * Raised when the retry policy declines another connection attempt. The cause, when present, is
 * the failure of the last attempt.
 */
public class ConnectionExhaustedException extends SQLNonTransientConnectionException {

  private static final long serialVersionUID = 1L;

  /** SQLState reported when no connection could be established. */
  public static final String SQL_STATE = "08001";

  private final int attempts;

  public ConnectionExhaustedException(final int attempts, final Throwable lastError) {
    super(message(lastError), SQL_STATE, lastError);
    this.attempts = attempts;
  }

  /** Number of connection attempts made before giving up. */
  public int attempts() {
    return attempts;
  }

  private static String message(final Throwable lastError) {
    final var detail =
        lastError == null || lastError.getMessage() == null ? "" : lastError.getMessage().strip();
    return "All connection attempts failed, can't connect: [" + detail + "]";
  }
}
