package com.example.safeconnection.core;

import java.sql.SQLNonTransientException;

/**
 * Raised when an operation would break the guarantees of an open transaction, or when transaction
 * control calls are unbalanced.
 *
 * <p>Uses SQLState {@code 25000} (invalid transaction state). {@link #kind()} tells the cases
 * apart.
 */
public class TransactionViolationException extends SQLNonTransientException {

  private static final long serialVersionUID = 1L;

  /** SQLState reported for every transaction violation. */
  public static final String SQL_STATE = "25000";

  /** What went wrong. */
  public enum Kind {
    /** {@code begin} while a transaction is already open. */
    ALREADY_IN_TRANSACTION,
    /** {@code commit} or {@code rollback} with no open transaction. */
    WITHOUT_BEGIN,
    /** The physical connection had to be replaced while a transaction was open. */
    RECONNECT_IN_TRANSACTION,
    /** The physical connection was replaced after the transaction began; its work is lost. */
    DISCONNECTED_DURING_TRANSACTION
  }

  private final Kind kind;

  public TransactionViolationException(final Kind kind, final String message) {
    super(message, SQL_STATE);
    this.kind = kind;
  }

  public TransactionViolationException(
      final Kind kind, final String message, final Throwable cause) {
    super(message, SQL_STATE, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
