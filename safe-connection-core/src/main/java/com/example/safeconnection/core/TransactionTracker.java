package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.WARNING;

import com.example.safeconnection.core.TransactionViolationException.Kind;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Tracks begin/commit/rollback so that a reconnect never happens silently underneath an open
 * transaction.
 *
 * <p>States are NORMAL (depth 0, auto-commit) and IN_TRANSACTION (depth 1). Nested begins are
 * rejected. Ending a transaction only checks that its physical connection is still there and
 * alive; the staleness policy and reconnect period wait for the next operation. Ending a
 * transaction whose physical connection is gone, or was replaced after the transaction began,
 * fails with {@link Kind#DISCONNECTED_DURING_TRANSACTION} instead of committing or rolling back on
 * a connection that never saw the transaction's writes.
 */
final class TransactionTracker {

  private static final System.Logger LOGGER = System.getLogger(TransactionTracker.class.getName());

  private final ReconnectionEngine engine;
  private final ConnectionState state;

  TransactionTracker(final ReconnectionEngine engine) {
    this.engine = engine;
    this.state = engine.state();
  }

  /**
   * Opens a transaction: connects if needed, then switches the physical connection to manual
   * commit.
   *
   * @throws TransactionViolationException if a transaction is already open
   * @throws SQLException if connecting or switching auto-commit fails
   */
  void begin() throws SQLException {
    final var lock = engine.lock();
    lock.lock();
    try {
      if (state.isInTransaction())
        throw new TransactionViolationException(
            Kind.ALREADY_IN_TRANSACTION, "Already in a transaction");

      final var physical = engine.ensureConnectedLocked();
      state.beginTransaction(engine.clock().instant());
      try {
        physical.setAutoCommit(false);
      } catch (final SQLException | RuntimeException e) {
        state.revertBegin();
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * JDBC auto-commit switch expressed as transaction control: turning auto-commit off begins a
   * transaction unless one is open, turning it on commits the open transaction.
   *
   * @param autoCommit requested mode
   * @throws SQLException as {@link #begin()} or {@link #commit()}
   */
  void setAutoCommit(final boolean autoCommit) throws SQLException {
    final var lock = engine.lock();
    lock.lock();
    try {
      if (autoCommit == state.isAutoCommit()) {
        if (autoCommit) engine.ensureConnectedLocked().setAutoCommit(true);
        return;
      }
      if (autoCommit) commit();
      else begin();
    } finally {
      lock.unlock();
    }
  }

  void commit() throws SQLException {
    end(true);
  }

  void rollback() throws SQLException {
    end(false);
  }

  private void end(final boolean commit) throws SQLException {
    final var operation = commit ? "commit" : "rollback";
    final var lock = engine.lock();
    lock.lock();
    try {
      if (state.isAutoCommit())
        throw new TransactionViolationException(
            Kind.WITHOUT_BEGIN, operation + "() without begin");

      final Connection physical;
      try {
        physical = engine.ensureConnectedForTransactionEndLocked();
      } catch (final TransactionViolationException e) {
        closeOut(operation);
        throw disconnected(operation, e);
      }

      closeOut(operation);
      if (state.reconnectedSinceTransactionStart()) throw disconnected(operation, null);

      if (commit) {
        try {
          physical.commit();
        } catch (final SQLException | RuntimeException e) {
          // transaction is still open on the server; let the caller roll back
          state.reopenTransaction();
          throw e;
        }
      } else {
        try {
          physical.rollback();
        } catch (final SQLException | RuntimeException e) {
          LOGGER.log(WARNING, "Rollback failed, discarding physical connection", e);
          engine.invalidateLocked();
          throw e;
        }
      }

      if (!state.isInTransaction()) restoreAutoCommit(physical, operation);
    } finally {
      lock.unlock();
    }
  }

  private void restoreAutoCommit(final Connection physical, final String operation)
      throws SQLException {
    try {
      physical.setAutoCommit(true);
    } catch (final SQLException | RuntimeException e) {
      LOGGER.log(
          WARNING, "Auto-commit not restored after " + operation + ", discarding connection", e);
      engine.invalidateLocked();
      throw e;
    }
  }

  private void closeOut(final String operation) {
    if (!state.decrementDepth())
      LOGGER.log(WARNING, "{0}() with transaction depth already at 0", operation);
    state.finishTransaction();
  }

  private static TransactionViolationException disconnected(
      final String operation, final Throwable cause) {
    return new TransactionViolationException(
        Kind.DISCONNECTED_DURING_TRANSACTION,
        "Disconnect occurred during transaction, " + operation + " impossible",
        cause);
  }
}
