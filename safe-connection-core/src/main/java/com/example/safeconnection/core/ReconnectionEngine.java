package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.safeconnection.core.TransactionViolationException.Kind;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a usable physical connection in a {@link ConnectionState}.
 *
 * <p>Before every forwarded operation {@link #ensureConnected()} checks, in order, whether the
 * physical connection is missing, was opened by another thread or by another process, fails the
 * liveness probe, is judged stale by the staleness policy, or is older than the reconnect period.
 * If any holds the connection is replaced, unless a transaction is open, in which case the call
 * fails with {@link TransactionViolationException} and the state is left untouched.
 *
 * <p>A connection inherited from another process is parked under that process without being
 * closed, since closing it would tear down a transport the other process still uses. The owning
 * process gets it back on its next call.
 */
final class ReconnectionEngine {

  private static final System.Logger LOGGER = System.getLogger(ReconnectionEngine.class.getName());

  private final ConnectionState state;
  private final ConnectFactory connectFactory;
  private final Retry.Policy retryPolicy;
  private final StalenessPolicy stalenessPolicy;
  private final StalenessPolicy periodPolicy;
  private final LivenessProbe livenessProbe;
  private final OwnerIdentity.Source identitySource;
  private final Clock clock;
  private final ReentrantLock lock;

  ReconnectionEngine(
      final ConnectionState state,
      final ConnectFactory connectFactory,
      final Retry.Policy retryPolicy,
      final StalenessPolicy stalenessPolicy,
      final StalenessPolicy periodPolicy,
      final LivenessProbe livenessProbe,
      final OwnerIdentity.Source identitySource,
      final Clock clock,
      final ReentrantLock lock) {
    this.state = state;
    this.connectFactory = connectFactory;
    this.retryPolicy = retryPolicy;
    this.stalenessPolicy = stalenessPolicy;
    this.periodPolicy = periodPolicy;
    this.livenessProbe = livenessProbe;
    this.identitySource = identitySource;
    this.clock = clock;
    this.lock = lock;
  }

  ConnectionState state() {
    return state;
  }

  Clock clock() {
    return clock;
  }

  ReentrantLock lock() {
    return lock;
  }

  /**
   * Returns a usable physical connection, reconnecting first if needed.
   *
   * @return the current physical connection
   * @throws TransactionViolationException if a reconnect is needed while a transaction is open
   * @throws ConnectionExhaustedException if the retry policy gave up
   * @throws SQLException if the logical connection was closed
   */
  Connection ensureConnected() throws SQLException {
    lock.lock();
    try {
      return ensureConnectedLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Same as {@link #ensureConnected()}; the caller holds the lock. */
  Connection ensureConnectedLocked() throws SQLException {
    return ensureConnectedLocked(true);
  }

  /**
   * Variant used when ending a transaction: the staleness policy and the reconnect period are not
   * consulted, so an aged but working connection can still commit or roll back.
   */
  Connection ensureConnectedForTransactionEndLocked() throws SQLException {
    return ensureConnectedLocked(false);
  }

  private Connection ensureConnectedLocked(final boolean checkAge) throws SQLException {
    if (!state.isActive()) throw new SQLException("Connection is closed", "08003");

    final var caller = identitySource.current();
    final var current = state.physical();
    final var owner = state.getOwner().orElse(caller);
    final var processChanged = current != null && !owner.sameProcess(caller);
    final var reason =
        current == null
            ? "no physical connection"
            : staleReason(current, owner, caller, processChanged, checkAge);
    if (reason == null) return current;

    if (state.isInTransaction()) {
      LOGGER.log(WARNING, "Reconnect needed ({0}) while in a transaction", reason);
      throw new TransactionViolationException(
          Kind.RECONNECT_IN_TRANSACTION, "Reconnect needed when db in transaction: " + reason);
    }

    release(processChanged);
    if (state.restore(caller.processId()) != null) {
      LOGGER.log(INFO, "Restored connection parked for process {0}", caller.processId());
      return ensureConnectedLocked(checkAge);
    }
    return connect(caller, reason);
  }

  /**
   * Replaces the physical connection unconditionally. Allowed inside a transaction, which is then
   * reported broken by the next commit or rollback.
   *
   * @return the new physical connection
   * @throws SQLException if the logical connection was closed or no connection could be made
   */
  Connection reconnect() throws SQLException {
    lock.lock();
    try {
      if (!state.isActive()) throw new SQLException("Connection is closed", "08003");
      if (state.isInTransaction())
        LOGGER.log(WARNING, "Forced reconnect inside a transaction, its work is lost");

      invalidateLocked();
      return connect(identitySource.current(), "forced reconnect");
    } finally {
      lock.unlock();
    }
  }

  /** Marks the state inactive and closes the physical connection if this process opened it. */
  void shutdown() {
    lock.lock();
    try {
      if (!state.isActive()) return;
      state.deactivate();
      invalidateLocked();
      state.clearParked();
    } finally {
      lock.unlock();
    }
  }

  /** Drops the physical connection so the next operation reconnects; the caller holds the lock. */
  void invalidateLocked() {
    final var caller = identitySource.current();
    release(state.getOwner().map(owner -> !owner.sameProcess(caller)).orElse(false));
  }

  private String staleReason(
      final Connection current,
      final OwnerIdentity owner,
      final OwnerIdentity caller,
      final boolean processChanged,
      final boolean checkAge) {
    if (!owner.sameThread(caller))
      return "thread changed from " + owner.threadId() + " to " + caller.threadId();
    if (processChanged)
      return "process changed from " + owner.processId() + " to " + caller.processId();
    if (!livenessProbe.isAlive(current)) return "connection is not alive";
    if (!checkAge) return null;
    if (stalenessPolicy.isStale(state)) return "staleness policy";
    if (periodPolicy != null && periodPolicy.isStale(state)) return "reconnect period elapsed";
    return null;
  }

  private Connection connect(final OwnerIdentity caller, final String reason)
      throws ConnectionExhaustedException {
    LOGGER.log(INFO, "Connecting: {0}", reason);
    state.markReconnect(clock.instant());

    Exception lastFailure = null;
    var attempt = 0;
    while (true) {
      attempt++;
      if (!retryPolicy.shouldAttempt(attempt)) {
        final var exhausted = new ConnectionExhaustedException(attempt - 1, lastFailure);
        state.recordError(exhausted);
        LOGGER.log(ERROR, exhausted.getMessage());
        throw exhausted;
      }

      try {
        final var connection = connectFactory.connect();
        if (connection == null)
          throw new SQLException("Connect factory returned no connection", "08001");
        state.attach(connection, caller, clock.instant());
        LOGGER.log(DEBUG, "Connected on attempt {0}", attempt);
        return connection;
      } catch (final SQLException | RuntimeException e) {
        lastFailure = e;
        state.recordError(e);
        LOGGER.log(DEBUG, "Connection attempt {0} failed: {1}", attempt, e.getMessage());
      }
    }
  }

  private void release(final boolean inheritedFromOtherProcess) {
    if (inheritedFromOtherProcess) {
      LOGGER.log(INFO, "Parking connection opened by another process without closing it");
      state.park();
      return;
    }
    final var previous = state.detach();
    if (previous == null) return;

    try {
      previous.close();
    } catch (final Exception e) {
      LOGGER.log(WARNING, "Failed to close replaced connection", e);
    }
  }
}
