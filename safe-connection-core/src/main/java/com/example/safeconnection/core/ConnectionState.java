package com.example.safeconnection.core;

import java.sql.Connection;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable bookkeeping for one logical connection: the current physical connection, who opened it
 * and when, the last connection error and the transaction depth.
 *
 * <p>Owned by exactly one {@link SafeConnection}. Only the reconnection engine and the transaction
 * tracker change it, always while holding the connection's lock. The public accessors exist so a
 * {@link StalenessPolicy} can inspect the state; they do not expose the physical connection itself.
 */
public final class ConnectionState {

  private Connection physical;
  private OwnerIdentity owner;
  private Instant lastConnectedAt;
  private Instant lastReconnectAt;
  private Instant transactionStartedAt;
  private Exception lastError;
  private int transactionDepth;
  private volatile boolean autoCommit = true;
  private volatile boolean active = true;
  private long reconnectCount;
  private long generation;
  private long transactionGeneration;
  private final Map<Long, Parked> parkedByProcess = new HashMap<>();

  ConnectionState() {}

  Connection physical() {
    return physical;
  }

  public boolean hasPhysical() {
    return physical != null;
  }

  public Optional<OwnerIdentity> getOwner() {
    return Optional.ofNullable(owner);
  }

  public Optional<Instant> getLastConnectedAt() {
    return Optional.ofNullable(lastConnectedAt);
  }

  public Optional<Instant> getLastReconnectAt() {
    return Optional.ofNullable(lastReconnectAt);
  }

  public Optional<Instant> getTransactionStartedAt() {
    return Optional.ofNullable(transactionStartedAt);
  }

  public Optional<Exception> getLastError() {
    return Optional.ofNullable(lastError);
  }

  public int getTransactionDepth() {
    return transactionDepth;
  }

  public boolean isInTransaction() {
    return transactionDepth > 0;
  }

  public boolean isAutoCommit() {
    return autoCommit;
  }

  public boolean isActive() {
    return active;
  }

  /** Number of times a physical connection was opened, including the first one. */
  public long getReconnectCount() {
    return reconnectCount;
  }

  /**
   * Point-in-time copy of this state.
   *
   * @return immutable snapshot
   */
  public Snapshot snapshot() {
    return new Snapshot(
        physical != null,
        owner,
        lastConnectedAt,
        lastReconnectAt,
        transactionStartedAt,
        lastError,
        transactionDepth,
        autoCommit,
        active,
        reconnectCount);
  }

  void attach(final Connection connection, final OwnerIdentity identity, final Instant now) {
    physical = connection;
    owner = identity;
    lastConnectedAt = now;
    reconnectCount++;
  }

  /** Drops the physical connection and returns it; the caller decides whether to close it. */
  Connection detach() {
    final var previous = physical;
    physical = null;
    return previous;
  }

  /**
   * Sets the physical connection aside under the process that opened it, without closing it, so
   * that process gets it back on its next call.
   */
  void park() {
    if (physical == null || owner == null) return;
    parkedByProcess.put(owner.processId(), new Parked(physical, owner, lastConnectedAt));
    physical = null;
  }

  /**
   * Restores the connection parked for a process.
   *
   * @return the restored connection, or null if none was parked for that process
   */
  Connection restore(final long processId) {
    final var parked = parkedByProcess.remove(processId);
    if (parked == null) return null;
    physical = parked.physical();
    owner = parked.owner();
    lastConnectedAt = parked.connectedAt();
    return physical;
  }

  /** Forgets parked connections; they belong to other processes and are never closed here. */
  void clearParked() {
    parkedByProcess.clear();
  }

  void markReconnect(final Instant now) {
    lastReconnectAt = now;
    generation++;
  }

  void recordError(final Exception error) {
    lastError = error;
  }

  void beginTransaction(final Instant now) {
    autoCommit = false;
    transactionDepth++;
    transactionStartedAt = now;
    transactionGeneration = generation;
  }

  /** Reopens the transaction closed by a failed commit, keeping its start time. */
  void reopenTransaction() {
    autoCommit = false;
    transactionDepth++;
  }

  void revertBegin() {
    transactionDepth = Math.max(0, transactionDepth - 1);
    if (transactionDepth == 0) autoCommit = true;
  }

  /**
   * Decrements the transaction depth, never below zero.
   *
   * @return false if the depth was already zero
   */
  boolean decrementDepth() {
    if (transactionDepth <= 0) {
      transactionDepth = 0;
      return false;
    }
    transactionDepth--;
    return true;
  }

  void finishTransaction() {
    if (transactionDepth == 0) autoCommit = true;
  }

  /** True when a physical connection was replaced after the current transaction began. */
  boolean reconnectedSinceTransactionStart() {
    return transactionStartedAt != null && generation != transactionGeneration;
  }

  void deactivate() {
    active = false;
  }

  private record Parked(Connection physical, OwnerIdentity owner, Instant connectedAt) {}

  /**
   * Immutable copy of a {@link ConnectionState}.
   *
   * @param connected whether a physical connection is currently held
   * @param owner identity that opened the physical connection, or null
   * @param lastConnectedAt time of the last successful connect, or null
   * @param lastReconnectAt time the last replacement started, or null
   * @param transactionStartedAt time the current or last transaction began, or null
   * @param lastError most recent connection failure, or null
   * @param transactionDepth open transaction count
   * @param autoCommit whether no transaction is logically open
   * @param active false once the logical connection was closed
   * @param reconnectCount physical connections opened so far
   */
  public record Snapshot(
      boolean connected,
      OwnerIdentity owner,
      Instant lastConnectedAt,
      Instant lastReconnectAt,
      Instant transactionStartedAt,
      Exception lastError,
      int transactionDepth,
      boolean autoCommit,
      boolean active,
      long reconnectCount) {}
}
