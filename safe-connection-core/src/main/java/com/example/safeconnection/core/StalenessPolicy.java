package com.example.safeconnection.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether the current physical connection must be replaced even though it is still
 * reachable.
 */
@FunctionalInterface
public interface StalenessPolicy {

  /**
   * Determines if the physical connection described by {@code state} is stale.
   *
   * @param state current connection state, with a physical connection present
   * @return true to force a reconnect
   */
  boolean isStale(ConnectionState state);

  /**
   * Never forces a reconnect. This is the default.
   *
   * @return policy that always answers false
   */
  static StalenessPolicy never() {
    return state -> false;
  }

  /**
   * Forces a reconnect once the physical connection is older than {@code maxAge}.
   *
   * @param maxAge maximum time since the last successful connect, must be positive
   * @param clock time source
   * @return age based policy
   */
  static StalenessPolicy maxAge(final Duration maxAge, final Clock clock) {
    Objects.requireNonNull(clock, "clock");
    if (maxAge == null || maxAge.isNegative() || maxAge.isZero())
      throw new IllegalArgumentException("maxAge must be positive");
    return state ->
        state
            .getLastConnectedAt()
            .map(at -> Duration.between(at, clock.instant()).compareTo(maxAge) > 0)
            .orElse(false);
  }

  /**
   * Combines this policy with another using OR logic.
   *
   * @param other the other policy
   * @return combined policy
   */
  default StalenessPolicy or(final StalenessPolicy other) {
    return state -> this.isStale(state) || other.isStale(state);
  }
}
