package com.example.safeconnection.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

/**
 * Retry policies for the reconnection loop of a {@link SafeConnection}.
 *
 * <p>A policy is asked before every connection attempt whether the attempt may be made. Any delay
 * between attempts happens inside the policy, so a policy is also the place to bound how long a
 * caller can be blocked while the database is unreachable.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * // default: exactly one attempt
 * Retry.Policy.once();
 *
 * // three attempts, 500ms apart
 * Retry.Policy.fixed(3, 500L);
 *
 * // five attempts, 100ms doubling up to 60s, with jitter
 * Retry.Policy.exponential(5, 100L);
 *
 * // anything else
 * Retry.Policy policy = attempt -> attempt <= 10 && sleepQuietly(attempt * 1_000L);
 * }</pre>
 */
public final class Retry {

  private static final System.Logger LOGGER = System.getLogger(Retry.class.getName());

  private Retry() {}

  /** Decides whether another connection attempt should be made. */
  @FunctionalInterface
  public interface Policy {

    /**
     * Called before each connection attempt.
     *
     * @param attempt attempt number, starting at 1
     * @return true to make the attempt, false to give up
     */
    boolean shouldAttempt(int attempt);

    /**
     * Allows exactly one attempt. This is the default policy.
     *
     * @return single attempt policy
     */
    static Policy once() {
      return attempt -> attempt == 1;
    }

    /**
     * Allows up to {@code attempts} attempts with no delay between them.
     *
     * @param attempts number of attempts (including first), must be >= 1
     * @return immediate retry policy
     */
    static Policy attempts(final int attempts) {
      return new Backoff(attempts, 0L, 0L, 1.0, false);
    }

    /**
     * Creates a fixed delay retry policy.
     *
     * @param attempts number of attempts (including first)
     * @param delayMillis delay between attempts in milliseconds
     * @return fixed delay retry policy
     */
    static Policy fixed(final int attempts, final long delayMillis) {
      return new Backoff(attempts, delayMillis, delayMillis, 1.0, false);
    }

    /**
     * Creates an exponential backoff retry policy with jitter.
     *
     * <p>Delays grow exponentially (2x) up to a maximum of 60 seconds, with 25% random jitter.
     *
     * @param attempts number of attempts (including first)
     * @param initialDelay initial delay in milliseconds
     * @return exponential backoff retry policy with jitter
     */
    static Policy exponential(final int attempts, final long initialDelay) {
      return new Backoff(attempts, initialDelay, 60_000L, 2.0, true);
    }
  }

  /**
   * Bounded retry policy with fixed or exponential delay between attempts.
   *
   * @param maxAttempts maximum number of attempts (including first), must be >= 1
   * @param initialDelayMillis initial delay between retries in milliseconds, must be >= 0
   * @param maxDelayMillis maximum delay cap for exponential backoff, must be >= initialDelayMillis
   * @param backoffMultiplier multiplier for exponential backoff (1.0 = fixed delay), must be >= 1.0
   * @param jitter whether to add random jitter (up to 25%) to delays
   */
  public record Backoff(
      int maxAttempts,
      long initialDelayMillis,
      long maxDelayMillis,
      double backoffMultiplier,
      boolean jitter)
      implements Policy {

    public Backoff {
      if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
      if (initialDelayMillis < 0)
        throw new IllegalArgumentException("initialDelayMillis must be >= 0");
      if (maxDelayMillis < initialDelayMillis)
        throw new IllegalArgumentException("maxDelayMillis must be >= initialDelayMillis");
      if (backoffMultiplier < 1.0)
        throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }

    /**
     * Permits the attempt if it is within {@link #maxAttempts()}, sleeping first for the delay
     * computed by {@link #calculateDelay(int)}. An interrupted sleep declines the attempt and keeps
     * the interrupt flag set.
     */
    @Override
    public boolean shouldAttempt(final int attempt) {
      if (attempt > maxAttempts) return false;

      final var delay = calculateDelay(attempt);
      if (delay > 0) {
        LOGGER.log(DEBUG, "Waiting {0} ms before connection attempt {1}", delay, attempt);
        try {
          Thread.sleep(delay);
        } catch (final InterruptedException ie) {
          Thread.currentThread().interrupt();
          LOGGER.log(WARNING, "Interrupted before connection attempt {0}, giving up", attempt);
          return false;
        }
      }
      return true;
    }

    /**
     * Calculates the delay for a given attempt number.
     *
     * @param attempt current attempt number (1-based)
     * @return delay in milliseconds before the attempt
     */
    long calculateDelay(final int attempt) {
      if (attempt <= 1) return 0L;

      var delay = initialDelayMillis;
      if (backoffMultiplier > 1.0) {
        delay = (long) (initialDelayMillis * Math.pow(backoffMultiplier, attempt - 2));
        delay = Math.min(delay, maxDelayMillis);
      }

      if (jitter) {
        final var jitterAmount = (long) (delay * 0.25 * Math.random());
        delay += jitterAmount;
      }

      return delay;
    }
  }
}
