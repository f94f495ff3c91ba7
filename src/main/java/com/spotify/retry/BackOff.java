package com.spotify.retry;

import java.time.Duration;

/**
 * Policy deciding how long to wait between attempts and when to give up.
 *
 * <p>Implementations are stateful and not expected to be thread-safe. A single instance must not
 * be used by two {@link Retrier} invocations at the same time.
 */
public interface BackOff {

  /** Returned by {@link #nextBackOff()} when no further attempt should be made. */
  Duration STOP = Duration.ofMillis(-1);

  /** Returns the policy to its initial state. */
  void reset();

  /**
   * Gets the time to wait before the next attempt, or {@link #STOP} to indicate that the
   * operation should not be retried.
   */
  Duration nextBackOff();

  /** Any negative duration is treated the same way as {@link #STOP}. */
  static boolean isStop(Duration backOff) {
    return backOff.isNegative();
  }

  /** Retries immediately, without ever giving up. */
  BackOff ZERO_BACKOFF =
      new BackOff() {
        @Override
        public void reset() {}

        @Override
        public Duration nextBackOff() {
          return Duration.ZERO;
        }
      };

  /** Never retries. */
  BackOff STOP_BACKOFF =
      new BackOff() {
        @Override
        public void reset() {}

        @Override
        public Duration nextBackOff() {
          return STOP;
        }
      };
}
