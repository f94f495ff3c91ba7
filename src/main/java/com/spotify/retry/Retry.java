package com.spotify.retry;

import javax.annotation.Nullable;

/**
 * Shortcuts for one-off retries. Each call builds a {@link Retrier} and runs the operation once
 * through it.
 *
 * <p>The operation is guaranteed to run at least once, unless the cancellation signal is already
 * done. The policy is reset before the first attempt; resetting it again before reuse is up to
 * the caller.
 */
public final class Retry {

  private Retry() {}

  /** Retries the operation until it succeeds or the policy stops. */
  public static <T> T retry(Operation<T> operation, BackOff backOff) throws Exception {
    return retryNotify(operation, backOff, null);
  }

  /** Like {@link #retry}, calling {@code notify} before waiting after every failed attempt. */
  public static <T> T retryNotify(Operation<T> operation, BackOff backOff, @Nullable Notify notify)
      throws Exception {
    return retryNotifyWithCancellation(null, operation, backOff, notify);
  }

  /**
   * Like {@link #retryNotify}, giving up as soon as the signal is done. A {@code null} signal
   * never cancels.
   */
  public static <T> T retryNotifyWithCancellation(
      @Nullable CancellationSignal signal,
      Operation<T> operation,
      BackOff backOff,
      @Nullable Notify notify)
      throws Exception {
    return Retrier.builder(backOff).notifier(notify).cancellation(signal).build().call(operation);
  }
}
