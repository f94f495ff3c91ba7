package com.spotify.retry;

import java.time.Duration;
import javax.annotation.Nullable;

/**
 * Read-only view of an external cancellation.
 *
 * <p>A signal becomes done at most once and then stays done. {@link Retrier} checks it before the
 * first attempt and while waiting between attempts, never while the operation is running.
 */
public interface CancellationSignal {

  /** Whether the signal was cancelled. Once {@code true}, stays {@code true}. */
  boolean isDone();

  /**
   * The reason the signal was cancelled.
   *
   * @return {@code null} until the signal is done, then always the same exception
   */
  @Nullable
  Exception reason();

  /**
   * Blocks until the signal is done or the timeout elapses, whichever comes first.
   *
   * @return {@code true} if the signal is done
   */
  boolean await(Duration timeout) throws InterruptedException;
}
