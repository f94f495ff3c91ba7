package com.spotify.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;

/** Waits out the delay between two attempts. */
interface Sleeper {

  /**
   * Waits for the given delay, returning early if the signal becomes done.
   *
   * @return {@code true} if the full delay elapsed, {@code false} if the signal won
   */
  boolean sleep(Duration delay, @Nullable CancellationSignal signal) throws InterruptedException;

  Sleeper SYSTEM =
      (delay, signal) -> {
        if (signal != null) {
          return !signal.await(delay);
        }
        if (!delay.isZero()) {
          TimeUnit.NANOSECONDS.sleep(CancellationSource.saturatedNanos(delay));
        }
        return true;
      };
}
