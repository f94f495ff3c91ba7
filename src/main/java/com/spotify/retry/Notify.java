package com.spotify.retry;

import java.time.Duration;

/**
 * Callback invoked after a failed attempt, before waiting for the next one.
 *
 * <p>It runs on the retrying thread, so a slow callback delays the next attempt. It is not
 * called when the {@link BackOff} policy has decided to stop.
 */
@FunctionalInterface
public interface Notify {
  void onRetry(Exception error, Duration delay);
}
