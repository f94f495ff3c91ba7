package com.spotify.retry;

/**
 * A unit of work that is executed by a {@link Retrier}.
 *
 * <p>The operation succeeds by returning (possibly {@code null}) and fails by throwing. A failed
 * operation is retried according to the {@link BackOff} policy, so it may be invoked several
 * times and should tolerate that.
 *
 * @param <T> type of the value produced by a successful call
 */
@FunctionalInterface
public interface Operation<T> {
  T call() throws Exception;
}
