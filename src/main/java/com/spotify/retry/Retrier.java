package com.spotify.retry;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.time.Duration;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@link Operation} until it succeeds, the {@link BackOff} policy stops, or the {@link
 * CancellationSignal} is done.
 *
 * <p>The policy is reset at the start of every {@link #call}. Errors thrown by the operation are
 * passed through untouched: when the policy stops, the exception of the last attempt is thrown;
 * when the signal wins, its {@link CancellationSignal#reason() reason} is thrown instead.
 *
 * <p>A retrier holds no state of its own, but its policy does. Do not run the same retrier (or two
 * retriers sharing a policy) from several threads at once.
 */
public class Retrier {
  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  private final BackOff backOff;
  @Nullable private final Notify notify;
  @Nullable private final CancellationSignal signal;
  private final String operationName;
  private final Sleeper sleeper;

  private Retrier(Builder builder) {
    this.backOff = builder.backOff;
    this.notify = builder.notify;
    this.signal = builder.signal;
    this.operationName =
        builder.operationName != null ? builder.operationName : builder.options.operationName();
    this.sleeper = builder.sleeper;
  }

  public static Retrier.Builder builder(@Nonnull BackOff backOff) {
    return new Retrier.Builder(backOff);
  }

  /**
   * Executes the operation, retrying it on failure.
   *
   * @return the value returned by the first successful attempt
   * @throws Exception the error of the last attempt once the policy stops, or the cancellation
   *     reason if the signal is done before the first attempt or during a wait
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public <T> T call(Operation<T> operation) throws Exception {
    Objects.requireNonNull(operation, "operation");
    if (signal != null && signal.isDone()) {
      log.debug("{} cancelled before the first attempt", operationName);
      throw cancellationReason();
    }

    backOff.reset();
    int attempt = 0;
    while (true) {
      attempt++;
      final Exception error;
      try {
        return operation.call();
      } catch (Exception e) {
        error = e;
      }

      final Duration next =
          Objects.requireNonNull(backOff.nextBackOff(), "BackOff.nextBackOff() returned null");
      if (BackOff.isStop(next)) {
        log.debug("{} attempt {} failed, giving up: {}", operationName, attempt, error.toString());
        throw error;
      }

      log.debug(
          "{} attempt {} failed, retrying in {}: {}",
          operationName,
          attempt,
          next,
          error.toString());
      if (notify != null) {
        notify.onRetry(error, next);
      }

      if (!sleeper.sleep(next, signal)) {
        log.debug("{} cancelled while waiting after attempt {}", operationName, attempt);
        throw cancellationReason();
      }
    }
  }

  private Exception cancellationReason() {
    final Exception reason = signal.reason();
    if (reason == null) {
      // the signal reported done without a reason
      return new Exceptions.Cancelled(operationName + " was cancelled");
    }
    return reason;
  }

  @VisibleForTesting
  String operationName() {
    return operationName;
  }

  @Override
  public String toString() {
    return "Retrier{" + "operationName='" + operationName + '\'' + ", backOff=" + backOff + '}';
  }

  public static class Builder {
    private final BackOff backOff;
    @Nullable private Notify notify;
    @Nullable private CancellationSignal signal;
    @Nullable private String operationName;
    private RetryOptions options = RetryOptions.DEFAULT;
    private Sleeper sleeper = Sleeper.SYSTEM;

    public Builder(@Nonnull BackOff backOff) {
      this.backOff = Objects.requireNonNull(backOff, "backOff");
    }

    /** Callback invoked with the error and the upcoming delay of every retried attempt. */
    public Builder notifier(@Nullable Notify notify) {
      this.notify = notify;
      return this;
    }

    /** Signal that aborts the retries while waiting between attempts. */
    public Builder cancellation(@Nullable CancellationSignal signal) {
      this.signal = signal;
      return this;
    }

    /**
     * Name used to identify the operation in log messages. Overrides the name from {@link
     * #options}; {@code null} or empty falls back to it.
     */
    public Builder operationName(@Nullable String operationName) {
      this.operationName = Strings.emptyToNull(operationName);
      return this;
    }

    /** Shared settings; {@code null} restores {@link RetryOptions#DEFAULT}. */
    public Builder options(@Nullable RetryOptions options) {
      this.options = options != null ? options : RetryOptions.DEFAULT;
      return this;
    }

    @VisibleForTesting
    Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
      return this;
    }

    public Retrier build() {
      options.loggingLevel().ifPresent(LoggingConfigurator::configureLogging);
      return new Retrier(this);
    }
  }
}
