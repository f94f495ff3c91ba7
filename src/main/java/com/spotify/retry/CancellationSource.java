package com.spotify.retry;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link CancellationSignal} owned and triggered by the caller.
 *
 * <p>The first cancellation wins: its reason is kept and later calls to {@link #cancel} have no
 * effect. A source may be shared by any number of concurrent {@link Retrier} invocations.
 *
 * <pre>{@code
 * try (CancellationSource source = CancellationSource.withTimeout(Duration.ofSeconds(10))) {
 *   return Retry.retryNotifyWithCancellation(source, operation, backOff, null);
 * }
 * }</pre>
 */
public class CancellationSource implements CancellationSignal, Closeable {
  private static final Logger log = LoggerFactory.getLogger(CancellationSource.class);

  private static final ScheduledThreadPoolExecutor deadlineExecutor = newDeadlineExecutor();

  private final AtomicReference<Exception> reason = new AtomicReference<>();
  private final CountDownLatch done = new CountDownLatch(1);
  @Nullable private volatile ScheduledFuture<?> deadline;

  public CancellationSource() {}

  /**
   * Creates a source that cancels itself with {@link Exceptions.DeadlineExceeded} once the
   * timeout has elapsed, unless it was cancelled or closed before that.
   */
  public static CancellationSource withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    checkArgument(!timeout.isNegative(), "timeout must not be negative: %s", timeout);
    final CancellationSource source = new CancellationSource();
    source.deadline =
        deadlineExecutor.schedule(
            () ->
                source.cancel(
                    new Exceptions.DeadlineExceeded("deadline of " + timeout + " exceeded")),
            saturatedNanos(timeout),
            TimeUnit.NANOSECONDS);
    if (source.isDone()) {
      // the deadline fired before it was assigned
      source.stopDeadline();
    }
    return source;
  }

  /** Cancels with {@link Exceptions.Cancelled}. */
  public boolean cancel() {
    return cancel(new Exceptions.Cancelled("operation was cancelled"));
  }

  /**
   * Cancels with the given reason.
   *
   * @return {@code true} if this call cancelled the source, {@code false} if it was already done
   */
  public boolean cancel(Exception reason) {
    Objects.requireNonNull(reason, "reason");
    if (!this.reason.compareAndSet(null, reason)) {
      return false;
    }
    done.countDown();
    stopDeadline();
    log.debug("Cancellation signalled: {}", reason.getMessage());
    return true;
  }

  @Override
  public boolean isDone() {
    return reason.get() != null;
  }

  @Nullable
  @Override
  public Exception reason() {
    return reason.get();
  }

  @Override
  public boolean await(Duration timeout) throws InterruptedException {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      return isDone();
    }
    return done.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
  }

  /** Releases the pending deadline, cancelling the source if it is not done yet. */
  @Override
  public void close() {
    stopDeadline();
    cancel(new Exceptions.Cancelled("cancellation source closed"));
  }

  private void stopDeadline() {
    final ScheduledFuture<?> pending = deadline;
    if (pending != null) {
      pending.cancel(false);
    }
  }

  @VisibleForTesting
  boolean hasPendingDeadline() {
    final ScheduledFuture<?> pending = deadline;
    return pending != null && deadlineExecutor.getQueue().contains(pending);
  }

  private static ScheduledThreadPoolExecutor newDeadlineExecutor() {
    final ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("retry-cancellation-deadline-%d")
                .build());
    // closed sources must not keep their timer queued until it would have fired
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  static long saturatedNanos(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }
}
