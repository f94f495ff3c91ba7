package com.spotify.retry;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Settings shared by the {@link Retrier}s of an application.
 *
 * <p>Options are immutable. Pass them to {@link Retrier.Builder#options} and override single
 * settings on the builder where needed:
 *
 * <pre>{@code
 * RetryOptions options =
 *     RetryOptions.newBuilder()
 *         .operationName("inventory-sync")
 *         .loggingLevel(RetryOptions.LoggingLevel.DEBUG)
 *         .build();
 * Retrier retrier = Retrier.builder(backOff).options(options).build();
 * }</pre>
 */
public final class RetryOptions {

  /** Level for the {@code com.spotify.retry} loggers, applied when Logback is the backend. */
  public enum LoggingLevel {
    ALL,
    TRACE,
    /** Shows every retried attempt, exhaustion and cancellation */
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF
  }

  static final String DEFAULT_OPERATION_NAME = "operation";

  /** Operation name {@value #DEFAULT_OPERATION_NAME}, logging left as configured by the host. */
  public static final RetryOptions DEFAULT = newBuilder().build();

  private final String operationName;
  @Nullable private final LoggingLevel loggingLevel;

  private RetryOptions(Builder builder) {
    this.operationName = builder.operationName;
    this.loggingLevel = builder.loggingLevel;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().operationName(operationName).loggingLevel(loggingLevel);
  }

  /** Name identifying the operation in log lines, unless the retrier sets its own. */
  public String operationName() {
    return operationName;
  }

  /** Empty when the library should not touch the logger levels. */
  public Optional<LoggingLevel> loggingLevel() {
    return Optional.ofNullable(loggingLevel);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetryOptions)) return false;
    final RetryOptions that = (RetryOptions) o;
    return operationName.equals(that.operationName) && loggingLevel == that.loggingLevel;
  }

  @Override
  public int hashCode() {
    return Objects.hash(operationName, loggingLevel);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("operationName", operationName)
        .add("loggingLevel", loggingLevel)
        .omitNullValues()
        .toString();
  }

  public static class Builder {
    private String operationName = DEFAULT_OPERATION_NAME;
    @Nullable private LoggingLevel loggingLevel;

    private Builder() {}

    public Builder operationName(String operationName) {
      checkArgument(!Strings.isNullOrEmpty(operationName), "operationName must not be empty");
      this.operationName = operationName;
      return this;
    }

    /** {@code null} keeps the host's logging configuration. */
    public Builder loggingLevel(@Nullable LoggingLevel loggingLevel) {
      this.loggingLevel = loggingLevel;
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
