package com.spotify.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RetrierOptionsTest {

  private final Logger retryLogger =
      (Logger) LoggerFactory.getLogger(LoggingConfigurator.RETRY_LOGGER_NAME);

  @AfterEach
  void restoreLevel() {
    retryLogger.setLevel(Level.DEBUG);
  }

  @Test
  void testRetrierUsesDefaultOperationName() {
    final Retrier retrier = Retrier.builder(BackOff.ZERO_BACKOFF).build();

    assertThat(retrier.operationName()).isEqualTo("operation");
  }

  @Test
  void testOperationNameComesFromOptions() {
    final RetryOptions options = RetryOptions.newBuilder().operationName("inventory-sync").build();
    final CancellationSignal signal = mock(CancellationSignal.class);
    when(signal.isDone()).thenReturn(true);
    final Retrier retrier =
        Retrier.builder(BackOff.ZERO_BACKOFF).options(options).cancellation(signal).build();

    assertThat(retrier.operationName()).isEqualTo("inventory-sync");
    assertThatThrownBy(() -> retrier.call(() -> "never"))
        .isInstanceOf(Exceptions.Cancelled.class)
        .hasMessage("inventory-sync was cancelled");
  }

  @Test
  void testBuilderOperationNameOverridesOptions() {
    final RetryOptions options = RetryOptions.newBuilder().operationName("shared").build();

    final Retrier named =
        Retrier.builder(BackOff.ZERO_BACKOFF).options(options).operationName("upload").build();
    final Retrier unnamed =
        Retrier.builder(BackOff.ZERO_BACKOFF).operationName("").options(options).build();

    assertThat(named.operationName()).isEqualTo("upload");
    assertThat(unnamed.operationName()).isEqualTo("shared");
  }

  @Test
  void testNullOptionsRestoreDefaults() {
    final Retrier retrier =
        Retrier.builder(BackOff.ZERO_BACKOFF)
            .options(RetryOptions.newBuilder().operationName("shared").build())
            .options(null)
            .build();

    assertThat(retrier.operationName()).isEqualTo(RetryOptions.DEFAULT.operationName());
  }

  @Test
  void testLoggingLevelIsAppliedOnBuild() {
    Retrier.builder(BackOff.STOP_BACKOFF)
        .options(RetryOptions.newBuilder().loggingLevel(RetryOptions.LoggingLevel.WARN).build())
        .build();

    assertThat(retryLogger.getLevel()).isEqualTo(Level.WARN);
  }

  @Test
  void testOptionsWithoutLoggingLevelLeaveLoggerAlone() {
    retryLogger.setLevel(Level.TRACE);

    Retrier.builder(BackOff.STOP_BACKOFF).options(RetryOptions.DEFAULT).build();

    assertThat(RetryOptions.DEFAULT.loggingLevel()).isEmpty();
    assertThat(retryLogger.getLevel()).isEqualTo(Level.TRACE);
  }

  @Test
  void testEmptyOperationNameIsRejected() {
    assertThatThrownBy(() -> RetryOptions.newBuilder().operationName(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testToBuilderKeepsSettings() {
    final RetryOptions options =
        RetryOptions.newBuilder()
            .operationName("inventory-sync")
            .loggingLevel(RetryOptions.LoggingLevel.DEBUG)
            .build();

    final RetryOptions quieter =
        options.toBuilder().loggingLevel(RetryOptions.LoggingLevel.ERROR).build();

    assertThat(options.toBuilder().build()).isEqualTo(options).hasSameHashCodeAs(options);
    assertThat(quieter.operationName()).isEqualTo("inventory-sync");
    assertThat(quieter.loggingLevel()).contains(RetryOptions.LoggingLevel.ERROR);
    assertThat(quieter).isNotEqualTo(options);
    assertThat(quieter.toString()).contains("inventory-sync", "ERROR");
  }
}
