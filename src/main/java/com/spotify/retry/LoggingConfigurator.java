package com.spotify.retry;

import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@link RetryOptions.LoggingLevel} to the library's loggers.
 *
 * <p>Logback is driven through reflection so that it stays an optional dependency. With any other
 * SLF4J backend the configured level is ignored and retries work as usual.
 */
class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  static final String RETRY_LOGGER_NAME = "com.spotify.retry";

  private static Class<?> logbackLevelClass = null;
  private static Class<?> logbackLoggerClass = null;
  private static Method setLevelMethod = null;
  private static boolean logbackAvailable = false;

  static {
    initializeLogbackSupport();
  }

  /** Sets the level of the {@code com.spotify.retry} logger. */
  static void configureLogging(RetryOptions.LoggingLevel loggingLevel) {
    configureLogger(RETRY_LOGGER_NAME, loggingLevel);
  }

  static void configureLogger(String loggerName, RetryOptions.LoggingLevel loggingLevel) {
    if (loggingLevel == null || loggerName == null || !logbackAvailable) {
      return;
    }

    try {
      final Logger slf4jLogger = LoggerFactory.getLogger(loggerName);
      if (logbackLoggerClass.isInstance(slf4jLogger)) {
        // Logback's Level constants share their names with LoggingLevel
        final Object logbackLevel = logbackLevelClass.getField(loggingLevel.name()).get(null);
        setLevelMethod.invoke(slf4jLogger, logbackLevel);
      }
    } catch (ReflectiveOperationException e) {
      log.warn("Could not set level of logger {}: {}", loggerName, e.toString());
    }
  }

  static boolean isLogbackAvailable() {
    return logbackAvailable;
  }

  private static void initializeLogbackSupport() {
    try {
      logbackLevelClass = Class.forName("ch.qos.logback.classic.Level");
      logbackLoggerClass = Class.forName("ch.qos.logback.classic.Logger");
      setLevelMethod = logbackLoggerClass.getMethod("setLevel", logbackLevelClass);
      logbackAvailable = true;
    } catch (ClassNotFoundException | NoSuchMethodException e) {
      // Logback is not on the classpath
      logbackAvailable = false;
    }
  }
}
