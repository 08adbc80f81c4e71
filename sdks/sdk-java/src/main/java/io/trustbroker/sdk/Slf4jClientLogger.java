package io.trustbroker.sdk;

import org.slf4j.Logger;

import java.util.Objects;

public final class Slf4jClientLogger implements ClientLogger {
  private final Logger logger;

  public Slf4jClientLogger(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void debug(String message) {
    logger.debug(message);
  }

  @Override
  public void info(String message) {
    logger.info(message);
  }

  @Override
  public void warn(String message) {
    logger.warn(message);
  }

  @Override
  public void error(String message, Throwable error) {
    logger.error(message, error);
  }
}
