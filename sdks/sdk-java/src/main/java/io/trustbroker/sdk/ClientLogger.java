package io.trustbroker.sdk;

import org.slf4j.LoggerFactory;

/** Sink for the client's operational messages. Use {@link #NOOP} when nothing should be logged. */
public interface ClientLogger {
  ClientLogger NOOP = new ClientLogger() {
    @Override
    public void debug(String message) {}

    @Override
    public void info(String message) {}

    @Override
    public void warn(String message) {}

    @Override
    public void error(String message, Throwable error) {}
  };

  void debug(String message);

  void info(String message);

  void warn(String message);

  void error(String message, Throwable error);

  static ClientLogger slf4j(Class<?> owner) {
    return new Slf4jClientLogger(LoggerFactory.getLogger(owner));
  }
}
