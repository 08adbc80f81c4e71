package io.trustbroker.sdk;

import java.time.Duration;

@FunctionalInterface
interface Sleeper {
  Sleeper CANCELLABLE = (duration, cancellation) -> cancellation.await(duration);

  /** Returns {@code true} if the sleep ended because {@code cancellation} fired. */
  boolean sleep(Duration duration, CancellationToken cancellation) throws InterruptedException;
}
