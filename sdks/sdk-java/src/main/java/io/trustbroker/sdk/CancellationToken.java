package io.trustbroker.sdk;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared between a caller and a running poll. Cancelling wakes a
 * poll that is waiting between queries.
 */
public final class CancellationToken {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /** Waits up to {@code timeout}; returns {@code true} if cancelled before it elapsed. */
  public boolean await(Duration timeout) throws InterruptedException {
    return cancelled.await(ConsentPoller.saturatedNanos(timeout), TimeUnit.NANOSECONDS);
  }
}
