package io.trustbroker.sdk;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Polls a request's status until the broker reports a terminal status, the deadline passes, or
 * the caller cancels.
 *
 * <p>Each iteration checks cancellation, checks the deadline, issues one query and classifies it
 * as continue, approved or failed. Only approved and failed leave the loop. Waits between queries
 * are cut short at the deadline and end immediately on cancellation, so a poll never runs longer
 * than its timeout plus one query round trip.
 *
 * <p>A poller holds no per-session state and may run several polls concurrently.
 */
public final class ConsentPoller {
  public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(3000);
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(120000);

  private static final String CONTEXT = "pollForConsent";
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private final BrokerTransport transport;
  private final ProviderAuthMode mode;
  private final ClientLogger logger;
  private final Sleeper sleeper;
  private final LongSupplier nanoTime;

  public ConsentPoller(BrokerTransport transport, ProviderAuthMode mode, ClientLogger logger) {
    this(transport, mode, logger, Sleeper.CANCELLABLE, System::nanoTime);
  }

  ConsentPoller(
      BrokerTransport transport,
      ProviderAuthMode mode,
      ClientLogger logger,
      Sleeper sleeper,
      LongSupplier nanoTime
  ) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.logger = logger != null ? logger : ClientLogger.NOOP;
    this.sleeper = sleeper;
    this.nanoTime = nanoTime;
  }

  /**
   * @param cancellation may be {@code null}
   * @param listener may be {@code null}
   * @return the approved record, carrying the deliverables the configured mode needs
   * @throws RequestException with {@code DENIED}, {@code EXPIRED}, {@code FAILED},
   *     {@code TIMED_OUT}, {@code ABORTED}, {@code UNKNOWN_STATUS}, {@code INVALID_RESPONSE} or
   *     {@code API_ERROR}; {@link SigningException} if the request could not be signed
   */
  public RequestRecord poll(
      String requestId,
      Duration interval,
      Duration timeout,
      CancellationToken cancellation,
      StatusListener listener
  ) {
    if (requestId == null || requestId.trim().isEmpty()) {
      throw new IllegalArgumentException("requestId is required");
    }
    if (interval == null || interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (timeout == null || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }

    PollSession session = new PollSession(requestId, interval, timeout,
        cancellation != null ? cancellation : new CancellationToken(), listener, nanoTime.getAsLong());
    logger.debug(CONTEXT + ": polling " + requestId + " every " + toMillis(session.intervalNanos) +
        " ms for up to " + toMillis(session.timeoutNanos) + " ms");

    while (true) {
      if (session.cancellation.isCancelled()) {
        throw aborted(session, null);
      }
      if (session.remainingNanos() <= 0) {
        throw timedOut(session);
      }

      PollStep step = queryOnce(session);
      if (step.kind == PollStep.Kind.APPROVED) {
        logger.info(CONTEXT + ": request " + requestId + " approved after " + session.queries + " queries");
        return step.record;
      }
      if (step.kind == PollStep.Kind.FAILED) {
        throw step.error;
      }

      long remaining = session.remainingNanos();
      if (remaining <= 0) {
        throw timedOut(session);
      }
      Duration pause = Duration.ofNanos(Math.min(session.intervalNanos, remaining));
      boolean cancelledDuringSleep;
      try {
        cancelledDuringSleep = sleeper.sleep(pause, session.cancellation);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw aborted(session, e);
      }
      if (cancelledDuringSleep) {
        throw aborted(session, null);
      }
    }
  }

  private PollStep queryOnce(PollSession session) {
    session.queries++;
    TransportResponse response;
    try {
      response = transport.send(TransportRequest.get(mode.statusPath(session.requestId)));
    } catch (IOException | UncheckedIOException e) {
      logger.warn(CONTEXT + ": transient failure polling " + session.requestId + ": " + e.getMessage());
      return PollStep.retry();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return PollStep.failed(aborted(session, e));
    } catch (RequestException e) {
      return PollStep.failed(e);
    } catch (TrustBrokerException e) {
      throw e;
    } catch (RuntimeException e) {
      logger.error(CONTEXT + ": transport failed unexpectedly for " + session.requestId, e);
      return PollStep.failed(ErrorClassifier.unexpected(CONTEXT, e));
    }

    if (ErrorClassifier.isTransient(response)) {
      logger.warn(CONTEXT + ": broker returned " + response.statusCode() + " for " + session.requestId +
          ", retrying");
      return PollStep.retry();
    }
    if (!response.isSuccess()) {
      return PollStep.failed(ErrorClassifier.apiError(CONTEXT, response));
    }

    RequestRecord record;
    try {
      record = Json.decode(CONTEXT, response, RequestRecord.class);
    } catch (RequestException e) {
      return PollStep.failed(e);
    }
    if (record.requestId == null) {
      record.requestId = session.requestId;
    }
    if (record.status == null) {
      return PollStep.failed(ErrorClassifier.invalidResponse(CONTEXT, session.requestId, "status is missing"));
    }
    notifyListener(session, record);

    RequestStatus status = RequestStatus.parse(record.status);
    if (status == null) {
      return PollStep.failed(ErrorClassifier.unknownStatus(CONTEXT, session.requestId, record.status));
    }
    if (!status.isTerminal()) {
      logger.debug(CONTEXT + ": " + session.requestId + " is " + record.status);
      return PollStep.retry();
    }
    if (status == RequestStatus.APPROVED) {
      String missing = mode.missingDeliverable(record);
      if (missing != null) {
        return PollStep.failed(ErrorClassifier.invalidResponse(CONTEXT, session.requestId,
            "approved request is missing " + missing));
      }
      return PollStep.approved(record);
    }
    return PollStep.failed(ErrorClassifier.terminal(CONTEXT, record));
  }

  private void notifyListener(PollSession session, RequestRecord record) {
    if (session.listener == null) {
      return;
    }
    try {
      session.listener.onStatus(record);
    } catch (RuntimeException e) {
      logger.error(CONTEXT + ": status listener failed for " + session.requestId, e);
    }
  }

  private RequestException aborted(PollSession session, Throwable cause) {
    logger.info(CONTEXT + ": polling " + session.requestId + " cancelled after " + session.queries + " queries");
    return ErrorClassifier.aborted(CONTEXT, session.requestId, cause);
  }

  private RequestException timedOut(PollSession session) {
    logger.warn(CONTEXT + ": polling " + session.requestId + " timed out after " + session.queries + " queries");
    return ErrorClassifier.timedOut(CONTEXT, session.requestId, toMillis(session.timeoutNanos));
  }

  /** Durations beyond the nanosecond range (about 292 years) count as unbounded. */
  static long saturatedNanos(Duration duration) {
    return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
  }

  private static long toMillis(long nanos) {
    return TimeUnit.NANOSECONDS.toMillis(nanos);
  }

  private final class PollSession {
    final String requestId;
    final CancellationToken cancellation;
    final StatusListener listener;
    final long intervalNanos;
    final long timeoutNanos;
    final long startNanos;
    int queries;

    PollSession(
        String requestId,
        Duration interval,
        Duration timeout,
        CancellationToken cancellation,
        StatusListener listener,
        long startNanos
    ) {
      this.requestId = requestId;
      this.cancellation = cancellation;
      this.listener = listener;
      this.intervalNanos = saturatedNanos(interval);
      this.timeoutNanos = saturatedNanos(timeout);
      this.startNanos = startNanos;
    }

    // Elapsed time is a difference of two readings, which stays correct when nanoTime wraps.
    long remainingNanos() {
      return timeoutNanos - (nanoTime.getAsLong() - startNanos);
    }
  }

  private static final class PollStep {
    enum Kind { CONTINUE, APPROVED, FAILED }

    final Kind kind;
    final RequestRecord record;
    final RequestException error;

    private PollStep(Kind kind, RequestRecord record, RequestException error) {
      this.kind = kind;
      this.record = record;
      this.error = error;
    }

    static PollStep retry() {
      return new PollStep(Kind.CONTINUE, null, null);
    }

    static PollStep approved(RequestRecord record) {
      return new PollStep(Kind.APPROVED, record, null);
    }

    static PollStep failed(RequestException error) {
      return new PollStep(Kind.FAILED, null, error);
    }
  }
}
