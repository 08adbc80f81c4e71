package io.trustbroker.sdk;

/** Called synchronously with every record the poller reads, before the record is acted on. */
@FunctionalInterface
public interface StatusListener {
  void onStatus(RequestRecord record);
}
