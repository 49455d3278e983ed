package com.verlumen.marketpipe.signals;

/** Hands actionable signals to downstream consumers. Failures are logged, never thrown. */
public interface SignalPublisher extends AutoCloseable {
  void publish(Signal signal);

  @Override
  void close();

  interface Factory {
    SignalPublisher create(String topic);
  }
}
