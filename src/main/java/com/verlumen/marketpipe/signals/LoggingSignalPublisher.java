package com.verlumen.marketpipe.signals;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;

/** Dry-run publisher: signals are only logged. */
final class LoggingSignalPublisher implements SignalPublisher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  LoggingSignalPublisher() {}

  @Override
  public void publish(Signal signal) {
    logger.atInfo().log("[dry run] would publish %s", SignalCodec.toJson(signal));
  }

  @Override
  public void close() {}
}
