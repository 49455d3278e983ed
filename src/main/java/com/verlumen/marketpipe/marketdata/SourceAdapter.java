package com.verlumen.marketpipe.marketdata;

import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;

/**
 * Uniform pull contract over an upstream market-data provider.
 *
 * <p>Implementations translate provider-specific pagination and payloads into {@link Observation}s.
 * They are selected by name from configuration.
 */
public interface SourceAdapter {
  /** Name recorded as {@link Observation#source()} and used in configuration. */
  String sourceName();

  SourceCapabilities capabilities();

  boolean supports(Instrument instrument);

  /**
   * Fetches the next page of completed bars after {@code since} and no later than {@code until}.
   *
   * @return observations in ascending timestamp order, possibly empty
   * @throws TransientSourceException for network failures, timeouts, throttling and 5xx answers
   * @throws PermanentSourceException for unknown symbols, rejected credentials and malformed payloads
   */
  FetchResult fetch(Instrument instrument, CursorPosition since, Instant until)
      throws SourceException, InterruptedException;
}
