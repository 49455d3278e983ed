package com.verlumen.marketpipe.marketdata;

import com.verlumen.marketpipe.time.TimeFrame;
import java.time.Instant;

/**
 * Provider settings.
 *
 * @param backfillStart first bar requested for a pair that has never been ingested
 * @param timeFrame bar interval requested from interval-aware providers
 */
public record MarketDataConfig(
    Instant backfillStart,
    TimeFrame timeFrame,
    String binanceBaseUrl,
    String alphaVantageBaseUrl,
    String alphaVantageApiKey,
    int alphaVantagePageSize) {

  public static final String DEFAULT_BINANCE_BASE_URL = "https://api.binance.com/api/v3";
  public static final String DEFAULT_ALPHA_VANTAGE_BASE_URL = "https://www.alphavantage.co/query";

  public static MarketDataConfig create(
      Instant backfillStart, TimeFrame timeFrame, String alphaVantageApiKey) {
    return new MarketDataConfig(
        backfillStart,
        timeFrame,
        DEFAULT_BINANCE_BASE_URL,
        DEFAULT_ALPHA_VANTAGE_BASE_URL,
        alphaVantageApiKey,
        1000);
  }
}
