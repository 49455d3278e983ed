package com.verlumen.marketpipe.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.marketpipe.http.HttpClient;
import com.verlumen.marketpipe.http.HttpStatusException;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import java.io.IOException;
import java.time.Instant;

/**
 * Crypto candles from the Binance klines endpoint.
 *
 * <p>Pages are time windows: each request asks for up to {@value #REQUEST_LIMIT} klines starting one
 * millisecond after the last committed open time. Klines still open at {@code until} are left for
 * a later cycle so that a committed bar never changes.
 */
final class BinanceKlineAdapter implements SourceAdapter {
  static final String SOURCE_NAME = "binance";

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int REQUEST_LIMIT = 1000;
  // 0.2 seconds between requests.
  private static final double PERMITS_PER_SECOND = 5.0;
  private static final ImmutableMap<String, String> HEADERS =
      ImmutableMap.of("Accept", "application/json", "User-Agent", "marketpipe-ingestion/1.0");

  // Kline array positions.
  private static final int OPEN_TIME = 0;
  private static final int OPEN = 1;
  private static final int HIGH = 2;
  private static final int LOW = 3;
  private static final int CLOSE = 4;
  private static final int VOLUME = 5;
  private static final int CLOSE_TIME = 6;
  private static final int QUOTE_ASSET_VOLUME = 7;
  private static final int NUM_TRADES = 8;
  private static final int TAKER_BUY_BASE_VOLUME = 9;
  private static final int TAKER_BUY_QUOTE_VOLUME = 10;

  private final HttpClient httpClient;
  private final MarketDataConfig config;

  @Inject
  BinanceKlineAdapter(HttpClient httpClient, MarketDataConfig config) {
    this.httpClient = httpClient;
    this.config = config;
  }

  @Override
  public String sourceName() {
    return SOURCE_NAME;
  }

  @Override
  public SourceCapabilities capabilities() {
    return SourceCapabilities.create(
        PaginationScheme.TIME_WINDOW, PERMITS_PER_SECOND, /* supportsBackfill= */ true, REQUEST_LIMIT);
  }

  @Override
  public boolean supports(Instrument instrument) {
    return instrument.assetClass() == AssetClass.CRYPTO && instrument.venue().equals(SOURCE_NAME);
  }

  @Override
  public FetchResult fetch(Instrument instrument, CursorPosition since, Instant until)
      throws SourceException {
    Instant startTime =
        since.lastTimestamp().map(last -> last.plusMillis(1)).orElse(config.backfillStart());
    if (startTime.isAfter(until)) {
      return FetchResult.empty(since);
    }

    String url =
        String.format(
            "%s/klines?symbol=%s&interval=%s&limit=%d&startTime=%d&endTime=%d",
            config.binanceBaseUrl(),
            instrument.currencyPair().concatenatedSymbol(),
            config.timeFrame().getLabel(),
            REQUEST_LIMIT,
            startTime.toEpochMilli(),
            until.toEpochMilli());

    JsonArray klines = parse(request(instrument, url), instrument);
    ImmutableList.Builder<Observation> observations = ImmutableList.builder();
    CursorPosition next = since;
    try {
      for (JsonElement element : klines) {
        JsonArray kline = element.getAsJsonArray();
        Instant closeTime = Instant.ofEpochMilli(kline.get(CLOSE_TIME).getAsLong());
        if (!closeTime.isBefore(until)) {
          // Still forming at the as-of instant.
          continue;
        }
        Observation observation = toObservation(instrument, kline);
        observations.add(observation);
        next = CursorPosition.at(observation.timestamp());
      }
    } catch (IllegalStateException
        | IndexOutOfBoundsException
        | NumberFormatException
        | UnsupportedOperationException e) {
      throw new PermanentSourceException("Malformed Binance kline for " + instrument, e);
    }

    boolean hasMore = klines.size() == REQUEST_LIMIT;
    ImmutableList<Observation> page = observations.build();
    logger.atFine().log(
        "Fetched %d klines (%d complete) for %s from %s", klines.size(), page.size(), instrument, startTime);
    return FetchResult.create(page, next, hasMore && !page.isEmpty());
  }

  private String request(Instrument instrument, String url) throws SourceException {
    try {
      return httpClient.get(url, HEADERS);
    } catch (HttpStatusException e) {
      if (e.isRetryable()) {
        throw new TransientSourceException(
            String.format("Binance returned HTTP %d for %s", e.statusCode(), instrument), e);
      }
      throw new PermanentSourceException(
          String.format("Binance rejected request for %s with HTTP %d", instrument, e.statusCode()), e);
    } catch (IOException e) {
      throw new TransientSourceException("Binance request failed for " + instrument, e);
    }
  }

  private static JsonArray parse(String body, Instrument instrument) throws PermanentSourceException {
    try {
      JsonElement root = JsonParser.parseString(body);
      if (!root.isJsonArray()) {
        throw new PermanentSourceException("Unexpected Binance payload for " + instrument + ": " + body);
      }
      return root.getAsJsonArray();
    } catch (JsonParseException e) {
      throw new PermanentSourceException("Malformed Binance payload for " + instrument, e);
    }
  }

  private static Observation toObservation(Instrument instrument, JsonArray kline) {
    return Observation.builder()
        .setInstrument(instrument)
        .setTimestamp(Instant.ofEpochMilli(kline.get(OPEN_TIME).getAsLong()))
        .setOpen(kline.get(OPEN).getAsDouble())
        .setHigh(kline.get(HIGH).getAsDouble())
        .setLow(kline.get(LOW).getAsDouble())
        .setClose(kline.get(CLOSE).getAsDouble())
        .setVolume(kline.get(VOLUME).getAsDouble())
        .setSource(SOURCE_NAME)
        .setAttributes(
            ImmutableSortedMap.of(
                "num_trades", kline.get(NUM_TRADES).getAsDouble(),
                "quote_asset_volume", kline.get(QUOTE_ASSET_VOLUME).getAsDouble(),
                "taker_buy_base_volume", kline.get(TAKER_BUY_BASE_VOLUME).getAsDouble(),
                "taker_buy_quote_volume", kline.get(TAKER_BUY_QUOTE_VOLUME).getAsDouble()))
        .build();
  }
}
