package com.verlumen.marketpipe.marketdata;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.marketpipe.http.HttpClient;
import com.verlumen.marketpipe.http.HttpStatusException;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.time.Timestamps;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Daily equity bars from Alpha Vantage's {@code TIME_SERIES_DAILY_ADJUSTED} function.
 *
 * <p>The provider returns the whole history in one payload, so this adapter pages on its side: each
 * call serves at most {@code alphaVantagePageSize} days after the page token (the ISO date of the
 * last day served) and hands back a new token.
 */
final class AlphaVantageDailyAdapter implements SourceAdapter {
  static final String SOURCE_NAME = "alphavantage";

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String SERIES_KEY = "Time Series (Daily)";
  // Free tier: 5 calls per minute.
  private static final double PERMITS_PER_SECOND = 5.0 / 60.0;
  private static final ImmutableMap<String, String> HEADERS =
      ImmutableMap.of("Accept", "application/json");

  private final HttpClient httpClient;
  private final MarketDataConfig config;

  @Inject
  AlphaVantageDailyAdapter(HttpClient httpClient, MarketDataConfig config) {
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
        PaginationScheme.PAGE_TOKEN,
        PERMITS_PER_SECOND,
        /* supportsBackfill= */ true,
        config.alphaVantagePageSize());
  }

  @Override
  public boolean supports(Instrument instrument) {
    return instrument.assetClass() == AssetClass.EQUITY;
  }

  @Override
  public FetchResult fetch(Instrument instrument, CursorPosition since, Instant until)
      throws SourceException {
    if (config.alphaVantageApiKey().isBlank()) {
      throw new PermanentSourceException("No Alpha Vantage API key configured");
    }

    Optional<Instant> after =
        since.pageToken().map(Timestamps::startOfDayUtc).or(since::lastTimestamp);
    String url =
        String.format(
            "%s?function=TIME_SERIES_DAILY_ADJUSTED&symbol=%s&outputsize=full&datatype=json&apikey=%s",
            config.alphaVantageBaseUrl(), instrument.symbol(), config.alphaVantageApiKey());

    JsonObject series = seriesOf(instrument, request(instrument, url));
    ImmutableSortedMap<Instant, JsonObject> days = parseDays(instrument, series);

    ImmutableList<Map.Entry<Instant, JsonObject>> pending =
        days.entrySet().stream()
            .filter(day -> isAfterCursor(day.getKey(), after))
            // A day is complete once the whole day lies before the as-of instant.
            .filter(day -> !day.getKey().plus(Duration.ofDays(1)).isAfter(until))
            .collect(toImmutableList());

    ImmutableList<Observation> page;
    try {
      page =
          pending.stream()
              .limit(config.alphaVantagePageSize())
              .map(day -> toObservation(instrument, day.getKey(), day.getValue()))
              .collect(toImmutableList());
    } catch (NullPointerException | IllegalStateException | NumberFormatException e) {
      throw new PermanentSourceException("Malformed daily bar for " + instrument, e);
    }
    if (page.isEmpty()) {
      return FetchResult.empty(since);
    }

    Instant last = page.get(page.size() - 1).timestamp();
    logger.atFine().log(
        "Serving %d of %d pending days for %s", page.size(), pending.size(), instrument);
    return FetchResult.create(
        page, CursorPosition.at(last, Timestamps.toDayBucket(last)), pending.size() > page.size());
  }

  private boolean isAfterCursor(Instant day, Optional<Instant> after) {
    return after.map(day::isAfter).orElse(!day.isBefore(config.backfillStart()));
  }

  private String request(Instrument instrument, String url) throws SourceException {
    try {
      return httpClient.get(url, HEADERS);
    } catch (HttpStatusException e) {
      if (e.isRetryable()) {
        throw new TransientSourceException(
            String.format("Alpha Vantage returned HTTP %d for %s", e.statusCode(), instrument), e);
      }
      throw new PermanentSourceException(
          String.format("Alpha Vantage rejected request for %s with HTTP %d", instrument, e.statusCode()),
          e);
    } catch (IOException e) {
      throw new TransientSourceException("Alpha Vantage request failed for " + instrument, e);
    }
  }

  private static JsonObject seriesOf(Instrument instrument, String body) throws SourceException {
    JsonObject root;
    try {
      JsonElement parsed = JsonParser.parseString(body);
      if (!parsed.isJsonObject()) {
        throw new PermanentSourceException("Unexpected Alpha Vantage payload for " + instrument);
      }
      root = parsed.getAsJsonObject();
    } catch (JsonParseException e) {
      throw new PermanentSourceException("Malformed Alpha Vantage payload for " + instrument, e);
    }

    if (root.has("Error Message")) {
      throw new PermanentSourceException(
          String.format("Alpha Vantage rejected %s: %s", instrument, root.get("Error Message").getAsString()));
    }
    // Throttled responses come back as 200 with a note instead of data.
    for (String throttleKey : ImmutableList.of("Note", "Information")) {
      if (root.has(throttleKey)) {
        throw new TransientSourceException(
            String.format("Alpha Vantage throttled %s: %s", instrument, root.get(throttleKey).getAsString()));
      }
    }
    if (!root.has(SERIES_KEY) || !root.get(SERIES_KEY).isJsonObject()) {
      throw new PermanentSourceException("Unexpected response for " + instrument + ": " + body);
    }
    return root.getAsJsonObject(SERIES_KEY);
  }

  private static ImmutableSortedMap<Instant, JsonObject> parseDays(Instrument instrument, JsonObject series)
      throws PermanentSourceException {
    try {
      ImmutableSortedMap.Builder<Instant, JsonObject> days = ImmutableSortedMap.naturalOrder();
      for (Map.Entry<String, JsonElement> day : series.entrySet()) {
        days.put(Timestamps.startOfDayUtc(day.getKey()), day.getValue().getAsJsonObject());
      }
      return days.buildOrThrow();
    } catch (RuntimeException e) {
      throw new PermanentSourceException("Malformed daily series for " + instrument, e);
    }
  }

  private static Observation toObservation(Instrument instrument, Instant day, JsonObject values) {
    return Observation.builder()
        .setInstrument(instrument)
        .setTimestamp(day)
        .setOpen(values.get("1. open").getAsDouble())
        .setHigh(values.get("2. high").getAsDouble())
        .setLow(values.get("3. low").getAsDouble())
        .setClose(values.get("4. close").getAsDouble())
        .setVolume(values.get("6. volume").getAsDouble())
        .setSource(SOURCE_NAME)
        .setAttributes(
            ImmutableSortedMap.of("adjusted_close", values.get("5. adjusted close").getAsDouble()))
        .build();
  }
}
