package com.verlumen.marketpipe.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.inject.Inject;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.time.TimeFrame;
import com.verlumen.marketpipe.time.TradingCalendar;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Generates synthetic bars so a dry run exercises the whole pipeline without network access.
 *
 * <p>Every bar is a pure function of the instrument and its timestamp, so re-fetching a window
 * returns identical observations.
 */
final class DryRunSourceAdapter implements SourceAdapter {
  static final String SOURCE_NAME = "dryrun";
  private static final int PAGE_SIZE = 500;
  private static final Duration EQUITY_HISTORY = Duration.ofDays(150);

  private final MarketDataConfig config;

  @Inject
  DryRunSourceAdapter(MarketDataConfig config) {
    this.config = config;
  }

  @Override
  public String sourceName() {
    return SOURCE_NAME;
  }

  @Override
  public SourceCapabilities capabilities() {
    return SourceCapabilities.create(
        PaginationScheme.TIME_WINDOW, 1_000.0, /* supportsBackfill= */ true, PAGE_SIZE);
  }

  @Override
  public boolean supports(Instrument instrument) {
    return true;
  }

  @Override
  public FetchResult fetch(Instrument instrument, CursorPosition since, Instant until) {
    TimeFrame timeFrame = timeFrame(instrument);
    TradingCalendar calendar = instrument.assetClass().calendar();
    Duration step = timeFrame.getDuration();
    Instant origin = origin(instrument);
    Instant next =
        since.lastTimestamp()
            .map(last -> calendar.next(last, timeFrame))
            .orElseGet(() -> firstBar(instrument, until));
    double basePrice = basePrice(instrument);

    ImmutableList.Builder<Observation> page = ImmutableList.builder();
    int count = 0;
    CursorPosition position = since;
    // Only bars that have closed by the as-of instant.
    while (count < PAGE_SIZE && !next.plus(step).isAfter(until)) {
      long index = Duration.between(origin, next).dividedBy(step);
      double close = basePrice * (1.0 + 0.05 * Math.sin(index / 24.0)) + index * 0.01;
      double open = close - 0.5 * Math.cos(index / 7.0);
      page.add(
          Observation.builder()
              .setInstrument(instrument)
              .setTimestamp(next)
              .setOpen(open)
              .setHigh(Math.max(open, close) + 0.25)
              .setLow(Math.min(open, close) - 0.25)
              .setClose(close)
              .setVolume(1_000.0 + (index % 17) * 10.0)
              .setSource(SOURCE_NAME)
              .build());
      position = CursorPosition.at(next);
      next = calendar.next(next, timeFrame);
      count++;
    }
    boolean hasMore = count == PAGE_SIZE && !next.plus(step).isAfter(until);
    return FetchResult.create(page.build(), position, hasMore);
  }

  /** Equities get weekday daily bars like the equity provider serves; crypto the configured interval. */
  private TimeFrame timeFrame(Instrument instrument) {
    return instrument.assetClass() == AssetClass.EQUITY ? TimeFrame.ONE_DAY : config.timeFrame();
  }

  private Instant origin(Instrument instrument) {
    return instrument.assetClass() == AssetClass.EQUITY ? Instant.EPOCH : config.backfillStart();
  }

  private Instant firstBar(Instrument instrument, Instant until) {
    if (instrument.assetClass() != AssetClass.EQUITY) {
      return config.backfillStart();
    }
    // Enough daily history for the slowest daily feature without paging through years.
    Instant start = until.minus(EQUITY_HISTORY);
    if (config.backfillStart().isBefore(start)) {
      start = config.backfillStart();
    }
    Instant day = start.truncatedTo(ChronoUnit.DAYS);
    return AssetClass.EQUITY.calendar().next(day.minus(Duration.ofDays(1)), TimeFrame.ONE_DAY);
  }

  private static double basePrice(Instrument instrument) {
    int bucket = Hashing.murmur3_32_fixed().hashString(instrument.symbol(), StandardCharsets.UTF_8).asInt();
    return 50.0 + Math.floorMod(bucket, 200);
  }
}
