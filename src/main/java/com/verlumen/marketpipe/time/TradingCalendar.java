package com.verlumen.marketpipe.time;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Defines which periods a market is expected to produce a bar for.
 *
 * <p>Feature windows are measured in expected periods, so a weekend is not a gap for a daily
 * equity series while a missing minute is a gap for a continuously traded crypto pair.
 */
public interface TradingCalendar {
  /** The expected period that follows {@code instant}. */
  Instant next(Instant instant, TimeFrame timeFrame);

  /** The expected period that precedes {@code instant}. */
  Instant previous(Instant instant, TimeFrame timeFrame);

  /** Steps back {@code periods} expected periods from {@code instant}. */
  default Instant stepBack(Instant instant, TimeFrame timeFrame, int periods) {
    checkArgument(periods >= 0, "periods must be non-negative: %s", periods);
    Instant current = instant;
    for (int i = 0; i < periods; i++) {
      current = previous(current, timeFrame);
    }
    return current;
  }

  /** Markets that trade around the clock. */
  static TradingCalendar continuous() {
    return Continuous.INSTANCE;
  }

  /** Markets that trade Monday to Friday; intraday bars are treated as continuous on those days. */
  static TradingCalendar weekdays() {
    return Weekdays.INSTANCE;
  }

  enum Continuous implements TradingCalendar {
    INSTANCE;

    @Override
    public Instant next(Instant instant, TimeFrame timeFrame) {
      return instant.plus(timeFrame.getDuration());
    }

    @Override
    public Instant previous(Instant instant, TimeFrame timeFrame) {
      return instant.minus(timeFrame.getDuration());
    }
  }

  enum Weekdays implements TradingCalendar {
    INSTANCE;

    @Override
    public Instant next(Instant instant, TimeFrame timeFrame) {
      Instant candidate = instant.plus(timeFrame.getDuration());
      while (isWeekend(candidate)) {
        candidate = candidate.plus(timeFrame.getDuration());
      }
      return candidate;
    }

    @Override
    public Instant previous(Instant instant, TimeFrame timeFrame) {
      Instant candidate = instant.minus(timeFrame.getDuration());
      while (isWeekend(candidate)) {
        candidate = candidate.minus(timeFrame.getDuration());
      }
      return candidate;
    }

    private static boolean isWeekend(Instant instant) {
      DayOfWeek day = instant.atOffset(ZoneOffset.UTC).getDayOfWeek();
      return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
  }
}
