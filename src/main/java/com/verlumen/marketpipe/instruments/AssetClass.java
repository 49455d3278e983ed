package com.verlumen.marketpipe.instruments;

import com.verlumen.marketpipe.time.TradingCalendar;

public enum AssetClass {
  EQUITY(TradingCalendar.weekdays()),
  CRYPTO(TradingCalendar.continuous());

  private final TradingCalendar calendar;

  AssetClass(TradingCalendar calendar) {
    this.calendar = calendar;
  }

  /** Calendar used to decide whether a missing period is a gap. */
  public TradingCalendar calendar() {
    return calendar;
  }

  public static AssetClass fromString(String name) {
    return AssetClass.valueOf(name.trim().toUpperCase());
  }
}
