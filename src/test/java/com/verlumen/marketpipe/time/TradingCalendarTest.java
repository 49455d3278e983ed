package com.verlumen.marketpipe.time;

import static com.google.common.truth.Truth.assertThat;

import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TradingCalendarTest {
  // 2024-01-05 is a Friday.
  private static final Instant FRIDAY = Instant.parse("2024-01-05T00:00:00Z");
  private static final Instant MONDAY = Instant.parse("2024-01-08T00:00:00Z");

  @Test
  public void continuous_nextMinute() {
    assertThat(TradingCalendar.continuous().next(FRIDAY, TimeFrame.ONE_MIN))
        .isEqualTo(Instant.parse("2024-01-05T00:01:00Z"));
  }

  @Test
  public void continuous_dailySpansWeekend() {
    assertThat(TradingCalendar.continuous().next(FRIDAY, TimeFrame.ONE_DAY))
        .isEqualTo(Instant.parse("2024-01-06T00:00:00Z"));
  }

  @Test
  public void weekdays_nextDayAfterFriday_isMonday() {
    assertThat(TradingCalendar.weekdays().next(FRIDAY, TimeFrame.ONE_DAY)).isEqualTo(MONDAY);
  }

  @Test
  public void weekdays_previousDayBeforeMonday_isFriday() {
    assertThat(TradingCalendar.weekdays().previous(MONDAY, TimeFrame.ONE_DAY)).isEqualTo(FRIDAY);
  }

  @Test
  public void weekdays_stepBackFiveDays_isPreviousWeek() {
    // Act
    Instant fiveBack = TradingCalendar.weekdays().stepBack(MONDAY, TimeFrame.ONE_DAY, 5);

    // Assert
    assertThat(fiveBack).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
  }

  @Test
  public void stepBack_zeroPeriods_returnsSameInstant() {
    assertThat(TradingCalendar.continuous().stepBack(FRIDAY, TimeFrame.ONE_HOUR, 0)).isEqualTo(FRIDAY);
  }
}
