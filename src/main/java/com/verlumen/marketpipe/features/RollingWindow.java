package com.verlumen.marketpipe.features;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.time.TimeFrame;
import com.verlumen.marketpipe.time.TradingCalendar;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Trailing observations of one instrument, fed in ascending timestamp order.
 *
 * <p>Holds every pushed observation within {@code horizonPeriods} expected periods of the latest
 * one and nothing older, so its contents depend only on the data and never on where a computation
 * started. One instance belongs to one computation; it is not thread safe.
 */
final class RollingWindow {
  private final TradingCalendar calendar;
  private final TimeFrame timeFrame;
  private final int horizonPeriods;
  private final Deque<Observation> points = new ArrayDeque<>();

  RollingWindow(TradingCalendar calendar, TimeFrame timeFrame, int horizonPeriods) {
    this.calendar = calendar;
    this.timeFrame = timeFrame;
    this.horizonPeriods = horizonPeriods;
  }

  void push(Observation observation) {
    checkState(
        points.isEmpty() || observation.timestamp().isAfter(points.peekLast().timestamp()),
        "Observations must be pushed in ascending order: %s after %s",
        observation.timestamp(),
        points.isEmpty() ? null : points.peekLast().timestamp());
    points.addLast(observation);
    Instant oldest = calendar.stepBack(observation.timestamp(), timeFrame, horizonPeriods);
    while (points.peekFirst().timestamp().isBefore(oldest)) {
      points.removeFirst();
    }
  }

  Instant latest() {
    checkState(!points.isEmpty(), "Window is empty");
    return points.peekLast().timestamp();
  }

  /**
   * The last {@code count} observations if they occupy consecutive expected periods ending at the
   * latest one.
   */
  Optional<ImmutableList<Observation>> contiguousTail(int count) {
    if (points.size() < count) {
      return Optional.empty();
    }
    Observation[] tail = new Observation[count];
    Iterator<Observation> newestFirst = points.descendingIterator();
    for (int i = count - 1; i >= 0; i--) {
      tail[i] = newestFirst.next();
      if (i < count - 1
          && !calendar.next(tail[i].timestamp(), timeFrame).equals(tail[i + 1].timestamp())) {
        return Optional.empty();
      }
    }
    return Optional.of(ImmutableList.copyOf(tail));
  }

  /**
   * Observations inside the last {@code periods} expected periods, provided history reaches back
   * to the start of that span. History counts only within {@code 2 * periods} periods.
   */
  Optional<ImmutableList<Observation>> coveringTail(int periods) {
    Instant latest = latest();
    Instant windowStart = calendar.stepBack(latest, timeFrame, periods - 1);
    Instant searchStart = calendar.stepBack(latest, timeFrame, 2 * periods);
    boolean anchored =
        points.stream()
            .map(Observation::timestamp)
            .anyMatch(t -> !t.isBefore(searchStart) && !t.isAfter(windowStart));
    if (!anchored) {
      return Optional.empty();
    }
    return Optional.of(
        points.stream()
            .filter(point -> !point.timestamp().isBefore(windowStart))
            .collect(ImmutableList.toImmutableList()));
  }
}
