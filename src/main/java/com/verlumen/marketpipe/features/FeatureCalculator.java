package com.verlumen.marketpipe.features;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.math.Stats;
import com.verlumen.marketpipe.marketdata.Observation;
import com.verlumen.marketpipe.time.TimeFrame;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBar;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighPriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowPriceIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.num.Num;

/** Evaluates the features of one {@link FeatureSet} against a {@link RollingWindow}. */
final class FeatureCalculator {
  private final FeatureSet featureSet;

  FeatureCalculator(FeatureSet featureSet) {
    this.featureSet = featureSet;
  }

  /**
   * Values of every feature computable at the window's latest timestamp, or empty if none is.
   *
   * @throws FeatureComputationException if a window the features need holds an unusable bar
   */
  ImmutableSortedMap<String, Double> compute(RollingWindow window)
      throws FeatureComputationException {
    ImmutableSortedMap.Builder<String, Double> values = ImmutableSortedMap.naturalOrder();
    for (FeatureDefinition definition : featureSet.definitions()) {
      OptionalDouble value = compute(definition, window);
      if (value.isPresent()) {
        values.put(definition.name(), value.getAsDouble());
      }
    }
    return values.buildOrThrow();
  }

  private OptionalDouble compute(FeatureDefinition definition, RollingWindow window)
      throws FeatureComputationException {
    Optional<ImmutableList<Observation>> points =
        definition.gapPolicy() == GapPolicy.GAP_SENSITIVE
            ? window.contiguousTail(definition.pointsNeeded())
            : window.coveringTail(definition.pointsNeeded());
    if (points.isEmpty()) {
      return OptionalDouble.empty();
    }
    checkUsable(definition, points.get());
    double value = evaluate(definition.kind(), points.get());
    if (!Double.isFinite(value)) {
      throw new FeatureComputationException(
          window.latest(), String.format("%s evaluated to %s", definition.name(), value));
    }
    return OptionalDouble.of(value);
  }

  private double evaluate(FeatureKind kind, ImmutableList<Observation> points) {
    Observation first = points.get(0);
    Observation last = points.get(points.size() - 1);
    switch (kind) {
      case MOMENTUM:
        return last.close() - first.close();
      case SIMPLE_RETURN:
        return last.close() / first.close() - 1;
      case LOG_RETURN:
        return Math.log(last.close() / first.close());
      case REALIZED_VOLATILITY:
        return Stats.of(logReturns(points)).sampleStandardDeviation();
      default:
        return aggregate(kind, points);
    }
  }

  /** Window aggregates, evaluated with ta4j over a series holding exactly the window. */
  private double aggregate(FeatureKind kind, ImmutableList<Observation> points) {
    BarSeries series = toBarSeries(points);
    int barCount = points.size();
    Indicator<Num> indicator;
    switch (kind) {
      case ROLLING_MEAN:
        indicator = new SMAIndicator(new ClosePriceIndicator(series), barCount);
        break;
      case ROLLING_STDDEV:
        indicator = new StandardDeviationIndicator(new ClosePriceIndicator(series), barCount);
        break;
      case ROLLING_HIGH:
        indicator = new HighestValueIndicator(new HighPriceIndicator(series), barCount);
        break;
      case ROLLING_LOW:
        indicator = new LowestValueIndicator(new LowPriceIndicator(series), barCount);
        break;
      case VOLUME_SUM:
        indicator = new VolumeIndicator(series, barCount);
        break;
      default:
        throw new IllegalArgumentException("Not an aggregate: " + kind);
    }
    return indicator.getValue(series.getEndIndex()).doubleValue();
  }

  private BarSeries toBarSeries(List<Observation> points) {
    BarSeries series = new BaseBarSeries();
    TimeFrame timeFrame = featureSet.timeFrame();
    for (Observation point : points) {
      series.addBar(
          new BaseBar(
              timeFrame.getDuration(),
              point.timestamp().plus(timeFrame.getDuration()).atZone(ZoneOffset.UTC),
              point.open(),
              point.high(),
              point.low(),
              point.close(),
              point.volume()));
    }
    return series;
  }

  private static double[] logReturns(List<Observation> points) {
    double[] returns = new double[points.size() - 1];
    for (int i = 1; i < points.size(); i++) {
      returns[i - 1] = Math.log(points.get(i).close() / points.get(i - 1).close());
    }
    return returns;
  }

  private static void checkUsable(FeatureDefinition definition, List<Observation> points)
      throws FeatureComputationException {
    for (Observation point : points) {
      String problem = problemWith(point);
      if (problem != null) {
        throw new FeatureComputationException(
            points.get(points.size() - 1).timestamp(),
            String.format("%s: bar at %s %s", definition.name(), point.timestamp(), problem));
      }
    }
  }

  private static String problemWith(Observation point) {
    double[] prices = {point.open(), point.high(), point.low(), point.close()};
    for (double price : prices) {
      if (!Double.isFinite(price) || price <= 0) {
        return "has a non-positive or non-finite price";
      }
    }
    if (point.high() < point.low()) {
      return "has high below low";
    }
    if (!Double.isFinite(point.volume()) || point.volume() < 0) {
      return "has an invalid volume";
    }
    return null;
  }
}
