package com.verlumen.marketpipe.time;

import java.time.Duration;
import java.util.Arrays;

/** Bar intervals understood by the source adapters and feature sets. */
public enum TimeFrame {
    ONE_MIN("1m", Duration.ofMinutes(1)),
    FIVE_MIN("5m", Duration.ofMinutes(5)),
    FIFTEEN_MIN("15m", Duration.ofMinutes(15)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    FOUR_HOUR("4h", Duration.ofHours(4)),
    ONE_DAY("1d", Duration.ofDays(1));

    private final String label;
    private final Duration duration;

    TimeFrame(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    /** Interval label, identical to the one Binance uses for klines. */
    public String getLabel() {
        return label;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isIntraday() {
        return duration.compareTo(ONE_DAY.duration) < 0;
    }

    public static TimeFrame fromLabel(String label) {
        return Arrays.stream(values())
                .filter(tf -> tf.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No TimeFrame for label " + label));
    }
}
