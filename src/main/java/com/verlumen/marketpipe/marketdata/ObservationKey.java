package com.verlumen.marketpipe.marketdata;

import com.google.auto.value.AutoValue;
import com.verlumen.marketpipe.instruments.Instrument;
import java.time.Instant;

/** Identity of a raw bar: at most one original observation exists per key. */
@AutoValue
public abstract class ObservationKey {
    public static ObservationKey create(Instrument instrument, Instant timestamp, String source) {
        return new AutoValue_ObservationKey(instrument, timestamp, source);
    }

    public abstract Instrument instrument();
    public abstract Instant timestamp();
    public abstract String source();
}
