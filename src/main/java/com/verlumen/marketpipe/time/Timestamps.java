package com.verlumen.marketpipe.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Utility methods for the UTC time conversions used by partitioned storage and adapters. */
public final class Timestamps {
    private static final DateTimeFormatter DAY_BUCKET = DateTimeFormatter.ISO_LOCAL_DATE;

    /** Day bucket of an instant, e.g. {@code 2024-03-01}. Buckets sort lexicographically. */
    public static String toDayBucket(Instant instant) {
        return DAY_BUCKET.format(instant.atOffset(ZoneOffset.UTC));
    }

    /** Parse an ISO date such as {@code 2017-08-01} as midnight UTC. */
    public static Instant startOfDayUtc(String isoDate) {
        return LocalDate.parse(isoDate, DAY_BUCKET).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** Parse either an ISO instant or an ISO date. */
    public static Instant parseInstantOrDate(String value) {
        return value.contains("T") ? Instant.parse(value) : startOfDayUtc(value);
    }

    private Timestamps() {} // Prevent instantiation
}
