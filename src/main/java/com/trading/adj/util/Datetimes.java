package com.trading.adj.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Conversions for datetime64[ns] cells: nanoseconds since the epoch held in a
 * long, with {@link #NAT} as the not-a-time marker.
 */
public final class Datetimes {
    private Datetimes() {
        // Utility class
    }

    /** Not-a-time. Same bit pattern numpy uses for NaT. */
    public static final long NAT = Long.MIN_VALUE;

    private static final DateTimeFormatter FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS")
            .withZone(ZoneOffset.UTC);

    public static boolean isNaT(long nanos) {
        return nanos == NAT;
    }

    /**
     * @throws ArithmeticException if the instant does not fit in 64-bit nanoseconds.
     */
    public static long toNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    public static Instant toInstant(long nanos) {
        if (isNaT(nanos))
            throw new IllegalArgumentException("NaT has no instant");
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    /** Formats as {@code 2014-01-02T00:00:00.000000000}, or {@code NaT}. */
    public static String format(long nanos) {
        return isNaT(nanos) ? "NaT" : FORMAT.format(toInstant(nanos));
    }

    /** Parses an ISO-8601 instant, or {@code NaT}. */
    public static long parse(String text) {
        if ("NaT".equalsIgnoreCase(text))
            return NAT;
        return toNanos(Instant.parse(text));
    }
}
