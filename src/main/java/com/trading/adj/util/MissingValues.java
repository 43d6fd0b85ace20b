package com.trading.adj.util;

import com.trading.adj.api.DType;

import java.time.Instant;

/**
 * Missing-value sentinels per dtype.
 *
 * Missing values cross the API boxed; {@link #coerce(DType, Object)} turns a
 * caller-supplied value into the canonical box for the dtype ({@link Double},
 * {@link Long} or {@link String}) or rejects it.
 */
public final class MissingValues {
    private MissingValues() {
        // Utility class
    }

    /**
     * Default missing value for a dtype: NaN, NaT, or the empty string.
     *
     * @throws IllegalArgumentException for int64, which has no natural sentinel.
     */
    public static Object defaultFor(DType dtype) {
        return switch (dtype) {
            case FLOAT64 -> Double.NaN;
            case DATETIME64 -> Datetimes.NAT;
            case LABEL -> "";
            case INT64 -> throw new IllegalArgumentException(
                    "No default missing value for dtype " + dtype.typeName() + "; one must be supplied");
        };
    }

    /**
     * Converts a caller-supplied missing value to the canonical box for
     * {@code dtype}.
     *
     * @throws IllegalArgumentException if the value is not representable.
     */
    public static Object coerce(DType dtype, Object value) {
        switch (dtype) {
            case FLOAT64:
                if (value instanceof Number n)
                    return n.doubleValue();
                if (value instanceof String s && "nan".equalsIgnoreCase(s))
                    return Double.NaN;
                break;
            case INT64:
                if (value instanceof Number n && isIntegral(n))
                    return n.longValue();
                break;
            case DATETIME64:
                if (value instanceof Instant i)
                    return Datetimes.toNanos(i);
                if (value instanceof Number n && isIntegral(n))
                    return n.longValue();
                if (value instanceof String s && "NaT".equalsIgnoreCase(s))
                    return Datetimes.NAT;
                break;
            case LABEL:
                if (value instanceof String s)
                    return s;
                break;
        }
        throw new IllegalArgumentException(
                "Missing value " + value + " is not representable as dtype " + dtype.typeName());
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte)
            return true;
        double d = n.doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d)
                && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE;
    }
}
