package com.trading.adj.api;

/**
 * Logical element type of a columnar array.
 *
 * The set is closed: every buffer the engine handles is either a primitive
 * numeric array ({@link #FLOAT64}, {@link #INT64}, {@link #DATETIME64}) or a
 * label-encoded string array ({@link #LABEL}).
 */
public enum DType {
    FLOAT64("float64"),
    INT64("int64"),
    /** Nanoseconds since the epoch, stored as a long. */
    DATETIME64("datetime64[ns]"),
    LABEL("object");

    private final String typeName;

    DType(String typeName) {
        this.typeName = typeName;
    }

    /** Returns the conventional name of this dtype, e.g. {@code float64}. */
    public String typeName() {
        return typeName;
    }

    public boolean isNumeric() {
        return this != LABEL;
    }

    public static DType fromString(String text) {
        for (DType t : values()) {
            if (t.typeName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        if ("datetime64".equalsIgnoreCase(text))
            return DATETIME64;
        if ("str".equalsIgnoreCase(text) || "string".equalsIgnoreCase(text))
            return LABEL;
        throw new IllegalArgumentException("Unknown dtype: " + text);
    }
}
