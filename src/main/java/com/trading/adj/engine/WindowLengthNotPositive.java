package com.trading.adj.engine;

/** Thrown by {@code traverse} when the requested window length is zero or negative. */
public final class WindowLengthNotPositive extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int windowLength;

    public WindowLengthNotPositive(int windowLength) {
        super("Expected a window_length greater than 0, got " + windowLength + ".");
        this.windowLength = windowLength;
    }

    public int windowLength() {
        return windowLength;
    }
}
