package com.trading.adj.engine;

/** Thrown by {@code traverse} when the requested window is longer than the buffer. */
public final class WindowLengthTooLong extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int nrows;
    private final int windowLength;

    public WindowLengthTooLong(int nrows, int windowLength) {
        super("Can't construct a rolling window of length " + windowLength + " on an array of length " + nrows
                + ".");
        this.nrows = nrows;
        this.windowLength = windowLength;
    }

    public int nrows() {
        return nrows;
    }

    public int windowLength() {
        return windowLength;
    }
}
