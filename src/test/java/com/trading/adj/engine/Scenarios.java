package com.trading.adj.engine;

import com.trading.adj.adjustment.Adjustment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference 6x3 adjustment scenarios.
 *
 * Each scenario gives the schedule and, for every row k, the state the
 * buffer must be in once every adjustment keyed at or before k is applied.
 * The window starting at offset o with length w must equal
 * {@code stateAsOf[o + w - 1]} rows {@code [o, o + w)}.
 */
final class Scenarios {
    private Scenarios() {
    }

    static final int NROWS = 6;
    static final int NCOLS = 3;

    /** Builds an adjustment from (first_row, last_row, first_col, last_col, value). */
    interface Factory {
        Adjustment make(int firstRow, int lastRow, int firstCol, int lastCol, long value);
    }

    static final long[][] MULTIPLY_BASELINE = fill(1);

    static final long[][][] MULTIPLY_STATES = {
            fill(1),
            {
                    { 2, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 } },
            {
                    { 2, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 } },
            {
                    { 8, 1, 1 }, { 4, 3, 1 }, { 1, 3, 1 }, { 1, 1, 1 }, { 1, 1, 1 }, { 1, 1, 1 } },
            {
                    { 8, 1, 5 }, { 4, 3, 5 }, { 1, 3, 5 }, { 1, 1, 5 }, { 1, 1, 1 }, { 1, 1, 1 } },
            {
                    { 8, 6, 5 }, { 4, 18, 5 }, { 1, 18, 35 }, { 1, 6, 5 }, { 1, 6, 1 }, { 1, 1, 1 } },
    };

    static final long[][] OVERWRITE_BASELINE = fill(2);

    static final long[][][] OVERWRITE_STATES = {
            fill(2),
            {
                    { 1, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 } },
            {
                    { 1, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 } },
            {
                    { 4, 2, 2 }, { 4, 3, 2 }, { 2, 3, 2 }, { 2, 2, 2 }, { 2, 2, 2 }, { 2, 2, 2 } },
            {
                    { 4, 2, 5 }, { 4, 3, 5 }, { 2, 3, 5 }, { 2, 2, 5 }, { 2, 2, 2 }, { 2, 2, 2 } },
            {
                    { 4, 6, 5 }, { 4, 6, 5 }, { 2, 6, 7 }, { 2, 6, 5 }, { 2, 6, 2 }, { 2, 2, 2 } },
    };

    /**
     * Row 1: (0,0) by 2. Row 3: rows 1-2 col 1 by 3, then rows 0-1 col 0 by 4.
     * Row 4: rows 0-3 col 2 by 5. Row 5: rows 0-4 col 1 by 6, then (2,2) by 7.
     * Row 2 has no entry.
     */
    static Map<Integer, List<Adjustment>> schedule(Factory f) {
        Map<Integer, List<Adjustment>> adjustments = new LinkedHashMap<>();
        adjustments.put(1, List.of(f.make(0, 0, 0, 0, 2)));
        adjustments.put(3, List.of(f.make(1, 2, 1, 1, 3), f.make(0, 1, 0, 0, 4)));
        adjustments.put(4, List.of(f.make(0, 3, 2, 2, 5)));
        adjustments.put(5, List.of(f.make(0, 4, 1, 1, 6), f.make(2, 2, 2, 2, 7)));
        return adjustments;
    }

    /** Expected windows of length {@code w}, in emission order. */
    static List<long[][]> expectedWindows(long[][][] states, int w) {
        List<long[][]> out = new ArrayList<>();
        for (int o = 0; o + w <= NROWS; o++) {
            long[][] state = states[o + w - 1];
            long[][] window = new long[w][];
            for (int r = 0; r < w; r++)
                window[r] = state[o + r].clone();
            out.add(window);
        }
        return out;
    }

    static long[][] fill(long v) {
        long[][] out = new long[NROWS][NCOLS];
        for (long[] row : out)
            java.util.Arrays.fill(row, v);
        return out;
    }

    static double[][] toDoubles(long[][] m) {
        double[][] out = new double[m.length][];
        for (int r = 0; r < m.length; r++) {
            out[r] = new double[m[r].length];
            for (int c = 0; c < m[r].length; c++)
                out[r][c] = m[r][c];
        }
        return out;
    }

    static String[][] toStrings(long[][] m) {
        String[][] out = new String[m.length][];
        for (int r = 0; r < m.length; r++) {
            out[r] = new String[m[r].length];
            for (int c = 0; c < m[r].length; c++)
                out[r][c] = Long.toString(m[r][c]);
        }
        return out;
    }

    /** 0, 1, 2, ... laid out in {@code rows x cols}. */
    static long[][] arange(int rows, int cols) {
        long[][] out = new long[rows][cols];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                out[r][c] = (long) r * cols + c;
        return out;
    }
}
