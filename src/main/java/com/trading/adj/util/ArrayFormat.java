package com.trading.adj.util;

import java.util.Locale;

/**
 * Text rendering of 2-D buffers for diagnostics.
 *
 * <p>
 * Output mimics the familiar {@code array([[...]])} layout: one line per row,
 * cells right-aligned to a common width, continuation rows indented under the
 * first. Formatting is deterministic so dumps can be compared in tests.
 *
 * <p>
 * Allocates freely. Do <b>not</b> use on the traversal path.
 */
public final class ArrayFormat {
    private ArrayFormat() {
        // Utility class
    }

    /** Formats a float64 cell: {@code 3.}, {@code -0.}, {@code 0.5}, {@code nan}, {@code -inf}. */
    public static String float64Cell(double v) {
        if (Double.isNaN(v))
            return "nan";
        if (Double.isInfinite(v))
            return v > 0 ? "inf" : "-inf";
        if (v == Math.rint(v) && Math.abs(v) < 1e16) {
            String digits = (long) Math.abs(v) + ".";
            // sign bit, so -0.0 keeps its sign
            return Double.doubleToRawLongBits(v) < 0 ? "-" + digits : digits;
        }
        return Double.toString(v).toLowerCase(Locale.ROOT);
    }

    /** Formats a datetime64[ns] cell as a quoted ISO timestamp. */
    public static String datetimeCell(long nanos) {
        return "'" + Datetimes.format(nanos) + "'";
    }

    /** Formats a string cell, quoted. */
    public static String stringCell(String s) {
        return "'" + s.replace("'", "\\'") + "'";
    }

    /**
     * Lays out pre-formatted cells.
     *
     * @param prefix       leading text, e.g. {@code array(}
     * @param cells        row-major cell tokens
     * @param rows         number of rows
     * @param cols         number of columns
     * @param suffix       trailing text before the closing parenthesis, e.g.
     *                     {@code , dtype='datetime64[ns]'}
     * @param reserveSign  pad one extra column when no cell is negative, the way
     *                     floating point arrays reserve room for a sign
     */
    public static String grid(String prefix, String[] cells, int rows, int cols, String suffix,
            boolean reserveSign) {
        int width = 0;
        boolean anyNegative = false;
        for (String cell : cells) {
            width = Math.max(width, cell.length());
            anyNegative |= cell.startsWith("-");
        }
        if (reserveSign && !anyNegative && cells.length > 0)
            width++;

        StringBuilder sb = new StringBuilder(prefix.length() + cells.length * (width + 2) + rows * 16);
        sb.append(prefix).append('[');
        String indent = " ".repeat(prefix.length() + 1);
        for (int r = 0; r < rows; r++) {
            if (r > 0)
                sb.append(",\n").append(indent);
            sb.append('[');
            for (int c = 0; c < cols; c++) {
                if (c > 0)
                    sb.append(", ");
                String cell = cells[r * cols + c];
                for (int p = cell.length(); p < width; p++)
                    sb.append(' ');
                sb.append(cell);
            }
            sb.append(']');
        }
        return sb.append(']').append(suffix).append(')').toString();
    }
}
