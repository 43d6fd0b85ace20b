package com.trading.adj.util;

/**
 * Bounds checks for rectangular regions given as inclusive row and column
 * ranges.
 */
public final class Regions {
    private Regions() {
        // Utility class
    }

    /**
     * @throws IndexOutOfBoundsException if the region is empty, inverted, or
     *                                   reaches outside a {@code rows x cols} buffer.
     */
    public static void check(int firstRow, int lastRow, int firstCol, int lastCol, int rows, int cols) {
        if (firstRow < 0 || firstCol < 0 || firstRow > lastRow || firstCol > lastCol
                || lastRow >= rows || lastCol >= cols) {
            throw new IndexOutOfBoundsException(
                    "Region rows [" + firstRow + ", " + lastRow + "] cols [" + firstCol + ", " + lastCol
                            + "] out of bounds for shape (" + rows + ", " + cols + ")");
        }
    }

    /**
     * @throws IndexOutOfBoundsException if {@code [startRow, startRow + length)}
     *                                   is not within {@code [0, rows)}.
     */
    public static void checkRowRange(int startRow, int length, int rows) {
        if (startRow < 0 || length < 0 || startRow + length > rows) {
            throw new IndexOutOfBoundsException(
                    "Rows [" + startRow + ", " + (startRow + length) + ") out of bounds for " + rows + " rows");
        }
    }
}
