package com.trading.adj.array;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.mask.Mask;
import com.trading.adj.util.ArrayFormat;
import com.trading.adj.util.MissingValues;
import com.trading.adj.util.Regions;

import java.util.Arrays;

/**
 * Mutable 2-D buffer of 64-bit integers, stored row-major in a {@code long[]}.
 *
 * Backs two dtypes: plain {@link DType#INT64} counts and
 * {@link DType#DATETIME64} nanosecond timestamps. The dtype only changes
 * formatting and which adjustments may target the array.
 */
public final class Int64Array implements ColumnarArray<Int64Window> {
    private final DType dtype;
    private final long[] data;
    private final int rows;
    private final int cols;

    Int64Array(DType dtype, long[] data, int rows, int cols) {
        if (dtype != DType.INT64 && dtype != DType.DATETIME64)
            throw new IllegalArgumentException("Int64Array cannot hold dtype " + dtype.typeName());
        this.dtype = dtype;
        this.data = data;
        this.rows = rows;
        this.cols = cols;
    }

    /** Copies a rectangular matrix of int64 values. */
    public static Int64Array of(long[][] matrix) {
        return copyOf(DType.INT64, matrix);
    }

    /** Copies a rectangular matrix of epoch-nanosecond timestamps. */
    public static Int64Array datetimes(long[][] matrix) {
        return copyOf(DType.DATETIME64, matrix);
    }

    public static Int64Array fromRowMajor(DType dtype, int rows, int cols, long[] values) {
        if (values.length != rows * cols)
            throw new IllegalArgumentException(
                    "Length mismatch: expected " + (rows * cols) + ", got " + values.length);
        return new Int64Array(dtype, values.clone(), rows, cols);
    }

    public static Int64Array full(DType dtype, int rows, int cols, long value) {
        long[] flat = new long[rows * cols];
        Arrays.fill(flat, value);
        return new Int64Array(dtype, flat, rows, cols);
    }

    private static Int64Array copyOf(DType dtype, long[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        long[] flat = new long[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (matrix[r].length != cols)
                throw new IllegalArgumentException(
                        "Ragged input: row " + r + " has " + matrix[r].length + " columns, expected " + cols);
            System.arraycopy(matrix[r], 0, flat, r * cols, cols);
        }
        return new Int64Array(dtype, flat, rows, cols);
    }

    @Override
    public DType dtype() {
        return dtype;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int cols() {
        return cols;
    }

    public long valueAt(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + col + ") out of bounds for shape " + shapeString());
        return data[row * cols + col];
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    /** Overwrites every cell of the inclusive region with {@code value}. */
    public void fill(int firstRow, int lastRow, int firstCol, int lastCol, long value) {
        Regions.check(firstRow, lastRow, firstCol, lastCol, rows, cols);
        for (int r = firstRow; r <= lastRow; r++) {
            int base = r * cols;
            Arrays.fill(data, base + firstCol, base + lastCol + 1, value);
        }
    }

    @Override
    public Int64Array copy() {
        return new Int64Array(dtype, data.clone(), rows, cols);
    }

    @Override
    public void fillMissing(Mask mask, Object missingValue) {
        long missing = (Long) MissingValues.coerce(dtype, missingValue);
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                if (!mask.isValid(r, c))
                    data[r * cols + c] = missing;
    }

    @Override
    public Int64Window window(int startRow, int length) {
        Regions.checkRowRange(startRow, length, rows);
        return new Int64Window(dtype, data, startRow, length, cols);
    }

    public long[][] toMatrix() {
        long[][] out = new long[rows][];
        for (int r = 0; r < rows; r++)
            out[r] = Arrays.copyOfRange(data, r * cols, (r + 1) * cols);
        return out;
    }

    @Override
    public String format() {
        String[] cells = new String[data.length];
        if (dtype == DType.DATETIME64) {
            for (int i = 0; i < data.length; i++)
                cells[i] = ArrayFormat.datetimeCell(data[i]);
            return ArrayFormat.grid("array(", cells, rows, cols, ", dtype='datetime64[ns]'", false);
        }
        for (int i = 0; i < data.length; i++)
            cells[i] = Long.toString(data[i]);
        return ArrayFormat.grid("array(", cells, rows, cols, "", false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Int64Array other))
            return false;
        return dtype == other.dtype && rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * dtype.hashCode() + rows) + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return format();
    }
}
