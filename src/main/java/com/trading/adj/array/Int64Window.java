package com.trading.adj.array;

import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.DType;

import java.nio.LongBuffer;
import java.util.Arrays;

/**
 * Read-only int64 / datetime64[ns] window over a contiguous run of rows.
 */
public final class Int64Window implements ArrayWindow {
    private final DType dtype;
    private final long[] data;
    private final int startRow;
    private final int rows;
    private final int cols;

    Int64Window(DType dtype, long[] data, int startRow, int rows, int cols) {
        this.dtype = dtype;
        this.data = data;
        this.startRow = startRow;
        this.rows = rows;
        this.cols = cols;
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

    @Override
    public int startRow() {
        return startRow;
    }

    public long valueAt(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + col + ") out of bounds for window (" + rows + ", " + cols + ")");
        return data[(startRow + row) * cols + col];
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    /** Row-major read-only buffer over the window. */
    public LongBuffer buffer() {
        return LongBuffer.wrap(data, startRow * cols, rows * cols).slice().asReadOnlyBuffer();
    }

    public long[][] toMatrix() {
        long[][] out = new long[rows][];
        for (int r = 0; r < rows; r++) {
            int from = (startRow + r) * cols;
            out[r] = Arrays.copyOfRange(data, from, from + cols);
        }
        return out;
    }

    @Override
    public Int64Array copy() {
        return new Int64Array(dtype, Arrays.copyOfRange(data, startRow * cols, (startRow + rows) * cols), rows, cols);
    }

    @Override
    public String toString() {
        return "Int64Window[" + dtype.typeName() + ", start=" + startRow + ", shape=(" + rows + ", " + cols + ")]";
    }
}
