package com.trading.adj.array;

import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.DType;

import java.nio.DoubleBuffer;
import java.util.Arrays;

/**
 * Read-only float64 window over a contiguous run of rows.
 *
 * Reads go straight to the backing buffer (zero-copy); see
 * {@link ArrayWindow} for how long the contents stay stable.
 */
public final class Float64Window implements ArrayWindow {
    private final double[] data;
    private final int startRow;
    private final int rows;
    private final int cols;

    Float64Window(double[] data, int startRow, int rows, int cols) {
        this.data = data;
        this.startRow = startRow;
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public DType dtype() {
        return DType.FLOAT64;
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

    public double valueAt(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + col + ") out of bounds for window (" + rows + ", " + cols + ")");
        return data[(startRow + row) * cols + col];
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    /**
     * Row-major read-only buffer over the window. Position 0 is cell (0, 0);
     * {@code put} throws {@link java.nio.ReadOnlyBufferException}.
     */
    public DoubleBuffer buffer() {
        return DoubleBuffer.wrap(data, startRow * cols, rows * cols).slice().asReadOnlyBuffer();
    }

    public double[][] toMatrix() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++) {
            int from = (startRow + r) * cols;
            out[r] = Arrays.copyOfRange(data, from, from + cols);
        }
        return out;
    }

    @Override
    public Float64Array copy() {
        return new Float64Array(Arrays.copyOfRange(data, startRow * cols, (startRow + rows) * cols), rows, cols);
    }

    @Override
    public String toString() {
        return "Float64Window[start=" + startRow + ", shape=(" + rows + ", " + cols + ")]";
    }
}
