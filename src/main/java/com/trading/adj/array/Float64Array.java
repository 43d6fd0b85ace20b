package com.trading.adj.array;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.mask.Mask;
import com.trading.adj.util.ArrayFormat;
import com.trading.adj.util.MissingValues;
import com.trading.adj.util.Regions;

import java.util.Arrays;

/**
 * Mutable 2-D float64 buffer, stored row-major in a single {@code double[]}.
 *
 * Factories copy their input, so caller-owned arrays are never aliased.
 * Region operations are the in-place primitives adjustments are built on.
 */
public final class Float64Array implements ColumnarArray<Float64Window> {
    private final double[] data;
    private final int rows;
    private final int cols;

    Float64Array(double[] data, int rows, int cols) {
        this.data = data;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Copies a rectangular matrix.
     *
     * @throws IllegalArgumentException if the matrix is ragged.
     */
    public static Float64Array of(double[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        double[] flat = new double[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (matrix[r].length != cols)
                throw new IllegalArgumentException(
                        "Ragged input: row " + r + " has " + matrix[r].length + " columns, expected " + cols);
            System.arraycopy(matrix[r], 0, flat, r * cols, cols);
        }
        return new Float64Array(flat, rows, cols);
    }

    /** Copies {@code rows * cols} values laid out row-major. */
    public static Float64Array fromRowMajor(int rows, int cols, double[] values) {
        if (values.length != rows * cols)
            throw new IllegalArgumentException(
                    "Length mismatch: expected " + (rows * cols) + ", got " + values.length);
        return new Float64Array(values.clone(), rows, cols);
    }

    public static Float64Array full(int rows, int cols, double value) {
        double[] flat = new double[rows * cols];
        Arrays.fill(flat, value);
        return new Float64Array(flat, rows, cols);
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

    public double valueAt(int row, int col) {
        return data[index(row, col)];
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    /** Multiplies every cell of the inclusive region by {@code factor}. */
    public void multiply(int firstRow, int lastRow, int firstCol, int lastCol, double factor) {
        Regions.check(firstRow, lastRow, firstCol, lastCol, rows, cols);
        for (int r = firstRow; r <= lastRow; r++) {
            int base = r * cols;
            for (int c = firstCol; c <= lastCol; c++)
                data[base + c] *= factor;
        }
    }

    /** Overwrites every cell of the inclusive region with {@code value}. */
    public void fill(int firstRow, int lastRow, int firstCol, int lastCol, double value) {
        Regions.check(firstRow, lastRow, firstCol, lastCol, rows, cols);
        for (int r = firstRow; r <= lastRow; r++) {
            int base = r * cols;
            Arrays.fill(data, base + firstCol, base + lastCol + 1, value);
        }
    }

    @Override
    public Float64Array copy() {
        return new Float64Array(data.clone(), rows, cols);
    }

    @Override
    public void fillMissing(Mask mask, Object missingValue) {
        double missing = (Double) MissingValues.coerce(DType.FLOAT64, missingValue);
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                if (!mask.isValid(r, c))
                    data[r * cols + c] = missing;
    }

    @Override
    public Float64Window window(int startRow, int length) {
        Regions.checkRowRange(startRow, length, rows);
        return new Float64Window(data, startRow, length, cols);
    }

    /** Returns a fresh {@code double[rows][cols]}. */
    public double[][] toMatrix() {
        double[][] out = new double[rows][];
        for (int r = 0; r < rows; r++)
            out[r] = Arrays.copyOfRange(data, r * cols, (r + 1) * cols);
        return out;
    }

    @Override
    public String format() {
        String[] cells = new String[data.length];
        for (int i = 0; i < data.length; i++)
            cells[i] = ArrayFormat.float64Cell(data[i]);
        return ArrayFormat.grid("array(", cells, rows, cols, "", true);
    }

    private int index(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + col + ") out of bounds for shape " + shapeString());
        return row * cols + col;
    }

    /** NaN compares equal to NaN, as in {@link Arrays#equals(double[], double[])}. */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Float64Array other))
            return false;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return format();
    }
}
