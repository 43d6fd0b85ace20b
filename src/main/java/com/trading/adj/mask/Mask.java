package com.trading.adj.mask;

/**
 * Boolean validity mask over a 2-D buffer. {@code true} marks a valid cell,
 * {@code false} a logically missing one.
 *
 * {@link #NOMASK} stands for "every cell is valid" and has no shape.
 */
public final class Mask {

    /** Sentinel meaning "no mask". */
    public static final Mask NOMASK = new Mask(null, 0, 0);

    // row-major, null for NOMASK
    private final boolean[] valid;
    private final int rows;
    private final int cols;

    private Mask(boolean[] valid, int rows, int cols) {
        this.valid = valid;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Builds a mask from a rectangular boolean matrix. The input is copied.
     *
     * @throws IllegalArgumentException if the matrix is ragged.
     */
    public static Mask of(boolean[][] matrix) {
        int rows = matrix.length;
        int cols = rows == 0 ? 0 : matrix[0].length;
        boolean[] flat = new boolean[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (matrix[r].length != cols) {
                throw new IllegalArgumentException(
                        "Ragged mask: row " + r + " has " + matrix[r].length + " columns, expected " + cols);
            }
            System.arraycopy(matrix[r], 0, flat, r * cols, cols);
        }
        return new Mask(flat, rows, cols);
    }

    public boolean isNoMask() {
        return valid == null;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /** Always {@code true} for {@link #NOMASK}. */
    public boolean isValid(int row, int col) {
        return valid == null || valid[row * cols + col];
    }

    public String shapeString() {
        return isNoMask() ? "NOMASK" : "(" + rows + ", " + cols + ")";
    }

    @Override
    public String toString() {
        return "Mask" + shapeString();
    }
}
