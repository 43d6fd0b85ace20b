package com.trading.adj.api;

import com.trading.adj.mask.Mask;

/**
 * A rectangular, row-major buffer of per-asset time series.
 *
 * Rows are chronological, columns index independent series. Implementations
 * are the closed set {@code Float64Array}, {@code Int64Array} and
 * {@code LabelArray}; adjustments dispatch on the concrete type.
 *
 * @param <W> the window type produced by {@link #window(int, int)}.
 */
public interface ColumnarArray<W extends ArrayWindow> {

    DType dtype();

    int rows();

    int cols();

    /** Boxed cell access. */
    Object get(int row, int col);

    /**
     * Returns a deep copy of the cell storage. Label arrays share their
     * (append-only) vocabulary with the copy.
     */
    ColumnarArray<W> copy();

    /**
     * Returns a copy that shares no mutable state with this array. Same as
     * {@link #copy()} except for label arrays, whose vocabulary is copied too.
     */
    default ColumnarArray<W> detach() {
        return copy();
    }

    /**
     * Writes {@code missingValue} into every cell the mask marks invalid.
     * Mutates this array in place.
     */
    void fillMissing(Mask mask, Object missingValue);

    /** Returns a read-only view over rows {@code [startRow, startRow + length)}. */
    W window(int startRow, int length);

    /** Renders the array as deterministic, human-readable text. */
    String format();

    default String shapeString() {
        return "(" + rows() + ", " + cols() + ")";
    }
}
