package com.trading.adj.api;

/**
 * A read-only, fixed-length, all-columns slice of a columnar array.
 *
 * Windows are views: they do not own their storage. A window produced by a
 * traversal reads the traversal's working buffer directly, so it is only
 * guaranteed to show the state as of its emission until the traversal is
 * advanced again. Call {@link #copy()} to keep a window's contents.
 *
 * No mutator is exposed. Numeric windows hand out primitive buffers via
 * {@code asReadOnlyBuffer()}, so any write attempt fails with
 * {@link java.nio.ReadOnlyBufferException}; label windows only decode.
 */
public interface ArrayWindow {

    DType dtype();

    /** Number of rows in the window (the window length). */
    int rows();

    int cols();

    /** Row index in the underlying buffer at which this window starts. */
    int startRow();

    /**
     * Boxed access to a single cell. Intended for diagnostics and tests; typed
     * windows offer primitive accessors.
     */
    Object get(int row, int col);

    /** Materializes the window into a detached, mutable array. */
    ColumnarArray<?> copy();
}
