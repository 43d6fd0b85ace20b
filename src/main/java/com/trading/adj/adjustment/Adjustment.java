package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;

import java.util.Objects;

/**
 * Immutable point-in-time correction to a rectangular region of a buffer.
 *
 * <p>
 * Bounds are inclusive on both ends. The region names the historical cells
 * that were recorded before the correction took effect (e.g. prices before a
 * split); the row at which the correction becomes visible is not part of the
 * adjustment but the key it is filed under in an
 * {@code AdjustmentSchedule}.
 *
 * <p>
 * Concrete adjustments form a closed set keyed by (operation x dtype family):
 * {@link Float64Multiply}, {@link Float64Overwrite}, {@link Int64Overwrite},
 * {@link Datetime64Overwrite} and {@link ObjectOverwrite}.
 */
public abstract class Adjustment {
    private final int firstRow;
    private final int lastRow;
    private final int firstCol;
    private final int lastCol;

    protected Adjustment(int firstRow, int lastRow, int firstCol, int lastCol) {
        if (firstRow < 0 || firstCol < 0)
            throw new IllegalArgumentException(
                    "Negative bounds: first_row=" + firstRow + ", first_col=" + firstCol);
        if (firstRow > lastRow)
            throw new IllegalArgumentException("first_row " + firstRow + " > last_row " + lastRow);
        if (firstCol > lastCol)
            throw new IllegalArgumentException("first_col " + firstCol + " > last_col " + lastCol);
        this.firstRow = firstRow;
        this.lastRow = lastRow;
        this.firstCol = firstCol;
        this.lastCol = lastCol;
    }

    public final int firstRow() {
        return firstRow;
    }

    public final int lastRow() {
        return lastRow;
    }

    public final int firstCol() {
        return firstCol;
    }

    public final int lastCol() {
        return lastCol;
    }

    public abstract AdjustmentKind kind();

    /** Whether this adjustment can be applied to buffers of {@code dtype}. */
    public abstract boolean supports(DType dtype);

    /** The payload: multiplier or replacement value, boxed. */
    public abstract Object value();

    /**
     * Mutates {@code target} in place.
     *
     * @throws IllegalArgumentException  if the target's dtype is not supported.
     * @throws IndexOutOfBoundsException if the region does not fit the target.
     */
    public abstract void applyTo(ColumnarArray<?> target);

    /** Renders the payload for {@link #toString()}. */
    protected abstract String formatValue();

    protected final void requireSupported(ColumnarArray<?> target) {
        if (!supports(target.dtype()))
            throw new IllegalArgumentException(
                    getClass().getSimpleName() + " cannot be applied to dtype " + target.dtype().typeName());
    }

    @Override
    public final String toString() {
        return getClass().getSimpleName() + "(first_row=" + firstRow + ", last_row=" + lastRow
                + ", first_col=" + firstCol + ", last_col=" + lastCol + ", value=" + formatValue() + ")";
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || o.getClass() != getClass())
            return false;
        Adjustment other = (Adjustment) o;
        return firstRow == other.firstRow && lastRow == other.lastRow && firstCol == other.firstCol
                && lastCol == other.lastCol && Objects.equals(value(), other.value());
    }

    @Override
    public final int hashCode() {
        return Objects.hash(getClass(), firstRow, lastRow, firstCol, lastCol, value());
    }
}
