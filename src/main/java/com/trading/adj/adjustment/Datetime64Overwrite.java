package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.array.Int64Array;
import com.trading.adj.util.Datetimes;

import java.time.Instant;

/**
 * Replaces a datetime64[ns] region with a timestamp, e.g. a corrected
 * announcement date.
 */
public final class Datetime64Overwrite extends Adjustment {
    private final long nanos;

    /**
     * @param nanos nanoseconds since the epoch, or {@link Datetimes#NAT}.
     */
    public Datetime64Overwrite(int firstRow, int lastRow, int firstCol, int lastCol, long nanos) {
        super(firstRow, lastRow, firstCol, lastCol);
        this.nanos = nanos;
    }

    public Datetime64Overwrite(int firstRow, int lastRow, int firstCol, int lastCol, Instant value) {
        this(firstRow, lastRow, firstCol, lastCol, Datetimes.toNanos(value));
    }

    public long replacementNanos() {
        return nanos;
    }

    @Override
    public AdjustmentKind kind() {
        return AdjustmentKind.OVERWRITE;
    }

    @Override
    public boolean supports(DType dtype) {
        return dtype == DType.DATETIME64;
    }

    @Override
    public Object value() {
        return nanos;
    }

    @Override
    public void applyTo(ColumnarArray<?> target) {
        requireSupported(target);
        ((Int64Array) target).fill(firstRow(), lastRow(), firstCol(), lastCol(), nanos);
    }

    @Override
    protected String formatValue() {
        return Datetimes.format(nanos);
    }
}
