package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.array.Int64Array;

/** Replaces an int64 region with a constant. */
public final class Int64Overwrite extends Adjustment {
    private final long value;

    public Int64Overwrite(int firstRow, int lastRow, int firstCol, int lastCol, long value) {
        super(firstRow, lastRow, firstCol, lastCol);
        this.value = value;
    }

    public long replacement() {
        return value;
    }

    @Override
    public AdjustmentKind kind() {
        return AdjustmentKind.OVERWRITE;
    }

    @Override
    public boolean supports(DType dtype) {
        return dtype == DType.INT64;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public void applyTo(ColumnarArray<?> target) {
        requireSupported(target);
        ((Int64Array) target).fill(firstRow(), lastRow(), firstCol(), lastCol(), value);
    }

    @Override
    protected String formatValue() {
        return Long.toString(value);
    }
}
