package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.array.Float64Array;

import java.util.Locale;

/** Replaces a float64 region with a constant, e.g. a restated value. */
public final class Float64Overwrite extends Adjustment {
    private final double value;

    public Float64Overwrite(int firstRow, int lastRow, int firstCol, int lastCol, double value) {
        super(firstRow, lastRow, firstCol, lastCol);
        this.value = value;
    }

    public double replacement() {
        return value;
    }

    @Override
    public AdjustmentKind kind() {
        return AdjustmentKind.OVERWRITE;
    }

    @Override
    public boolean supports(DType dtype) {
        return dtype == DType.FLOAT64;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public void applyTo(ColumnarArray<?> target) {
        requireSupported(target);
        ((Float64Array) target).fill(firstRow(), lastRow(), firstCol(), lastCol(), value);
    }

    @Override
    protected String formatValue() {
        return String.format(Locale.ROOT, "%f", value);
    }
}
