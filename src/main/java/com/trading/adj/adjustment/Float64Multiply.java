package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.array.Float64Array;

import java.util.Locale;

/**
 * Multiplies a float64 region by a scalar. The typical use is a split or
 * dividend ratio applied to prices recorded before the event.
 */
public final class Float64Multiply extends Adjustment {
    private final double value;

    public Float64Multiply(int firstRow, int lastRow, int firstCol, int lastCol, double value) {
        super(firstRow, lastRow, firstCol, lastCol);
        this.value = value;
    }

    public double multiplier() {
        return value;
    }

    @Override
    public AdjustmentKind kind() {
        return AdjustmentKind.MULTIPLY;
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
        ((Float64Array) target).multiply(firstRow(), lastRow(), firstCol(), lastCol(), value);
    }

    @Override
    protected String formatValue() {
        return String.format(Locale.ROOT, "%f", value);
    }
}
