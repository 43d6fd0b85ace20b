package com.trading.adj.adjustment;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.label.LabelArray;

/**
 * Replaces a region of a label-encoded buffer with a string. Strings the
 * buffer has never seen are registered in its vocabulary on application.
 */
public final class ObjectOverwrite extends Adjustment {
    private final String value;

    public ObjectOverwrite(int firstRow, int lastRow, int firstCol, int lastCol, String value) {
        super(firstRow, lastRow, firstCol, lastCol);
        if (value == null)
            throw new IllegalArgumentException("Overwrite value must not be null");
        this.value = value;
    }

    public String replacement() {
        return value;
    }

    @Override
    public AdjustmentKind kind() {
        return AdjustmentKind.OVERWRITE;
    }

    @Override
    public boolean supports(DType dtype) {
        return dtype == DType.LABEL;
    }

    @Override
    public Object value() {
        return value;
    }

    @Override
    public void applyTo(ColumnarArray<?> target) {
        requireSupported(target);
        ((LabelArray) target).set(firstRow(), lastRow(), firstCol(), lastCol(), value);
    }

    @Override
    protected String formatValue() {
        return "'" + value + "'";
    }
}
