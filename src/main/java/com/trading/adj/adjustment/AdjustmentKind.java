package com.trading.adj.adjustment;

/** The operation an {@link Adjustment} performs on its region. */
public enum AdjustmentKind {
    /** Scale every cell by a scalar. Numeric dtypes only. */
    MULTIPLY,
    /** Replace every cell with a value of the buffer's dtype. */
    OVERWRITE
}
