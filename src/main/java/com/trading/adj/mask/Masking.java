package com.trading.adj.mask;

import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.ColumnarArray;

/**
 * Produces the masked baseline of a buffer: the buffer with the missing
 * value substituted at every position the mask marks invalid.
 *
 * The caller's buffer is never mutated; the result is always a detached copy
 * (see {@link ColumnarArray#detach()}).
 */
public final class Masking {
    private Masking() {
        // Utility class
    }

    /**
     * Checks that a mask matches the shape of the buffer it is applied to.
     *
     * @throws IllegalArgumentException naming both shapes on mismatch.
     */
    public static void checkShape(ColumnarArray<?> buffer, Mask mask) {
        if (mask.isNoMask())
            return;
        if (mask.rows() != buffer.rows() || mask.cols() != buffer.cols()) {
            throw new IllegalArgumentException(
                    "Mask shape " + mask.shapeString() + " != data shape " + buffer.shapeString());
        }
    }

    /**
     * Returns a copy of {@code buffer} with {@code missingValue} written at every
     * invalid position of {@code mask}. With {@link Mask#NOMASK} the copy is
     * unchanged.
     */
    public static <W extends ArrayWindow> ColumnarArray<W> apply(ColumnarArray<W> buffer, Mask mask,
            Object missingValue) {
        checkShape(buffer, mask);
        ColumnarArray<W> masked = buffer.detach();
        if (!mask.isNoMask()) {
            masked.fillMissing(mask, missingValue);
        }
        return masked;
    }
}
