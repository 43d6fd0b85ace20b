package com.trading.adj.engine;

import com.trading.adj.adjustment.Adjustment;
import com.trading.adj.adjustment.ObjectOverwrite;
import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.label.LabelArray;
import com.trading.adj.label.LabelWindow;
import com.trading.adj.mask.Mask;
import com.trading.adj.mask.Masking;
import com.trading.adj.util.MissingValues;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import lombok.extern.log4j.Log4j2;

/**
 * A columnar buffer paired with a schedule of point-in-time adjustments, read
 * through sliding windows.
 *
 * <p>
 * <b>Model:</b> row {@code r} of the buffer is the value recorded on day
 * {@code r}. An adjustment filed under effective row {@code k} corrects
 * history (e.g. a 2:1 split halving earlier prices) and must be visible in
 * every window whose last row is at or after {@code k}, and in no window that
 * ends before it. {@link #traverse(int)} produces exactly those windows in a
 * single forward pass.
 *
 * <p>
 * <b>Lifecycle:</b> all validation happens here, at construction: mask shape,
 * missing-value type, adjustment dtype compatibility and adjustment bounds.
 * The masked baseline is computed once from a detached copy of the input and
 * kept private; it is never mutated and never handed out, so every traversal
 * starts from the same state and concurrent traversals of one instance do not
 * interfere. For label buffers the baseline owns its vocabulary, and every
 * overwrite value in the schedule is registered in it here, so traversals
 * only ever look codes up.
 *
 * @param <W> window type, determined by the buffer's dtype.
 */
@Log4j2
public final class AdjustedArray<W extends ArrayWindow> {
    private final ColumnarArray<W> baseline;
    private final AdjustmentSchedule adjustments;
    private final Object missingValue;

    /**
     * @param data         the raw buffer; copied, never mutated.
     * @param mask         validity mask of the same shape, or {@link Mask#NOMASK}.
     * @param adjustments  effective row to ordered adjustments.
     * @param missingValue value written at masked-out cells; must match the
     *                     buffer's dtype.
     * @throws IllegalArgumentException  on a mask shape mismatch, an unusable
     *                                   missing value, or an adjustment that
     *                                   does not apply to this dtype.
     * @throws IndexOutOfBoundsException if an adjustment reaches outside the
     *                                   buffer.
     */
    public AdjustedArray(ColumnarArray<W> data, Mask mask, AdjustmentSchedule adjustments, Object missingValue) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(mask, "mask (use Mask.NOMASK for none)");
        Objects.requireNonNull(adjustments, "adjustments");

        Masking.checkShape(data, mask);
        this.missingValue = MissingValues.coerce(data.dtype(), missingValue);
        if (data instanceof LabelArray labels && !labels.missingValue().equals(this.missingValue)) {
            throw new IllegalArgumentException("Missing value mismatch: label array uses '"
                    + labels.missingValue() + "', expected '" + this.missingValue + "'");
        }
        checkAdjustments(data, adjustments);

        this.baseline = Masking.apply(data, mask, this.missingValue);
        this.adjustments = adjustments;
        if (baseline instanceof LabelArray labels)
            registerLabels(labels, adjustments);

        log.debug("Built adjusted array: dtype={}, shape={}, masked={}, {} adjustment(s) over {} row(s)",
                data.dtype().typeName(), data.shapeString(), !mask.isNoMask(), adjustments.adjustmentCount(),
                adjustments.size());
    }

    public AdjustedArray(ColumnarArray<W> data, Mask mask,
            Map<Integer, ? extends List<? extends Adjustment>> adjustments, Object missingValue) {
        this(data, mask, AdjustmentSchedule.of(adjustments), missingValue);
    }

    /** Label-encodes {@code data} and wraps it. */
    public static AdjustedArray<LabelWindow> ofStrings(String[][] data, Mask mask,
            Map<Integer, ? extends List<? extends Adjustment>> adjustments, String missingValue) {
        return new AdjustedArray<>(LabelArray.encode(data, missingValue), mask, adjustments, missingValue);
    }

    private static void checkAdjustments(ColumnarArray<?> data, AdjustmentSchedule schedule) {
        int rows = data.rows();
        int cols = data.cols();
        for (int i = 0; i < schedule.size(); i++) {
            int row = schedule.effectiveRow(i);
            for (int j = schedule.start(i); j < schedule.end(i); j++) {
                Adjustment adj = schedule.adjustmentAt(j);
                if (!adj.supports(data.dtype())) {
                    throw new IllegalArgumentException(
                            adj + " at row " + row + " cannot be applied to dtype " + data.dtype().typeName());
                }
                if (adj.lastRow() >= rows || adj.lastCol() >= cols) {
                    throw new IndexOutOfBoundsException(
                            adj + " at row " + row + " is out of bounds for data shape " + data.shapeString());
                }
            }
            if (row >= rows) {
                log.debug("Adjustments at row {} are past the last row ({}) and will never be applied", row,
                        rows - 1);
            }
        }
    }

    private static void registerLabels(LabelArray labels, AdjustmentSchedule schedule) {
        for (int i = 0; i < schedule.adjustmentCount(); i++) {
            if (schedule.adjustmentAt(i) instanceof ObjectOverwrite overwrite)
                labels.vocabulary().codeOf(overwrite.replacement());
        }
    }

    public DType dtype() {
        return baseline.dtype();
    }

    public int rows() {
        return baseline.rows();
    }

    public int cols() {
        return baseline.cols();
    }

    public Object missingValue() {
        return missingValue;
    }

    public AdjustmentSchedule adjustments() {
        return adjustments;
    }

    /** Returns a detached copy of the masked, unadjusted baseline. */
    public ColumnarArray<W> data() {
        return baseline.detach();
    }

    /**
     * Starts a traversal producing every window of {@code windowLength} rows, in
     * row order: {@code rows() - windowLength + 1} windows in total.
     *
     * @throws WindowLengthNotPositive if {@code windowLength <= 0}.
     * @throws WindowLengthTooLong     if {@code windowLength > rows()}.
     */
    public WindowIterator<W> traverse(int windowLength) {
        if (windowLength <= 0)
            throw new WindowLengthNotPositive(windowLength);
        if (windowLength > baseline.rows())
            throw new WindowLengthTooLong(baseline.rows(), windowLength);
        return new WindowIterator<>(baseline.copy(), adjustments, windowLength);
    }

    /** Human-readable dump of the masked baseline and the adjustment schedule. */
    public String inspect() {
        return "Adjusted Array (" + dtype().typeName() + "):\n\n"
                + "Data:\n" + baseline.format() + "\n\n"
                + "Adjustments:\n" + adjustments + "\n";
    }

    @Override
    public String toString() {
        return "AdjustedArray[" + dtype().typeName() + ", shape=" + baseline.shapeString() + ", adjustments="
                + adjustments.adjustmentCount() + "]";
    }
}
