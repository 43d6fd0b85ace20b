package com.trading.adj.engine;

import com.trading.adj.adjustment.Adjustment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable mapping from effective row to the ordered adjustments that become
 * visible once a traversal reaches that row.
 *
 * <p>
 * Layout mirrors a CSR index so the traversal walks it with two ints and no
 * iterators:
 * <ul>
 * <li>{@code effectiveRows}: distinct keys, strictly increasing.</li>
 * <li>{@code offsets}: adjustments for entry {@code i} occupy
 * {@code adjustments[offsets[i]]} inclusive to {@code adjustments[offsets[i+1]]}
 * exclusive.</li>
 * <li>{@code adjustments}: flattened, caller order preserved within a key.</li>
 * </ul>
 * Keys with an empty list are dropped; they are no-ops.
 */
public final class AdjustmentSchedule {
    public static final AdjustmentSchedule EMPTY = new AdjustmentSchedule(new int[0], new int[] { 0 },
            new Adjustment[0]);

    private final int[] effectiveRows;
    private final int[] offsets;
    private final Adjustment[] adjustments;

    private AdjustmentSchedule(int[] effectiveRows, int[] offsets, Adjustment[] adjustments) {
        this.effectiveRows = effectiveRows;
        this.offsets = offsets;
        this.adjustments = adjustments;
    }

    /**
     * Builds a schedule from a row-keyed map. List order is preserved; keys
     * are sorted.
     *
     * @throws IllegalArgumentException on a negative or null key, or a null
     *                                  adjustment.
     */
    public static AdjustmentSchedule of(Map<Integer, ? extends List<? extends Adjustment>> byRow) {
        if (byRow == null || byRow.isEmpty())
            return EMPTY;
        Builder b = builder();
        for (var entry : byRow.entrySet()) {
            if (entry.getKey() == null)
                throw new IllegalArgumentException("Null effective row");
            for (Adjustment adj : entry.getValue())
                b.add(entry.getKey(), adj);
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of distinct effective rows. */
    public int size() {
        return effectiveRows.length;
    }

    public boolean isEmpty() {
        return effectiveRows.length == 0;
    }

    /** Total number of adjustments across all rows. */
    public int adjustmentCount() {
        return adjustments.length;
    }

    /** Effective row of entry {@code i}. Entries are in increasing row order. */
    public int effectiveRow(int i) {
        return effectiveRows[i];
    }

    public int start(int i) {
        return offsets[i];
    }

    public int end(int i) {
        return offsets[i + 1];
    }

    public Adjustment adjustmentAt(int flatIndex) {
        return adjustments[flatIndex];
    }

    /** Adjustments keyed at {@code effectiveRow}, in application order. */
    public List<Adjustment> adjustmentsAt(int effectiveRow) {
        int i = Arrays.binarySearch(effectiveRows, effectiveRow);
        if (i < 0)
            return Collections.emptyList();
        return Collections.unmodifiableList(Arrays.asList(adjustments).subList(offsets[i], offsets[i + 1]));
    }

    /** Unmodifiable row-ordered view of the schedule. */
    public Map<Integer, List<Adjustment>> asMap() {
        Map<Integer, List<Adjustment>> out = new LinkedHashMap<>(effectiveRows.length * 2);
        for (int i = 0; i < effectiveRows.length; i++)
            out.put(effectiveRows[i], adjustmentsAt(effectiveRows[i]));
        return Collections.unmodifiableMap(out);
    }

    /** Renders as {@code {1: [A, B], 3: [C]}}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(64 + adjustments.length * 96);
        sb.append('{');
        for (int i = 0; i < effectiveRows.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(effectiveRows[i]).append(": [");
            for (int j = offsets[i]; j < offsets[i + 1]; j++) {
                if (j > offsets[i])
                    sb.append(", ");
                sb.append(adjustments[j]);
            }
            sb.append(']');
        }
        return sb.append('}').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AdjustmentSchedule other))
            return false;
        return Arrays.equals(effectiveRows, other.effectiveRows) && Arrays.equals(offsets, other.offsets)
                && Arrays.equals(adjustments, other.adjustments);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(effectiveRows) + Arrays.hashCode(adjustments);
    }

    /**
     * Accumulates adjustments per effective row. Adjustments added under the
     * same row are applied in the order they were added.
     */
    public static final class Builder {
        private final TreeMap<Integer, List<Adjustment>> byRow = new TreeMap<>();
        private int count;

        public Builder add(int effectiveRow, Adjustment... adjustments) {
            if (effectiveRow < 0)
                throw new IllegalArgumentException("Negative effective row: " + effectiveRow);
            List<Adjustment> list = byRow.computeIfAbsent(effectiveRow, k -> new ArrayList<>());
            for (Adjustment adj : adjustments) {
                if (adj == null)
                    throw new IllegalArgumentException("Null adjustment at row " + effectiveRow);
                list.add(adj);
                count++;
            }
            return this;
        }

        public AdjustmentSchedule build() {
            if (count == 0)
                return EMPTY;
            int n = 0;
            for (List<Adjustment> list : byRow.values())
                if (!list.isEmpty())
                    n++;

            int[] rows = new int[n];
            int[] offs = new int[n + 1];
            Adjustment[] flat = new Adjustment[count];
            int i = 0, pos = 0;
            for (var entry : byRow.entrySet()) {
                List<Adjustment> list = entry.getValue();
                if (list.isEmpty())
                    continue;
                rows[i] = entry.getKey();
                offs[i] = pos;
                for (Adjustment adj : list)
                    flat[pos++] = adj;
                i++;
            }
            offs[n] = pos;
            return new AdjustmentSchedule(rows, offs, flat);
        }
    }
}
