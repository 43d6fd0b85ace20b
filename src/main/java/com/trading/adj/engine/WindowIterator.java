package com.trading.adj.engine;

import com.trading.adj.adjustment.Adjustment;
import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.ColumnarArray;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One traversal of an {@link AdjustedArray}: the sliding windows of a fixed
 * length over a private working buffer, with adjustments applied as the
 * cursor reaches their effective rows.
 *
 * <p>
 * Implemented as an explicit state machine with two cursors:
 * <ul>
 * <li>{@code offset}: start row of the next window to emit.</li>
 * <li>{@code nextEntry}: index of the first schedule entry not yet applied.</li>
 * </ul>
 * Before emitting the window {@code [offset, offset + windowLength)}, every
 * entry whose effective row is at or before the window's last row is applied,
 * in row order and then list order. Both cursors only move forward, so each
 * adjustment is applied exactly once and the whole pass costs
 * O(rows + adjustments) plus the cells touched.
 *
 * <p>
 * Emitted windows are live views of the working buffer; once {@link #next()}
 * is called again, later adjustments may show through earlier windows. Use
 * {@link ArrayWindow#copy()} to retain one.
 *
 * <p>
 * Single use. {@link #iterator()} returns this instance and may be called
 * once, so a traversal can drive a for-each loop. Not thread-safe.
 */
public final class WindowIterator<W extends ArrayWindow> implements Iterator<W>, Iterable<W> {
    private static final Logger log = LogManager.getLogger(WindowIterator.class);

    private final ColumnarArray<W> working;
    private final AdjustmentSchedule schedule;
    private final int windowLength;
    private final int lastOffset;

    private int offset;
    private int nextEntry;
    private boolean iteratorTaken;

    WindowIterator(ColumnarArray<W> working, AdjustmentSchedule schedule, int windowLength) {
        this.working = working;
        this.schedule = schedule;
        this.windowLength = windowLength;
        this.lastOffset = working.rows() - windowLength;
    }

    public int windowLength() {
        return windowLength;
    }

    /** Number of windows still to be emitted. */
    public int remaining() {
        return lastOffset - offset + 1;
    }

    @Override
    public boolean hasNext() {
        return offset <= lastOffset;
    }

    @Override
    public W next() {
        if (offset > lastOffset)
            throw new NoSuchElementException(
                    "Traversal exhausted after " + (lastOffset + 1) + " windows of length " + windowLength);

        int lastRow = offset + windowLength - 1;
        final int entries = schedule.size();
        while (nextEntry < entries && schedule.effectiveRow(nextEntry) <= lastRow) {
            if (log.isTraceEnabled())
                log.trace("Applying {} adjustment(s) at row {} before window [{}, {}]",
                        schedule.end(nextEntry) - schedule.start(nextEntry), schedule.effectiveRow(nextEntry),
                        offset, lastRow);
            for (int i = schedule.start(nextEntry), end = schedule.end(nextEntry); i < end; i++) {
                Adjustment adj = schedule.adjustmentAt(i);
                adj.applyTo(working);
            }
            nextEntry++;
        }

        W window = working.window(offset, windowLength);
        offset++;
        return window;
    }

    @Override
    public Iterator<W> iterator() {
        if (iteratorTaken)
            throw new IllegalStateException("A traversal can only be iterated once; call traverse() again");
        iteratorTaken = true;
        return this;
    }
}
