package com.trading.adj.engine;

import com.trading.adj.adjustment.Float64Multiply;
import com.trading.adj.array.Float64Array;
import com.trading.adj.array.Float64Window;
import com.trading.adj.mask.Mask;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Test;
import static org.junit.Assert.*;

public class WindowIteratorTest {

    private static AdjustedArray<Float64Window> column(double... values) {
        double[][] m = new double[values.length][1];
        for (int i = 0; i < values.length; i++)
            m[i][0] = values[i];
        return new AdjustedArray<>(Float64Array.of(m), Mask.NOMASK,
                Map.of(2, List.of(new Float64Multiply(0, 1, 0, 0, 10.0))), Double.NaN);
    }

    @Test
    public void testWindowCountAndStartRows() {
        WindowIterator<Float64Window> it = column(1, 2, 3, 4).traverse(2);
        assertEquals(2, it.windowLength());
        assertEquals(3, it.remaining());

        int expectedStart = 0;
        while (it.hasNext()) {
            Float64Window w = it.next();
            assertEquals(expectedStart++, w.startRow());
            assertEquals(2, w.rows());
            assertEquals(1, w.cols());
        }
        assertEquals(3, expectedStart);
        assertEquals(0, it.remaining());
    }

    @Test
    public void testAdjustmentAppliedWhenWindowReachesEffectiveRow() {
        WindowIterator<Float64Window> it = column(1, 2, 3, 4).traverse(2);

        Float64Window w0 = it.next(); // rows 0-1
        assertArrayEquals(new double[][] { { 1 }, { 2 } }, w0.toMatrix());

        Float64Window w1 = it.next(); // rows 1-2, row 2 adjustment now visible
        assertArrayEquals(new double[][] { { 20 }, { 3 } }, w1.toMatrix());

        Float64Window w2 = it.next();
        assertArrayEquals(new double[][] { { 3 }, { 4 } }, w2.toMatrix());
    }

    @Test(expected = NoSuchElementException.class)
    public void testNextPastEnd() {
        WindowIterator<Float64Window> it = column(1, 2).traverse(2);
        it.next();
        it.next();
    }

    @Test
    public void testIterableOnlyOnce() {
        WindowIterator<Float64Window> it = column(1, 2, 3).traverse(1);
        Iterator<Float64Window> first = it.iterator();
        assertSame(it, first);
        try {
            it.iterator();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testFullLengthWindow() {
        WindowIterator<Float64Window> it = column(1, 2, 3).traverse(3);
        Float64Window w = it.next();
        // every adjustment keyed at or before row 2 is visible
        assertArrayEquals(new double[][] { { 10 }, { 20 }, { 3 } }, w.toMatrix());
        assertFalse(it.hasNext());
    }
}
