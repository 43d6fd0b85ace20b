package com.trading.adj.array;

import com.trading.adj.api.DType;
import com.trading.adj.mask.Mask;
import com.trading.adj.util.Datetimes;

import java.nio.LongBuffer;
import java.time.Instant;

import org.junit.Test;
import static org.junit.Assert.*;

public class Int64ArrayTest {

    @Test
    public void testDtypeIsPartOfEquality() {
        long[][] m = { { 1, 2 } };
        assertEquals(DType.INT64, Int64Array.of(m).dtype());
        assertEquals(DType.DATETIME64, Int64Array.datetimes(m).dtype());
        assertNotEquals(Int64Array.of(m), Int64Array.datetimes(m));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsFloatDtype() {
        Int64Array.full(DType.FLOAT64, 1, 1, 0L);
    }

    @Test
    public void testFillMissing() {
        Int64Array a = Int64Array.of(new long[][] { { 1, 2 }, { 3, 4 } });
        a.fillMissing(Mask.of(new boolean[][] { { true, false }, { true, true } }), -1);
        assertArrayEquals(new long[][] { { 1, -1 }, { 3, 4 } }, a.toMatrix());
    }

    @Test
    public void testWindowBuffer() {
        Int64Array a = Int64Array.of(new long[][] { { 1 }, { 2 }, { 3 } });
        Int64Window w = a.window(1, 2);
        LongBuffer buf = w.buffer();
        assertTrue(buf.isReadOnly());
        assertEquals(2L, buf.get(0));
        assertEquals(3L, buf.get(1));
        assertEquals(Int64Array.of(new long[][] { { 2 }, { 3 } }), w.copy());
    }

    @Test
    public void testFormat() {
        assertEquals("array([[ 1, 20],\n"
                + "       [-3,  4]])", Int64Array.of(new long[][] { { 1, 20 }, { -3, 4 } }).format());

        long nanos = Datetimes.toNanos(Instant.parse("2014-01-02T00:00:00Z"));
        assertEquals("array([['2014-01-02T00:00:00.000000000', " + " ".repeat(26) + "'NaT']], "
                + "dtype='datetime64[ns]')",
                Int64Array.datetimes(new long[][] { { nanos, Datetimes.NAT } }).format());
    }
}
