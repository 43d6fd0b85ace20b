package com.trading.adj.api;

import org.junit.Test;
import static org.junit.Assert.*;

public class DTypeTest {

    @Test
    public void testFromString() {
        assertEquals(DType.FLOAT64, DType.fromString("float64"));
        assertEquals(DType.INT64, DType.fromString("INT64"));
        assertEquals(DType.DATETIME64, DType.fromString("datetime64[ns]"));
        assertEquals(DType.DATETIME64, DType.fromString("datetime64"));
        assertEquals(DType.LABEL, DType.fromString("object"));
        assertEquals(DType.LABEL, DType.fromString("str"));
        assertEquals(DType.LABEL, DType.fromString("label"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknown() {
        DType.fromString("complex128");
    }

    @Test
    public void testNumeric() {
        assertTrue(DType.DATETIME64.isNumeric());
        assertFalse(DType.LABEL.isNumeric());
    }
}
