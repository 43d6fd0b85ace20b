package com.trading.adj.io;

import com.trading.adj.adjustment.*;
import com.trading.adj.api.DType;
import com.trading.adj.array.Float64Array;
import com.trading.adj.array.Float64Window;
import com.trading.adj.array.Int64Window;
import com.trading.adj.engine.AdjustedArray;
import com.trading.adj.label.LabelWindow;
import com.trading.adj.util.Datetimes;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class JsonArrayCompilerTest {

    private final JsonArrayCompiler compiler = new JsonArrayCompiler();

    @Test
    @SuppressWarnings("unchecked")
    public void testCompileFloatDefinitionFromFile() throws Exception {
        Path path = Paths.get(getClass().getResource("/definitions/split.json").toURI());
        ArrayDefinition def = compiler.parseFile(path);
        assertEquals("close", def.getName());
        assertEquals(4, def.getAdjustments().size());

        AdjustedArray<Float64Window> array = (AdjustedArray<Float64Window>) compiler.compile(def);
        assertEquals(DType.FLOAT64, array.dtype());
        assertEquals(6, array.rows());
        assertEquals(6, array.adjustments().adjustmentCount());
        assertEquals(new Float64Multiply(0, 1, 0, 0, 4.0), array.adjustments().adjustmentsAt(3).get(1));

        // Full-length window sees every adjustment.
        Float64Window w = array.traverse(6).next();
        assertArrayEquals(new double[][] {
                { 8, 6, 5 }, { 4, 18, 5 }, { 1, 18, 35 }, { 1, 6, 5 }, { 1, 6, 1 }, { 1, 1, 1 } },
                w.toMatrix());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMaskAndMissingValue() {
        String json = "{\"dtype\": \"float64\", \"missing_value\": -1,"
                + " \"data\": [[1, null], [3, 4]],"
                + " \"mask\": [[true, true], [false, null]]}";
        AdjustedArray<Float64Window> array = (AdjustedArray<Float64Window>) compiler.compile(json);

        assertEquals(-1.0, array.missingValue());
        Float64Array data = (Float64Array) array.data();
        assertEquals(1.0, data.valueAt(0, 0), 0.0);
        assertTrue(Double.isNaN(data.valueAt(0, 1)));
        assertEquals(-1.0, data.valueAt(1, 0), 0.0);
        assertEquals(-1.0, data.valueAt(1, 1), 0.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testDatetimeDefinition() {
        String json = "{\"dtype\": \"datetime64[ns]\","
                + " \"data\": [[\"2014-01-01T00:00:00Z\"], [\"2014-01-02T00:00:00Z\"]],"
                + " \"adjustments\": {\"1\": [{\"type\": \"Datetime64Overwrite\", \"first_row\": 0,"
                + " \"last_row\": 0, \"first_col\": 0, \"last_col\": 0, \"value\": \"NaT\"}]}}";
        AdjustedArray<Int64Window> array = (AdjustedArray<Int64Window>) compiler.compile(json);

        assertEquals(Datetimes.NAT, array.missingValue());
        Iterator<Int64Window> it = array.traverse(1);
        assertEquals(Datetimes.toNanos(Instant.parse("2014-01-01T00:00:00Z")), it.next().valueAt(0, 0));
        assertEquals(Datetimes.toNanos(Instant.parse("2014-01-02T00:00:00Z")), it.next().valueAt(0, 0));
        assertEquals(new Datetime64Overwrite(0, 0, 0, 0, Datetimes.NAT), array.adjustments().adjustmentAt(0));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testLabelDefinition() {
        String json = "{\"dtype\": \"object\", \"missing_value\": \"?\","
                + " \"data\": [[\"a\", null], [\"b\", \"c\"]],"
                + " \"adjustments\": {\"1\": [{\"type\": \"ObjectOverwrite\", \"first_row\": 0,"
                + " \"last_row\": 0, \"first_col\": 0, \"last_col\": 1, \"value\": \"z\"}]}}";
        AdjustedArray<LabelWindow> array = (AdjustedArray<LabelWindow>) compiler.compile(json);

        LabelWindow w = array.traverse(2).next();
        assertArrayEquals(new String[][] { { "z", "z" }, { "b", "c" } }, w.decode());
        assertEquals("?", w.missingValue());
    }

    @Test
    public void testIntDefinitionRequiresMissingValue() {
        String json = "{\"dtype\": \"int64\", \"data\": [[1, 2]]}";
        try {
            compiler.compile(json);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("No default missing value"));
        }
        AdjustedArray<?> array = compiler.compile("{\"dtype\": \"int64\", \"missing_value\": 0, \"data\": [[1, 2]]}");
        assertEquals(0L, array.missingValue());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownAdjustmentType() {
        compiler.compile("{\"dtype\": \"float64\", \"data\": [[1]], \"adjustments\": {\"0\": [{\"type\": \"Add\","
                + " \"first_row\": 0, \"last_row\": 0, \"first_col\": 0, \"last_col\": 0, \"value\": 1}]}}");
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testOutOfBoundsAdjustment() {
        compiler.compile("{\"dtype\": \"float64\", \"data\": [[1]], \"adjustments\": {\"0\": [{\"type\":"
                + " \"Float64Overwrite\", \"first_row\": 0, \"last_row\": 1, \"first_col\": 0, \"last_col\": 0,"
                + " \"value\": 1}]}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedData() {
        compiler.compile("{\"dtype\": \"float64\", \"data\": [[1, 2], [3]]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingDtype() {
        compiler.compile("{\"data\": [[1]]}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJson() {
        compiler.parse("{\"dtype\": ");
    }

    @Test
    public void testWriteUsesSnakeCase() {
        ArrayDefinition.AdjustmentDef adj = new ArrayDefinition.AdjustmentDef();
        adj.setType("Float64Multiply");
        adj.setFirstRow(0);
        adj.setLastRow(1);
        adj.setValue(0.5);

        ArrayDefinition def = new ArrayDefinition();
        def.setName("px");
        def.setDtype("float64");
        def.setData(List.of(List.of(1.0), List.of(2.0)));
        def.setAdjustments(java.util.Map.of(1, List.of(adj)));

        String json = compiler.write(def);
        assertTrue(json, json.contains("\"first_row\":0"));
        assertTrue(json, json.contains("\"last_row\":1"));
        assertFalse(json, json.contains("mask"));
        assertEquals(def, compiler.parse(json));
    }

    @Test
    public void testEmptyMaskIsShapeChecked() {
        try {
            compiler.compile("{\"dtype\": \"float64\", \"data\": [[1]], \"mask\": []}");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Mask shape (0, 0) != data shape (1, 1)", e.getMessage());
        }
    }

    @Test
    public void testFactoryBuildsFromDefinition() {
        ArrayDefinition.AdjustmentDef def = new ArrayDefinition.AdjustmentDef();
        def.setFirstRow(1);
        def.setLastRow(2);
        def.setLastCol(3);
        def.setValue("1.5");

        Adjustment adj = AdjustmentType.FLOAT64_MULTIPLY.getFactory().create(def);
        assertEquals(new Float64Multiply(1, 2, 0, 3, 1.5), adj);
        assertEquals(1.5, ((Float64Multiply) adj).multiplier(), 0.0);

        def.setValue("1970-01-01T00:00:00.000000002Z");
        Datetime64Overwrite ts = (Datetime64Overwrite) AdjustmentType.DATETIME64_OVERWRITE.getFactory().create(def);
        assertEquals(2L, ts.replacementNanos());
    }

    @Test
    public void testAdjustmentTypeLookup() {
        assertEquals(AdjustmentType.INT64_OVERWRITE, AdjustmentType.fromString("Int64Overwrite"));
        assertEquals(AdjustmentType.OBJECT_OVERWRITE, AdjustmentType.fromString("object_overwrite"));
        assertEquals(AdjustmentType.FLOAT64_OVERWRITE, AdjustmentType.of(new Float64Overwrite(0, 0, 0, 0, 1.0)));
        assertEquals(Float64Multiply.class, AdjustmentType.FLOAT64_MULTIPLY.getAdjustmentClass());
    }
}
