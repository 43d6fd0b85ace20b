package com.trading.adj.io;

import com.trading.adj.adjustment.Adjustment;
import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.array.Float64Array;
import com.trading.adj.array.Int64Array;
import com.trading.adj.engine.AdjustedArray;
import com.trading.adj.engine.AdjustmentSchedule;
import com.trading.adj.label.LabelArray;
import com.trading.adj.mask.Mask;
import com.trading.adj.util.Datetimes;
import com.trading.adj.util.MissingValues;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link ArrayDefinition} into a live {@link AdjustedArray}.
 *
 * <p>
 * Cell conventions per dtype:
 * <ul>
 * <li>float64: numbers; {@code null} or {@code "nan"} is NaN.</li>
 * <li>int64: integral numbers only.</li>
 * <li>datetime64[ns]: ISO-8601 instants or epoch nanoseconds; {@code null} or
 * {@code "NaT"} is NaT.</li>
 * <li>object: strings; {@code null} is the missing value.</li>
 * </ul>
 * An absent mask means no mask; a present one, even {@code []}, must match
 * the data shape. A mask cell that is {@code null} counts as invalid.
 */
@Log4j2
public final class JsonArrayCompiler {

    /** Builds one adjustment record from its definition. */
    @FunctionalInterface
    public interface AdjustmentFactory {
        Adjustment create(ArrayDefinition.AdjustmentDef def);
    }

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @throws IllegalArgumentException if the text is not a valid definition.
     */
    public ArrayDefinition parse(String json) {
        try {
            return mapper.readValue(json, ArrayDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid array definition: " + e.getOriginalMessage(), e);
        }
    }

    public ArrayDefinition parseFile(Path path) throws IOException {
        return mapper.readValue(Files.readString(path), ArrayDefinition.class);
    }

    /** Serializes a definition back to JSON. */
    public String write(ArrayDefinition def) {
        try {
            return mapper.writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize array definition '" + def.getName() + "'", e);
        }
    }

    public AdjustedArray<?> compile(String json) {
        return compile(parse(json));
    }

    /**
     * Builds the buffer, mask and schedule and hands them to the engine, which
     * performs all shape and bounds validation.
     */
    public AdjustedArray<?> compile(ArrayDefinition def) {
        if (def.getDtype() == null)
            throw new IllegalArgumentException("Array definition '" + def.getName() + "' has no dtype");
        DType dtype = DType.fromString(def.getDtype());
        Object missing = def.getMissingValue() == null
                ? MissingValues.defaultFor(dtype)
                : toMissingValue(dtype, def.getMissingValue());

        List<List<Object>> rows = def.getData() != null ? def.getData() : Collections.emptyList();
        int nrows = rows.size();
        int ncols = nrows == 0 ? 0 : rows.get(0).size();
        for (int r = 0; r < nrows; r++) {
            if (rows.get(r).size() != ncols)
                throw new IllegalArgumentException("Ragged data: row " + r + " has " + rows.get(r).size()
                        + " columns, expected " + ncols);
        }

        AdjustmentSchedule schedule = compileSchedule(def.getAdjustments());
        Mask mask = compileMask(def.getMask());

        AdjustedArray<?> out = switch (dtype) {
            case FLOAT64 -> build(float64(rows, nrows, ncols), mask, schedule, missing);
            case INT64 -> build(int64(rows, nrows, ncols, DType.INT64), mask, schedule, missing);
            case DATETIME64 -> build(int64(rows, nrows, ncols, DType.DATETIME64), mask, schedule, missing);
            case LABEL -> build(labels(rows, nrows, ncols, (String) missing), mask, schedule, missing);
        };
        log.info("Compiled adjusted array '{}': dtype={}, shape=({}, {}), {} adjustment(s)", def.getName(),
                dtype.typeName(), nrows, ncols, schedule.adjustmentCount());
        return out;
    }

    private static <W extends ArrayWindow> AdjustedArray<W> build(ColumnarArray<W> data, Mask mask,
            AdjustmentSchedule schedule, Object missing) {
        return new AdjustedArray<>(data, mask, schedule, missing);
    }

    private static AdjustmentSchedule compileSchedule(Map<Integer, List<ArrayDefinition.AdjustmentDef>> defs) {
        if (defs == null || defs.isEmpty())
            return AdjustmentSchedule.EMPTY;
        AdjustmentSchedule.Builder b = AdjustmentSchedule.builder();
        for (var entry : defs.entrySet()) {
            for (ArrayDefinition.AdjustmentDef ad : entry.getValue()) {
                if (ad.getType() == null)
                    throw new IllegalArgumentException("Adjustment at row " + entry.getKey() + " has no type");
                b.add(entry.getKey(), AdjustmentType.fromString(ad.getType()).create(ad));
            }
        }
        return b.build();
    }

    private static Mask compileMask(List<List<Boolean>> cells) {
        if (cells == null)
            return Mask.NOMASK;
        boolean[][] m = new boolean[cells.size()][];
        for (int r = 0; r < m.length; r++) {
            List<Boolean> row = cells.get(r);
            m[r] = new boolean[row.size()];
            for (int c = 0; c < m[r].length; c++)
                m[r][c] = Boolean.TRUE.equals(row.get(c));
        }
        return Mask.of(m);
    }

    private static Float64Array float64(List<List<Object>> rows, int nrows, int ncols) {
        double[] flat = new double[nrows * ncols];
        for (int r = 0; r < nrows; r++)
            for (int c = 0; c < ncols; c++)
                flat[r * ncols + c] = toDouble(rows.get(r).get(c));
        return Float64Array.fromRowMajor(nrows, ncols, flat);
    }

    private static Int64Array int64(List<List<Object>> rows, int nrows, int ncols, DType dtype) {
        long[] flat = new long[nrows * ncols];
        for (int r = 0; r < nrows; r++) {
            for (int c = 0; c < ncols; c++) {
                Object cell = rows.get(r).get(c);
                flat[r * ncols + c] = dtype == DType.DATETIME64 ? toNanos(cell) : toLong(cell);
            }
        }
        return Int64Array.fromRowMajor(dtype, nrows, ncols, flat);
    }

    private static LabelArray labels(List<List<Object>> rows, int nrows, int ncols, String missing) {
        String[][] cells = new String[nrows][ncols];
        for (int r = 0; r < nrows; r++)
            for (int c = 0; c < ncols; c++) {
                Object cell = rows.get(r).get(c);
                cells[r][c] = cell == null ? null : toLabel(cell);
            }
        return LabelArray.encode(cells, missing);
    }

    private static Object toMissingValue(DType dtype, Object value) {
        return switch (dtype) {
            case FLOAT64 -> toDouble(value);
            case DATETIME64 -> toNanos(value);
            default -> MissingValues.coerce(dtype, value);
        };
    }

    static double toDouble(Object value) {
        if (value == null)
            return Double.NaN;
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof String s) {
            if ("nan".equalsIgnoreCase(s))
                return Double.NaN;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a float64 value: '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException("Not a float64 value: " + value);
    }

    static long toLong(Object value) {
        if (!(value instanceof Number))
            throw new IllegalArgumentException("Not an int64 value: " + value);
        return (Long) MissingValues.coerce(DType.INT64, value);
    }

    static long toNanos(Object value) {
        if (value == null)
            return Datetimes.NAT;
        if (value instanceof String s) {
            try {
                return Datetimes.parse(s);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not a datetime64[ns] value: '" + s + "'", e);
            }
        }
        if (value instanceof Instant i)
            return Datetimes.toNanos(i);
        return (Long) MissingValues.coerce(DType.DATETIME64, value);
    }

    static String toLabel(Object value) {
        if (value instanceof String s)
            return s;
        throw new IllegalArgumentException("Not a string value: " + value);
    }
}
