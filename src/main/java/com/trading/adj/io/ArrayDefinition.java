package com.trading.adj.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.Data;

/**
 * POJO representation of an adjusted array as handed over by a loader.
 *
 * <pre>
 * {
 *   "name": "close",
 *   "dtype": "float64",
 *   "missing_value": "nan",
 *   "data": [[1.0, 2.0], [3.0, 4.0]],
 *   "mask": [[true, true], [true, false]],
 *   "adjustments": {
 *     "1": [{"type": "Float64Multiply", "first_row": 0, "last_row": 0,
 *            "first_col": 0, "last_col": 1, "value": 0.5}]
 *   }
 * }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ArrayDefinition {
    private String name, dtype;
    private Object missingValue;
    private List<List<Object>> data;
    private List<List<Boolean>> mask;
    private Map<Integer, List<AdjustmentDef>> adjustments;

    /** A single adjustment record. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static final class AdjustmentDef {
        private String type;
        private int firstRow, lastRow, firstCol, lastCol;
        private Object value;
    }
}
