package com.trading.adj.io;

import com.trading.adj.adjustment.*;

/**
 * Registry of adjustment record types that may appear in an
 * {@link ArrayDefinition}, each with the factory that builds it.
 */
public enum AdjustmentType {
    FLOAT64_MULTIPLY(Float64Multiply.class, d -> new Float64Multiply(d.getFirstRow(), d.getLastRow(),
            d.getFirstCol(), d.getLastCol(), JsonArrayCompiler.toDouble(d.getValue()))),
    FLOAT64_OVERWRITE(Float64Overwrite.class, d -> new Float64Overwrite(d.getFirstRow(), d.getLastRow(),
            d.getFirstCol(), d.getLastCol(), JsonArrayCompiler.toDouble(d.getValue()))),
    INT64_OVERWRITE(Int64Overwrite.class, d -> new Int64Overwrite(d.getFirstRow(), d.getLastRow(),
            d.getFirstCol(), d.getLastCol(), JsonArrayCompiler.toLong(d.getValue()))),
    DATETIME64_OVERWRITE(Datetime64Overwrite.class, d -> new Datetime64Overwrite(d.getFirstRow(), d.getLastRow(),
            d.getFirstCol(), d.getLastCol(), JsonArrayCompiler.toNanos(d.getValue()))),
    OBJECT_OVERWRITE(ObjectOverwrite.class, d -> new ObjectOverwrite(d.getFirstRow(), d.getLastRow(),
            d.getFirstCol(), d.getLastCol(), JsonArrayCompiler.toLabel(d.getValue())));

    private final Class<? extends Adjustment> adjustmentClass;
    private final JsonArrayCompiler.AdjustmentFactory factory;

    AdjustmentType(Class<? extends Adjustment> adjustmentClass, JsonArrayCompiler.AdjustmentFactory factory) {
        this.adjustmentClass = adjustmentClass;
        this.factory = factory;
    }

    public Class<? extends Adjustment> getAdjustmentClass() {
        return adjustmentClass;
    }

    public JsonArrayCompiler.AdjustmentFactory getFactory() {
        return factory;
    }

    public Adjustment create(ArrayDefinition.AdjustmentDef def) {
        return factory.create(def);
    }

    /**
     * Accepts the enum name ({@code FLOAT64_MULTIPLY}) or the record class name
     * ({@code Float64Multiply}), case-insensitively.
     */
    public static AdjustmentType fromString(String text) {
        for (AdjustmentType t : AdjustmentType.values()) {
            if (t.name().equalsIgnoreCase(text) || t.adjustmentClass.getSimpleName().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown AdjustmentType: " + text);
    }

    public static AdjustmentType of(Adjustment adjustment) {
        for (AdjustmentType t : AdjustmentType.values()) {
            if (t.adjustmentClass == adjustment.getClass()) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unregistered adjustment class: " + adjustment.getClass().getName());
    }
}
