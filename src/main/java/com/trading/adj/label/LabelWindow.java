package com.trading.adj.label;

import com.trading.adj.api.ArrayWindow;
import com.trading.adj.api.DType;

import java.util.List;

/**
 * Read-only window over a {@link LabelArray}.
 *
 * Wraps a view of the working buffer and exposes only readers, so consumers
 * can neither write cells nor register new labels through it.
 */
public final class LabelWindow implements ArrayWindow {
    private final LabelArray view;
    private final int startRow;

    LabelWindow(LabelArray view, int startRow) {
        this.view = view;
        this.startRow = startRow;
    }

    @Override
    public DType dtype() {
        return DType.LABEL;
    }

    @Override
    public int rows() {
        return view.rows();
    }

    @Override
    public int cols() {
        return view.cols();
    }

    @Override
    public int startRow() {
        return startRow;
    }

    public String valueAt(int row, int col) {
        return view.valueAt(row, col);
    }

    public int codeAt(int row, int col) {
        return view.codeAt(row, col);
    }

    public boolean isMissing(int row, int col) {
        return view.isMissing(row, col);
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    public String missingValue() {
        return view.missingValue();
    }

    /** Strings indexed by code, unmodifiable. */
    public List<String> categories() {
        return view.vocabulary().categories();
    }

    public String[][] decode() {
        return view.decode();
    }

    /** Detached copy; labels written to it never reach the traversal's vocabulary. */
    @Override
    public LabelArray copy() {
        return view.detach();
    }

    @Override
    public String toString() {
        return "LabelWindow[start=" + startRow + ", shape=(" + rows() + ", " + cols() + ")]";
    }
}
