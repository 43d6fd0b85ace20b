package com.trading.adj.label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only dictionary mapping distinct strings to dense integer codes.
 *
 * Code {@link #MISSING_CODE} is reserved for the missing value and assigned
 * at construction, so no real string can collide with it. Codes are never
 * reassigned or removed: once issued, a code decodes to the same string for
 * the lifetime of the vocabulary. That is what lets every array derived from
 * one encoder share a single vocabulary by reference.
 *
 * Not thread-safe. Registration only happens during encoding and overwrite
 * adjustments, both single-threaded.
 */
public final class Vocabulary {
    public static final int MISSING_CODE = 0;

    private final String missingValue;
    private final List<String> categories = new ArrayList<>();
    private final Map<String, Integer> codes = new HashMap<>();

    Vocabulary(String missingValue) {
        if (missingValue == null)
            throw new IllegalArgumentException("Missing value must not be null");
        this.missingValue = missingValue;
        categories.add(missingValue);
        codes.put(missingValue, MISSING_CODE);
    }

    public String missingValue() {
        return missingValue;
    }

    /**
     * Returns the code for {@code value}, registering it if unseen. {@code null}
     * maps to the missing code.
     */
    public int codeOf(String value) {
        if (value == null)
            return MISSING_CODE;
        Integer code = codes.get(value);
        if (code != null)
            return code;
        int next = categories.size();
        categories.add(value);
        codes.put(value, next);
        return next;
    }

    /** Returns the code for {@code value}, or -1 if it was never registered. */
    public int indexOf(String value) {
        if (value == null)
            return MISSING_CODE;
        Integer code = codes.get(value);
        return code == null ? -1 : code;
    }

    /**
     * @throws IndexOutOfBoundsException if the code was never issued.
     */
    public String lookup(int code) {
        if (code < 0 || code >= categories.size())
            throw new IndexOutOfBoundsException("Unknown label code: " + code + " (size=" + categories.size() + ")");
        return categories.get(code);
    }

    /** Independent copy issuing the same codes. */
    Vocabulary copy() {
        Vocabulary out = new Vocabulary(missingValue);
        for (int code = 1; code < categories.size(); code++)
            out.codeOf(categories.get(code));
        return out;
    }

    public int size() {
        return categories.size();
    }

    /** Unmodifiable view of all registered strings, indexed by code. */
    public List<String> categories() {
        return Collections.unmodifiableList(categories);
    }

    @Override
    public String toString() {
        return "Vocabulary" + categories;
    }
}
