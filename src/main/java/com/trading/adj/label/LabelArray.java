package com.trading.adj.label;

import com.trading.adj.api.ColumnarArray;
import com.trading.adj.api.DType;
import com.trading.adj.mask.Mask;
import com.trading.adj.util.ArrayFormat;
import com.trading.adj.util.MissingValues;
import com.trading.adj.util.Regions;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Label-encoded 2-D string array.
 *
 * <p>
 * Cells hold integer codes into a {@link Vocabulary}; the vocabulary maps codes
 * back to strings. The missing value always has code
 * {@link Vocabulary#MISSING_CODE}.
 *
 * <p>
 * <b>Storage:</b> codes live in a row-major {@code int[]} addressed through an
 * offset and a row stride, so {@link #view(int, int, int, int)} can narrow an
 * array without copying. Views share both the code storage and the vocabulary
 * with their parent; writes through a view are visible in the parent.
 * {@link #copy()} detaches the codes but still shares the vocabulary; codes it
 * already issued stay valid because the vocabulary only ever grows.
 * {@link #detach()} copies the vocabulary too.
 *
 * <p>
 * <b>Equality</b> is by decoded value. Two arrays encoded from different raw
 * representations, with different code assignments, are equal as long as
 * every cell decodes to the same string.
 */
public final class LabelArray implements ColumnarArray<LabelWindow> {
    private final Vocabulary vocabulary;
    private final int[] codes;
    private final int offset;
    private final int rowStride;
    private final int rows;
    private final int cols;

    private LabelArray(Vocabulary vocabulary, int[] codes, int offset, int rowStride, int rows, int cols) {
        this.vocabulary = vocabulary;
        this.codes = codes;
        this.offset = offset;
        this.rowStride = rowStride;
        this.rows = rows;
        this.cols = cols;
    }

    /**
     * Encodes a rectangular matrix of strings. {@code null} cells encode as
     * missing.
     *
     * @throws IllegalArgumentException if the matrix is ragged or the missing
     *                                  value is null.
     */
    public static LabelArray encode(String[][] raw, String missingValue) {
        Vocabulary vocab = new Vocabulary(missingValue);
        int rows = raw.length;
        int cols = rows == 0 ? 0 : raw[0].length;
        int[] codes = new int[rows * cols];
        for (int r = 0; r < rows; r++) {
            if (raw[r].length != cols)
                throw new IllegalArgumentException(
                        "Ragged input: row " + r + " has " + raw[r].length + " columns, expected " + cols);
            for (int c = 0; c < cols; c++)
                codes[r * cols + c] = vocab.codeOf(raw[r][c]);
        }
        return new LabelArray(vocab, codes, 0, cols, rows, cols);
    }

    /**
     * Encodes a matrix of fixed-width byte strings in {@code charset}. Trailing
     * NUL padding is stripped from each cell before decoding.
     *
     * @throws IllegalArgumentException if {@code missingValue} cannot be encoded
     *                                  in {@code charset}, or a cell is not valid
     *                                  in it.
     */
    public static LabelArray encode(byte[][][] raw, Charset charset, String missingValue) {
        if (missingValue == null || !charset.newEncoder().canEncode(missingValue))
            throw new IllegalArgumentException(
                    "Missing value " + quote(missingValue) + " is not representable in " + charset.name());
        String[][] decoded = new String[raw.length][];
        for (int r = 0; r < raw.length; r++) {
            decoded[r] = new String[raw[r].length];
            for (int c = 0; c < raw[r].length; c++)
                decoded[r][c] = raw[r][c] == null ? null : decodeCell(raw[r][c], charset, r, c);
        }
        return encode(decoded, missingValue);
    }

    private static String decodeCell(byte[] bytes, Charset charset, int row, int col) {
        int len = bytes.length;
        while (len > 0 && bytes[len - 1] == 0)
            len--;
        try {
            CharBuffer chars = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, len));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException(
                    "Cell (" + row + ", " + col + ") is not valid " + charset.name(), e);
        }
    }

    @Override
    public DType dtype() {
        return DType.LABEL;
    }

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int cols() {
        return cols;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public String missingValue() {
        return vocabulary.missingValue();
    }

    public int codeAt(int row, int col) {
        return codes[index(row, col)];
    }

    public String valueAt(int row, int col) {
        return vocabulary.lookup(codeAt(row, col));
    }

    @Override
    public Object get(int row, int col) {
        return valueAt(row, col);
    }

    public boolean isMissing(int row, int col) {
        return codeAt(row, col) == Vocabulary.MISSING_CODE;
    }

    /** Decodes every cell back to its string. */
    public String[][] decode() {
        String[][] out = new String[rows][cols];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                out[r][c] = vocabulary.lookup(codes[offset + r * rowStride + c]);
        return out;
    }

    /** Distinct strings present in this array, in code order. */
    public Set<String> unique() {
        boolean[] seen = new boolean[vocabulary.size()];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                seen[codes[offset + r * rowStride + c]] = true;
        Set<String> out = new LinkedHashSet<>();
        for (int code = 0; code < seen.length; code++)
            if (seen[code])
                out.add(vocabulary.lookup(code));
        return Collections.unmodifiableSet(out);
    }

    /**
     * Returns a view over rows {@code [rowStart, rowEnd)} and columns
     * {@code [colStart, colEnd)}. Shares code storage and vocabulary.
     */
    public LabelArray view(int rowStart, int rowEnd, int colStart, int colEnd) {
        if (rowStart < 0 || rowEnd > rows || rowStart > rowEnd || colStart < 0 || colEnd > cols
                || colStart > colEnd) {
            throw new IndexOutOfBoundsException("View rows [" + rowStart + ", " + rowEnd + ") cols [" + colStart
                    + ", " + colEnd + ") out of bounds for shape " + shapeString());
        }
        return new LabelArray(vocabulary, codes, offset + rowStart * rowStride + colStart, rowStride,
                rowEnd - rowStart, colEnd - colStart);
    }

    /**
     * Writes {@code value} into every cell of the inclusive region, registering
     * it in the vocabulary if unseen.
     */
    public void set(int firstRow, int lastRow, int firstCol, int lastCol, String value) {
        Regions.check(firstRow, lastRow, firstCol, lastCol, rows, cols);
        int code = vocabulary.codeOf(value);
        for (int r = firstRow; r <= lastRow; r++) {
            int base = offset + r * rowStride;
            for (int c = firstCol; c <= lastCol; c++)
                codes[base + c] = code;
        }
    }

    public void set(int row, int col, String value) {
        codes[index(row, col)] = vocabulary.codeOf(value);
    }

    @Override
    public LabelArray copy() {
        int[] compact = new int[rows * cols];
        for (int r = 0; r < rows; r++)
            System.arraycopy(codes, offset + r * rowStride, compact, r * cols, cols);
        return new LabelArray(vocabulary, compact, 0, cols, rows, cols);
    }

    /** Like {@link #copy()}, but with a private copy of the vocabulary as well. */
    @Override
    public LabelArray detach() {
        LabelArray out = copy();
        return new LabelArray(vocabulary.copy(), out.codes, 0, cols, rows, cols);
    }

    @Override
    public void fillMissing(Mask mask, Object missingValue) {
        String missing = (String) MissingValues.coerce(DType.LABEL, missingValue);
        int code = vocabulary.codeOf(missing);
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                if (!mask.isValid(r, c))
                    codes[offset + r * rowStride + c] = code;
    }

    @Override
    public LabelWindow window(int startRow, int length) {
        Regions.checkRowRange(startRow, length, rows);
        return new LabelWindow(view(startRow, startRow + length, 0, cols), startRow);
    }

    @Override
    public String format() {
        String[] cells = new String[rows * cols];
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                cells[r * cols + c] = ArrayFormat.stringCell(valueAt(r, c));
        return ArrayFormat.grid("LabelArray(", cells, rows, cols,
                ", missing_value=" + ArrayFormat.stringCell(missingValue()), false);
    }

    private int index(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols)
            throw new IndexOutOfBoundsException(
                    "Cell (" + row + ", " + col + ") out of bounds for shape " + shapeString());
        return offset + row * rowStride + col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LabelArray other))
            return false;
        if (rows != other.rows || cols != other.cols)
            return false;
        boolean sameVocab = vocabulary == other.vocabulary;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                int a = codes[offset + r * rowStride + c];
                int b = other.codes[other.offset + r * other.rowStride + c];
                if (sameVocab ? a != b : !vocabulary.lookup(a).equals(other.vocabulary.lookup(b)))
                    return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 31 * rows + cols;
        for (int r = 0; r < rows; r++)
            for (int c = 0; c < cols; c++)
                h = 31 * h + valueAt(r, c).hashCode();
        return h;
    }

    @Override
    public String toString() {
        return format();
    }

    private static String quote(String s) {
        return s == null ? "null" : "'" + s + "'";
    }
}
