package com.hwapi.core.parser.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A read-only view of a range of characters in a larger source string.
 *
 * <p>Slices never copy the characters they cover; {@link #toString()} is the only
 * operation that materializes a new {@link String}. This lets a parsed catalog keep
 * references into its source text instead of one string per cell.
 *
 * <p>Two slices are equal when they cover the same character content, regardless of
 * which source they point into. {@link #hashCode()} matches {@link String#hashCode()}
 * for the same content.
 */
public final class TextSlice implements CharSequence, Comparable<TextSlice> {

    private final String source;
    private final int start;
    private final int end;

    private int hash;

    private TextSlice(String source, int start, int end) {
        this.source = source;
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a slice covering {@code source[start, end)}.
     *
     * @param source backing text
     * @param start first character (inclusive)
     * @param end last character (exclusive)
     * @return slice view
     */
    public static TextSlice of(String source, int start, int end) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.checkFromToIndex(start, end, source.length());
        return new TextSlice(source, start, end);
    }

    /**
     * Creates a slice covering all of {@code source}.
     *
     * @param source backing text
     * @return slice view
     */
    public static TextSlice of(String source) {
        return of(source, 0, source.length());
    }

    @Override
    public int length() {
        return end - start;
    }

    @Override
    public char charAt(int index) {
        Objects.checkIndex(index, length());
        return source.charAt(start + index);
    }

    @Override
    public TextSlice subSequence(int from, int to) {
        Objects.checkFromToIndex(from, to, length());
        return new TextSlice(source, start + from, start + to);
    }

    /**
     * Returns this slice without leading and trailing whitespace.
     *
     * @return narrowed view over the same source
     */
    public TextSlice strip() {
        int from = start;
        int to = end;
        while (from < to && Character.isWhitespace(source.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(source.charAt(to - 1))) {
            to--;
        }
        return from == start && to == end ? this : new TextSlice(source, from, to);
    }

    /**
     * Splits this slice around every occurrence of {@code delimiter}.
     *
     * <p>Empty pieces are kept, including trailing ones, so {@code "a,,b,"} split on
     * {@code ","} yields four slices.
     *
     * @param delimiter non-empty separator
     * @return pieces in source order
     */
    public List<TextSlice> split(String delimiter) {
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        List<TextSlice> pieces = new ArrayList<>();
        int from = start;
        int found = source.indexOf(delimiter, from);
        while (found >= 0 && found + delimiter.length() <= end) {
            pieces.add(new TextSlice(source, from, found));
            from = found + delimiter.length();
            found = source.indexOf(delimiter, from);
        }
        pieces.add(new TextSlice(source, from, end));
        return pieces;
    }

    @Override
    public int compareTo(TextSlice other) {
        int limit = Math.min(length(), other.length());
        for (int i = 0; i < limit; i++) {
            int difference = charAt(i) - other.charAt(i);
            if (difference != 0) {
                return difference;
            }
        }
        return length() - other.length();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TextSlice slice) || slice.length() != length()) {
            return false;
        }
        return source.regionMatches(start, slice.source, slice.start, length());
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && length() > 0) {
            for (int i = start; i < end; i++) {
                h = 31 * h + source.charAt(i);
            }
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return source.substring(start, end);
    }
}
