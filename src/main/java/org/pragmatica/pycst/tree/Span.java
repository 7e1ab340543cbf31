package org.pragmatica.pycst.tree;

/**
 * A range of UTF-8 byte offsets into the original source, start inclusive, end exclusive.
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span " + start + ".." + end);
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    public boolean contains(int offset) {
        return start <= offset && offset < end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
