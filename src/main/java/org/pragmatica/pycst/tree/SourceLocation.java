package org.pragmatica.pycst.tree;

/**
 * A position in source text: line and column are 1-based, {@code offset} is the
 * UTF-16 char index and {@code byteOffset} the UTF-8 byte index of the same position.
 */
public record SourceLocation(int line, int column, int offset, int byteOffset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0, 0);

    public static SourceLocation at(int line, int column, int offset, int byteOffset) {
        return new SourceLocation(line, column, offset, byteOffset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
