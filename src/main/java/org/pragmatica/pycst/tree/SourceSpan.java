package org.pragmatica.pycst.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive), with full locations at both ends.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * The same range expressed in UTF-8 byte offsets.
     */
    public Span bytes() {
        return Span.of(start.byteOffset(), end.byteOffset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
