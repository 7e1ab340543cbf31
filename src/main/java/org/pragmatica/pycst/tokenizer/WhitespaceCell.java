package org.pragmatica.pycst.tokenizer;

/**
 * The stretch of source text between two adjacent tokens: spaces, comments, blank lines,
 * line continuations. Adjacent tokens share a single cell (the cell after one token is the
 * cell before the next).
 *
 * <p>The cell is read front to back by exactly one writer, the inflation pass, which claims
 * prefixes of the remaining text through {@link #advance(int)}. Once inflation is complete,
 * every cell must be {@link #exhausted()}.
 */
public final class WhitespaceCell {
    private final String source;
    private final int start;
    private final int end;
    private int cursor;

    public WhitespaceCell(String source, int start, int end) {
        if (start < 0 || end < start || end > source.length()) {
            throw new IllegalArgumentException("Invalid cell bounds " + start + ".." + end);
        }
        this.source = source;
        this.start = start;
        this.end = end;
        this.cursor = start;
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    /**
     * Char offset of the first unclaimed character.
     */
    public int cursor() {
        return cursor;
    }

    public String text() {
        return source.substring(start, end);
    }

    public String remaining() {
        return source.substring(cursor, end);
    }

    public int remainingLength() {
        return end - cursor;
    }

    public char peek(int offset) {
        return source.charAt(cursor + offset);
    }

    public boolean startsWith(String prefix) {
        return source.startsWith(prefix, cursor) && cursor + prefix.length() <= end;
    }

    /**
     * Claim the next {@code count} characters and return them.
     */
    public String advance(int count) {
        if (count < 0 || cursor + count > end) {
            throw new IllegalStateException("Cannot claim " + count + " chars, " + remainingLength() + " left");
        }
        var claimed = source.substring(cursor, cursor + count);
        cursor += count;
        return claimed;
    }

    public boolean exhausted() {
        return cursor == end;
    }

    @Override
    public String toString() {
        return "WhitespaceCell[" + start + ".." + end + ", cursor=" + cursor + "]";
    }
}
