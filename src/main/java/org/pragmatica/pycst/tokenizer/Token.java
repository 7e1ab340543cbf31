package org.pragmatica.pycst.tokenizer;

import org.pragmatica.pycst.tree.SourceLocation;
import org.pragmatica.pycst.tree.SourceSpan;

/**
 * A lexical token with its position and the whitespace cells on either side of it.
 * Zero-width INDENT and DEDENT tokens use the cell of the token that follows them for both sides.
 */
public record Token(TokenType type,
                    String text,
                    SourceLocation start,
                    SourceLocation end,
                    WhitespaceCell whitespaceBefore,
                    WhitespaceCell whitespaceAfter) {

    public SourceSpan span() {
        return SourceSpan.of(start, end);
    }

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    /**
     * A NAME token with the given text; covers hard and soft keywords.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.NAME && text.equals(keyword);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Text shown in error messages.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "newline";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case ENDMARKER -> "end of file";
            default -> text;
        };
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + start;
    }
}
