package org.pragmatica.pycst.tokenizer;

/**
 * Token kinds produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    /**
     * Zero-width; the token text is the indentation added relative to the enclosing block.
     */
    INDENT,
    /**
     * Zero-width.
     */
    DEDENT,
    ENDMARKER
}
