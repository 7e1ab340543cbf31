package org.pragmatica.pycst.error;

import org.pragmatica.pycst.tree.SourceLocation;

/**
 * Raised when source text cannot be tokenized or parsed. No partial tree is ever produced.
 */
public final class PythonParseException extends Exception {
    private final ParseError error;

    public PythonParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public SourceLocation location() {
        return error.location();
    }
}
