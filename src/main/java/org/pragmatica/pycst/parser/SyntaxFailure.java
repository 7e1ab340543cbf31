package org.pragmatica.pycst.parser;

import org.pragmatica.pycst.tokenizer.Token;

/**
 * Control-flow signal for a failed grammar alternative. Carries no stack trace; it never escapes
 * the parser. A fatal failure is not subject to backtracking.
 */
final class SyntaxFailure extends RuntimeException {
    private final Token token;
    private final String expected;
    private final boolean fatal;

    SyntaxFailure(Token token, String expected, boolean fatal) {
        super("expected " + expected + " at " + token, null, false, false);
        this.token = token;
        this.expected = expected;
        this.fatal = fatal;
    }

    Token token() {
        return token;
    }

    String expected() {
        return expected;
    }

    boolean fatal() {
        return fatal;
    }
}
