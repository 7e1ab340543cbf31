package org.pragmatica.pycst.error;

import org.pragmatica.pycst.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Lexical error: bad indentation, unterminated literal or bracket, stray character.
     */
    record TokenizeError(SourceLocation location, String reason) implements ParseError {
        @Override
        public String message() {
            return reason + " at " + location;
        }
    }

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(SourceLocation location, String found, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(SourceLocation location, String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }
    }
}
