package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

/**
 * Delimiter tokens together with the whitespace they own.
 */
public sealed interface Punctuation extends Codegen {

    record Comma(ParenthesizableWhitespace whitespaceBefore, ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        public static final Comma DEFAULT = new Comma(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE);

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(",");
            whitespaceAfter.codegen(state);
        }
    }

    record Dot(ParenthesizableWhitespace whitespaceBefore, ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        public static final Dot DEFAULT = new Dot(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(".");
            whitespaceAfter.codegen(state);
        }
    }

    record Colon(ParenthesizableWhitespace whitespaceBefore, ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(":");
            whitespaceAfter.codegen(state);
        }
    }

    record Semicolon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(";");
            whitespaceAfter.codegen(state);
        }
    }

    record AssignEqual(ParenthesizableWhitespace whitespaceBefore, ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken("=");
            whitespaceAfter.codegen(state);
        }
    }

    record BitOr(ParenthesizableWhitespace whitespaceBefore, ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken("|");
            whitespaceAfter.codegen(state);
        }
    }

    record LeftParen(ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            state.addToken("(");
            whitespaceAfter.codegen(state);
        }
    }

    record RightParen(ParenthesizableWhitespace whitespaceBefore) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(")");
        }
    }

    record LeftSquareBracket(ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            state.addToken("[");
            whitespaceAfter.codegen(state);
        }
    }

    record RightSquareBracket(ParenthesizableWhitespace whitespaceBefore) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken("]");
        }
    }

    record LeftCurlyBrace(ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            state.addToken("{");
            whitespaceAfter.codegen(state);
        }
    }

    record RightCurlyBrace(ParenthesizableWhitespace whitespaceBefore) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken("}");
        }
    }

    /**
     * The {@code async} keyword of a definition, loop, context manager or comprehension.
     */
    record Asynchronous(ParenthesizableWhitespace whitespaceAfter) implements Punctuation {
        @Override
        public void codegen(CodegenState state) {
            state.addToken("async");
            whitespaceAfter.codegen(state);
        }
    }
}
