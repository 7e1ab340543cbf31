package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator tokens with the whitespace they own.
 */
public sealed interface Operator extends Codegen {

    enum BinaryKind {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        FLOOR_DIVIDE("//"),
        MODULO("%"),
        POWER("**"),
        MATRIX_MULTIPLY("@"),
        LEFT_SHIFT("<<"),
        RIGHT_SHIFT(">>"),
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^");

        private final String symbol;

        BinaryKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<BinaryKind> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(kind -> kind.symbol.equals(symbol))
                         .findFirst();
        }
    }

    enum UnaryKind {
        PLUS("+"),
        MINUS("-"),
        BIT_INVERT("~"),
        NOT("not");

        private final String symbol;

        UnaryKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<UnaryKind> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(kind -> kind.symbol.equals(symbol))
                         .findFirst();
        }
    }

    enum BooleanKind {
        AND("and"),
        OR("or");

        private final String symbol;

        BooleanKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /**
     * Comparison operators; {@code not in} and {@code is not} are written as two words.
     */
    enum CompKind {
        LESS_THAN("<", ""),
        GREATER_THAN(">", ""),
        EQUAL("==", ""),
        NOT_EQUAL("!=", ""),
        LESS_THAN_EQUAL("<=", ""),
        GREATER_THAN_EQUAL(">=", ""),
        IN("in", ""),
        NOT_IN("not", "in"),
        IS("is", ""),
        IS_NOT("is", "not");

        private final String first;
        private final String second;

        CompKind(String first, String second) {
            this.first = first;
            this.second = second;
        }

        public String first() {
            return first;
        }

        public String second() {
            return second;
        }

        public boolean twoWords() {
            return !second.isEmpty();
        }

        public static Optional<CompKind> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(kind -> !kind.twoWords() && kind.first.equals(symbol))
                         .findFirst();
        }
    }

    enum AugKind {
        ADD_ASSIGN("+="),
        SUBTRACT_ASSIGN("-="),
        MULTIPLY_ASSIGN("*="),
        DIVIDE_ASSIGN("/="),
        FLOOR_DIVIDE_ASSIGN("//="),
        MODULO_ASSIGN("%="),
        POWER_ASSIGN("**="),
        MATRIX_MULTIPLY_ASSIGN("@="),
        LEFT_SHIFT_ASSIGN("<<="),
        RIGHT_SHIFT_ASSIGN(">>="),
        BIT_AND_ASSIGN("&="),
        BIT_OR_ASSIGN("|="),
        BIT_XOR_ASSIGN("^=");

        private final String symbol;

        AugKind(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Optional<AugKind> fromSymbol(String symbol) {
            return Arrays.stream(values())
                         .filter(kind -> kind.symbol.equals(symbol))
                         .findFirst();
        }
    }

    record BinaryOperator(BinaryKind kind,
                          ParenthesizableWhitespace whitespaceBefore,
                          ParenthesizableWhitespace whitespaceAfter) implements Operator {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(kind.symbol());
            whitespaceAfter.codegen(state);
        }
    }

    record UnaryOperator(UnaryKind kind, ParenthesizableWhitespace whitespaceAfter) implements Operator {
        @Override
        public void codegen(CodegenState state) {
            state.addToken(kind.symbol());
            whitespaceAfter.codegen(state);
        }
    }

    record BooleanOperator(BooleanKind kind,
                           ParenthesizableWhitespace whitespaceBefore,
                           ParenthesizableWhitespace whitespaceAfter) implements Operator {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(kind.symbol());
            whitespaceAfter.codegen(state);
        }
    }

    /**
     * @param whitespaceBetween whitespace between the two words of {@code not in} / {@code is not}
     */
    record CompOperator(CompKind kind,
                        ParenthesizableWhitespace whitespaceBefore,
                        Optional<ParenthesizableWhitespace> whitespaceBetween,
                        ParenthesizableWhitespace whitespaceAfter) implements Operator {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(kind.first());
            if (kind.twoWords()) {
                whitespaceBetween.orElse(SimpleWhitespace.SPACE)
                                 .codegen(state);
                state.addToken(kind.second());
            }
            whitespaceAfter.codegen(state);
        }
    }

    record AugOperator(AugKind kind,
                       ParenthesizableWhitespace whitespaceBefore,
                       ParenthesizableWhitespace whitespaceAfter) implements Operator {
        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.addToken(kind.symbol());
            whitespaceAfter.codegen(state);
        }
    }
}
