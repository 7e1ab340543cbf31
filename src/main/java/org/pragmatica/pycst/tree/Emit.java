package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

import java.util.List;
import java.util.Optional;

/**
 * Codegen helpers shared by the node records.
 */
final class Emit {
    private static final String DEFAULT_SEPARATOR = ", ";

    private Emit() {}

    static void all(CodegenState state, List<? extends Codegen> items) {
        for (var item : items) {
            item.codegen(state);
        }
    }

    static void optional(CodegenState state, Optional<? extends Codegen> item) {
        item.ifPresent(value -> value.codegen(state));
    }

    /**
     * Emit list elements, synthesizing {@code ", "} where an element other than the last has no comma.
     */
    static void separated(CodegenState state, List<? extends CommaSeparated> items) {
        separated(state, items, false);
    }

    static void separated(CodegenState state, List<? extends CommaSeparated> items, boolean moreFollow) {
        for (int i = 0; i < items.size(); i++) {
            var item = items.get(i);
            item.codegen(state);
            if (item.comma().isEmpty() && (i < items.size() - 1 || moreFollow)) {
                state.addToken(DEFAULT_SEPARATOR);
            }
        }
    }

    static void parenthesized(CodegenState state,
                              List<Punctuation.LeftParen> lpar,
                              List<Punctuation.RightParen> rpar,
                              Runnable body) {
        all(state, lpar);
        body.run();
        all(state, rpar);
    }

    /**
     * Small statements of one line, synthesizing {@code "; "} where a statement other than the last
     * has no semicolon and {@code pass} for an empty line.
     */
    static void smallStatements(CodegenState state, List<SmallStatement> body) {
        if (body.isEmpty()) {
            state.addToken("pass");
            return;
        }
        for (int i = 0; i < body.size(); i++) {
            var statement = body.get(i);
            statement.codegen(state);
            if (statement.semicolon().isEmpty() && i < body.size() - 1) {
                state.addToken("; ");
            }
        }
    }

    /**
     * Statement header lines followed by the indentation of the statement's own line.
     */
    static void leading(CodegenState state, List<EmptyLine> leadingLines) {
        all(state, leadingLines);
        state.addIndent();
    }
}
