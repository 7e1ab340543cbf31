package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;

/**
 * Spaces, tabs, form feeds and backslash line continuations on a single logical line.
 */
public record SimpleWhitespace(String value) implements ParenthesizableWhitespace {
    public static final SimpleWhitespace EMPTY = new SimpleWhitespace("");
    public static final SimpleWhitespace SPACE = new SimpleWhitespace(" ");

    public static SimpleWhitespace of(String value) {
        return value.isEmpty()
               ? EMPTY
               : new SimpleWhitespace(value);
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public void codegen(CodegenState state) {
        state.addToken(value);
    }
}
