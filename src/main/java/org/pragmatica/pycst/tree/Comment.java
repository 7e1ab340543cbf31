package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

/**
 * A comment, including the leading {@code #}.
 */
public record Comment(String value) implements Codegen {
    public Comment {
        if (!value.startsWith("#")) {
            throw new IllegalArgumentException("Comment must start with '#': " + value);
        }
    }

    @Override
    public void codegen(CodegenState state) {
        state.addToken(value);
    }
}
