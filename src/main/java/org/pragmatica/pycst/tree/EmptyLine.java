package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

import java.util.Optional;

/**
 * A blank or comment-only line.
 *
 * @param indent whether the line starts with the indentation of the enclosing block
 */
public record EmptyLine(boolean indent,
                        SimpleWhitespace whitespace,
                        Optional<Comment> comment,
                        Newline newline) implements Codegen {

    public static EmptyLine blank() {
        return new EmptyLine(true, SimpleWhitespace.EMPTY, Optional.empty(), Newline.DEFAULT);
    }

    @Override
    public void codegen(CodegenState state) {
        if (indent) {
            state.addIndent();
        }
        whitespace.codegen(state);
        comment.ifPresent(c -> c.codegen(state));
        newline.codegen(state);
    }
}
