package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

import java.util.Optional;

/**
 * End of a logical line: whitespace, an optional comment and the newline.
 */
public record TrailingWhitespace(SimpleWhitespace whitespace,
                                 Optional<Comment> comment,
                                 Newline newline) implements Codegen {
    public static final TrailingWhitespace DEFAULT = new TrailingWhitespace(SimpleWhitespace.EMPTY,
                                                                            Optional.empty(),
                                                                            Newline.DEFAULT);

    @Override
    public void codegen(CodegenState state) {
        whitespace.codegen(state);
        comment.ifPresent(c -> c.codegen(state));
        newline.codegen(state);
    }
}
