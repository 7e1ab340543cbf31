package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.codegen.CodegenState;

import java.util.Optional;

/**
 * A line terminator. An empty value means the default newline of the module; an empty
 * string marks the end of a file that has no final line break.
 */
public record Newline(Optional<String> value) implements Codegen {
    public static final Newline DEFAULT = new Newline(Optional.empty());
    public static final Newline NONE = new Newline(Optional.of(""));

    public static Newline of(String value) {
        return new Newline(Optional.of(value));
    }

    @Override
    public void codegen(CodegenState state) {
        state.addNewline(value);
    }
}
