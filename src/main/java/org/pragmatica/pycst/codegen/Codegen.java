package org.pragmatica.pycst.codegen;

/**
 * Anything that can write its exact source text into a {@link CodegenState}.
 */
@FunctionalInterface
public interface Codegen {
    void codegen(CodegenState state);

    /**
     * Render this element on its own, using default indentation and newline.
     */
    default String code() {
        var state = CodegenState.create("    ", "\n");
        codegen(state);
        return state.result();
    }
}
