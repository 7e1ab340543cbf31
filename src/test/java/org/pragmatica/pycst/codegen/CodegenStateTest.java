package org.pragmatica.pycst.codegen;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodegenStateTest {

    @Test
    void addIndent_concatenatesNestedLevels() {
        var state = CodegenState.create("    ", "\n");

        state.increaseIndent("  ");
        state.increaseIndent("\t");
        state.addIndent();
        state.addToken("x");
        state.decreaseIndent();
        state.addNewline(Optional.empty());
        state.addIndent();
        state.addToken("y");

        assertThat(state.result()).isEqualTo("  \tx\n  y");
        assertThat(state.currentIndent()).isEqualTo("  ");
    }

    @Test
    void addNewline_prefersRecordedValue() {
        var state = CodegenState.create("    ", "\r\n");

        state.addNewline(Optional.of("\n"));
        state.addNewline(Optional.empty());

        assertThat(state.result()).isEqualTo("\n\r\n");
    }

    @Test
    void decreaseIndent_belowModuleLevel_fails() {
        var state = CodegenState.create("    ", "\n");

        assertThatThrownBy(state::decreaseIndent).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void code_rendersStandaloneElement() {
        Codegen element = state -> state.addToken("pass");

        assertThat(element.code()).isEqualTo("pass");
    }
}
