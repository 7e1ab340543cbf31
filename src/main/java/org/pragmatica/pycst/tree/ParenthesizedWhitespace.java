package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;

import java.util.List;

/**
 * Whitespace inside brackets that crosses at least one line break.
 *
 * @param firstLine  rest of the line the whitespace starts on, including its newline
 * @param emptyLines blank or comment-only lines in between
 * @param indent     whether the last line starts with the enclosing block's indentation
 * @param lastLine   whitespace on the last line, after the indentation
 */
public record ParenthesizedWhitespace(TrailingWhitespace firstLine,
                                      List<EmptyLine> emptyLines,
                                      boolean indent,
                                      SimpleWhitespace lastLine) implements ParenthesizableWhitespace {
    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public void codegen(CodegenState state) {
        firstLine.codegen(state);
        emptyLines.forEach(line -> line.codegen(state));
        if (indent) {
            state.addIndent();
        }
        lastLine.codegen(state);
    }
}
