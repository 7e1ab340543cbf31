package org.pragmatica.pycst.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mutable output buffer used while serializing an inflated tree.
 * Tracks the stack of relative indentation strings of the enclosing blocks.
 */
public final class CodegenState {
    private static final int DEFAULT_CAPACITY = 1024;

    private final StringBuilder output;
    private final List<String> indentTokens;
    private final String defaultIndent;
    private final String defaultNewline;

    private CodegenState(String defaultIndent, String defaultNewline) {
        this.output = new StringBuilder(DEFAULT_CAPACITY);
        this.indentTokens = new ArrayList<>();
        this.defaultIndent = defaultIndent;
        this.defaultNewline = defaultNewline;
    }

    public static CodegenState create(String defaultIndent, String defaultNewline) {
        return new CodegenState(defaultIndent, defaultNewline);
    }

    public void addToken(String text) {
        output.append(text);
    }

    /**
     * Emit the absolute indentation of the current block.
     */
    public void addIndent() {
        for (var token : indentTokens) {
            output.append(token);
        }
    }

    public void increaseIndent(String relativeIndent) {
        indentTokens.add(relativeIndent);
    }

    public void decreaseIndent() {
        if (indentTokens.isEmpty()) {
            throw new IllegalStateException("Indentation stack underflow");
        }
        indentTokens.remove(indentTokens.size() - 1);
    }

    public String currentIndent() {
        return String.join("", indentTokens);
    }

    public void addNewline(Optional<String> value) {
        output.append(value.orElse(defaultNewline));
    }

    public String defaultIndent() {
        return defaultIndent;
    }

    public String defaultNewline() {
        return defaultNewline;
    }

    public String result() {
        return output.toString();
    }
}
