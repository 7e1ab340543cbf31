package org.pragmatica.pycst.visitor;

/**
 * Kind of a Python name scope.
 */
public enum ScopeKind {
    MODULE("module"),
    CLASS("class"),
    FUNCTION("function"),
    LAMBDA("lambda"),
    COMPREHENSION("comprehension");

    private final String display;

    ScopeKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
