package org.pragmatica.pycst.parser;

/**
 * Python language level the parser accepts. Syntax introduced after the configured version is
 * rejected; {@link #PERMISSIVE} accepts everything the parser knows.
 */
public enum PythonVersion {
    PY38("3.8"),
    PY39("3.9"),
    PY310("3.10"),
    PY311("3.11"),
    PY312("3.12"),
    PY313("3.13"),
    PERMISSIVE("any");

    private final String display;

    PythonVersion(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Whether syntax introduced in {@code required} is available at this level.
     */
    public boolean supports(PythonVersion required) {
        return this == PERMISSIVE || ordinal() >= required.ordinal();
    }
}
