package org.pragmatica.pycst.visitor;

/**
 * Decision returned by a {@code visitX} hook.
 */
public enum VisitResult {
    /**
     * Descend into the children, then call the matching {@code leaveX} hook.
     */
    CONTINUE,
    /**
     * Do not descend; the matching {@code leaveX} hook is still called.
     */
    SKIP_CHILDREN,
    /**
     * Stop the whole traversal. No further hooks are called, including pending {@code leaveX} hooks.
     */
    ABORT
}
