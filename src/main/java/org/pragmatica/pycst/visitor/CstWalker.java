package org.pragmatica.pycst.visitor;

import org.pragmatica.pycst.tree.Node;

/**
 * Depth-first pre-order traversal of an inflated tree in source order.
 */
public final class CstWalker {
    private CstWalker() {}

    /**
     * Walk {@code node} and its descendants.
     *
     * @return {@code false} if a hook aborted the traversal
     */
    public static boolean walk(CstVisitor visitor, Node node) {
        var result = node.visit(visitor);
        if (result == VisitResult.ABORT) {
            return false;
        }
        if (result == VisitResult.CONTINUE) {
            for (var child : node.children()) {
                if (!walk(visitor, child)) {
                    return false;
                }
            }
        }
        node.leave(visitor);
        return true;
    }
}
