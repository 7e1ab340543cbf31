package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;

/**
 * A syntax node of the inflated tree. Nodes are immutable and own all whitespace around
 * the tokens they represent.
 */
public interface Node extends Codegen {
    /**
     * Direct child nodes in source order.
     */
    List<Node> children();

    /**
     * Double dispatch to the matching {@code visitX} hook.
     */
    VisitResult visit(CstVisitor visitor);

    /**
     * Double dispatch to the matching {@code leaveX} hook.
     */
    void leave(CstVisitor visitor);
}
