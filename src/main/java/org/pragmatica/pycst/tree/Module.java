package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;

/**
 * Root of an inflated tree. Carries the formatting defaults used when synthesizing text and
 * whether the source started with a byte order mark.
 */
public record Module(List<Statement> body,
                     List<EmptyLine> footer,
                     String defaultIndent,
                     String defaultNewline,
                     boolean byteOrderMark,
                     String encoding) implements Node {
    public static final String BYTE_ORDER_MARK = "\uFEFF";

    @Override
    public List<Node> children() {
        return Children.of(body);
    }

    @Override
    public VisitResult visit(CstVisitor visitor) {
        return visitor.visitModule(this);
    }

    @Override
    public void leave(CstVisitor visitor) {
        visitor.leaveModule(this);
    }

    @Override
    public void codegen(CodegenState state) {
        if (byteOrderMark) {
            state.addToken(BYTE_ORDER_MARK);
        }
        Emit.all(state, body);
        Emit.all(state, footer);
    }

    /**
     * Source text of this module using its own formatting defaults.
     */
    @Override
    public String code() {
        var state = CodegenState.create(defaultIndent, defaultNewline);
        codegen(state);
        return state.result();
    }
}
