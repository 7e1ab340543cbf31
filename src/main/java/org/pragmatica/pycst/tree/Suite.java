package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Body of a compound statement: either an indented block or statements on the header line.
 */
public sealed interface Suite extends Node {

    /**
     * @param header  rest of the header line after the colon
     * @param indent  indentation relative to the enclosing block; empty means the default
     * @param footer  trailing blank or comment lines indented to this block
     */
    record IndentedBlock(TrailingWhitespace header,
                         Optional<String> indent,
                         List<Statement> body,
                         List<EmptyLine> footer) implements Suite {
        @Override
        public List<Node> children() {
            return Children.of(body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitIndentedBlock(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveIndentedBlock(this);
        }

        @Override
        public void codegen(CodegenState state) {
            header.codegen(state);
            state.increaseIndent(indent.orElse(state.defaultIndent()));
            if (body.isEmpty()) {
                state.addIndent();
                state.addToken("pass");
                state.addNewline(Optional.empty());
            } else {
                Emit.all(state, body);
            }
            Emit.all(state, footer);
            state.decreaseIndent();
        }
    }

    record SimpleStatementSuite(SimpleWhitespace leadingWhitespace,
                                List<SmallStatement> body,
                                TrailingWhitespace trailingWhitespace) implements Suite {
        @Override
        public List<Node> children() {
            return Children.of(body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSimpleStatementSuite(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSimpleStatementSuite(this);
        }

        @Override
        public void codegen(CodegenState state) {
            leadingWhitespace.codegen(state);
            Emit.smallStatements(state, body);
            trailingWhitespace.codegen(state);
        }
    }
}
