package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.Punctuation.AssignEqual;
import org.pragmatica.pycst.tree.Punctuation.Colon;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Pieces of statements that are nodes in their own right: decorators, import aliases,
 * assignment targets, handler clauses, case blocks and type parameters.
 */
public sealed interface StatementPart extends Node {

    record Decorator(List<EmptyLine> leadingLines,
                     SimpleWhitespace whitespaceAfterAt,
                     Expression decorator,
                     TrailingWhitespace trailingWhitespace) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(decorator);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitDecorator(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveDecorator(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("@");
            whitespaceAfterAt.codegen(state);
            decorator.codegen(state);
            trailingWhitespace.codegen(state);
        }
    }

    /**
     * {@code as name} clause of imports, with items and except handlers.
     */
    record AsName(ParenthesizableWhitespace whitespaceBeforeAs,
                  ParenthesizableWhitespace whitespaceAfterAs,
                  Expression name) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAsName(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAsName(this);
        }

        @Override
        public void codegen(CodegenState state) {
            whitespaceBeforeAs.codegen(state);
            state.addToken("as");
            whitespaceAfterAs.codegen(state);
            name.codegen(state);
        }
    }

    record ImportAlias(Expression name, Optional<AsName> asname, Optional<Comma> comma)
        implements StatementPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(name, asname);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitImportAlias(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveImportAlias(this);
        }

        @Override
        public void codegen(CodegenState state) {
            name.codegen(state);
            Emit.optional(state, asname);
            Emit.optional(state, comma);
        }
    }

    /**
     * Name listed by {@code global} or {@code nonlocal}.
     */
    record NameItem(Expression.Name name, Optional<Comma> comma) implements StatementPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitNameItem(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveNameItem(this);
        }

        @Override
        public void codegen(CodegenState state) {
            name.codegen(state);
            Emit.optional(state, comma);
        }
    }

    record AssignTarget(Expression target,
                        SimpleWhitespace whitespaceBeforeEqual,
                        SimpleWhitespace whitespaceAfterEqual) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(target);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAssignTarget(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAssignTarget(this);
        }

        @Override
        public void codegen(CodegenState state) {
            target.codegen(state);
            whitespaceBeforeEqual.codegen(state);
            state.addToken("=");
            whitespaceAfterEqual.codegen(state);
        }
    }

    record WithItem(Expression item, Optional<AsName> asname, Optional<Comma> comma)
        implements StatementPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(item, asname);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitWithItem(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveWithItem(this);
        }

        @Override
        public void codegen(CodegenState state) {
            item.codegen(state);
            Emit.optional(state, asname);
            Emit.optional(state, comma);
        }
    }

    record ExceptHandler(List<EmptyLine> leadingLines,
                         SimpleWhitespace whitespaceAfterExcept,
                         Optional<Expression> type,
                         Optional<AsName> name,
                         SimpleWhitespace whitespaceBeforeColon,
                         Suite body,
                         Optional<NodeId> id) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(type, name, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitExceptHandler(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveExceptHandler(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("except");
            whitespaceAfterExcept.codegen(state);
            Emit.optional(state, type);
            Emit.optional(state, name);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    record ExceptStarHandler(List<EmptyLine> leadingLines,
                             SimpleWhitespace whitespaceAfterExcept,
                             SimpleWhitespace whitespaceAfterStar,
                             Expression type,
                             Optional<AsName> name,
                             SimpleWhitespace whitespaceBeforeColon,
                             Suite body,
                             Optional<NodeId> id) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(type, name, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitExceptStarHandler(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveExceptStarHandler(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("except");
            whitespaceAfterExcept.codegen(state);
            state.addToken("*");
            whitespaceAfterStar.codegen(state);
            type.codegen(state);
            Emit.optional(state, name);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    record Else(List<EmptyLine> leadingLines,
                SimpleWhitespace whitespaceBeforeColon,
                Suite body,
                Optional<NodeId> id) implements StatementPart, OrElse {
        @Override
        public List<Node> children() {
            return Children.of(body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitElse(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveElse(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("else");
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    record Finally(List<EmptyLine> leadingLines,
                   SimpleWhitespace whitespaceBeforeColon,
                   Suite body,
                   Optional<NodeId> id) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitFinally(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveFinally(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("finally");
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    record MatchCase(List<EmptyLine> leadingLines,
                     SimpleWhitespace whitespaceAfterCase,
                     Pattern pattern,
                     SimpleWhitespace whitespaceBeforeIf,
                     SimpleWhitespace whitespaceAfterIf,
                     Optional<Expression> guard,
                     SimpleWhitespace whitespaceBeforeColon,
                     Suite body,
                     Optional<NodeId> id) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(pattern, guard, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatchCase(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatchCase(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("case");
            whitespaceAfterCase.codegen(state);
            pattern.codegen(state);
            if (guard.isPresent()) {
                whitespaceBeforeIf.codegen(state);
                state.addToken("if");
                whitespaceAfterIf.codegen(state);
            }
            Emit.optional(state, guard);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    /**
     * Bracketed type parameter list of a generic function, class or type alias.
     */
    record TypeParameters(LeftSquareBracket lbracket,
                          List<TypeParam> params,
                          RightSquareBracket rbracket) implements StatementPart {
        @Override
        public List<Node> children() {
            return Children.of(params);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTypeParameters(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTypeParameters(this);
        }

        @Override
        public void codegen(CodegenState state) {
            lbracket.codegen(state);
            Emit.separated(state, params);
            rbracket.codegen(state);
        }
    }

    record TypeParam(TypeVarLike param,
                     Optional<AssignEqual> equal,
                     Optional<Expression> defaultValue,
                     Optional<Comma> comma) implements StatementPart, CommaSeparated {
        @Override
        public List<Node> children() {
            return Children.of(param, defaultValue);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTypeParam(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTypeParam(this);
        }

        @Override
        public void codegen(CodegenState state) {
            param.codegen(state);
            Emit.optional(state, equal);
            Emit.optional(state, defaultValue);
            Emit.optional(state, comma);
        }
    }

    sealed interface TypeVarLike extends StatementPart {
        Expression.Name name();
    }

    record TypeVar(Expression.Name name, Optional<Colon> colon, Optional<Expression> bound) implements TypeVarLike {
        @Override
        public List<Node> children() {
            return Children.of(name, bound);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTypeVar(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTypeVar(this);
        }

        @Override
        public void codegen(CodegenState state) {
            name.codegen(state);
            if (bound.isPresent()) {
                colon.orElse(new Colon(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE))
                     .codegen(state);
            }
            Emit.optional(state, bound);
        }
    }

    /**
     * {@code *Ts}.
     */
    record TypeVarTuple(ParenthesizableWhitespace whitespaceAfterStar, Expression.Name name) implements TypeVarLike {
        @Override
        public List<Node> children() {
            return Children.of(name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTypeVarTuple(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTypeVarTuple(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("*");
            whitespaceAfterStar.codegen(state);
            name.codegen(state);
        }
    }

    /**
     * {@code **P}.
     */
    record ParamSpec(ParenthesizableWhitespace whitespaceAfterStar, Expression.Name name) implements TypeVarLike {
        @Override
        public List<Node> children() {
            return Children.of(name);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitParamSpec(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveParamSpec(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("**");
            whitespaceAfterStar.codegen(state);
            name.codegen(state);
        }
    }
}
