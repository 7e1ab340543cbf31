package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.ExpressionPart.Annotation;
import org.pragmatica.pycst.tree.Operator.AugOperator;
import org.pragmatica.pycst.tree.Punctuation.AssignEqual;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.tree.Punctuation.Dot;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.Punctuation.Semicolon;
import org.pragmatica.pycst.tree.StatementPart.AssignTarget;
import org.pragmatica.pycst.tree.StatementPart.ImportAlias;
import org.pragmatica.pycst.tree.StatementPart.NameItem;
import org.pragmatica.pycst.tree.StatementPart.TypeParameters;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Statements that fit on one logical line and may be joined with semicolons.
 * Each one owns the semicolon that follows it.
 */
public sealed interface SmallStatement extends Node {
    Optional<Semicolon> semicolon();

    Optional<NodeId> id();

    record Pass(Optional<Semicolon> semicolon, Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitPass(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leavePass(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("pass");
            Emit.optional(state, semicolon);
        }
    }

    record Break(Optional<Semicolon> semicolon, Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveBreak(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("break");
            Emit.optional(state, semicolon);
        }
    }

    record Continue(Optional<Semicolon> semicolon, Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveContinue(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("continue");
            Emit.optional(state, semicolon);
        }
    }

    /**
     * Expression evaluated for its side effects.
     */
    record Expr(Expression value, Optional<Semicolon> semicolon, Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitExpr(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveExpr(this);
        }

        @Override
        public void codegen(CodegenState state) {
            value.codegen(state);
            Emit.optional(state, semicolon);
        }
    }

    record Return(SimpleWhitespace whitespaceAfterReturn,
                  Optional<Expression> value,
                  Optional<Semicolon> semicolon,
                  Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveReturn(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("return");
            whitespaceAfterReturn.codegen(state);
            Emit.optional(state, value);
            Emit.optional(state, semicolon);
        }
    }

    record Assert(SimpleWhitespace whitespaceAfterAssert,
                  Expression test,
                  Optional<Comma> comma,
                  Optional<Expression> msg,
                  Optional<Semicolon> semicolon,
                  Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(test, msg);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAssert(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("assert");
            whitespaceAfterAssert.codegen(state);
            test.codegen(state);
            if (msg.isPresent()) {
                comma.orElse(Comma.DEFAULT)
                     .codegen(state);
            }
            Emit.optional(state, msg);
            Emit.optional(state, semicolon);
        }
    }

    record Import(SimpleWhitespace whitespaceAfterImport,
                  List<ImportAlias> names,
                  Optional<Semicolon> semicolon,
                  Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(names);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitImport(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveImport(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("import");
            whitespaceAfterImport.codegen(state);
            Emit.separated(state, names);
            Emit.optional(state, semicolon);
        }
    }

    /**
     * {@code from module import names}. {@code relative} holds one dot per leading dot;
     * {@code star} marks {@code import *}, in which case {@code names} is empty.
     */
    record ImportFrom(SimpleWhitespace whitespaceAfterFrom,
                      List<Dot> relative,
                      Optional<Expression> module,
                      SimpleWhitespace whitespaceBeforeImport,
                      SimpleWhitespace whitespaceAfterImport,
                      Optional<LeftParen> lpar,
                      List<ImportAlias> names,
                      boolean star,
                      Optional<RightParen> rpar,
                      Optional<Semicolon> semicolon,
                      Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(module, names);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitImportFrom(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveImportFrom(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("from");
            whitespaceAfterFrom.codegen(state);
            Emit.all(state, relative);
            Emit.optional(state, module);
            whitespaceBeforeImport.codegen(state);
            state.addToken("import");
            whitespaceAfterImport.codegen(state);
            Emit.optional(state, lpar);
            if (star) {
                state.addToken("*");
            } else {
                Emit.separated(state, names);
            }
            Emit.optional(state, rpar);
            Emit.optional(state, semicolon);
        }
    }

    /**
     * Possibly chained assignment {@code a = b = value}.
     */
    record Assign(List<AssignTarget> targets,
                  Expression value,
                  Optional<Semicolon> semicolon,
                  Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(targets, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAssign(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.all(state, targets);
            value.codegen(state);
            Emit.optional(state, semicolon);
        }
    }

    record AnnAssign(Expression target,
                     Annotation annotation,
                     Optional<AssignEqual> equal,
                     Optional<Expression> value,
                     Optional<Semicolon> semicolon,
                     Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(target, annotation, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAnnAssign(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAnnAssign(this);
        }

        @Override
        public void codegen(CodegenState state) {
            target.codegen(state);
            annotation.codegen(state);
            if (value.isPresent()) {
                equal.orElse(new AssignEqual(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE))
                     .codegen(state);
            }
            Emit.optional(state, value);
            Emit.optional(state, semicolon);
        }
    }

    record AugAssign(Expression target,
                     AugOperator operator,
                     Expression value,
                     Optional<Semicolon> semicolon,
                     Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(target, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAugAssign(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAugAssign(this);
        }

        @Override
        public void codegen(CodegenState state) {
            target.codegen(state);
            operator.codegen(state);
            value.codegen(state);
            Emit.optional(state, semicolon);
        }
    }

    record Del(SimpleWhitespace whitespaceAfterDel,
               Expression target,
               Optional<Semicolon> semicolon,
               Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(target);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitDel(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveDel(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("del");
            whitespaceAfterDel.codegen(state);
            target.codegen(state);
            Emit.optional(state, semicolon);
        }
    }

    record Global(SimpleWhitespace whitespaceAfterGlobal,
                  List<NameItem> names,
                  Optional<Semicolon> semicolon,
                  Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(names);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitGlobal(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveGlobal(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("global");
            whitespaceAfterGlobal.codegen(state);
            Emit.separated(state, names);
            Emit.optional(state, semicolon);
        }
    }

    record Nonlocal(SimpleWhitespace whitespaceAfterNonlocal,
                    List<NameItem> names,
                    Optional<Semicolon> semicolon,
                    Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(names);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitNonlocal(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveNonlocal(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("nonlocal");
            whitespaceAfterNonlocal.codegen(state);
            Emit.separated(state, names);
            Emit.optional(state, semicolon);
        }
    }

    /**
     * {@code raise}, {@code raise exc} or {@code raise exc from cause}.
     */
    record Raise(SimpleWhitespace whitespaceAfterRaise,
                 Optional<Expression> exc,
                 SimpleWhitespace whitespaceBeforeFrom,
                 SimpleWhitespace whitespaceAfterFrom,
                 Optional<Expression> cause,
                 Optional<Semicolon> semicolon,
                 Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(exc, cause);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitRaise(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveRaise(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("raise");
            whitespaceAfterRaise.codegen(state);
            Emit.optional(state, exc);
            if (cause.isPresent()) {
                whitespaceBeforeFrom.codegen(state);
                state.addToken("from");
                whitespaceAfterFrom.codegen(state);
            }
            Emit.optional(state, cause);
            Emit.optional(state, semicolon);
        }
    }

    /**
     * {@code type Name[params] = value}.
     */
    record TypeAlias(SimpleWhitespace whitespaceAfterType,
                     Expression.Name name,
                     SimpleWhitespace whitespaceAfterName,
                     Optional<TypeParameters> typeParameters,
                     SimpleWhitespace whitespaceAfterTypeParameters,
                     SimpleWhitespace whitespaceAfterEquals,
                     Expression value,
                     Optional<Semicolon> semicolon,
                     Optional<NodeId> id) implements SmallStatement {
        @Override
        public List<Node> children() {
            return Children.of(name, typeParameters, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTypeAlias(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTypeAlias(this);
        }

        @Override
        public void codegen(CodegenState state) {
            state.addToken("type");
            whitespaceAfterType.codegen(state);
            name.codegen(state);
            whitespaceAfterName.codegen(state);
            Emit.optional(state, typeParameters);
            whitespaceAfterTypeParameters.codegen(state);
            state.addToken("=");
            whitespaceAfterEquals.codegen(state);
            value.codegen(state);
            Emit.optional(state, semicolon);
        }
    }
}
