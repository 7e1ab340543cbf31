package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.ExpressionPart.Annotation;
import org.pragmatica.pycst.tree.ExpressionPart.Arg;
import org.pragmatica.pycst.tree.ExpressionPart.Parameters;
import org.pragmatica.pycst.tree.Punctuation.Asynchronous;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.StatementPart.Decorator;
import org.pragmatica.pycst.tree.StatementPart.Else;
import org.pragmatica.pycst.tree.StatementPart.ExceptHandler;
import org.pragmatica.pycst.tree.StatementPart.ExceptStarHandler;
import org.pragmatica.pycst.tree.StatementPart.Finally;
import org.pragmatica.pycst.tree.StatementPart.MatchCase;
import org.pragmatica.pycst.tree.StatementPart.TypeParameters;
import org.pragmatica.pycst.tree.StatementPart.WithItem;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Statements of a module or block body. Each owns the blank and comment lines above it.
 */
public sealed interface Statement extends Node {
    List<EmptyLine> leadingLines();

    /**
     * One logical line of small statements separated by semicolons.
     */
    record SimpleStatementLine(List<EmptyLine> leadingLines,
                               List<SmallStatement> body,
                               TrailingWhitespace trailingWhitespace) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSimpleStatementLine(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSimpleStatementLine(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            Emit.smallStatements(state, body);
            trailingWhitespace.codegen(state);
        }
    }

    record FunctionDef(List<EmptyLine> leadingLines,
                       List<Decorator> decorators,
                       List<EmptyLine> linesAfterDecorators,
                       Optional<Asynchronous> asynchronous,
                       SimpleWhitespace whitespaceAfterDef,
                       Expression.Name name,
                       SimpleWhitespace whitespaceAfterName,
                       Optional<TypeParameters> typeParameters,
                       SimpleWhitespace whitespaceAfterTypeParameters,
                       ParenthesizableWhitespace whitespaceBeforeParams,
                       Parameters params,
                       Optional<Annotation> returns,
                       SimpleWhitespace whitespaceBeforeColon,
                       Suite body,
                       Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(decorators, name, typeParameters, params, returns, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitFunctionDef(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveFunctionDef(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.all(state, leadingLines);
            Emit.all(state, decorators);
            Emit.leading(state, linesAfterDecorators);
            Emit.optional(state, asynchronous);
            state.addToken("def");
            whitespaceAfterDef.codegen(state);
            name.codegen(state);
            whitespaceAfterName.codegen(state);
            Emit.optional(state, typeParameters);
            whitespaceAfterTypeParameters.codegen(state);
            state.addToken("(");
            whitespaceBeforeParams.codegen(state);
            params.codegen(state);
            state.addToken(")");
            Emit.optional(state, returns);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    record ClassDef(List<EmptyLine> leadingLines,
                    List<Decorator> decorators,
                    List<EmptyLine> linesAfterDecorators,
                    SimpleWhitespace whitespaceAfterClass,
                    Expression.Name name,
                    SimpleWhitespace whitespaceAfterName,
                    Optional<TypeParameters> typeParameters,
                    SimpleWhitespace whitespaceAfterTypeParameters,
                    Optional<LeftParen> lpar,
                    List<Arg> arguments,
                    Optional<RightParen> rpar,
                    SimpleWhitespace whitespaceBeforeColon,
                    Suite body,
                    Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(decorators, name, typeParameters, arguments, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitClassDef(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveClassDef(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.all(state, leadingLines);
            Emit.all(state, decorators);
            Emit.leading(state, linesAfterDecorators);
            state.addToken("class");
            whitespaceAfterClass.codegen(state);
            name.codegen(state);
            whitespaceAfterName.codegen(state);
            Emit.optional(state, typeParameters);
            whitespaceAfterTypeParameters.codegen(state);
            Emit.optional(state, lpar);
            Emit.separated(state, arguments);
            Emit.optional(state, rpar);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    /**
     * {@code if} statement; an {@code elif} branch is an {@code If} with {@code elif} set, nested
     * in the {@code orelse} of the previous branch.
     */
    record If(List<EmptyLine> leadingLines,
              boolean elif,
              SimpleWhitespace whitespaceBeforeTest,
              Expression test,
              SimpleWhitespace whitespaceAfterTest,
              Suite body,
              Optional<OrElse> orelse,
              Optional<NodeId> id) implements Statement, OrElse {
        @Override
        public List<Node> children() {
            return Children.of(test, body, orelse);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveIf(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken(elif ? "elif" : "if");
            whitespaceBeforeTest.codegen(state);
            test.codegen(state);
            whitespaceAfterTest.codegen(state);
            state.addToken(":");
            body.codegen(state);
            Emit.optional(state, orelse);
        }
    }

    record For(List<EmptyLine> leadingLines,
               Optional<Asynchronous> asynchronous,
               SimpleWhitespace whitespaceAfterFor,
               Expression target,
               SimpleWhitespace whitespaceBeforeIn,
               SimpleWhitespace whitespaceAfterIn,
               Expression iter,
               SimpleWhitespace whitespaceBeforeColon,
               Suite body,
               Optional<Else> orelse,
               Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(target, iter, body, orelse);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitFor(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveFor(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            Emit.optional(state, asynchronous);
            state.addToken("for");
            whitespaceAfterFor.codegen(state);
            target.codegen(state);
            whitespaceBeforeIn.codegen(state);
            state.addToken("in");
            whitespaceAfterIn.codegen(state);
            iter.codegen(state);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
            Emit.optional(state, orelse);
        }
    }

    record While(List<EmptyLine> leadingLines,
                 SimpleWhitespace whitespaceAfterWhile,
                 Expression test,
                 SimpleWhitespace whitespaceBeforeColon,
                 Suite body,
                 Optional<Else> orelse,
                 Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(test, body, orelse);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveWhile(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("while");
            whitespaceAfterWhile.codegen(state);
            test.codegen(state);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
            Emit.optional(state, orelse);
        }
    }

    record Try(List<EmptyLine> leadingLines,
               SimpleWhitespace whitespaceBeforeColon,
               Suite body,
               List<ExceptHandler> handlers,
               Optional<Else> orelse,
               Optional<Finally> finalBody,
               Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(body, handlers, orelse, finalBody);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTry(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTry(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("try");
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
            Emit.all(state, handlers);
            Emit.optional(state, orelse);
            Emit.optional(state, finalBody);
        }
    }

    /**
     * {@code try} with {@code except*} handlers.
     */
    record TryStar(List<EmptyLine> leadingLines,
                   SimpleWhitespace whitespaceBeforeColon,
                   Suite body,
                   List<ExceptStarHandler> handlers,
                   Optional<Else> orelse,
                   Optional<Finally> finalBody,
                   Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(body, handlers, orelse, finalBody);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTryStar(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTryStar(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("try");
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
            Emit.all(state, handlers);
            Emit.optional(state, orelse);
            Emit.optional(state, finalBody);
        }
    }

    record With(List<EmptyLine> leadingLines,
                Optional<Asynchronous> asynchronous,
                SimpleWhitespace whitespaceAfterWith,
                Optional<LeftParen> lpar,
                List<WithItem> items,
                Optional<RightParen> rpar,
                SimpleWhitespace whitespaceBeforeColon,
                Suite body,
                Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(items, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitWith(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveWith(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            Emit.optional(state, asynchronous);
            state.addToken("with");
            whitespaceAfterWith.codegen(state);
            Emit.optional(state, lpar);
            Emit.separated(state, items);
            Emit.optional(state, rpar);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            body.codegen(state);
        }
    }

    /**
     * {@code match subject:} with its indented {@code case} blocks.
     */
    record Match(List<EmptyLine> leadingLines,
                 SimpleWhitespace whitespaceAfterMatch,
                 Expression subject,
                 SimpleWhitespace whitespaceBeforeColon,
                 TrailingWhitespace whitespaceAfterColon,
                 Optional<String> indent,
                 List<MatchCase> cases,
                 List<EmptyLine> footer,
                 Optional<NodeId> id) implements Statement {
        @Override
        public List<Node> children() {
            return Children.of(subject, cases);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitMatch(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveMatch(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.leading(state, leadingLines);
            state.addToken("match");
            whitespaceAfterMatch.codegen(state);
            subject.codegen(state);
            whitespaceBeforeColon.codegen(state);
            state.addToken(":");
            whitespaceAfterColon.codegen(state);
            state.increaseIndent(indent.orElse(state.defaultIndent()));
            Emit.all(state, cases);
            Emit.all(state, footer);
            state.decreaseIndent();
        }
    }
}
