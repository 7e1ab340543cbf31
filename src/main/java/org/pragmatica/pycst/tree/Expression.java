package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.CodegenState;
import org.pragmatica.pycst.tree.ExpressionPart.Arg;
import org.pragmatica.pycst.tree.ExpressionPart.ComparisonTarget;
import org.pragmatica.pycst.tree.ExpressionPart.CompFor;
import org.pragmatica.pycst.tree.ExpressionPart.DictElement;
import org.pragmatica.pycst.tree.ExpressionPart.Element;
import org.pragmatica.pycst.tree.ExpressionPart.Parameters;
import org.pragmatica.pycst.tree.ExpressionPart.SubscriptElement;
import org.pragmatica.pycst.tree.Operator.BinaryOperator;
import org.pragmatica.pycst.tree.Operator.BooleanOperator;
import org.pragmatica.pycst.tree.Operator.UnaryOperator;
import org.pragmatica.pycst.tree.Punctuation.Colon;
import org.pragmatica.pycst.tree.Punctuation.Dot;
import org.pragmatica.pycst.tree.Punctuation.LeftCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.List;
import java.util.Optional;

/**
 * Python expressions. Every expression may be wrapped in any number of parentheses, kept in
 * {@link #lpar()} (outermost first) and {@link #rpar()} (innermost first).
 */
public sealed interface Expression extends Node {
    List<LeftParen> lpar();

    List<RightParen> rpar();

    enum NumberKind {
        INTEGER,
        FLOAT,
        IMAGINARY;

        public static NumberKind classify(String text) {
            var lower = text.toLowerCase();
            if (lower.endsWith("j")) {
                return IMAGINARY;
            }
            if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
                return INTEGER;
            }
            return lower.contains(".") || lower.contains("e")
                   ? FLOAT
                   : INTEGER;
        }
    }

    record Name(String value,
                List<LeftParen> lpar,
                List<RightParen> rpar,
                Optional<NodeId> id) implements Expression {
        public static Name of(String value) {
            return new Name(value, List.of(), List.of(), Optional.empty());
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitName(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveName(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> state.addToken(value));
        }
    }

    record Number(String value,
                  NumberKind kind,
                  List<LeftParen> lpar,
                  List<RightParen> rpar,
                  Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveNumber(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> state.addToken(value));
        }
    }

    /**
     * A single string literal including prefix and quotes. Formatted strings are kept whole.
     */
    record SimpleString(String value,
                        List<LeftParen> lpar,
                        List<RightParen> rpar,
                        Optional<NodeId> id) implements Expression {
        public String prefix() {
            int quote = 0;
            while (quote < value.length() && value.charAt(quote) != '\'' && value.charAt(quote) != '"') {
                quote++;
            }
            return value.substring(0, quote);
        }

        public boolean formatted() {
            var prefix = prefix().toLowerCase();
            return prefix.contains("f") || prefix.contains("t");
        }

        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSimpleString(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSimpleString(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> state.addToken(value));
        }
    }

    /**
     * Implicit concatenation of adjacent string literals, nested to the right.
     */
    record ConcatenatedString(Expression left,
                              ParenthesizableWhitespace whitespaceBetween,
                              Expression right,
                              List<LeftParen> lpar,
                              List<RightParen> rpar,
                              Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(left, right);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitConcatenatedString(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveConcatenatedString(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                left.codegen(state);
                whitespaceBetween.codegen(state);
                right.codegen(state);
            });
        }
    }

    record Ellipsis(List<LeftParen> lpar, List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return List.of();
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitEllipsis(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveEllipsis(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> state.addToken("..."));
        }
    }

    record Attribute(Expression value,
                     Dot dot,
                     Name attr,
                     List<LeftParen> lpar,
                     List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(value, attr);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAttribute(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAttribute(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                value.codegen(state);
                dot.codegen(state);
                attr.codegen(state);
            });
        }
    }

    record Call(Expression func,
                ParenthesizableWhitespace whitespaceAfterFunc,
                ParenthesizableWhitespace whitespaceBeforeArgs,
                List<Arg> args,
                List<LeftParen> lpar,
                List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(func, args);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveCall(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                func.codegen(state);
                whitespaceAfterFunc.codegen(state);
                state.addToken("(");
                whitespaceBeforeArgs.codegen(state);
                Emit.separated(state, args);
                state.addToken(")");
            });
        }
    }

    record Subscript(Expression value,
                     ParenthesizableWhitespace whitespaceAfterValue,
                     LeftSquareBracket lbracket,
                     List<SubscriptElement> slice,
                     RightSquareBracket rbracket,
                     List<LeftParen> lpar,
                     List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(value, slice);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSubscript(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSubscript(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                value.codegen(state);
                whitespaceAfterValue.codegen(state);
                lbracket.codegen(state);
                Emit.separated(state, slice);
                rbracket.codegen(state);
            });
        }
    }

    record UnaryOperation(UnaryOperator operator,
                          Expression expression,
                          List<LeftParen> lpar,
                          List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(expression);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitUnaryOperation(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveUnaryOperation(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                operator.codegen(state);
                expression.codegen(state);
            });
        }
    }

    record BinaryOperation(Expression left,
                           BinaryOperator operator,
                           Expression right,
                           List<LeftParen> lpar,
                           List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(left, right);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitBinaryOperation(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveBinaryOperation(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                left.codegen(state);
                operator.codegen(state);
                right.codegen(state);
            });
        }
    }

    record BooleanOperation(Expression left,
                            BooleanOperator operator,
                            Expression right,
                            List<LeftParen> lpar,
                            List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(left, right);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitBooleanOperation(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveBooleanOperation(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                left.codegen(state);
                operator.codegen(state);
                right.codegen(state);
            });
        }
    }

    record Comparison(Expression left,
                      List<ComparisonTarget> comparisons,
                      List<LeftParen> lpar,
                      List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(left, comparisons);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitComparison(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveComparison(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                left.codegen(state);
                Emit.all(state, comparisons);
            });
        }
    }

    /**
     * {@code body if test else orelse}.
     */
    record IfExp(Expression body,
                 ParenthesizableWhitespace whitespaceBeforeIf,
                 ParenthesizableWhitespace whitespaceAfterIf,
                 Expression test,
                 ParenthesizableWhitespace whitespaceBeforeElse,
                 ParenthesizableWhitespace whitespaceAfterElse,
                 Expression orelse,
                 List<LeftParen> lpar,
                 List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(body, test, orelse);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitIfExp(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveIfExp(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                body.codegen(state);
                whitespaceBeforeIf.codegen(state);
                state.addToken("if");
                whitespaceAfterIf.codegen(state);
                test.codegen(state);
                whitespaceBeforeElse.codegen(state);
                state.addToken("else");
                whitespaceAfterElse.codegen(state);
                orelse.codegen(state);
            });
        }
    }

    record Lambda(ParenthesizableWhitespace whitespaceAfterLambda,
                  Parameters params,
                  Colon colon,
                  Expression body,
                  List<LeftParen> lpar,
                  List<RightParen> rpar,
                  Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(params, body);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitLambda(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveLambda(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                state.addToken("lambda");
                whitespaceAfterLambda.codegen(state);
                params.codegen(state);
                colon.codegen(state);
                body.codegen(state);
            });
        }
    }

    /**
     * {@code yield}, {@code yield value} or {@code yield from value}.
     */
    record Yield(ParenthesizableWhitespace whitespaceAfterYield,
                 boolean from,
                 ParenthesizableWhitespace whitespaceAfterFrom,
                 Optional<Expression> value,
                 List<LeftParen> lpar,
                 List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitYield(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveYield(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                state.addToken("yield");
                if (from || value.isPresent()) {
                    whitespaceAfterYield.codegen(state);
                }
                if (from) {
                    state.addToken("from");
                    whitespaceAfterFrom.codegen(state);
                }
                Emit.optional(state, value);
            });
        }
    }

    record Await(ParenthesizableWhitespace whitespaceAfterAwait,
                 Expression expression,
                 List<LeftParen> lpar,
                 List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(expression);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitAwait(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveAwait(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                state.addToken("await");
                whitespaceAfterAwait.codegen(state);
                expression.codegen(state);
            });
        }
    }

    /**
     * Assignment expression {@code target := value}.
     */
    record NamedExpr(Expression target,
                     ParenthesizableWhitespace whitespaceBeforeWalrus,
                     ParenthesizableWhitespace whitespaceAfterWalrus,
                     Expression value,
                     List<LeftParen> lpar,
                     List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(target, value);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitNamedExpr(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveNamedExpr(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                target.codegen(state);
                whitespaceBeforeWalrus.codegen(state);
                state.addToken(":=");
                whitespaceAfterWalrus.codegen(state);
                value.codegen(state);
            });
        }
    }

    /**
     * A tuple; the parentheses, when present, are part of {@link #lpar()} and {@link #rpar()}.
     */
    record Tuple(List<Element> elements,
                 List<LeftParen> lpar,
                 List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elements);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveTuple(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                Emit.separated(state, elements);
                if (elements.size() == 1 && elements.get(0).comma().isEmpty()) {
                    state.addToken(",");
                }
            });
        }
    }

    record ListDisplay(LeftSquareBracket lbracket,
                       List<Element> elements,
                       RightSquareBracket rbracket,
                       List<LeftParen> lpar,
                       List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elements);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitListDisplay(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveListDisplay(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbracket.codegen(state);
                Emit.separated(state, elements);
                rbracket.codegen(state);
            });
        }
    }

    record SetDisplay(LeftCurlyBrace lbrace,
                      List<Element> elements,
                      RightCurlyBrace rbrace,
                      List<LeftParen> lpar,
                      List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elements);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSetDisplay(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSetDisplay(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbrace.codegen(state);
                Emit.separated(state, elements);
                rbrace.codegen(state);
            });
        }
    }

    record DictDisplay(LeftCurlyBrace lbrace,
                       List<DictElement> elements,
                       RightCurlyBrace rbrace,
                       List<LeftParen> lpar,
                       List<RightParen> rpar) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elements);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitDictDisplay(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveDictDisplay(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbrace.codegen(state);
                Emit.separated(state, elements);
                rbrace.codegen(state);
            });
        }
    }

    /**
     * Generator expression. Used as the sole call argument it has no parentheses of its own.
     */
    record GeneratorExp(Expression elt,
                        CompFor forIn,
                        List<LeftParen> lpar,
                        List<RightParen> rpar,
                        Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elt, forIn);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitGeneratorExp(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveGeneratorExp(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                elt.codegen(state);
                forIn.codegen(state);
            });
        }
    }

    record ListComp(LeftSquareBracket lbracket,
                    Expression elt,
                    CompFor forIn,
                    RightSquareBracket rbracket,
                    List<LeftParen> lpar,
                    List<RightParen> rpar,
                    Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elt, forIn);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitListComp(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveListComp(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbracket.codegen(state);
                elt.codegen(state);
                forIn.codegen(state);
                rbracket.codegen(state);
            });
        }
    }

    record SetComp(LeftCurlyBrace lbrace,
                   Expression elt,
                   CompFor forIn,
                   RightCurlyBrace rbrace,
                   List<LeftParen> lpar,
                   List<RightParen> rpar,
                   Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(elt, forIn);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitSetComp(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveSetComp(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbrace.codegen(state);
                elt.codegen(state);
                forIn.codegen(state);
                rbrace.codegen(state);
            });
        }
    }

    record DictComp(LeftCurlyBrace lbrace,
                    Expression key,
                    ParenthesizableWhitespace whitespaceBeforeColon,
                    ParenthesizableWhitespace whitespaceAfterColon,
                    Expression value,
                    CompFor forIn,
                    RightCurlyBrace rbrace,
                    List<LeftParen> lpar,
                    List<RightParen> rpar,
                    Optional<NodeId> id) implements Expression {
        @Override
        public List<Node> children() {
            return Children.of(key, value, forIn);
        }

        @Override
        public VisitResult visit(CstVisitor visitor) {
            return visitor.visitDictComp(this);
        }

        @Override
        public void leave(CstVisitor visitor) {
            visitor.leaveDictComp(this);
        }

        @Override
        public void codegen(CodegenState state) {
            Emit.parenthesized(state, lpar, rpar, () -> {
                lbrace.codegen(state);
                key.codegen(state);
                whitespaceBeforeColon.codegen(state);
                state.addToken(":");
                whitespaceAfterColon.codegen(state);
                value.codegen(state);
                forIn.codegen(state);
                rbrace.codegen(state);
            });
        }
    }
}
