package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Arg;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.CompFor;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.ComparisonTarget;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.DictElement;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Element;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Parameters;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.SubscriptElement;
import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Expression.NumberKind;
import org.pragmatica.pycst.tree.Operator.BinaryKind;
import org.pragmatica.pycst.tree.Operator.BinaryOperator;
import org.pragmatica.pycst.tree.Operator.BooleanKind;
import org.pragmatica.pycst.tree.Operator.BooleanOperator;
import org.pragmatica.pycst.tree.Operator.UnaryKind;
import org.pragmatica.pycst.tree.Operator.UnaryOperator;
import org.pragmatica.pycst.tree.Punctuation.Dot;
import org.pragmatica.pycst.tree.Punctuation.LeftCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightCurlyBrace;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.tree.SimpleWhitespace;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Expressions as produced by the parser: token references and child expressions, no whitespace.
 */
public sealed interface DeflatedExpression {
    Parens parens();

    /**
     * First token of the expression itself, ignoring enclosing parentheses.
     */
    Token innerFirst();

    Token innerLast();

    Expression inflate(InflateCtx ctx);

    default Token firstToken() {
        return parens().isEmpty()
               ? innerFirst()
               : parens().first();
    }

    default Token lastToken() {
        return parens().isEmpty()
               ? innerLast()
               : parens().last();
    }

    record Name(Token token, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return token;
        }

        @Override
        public Token innerLast() {
            return token;
        }

        @Override
        public Expression.Name inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordIdent(id, InflateCtx.span(token, token));
            var lpar = parens.inflateLeft(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Name(token.text(), lpar, rpar, id);
        }
    }

    record Number(Token token, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return token;
        }

        @Override
        public Token innerLast() {
            return token;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordIdent(id, InflateCtx.span(token, token));
            var lpar = parens.inflateLeft(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Number(token.text(), NumberKind.classify(token.text()), lpar, rpar, id);
        }
    }

    record SimpleString(Token token, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return token;
        }

        @Override
        public Token innerLast() {
            return token;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordIdent(id, InflateCtx.span(token, token));
            var lpar = parens.inflateLeft(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.SimpleString(token.text(), lpar, rpar, id);
        }
    }

    record ConcatenatedString(DeflatedExpression left, DeflatedExpression right, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return left.firstToken();
        }

        @Override
        public Token innerLast() {
            return right.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordIdent(id, InflateCtx.span(innerFirst(), innerLast()));
            var lpar = parens.inflateLeft(ctx);
            var inflatedLeft = left.inflate(ctx);
            var between = ctx.parenthesizable(left.lastToken()
                                                  .whitespaceAfter());
            var inflatedRight = right.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.ConcatenatedString(inflatedLeft, between, inflatedRight, lpar, rpar, id);
        }
    }

    record Ellipsis(Token token, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return token;
        }

        @Override
        public Token innerLast() {
            return token;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Ellipsis(lpar, rpar);
        }
    }

    record Attribute(DeflatedExpression value, Token dot, Token attr, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return value.firstToken();
        }

        @Override
        public Token innerLast() {
            return attr;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedValue = value.inflate(ctx);
            var inflatedDot = new Dot(ctx.parenthesizable(dot.whitespaceBefore()),
                                      ctx.parenthesizable(dot.whitespaceAfter()));
            var name = Claims.name(ctx, attr);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Attribute(inflatedValue, inflatedDot, name, lpar, rpar);
        }
    }

    record Call(DeflatedExpression func, Token open, List<Arg> args, Token close, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return func.firstToken();
        }

        @Override
        public Token innerLast() {
            return close;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedFunc = func.inflate(ctx);
            var afterFunc = ctx.parenthesizable(open.whitespaceBefore());
            var beforeArgs = ctx.parenthesizable(open.whitespaceAfter());
            var inflatedArgs = Claims.all(ctx, args);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Call(inflatedFunc, afterFunc, beforeArgs, inflatedArgs, lpar, rpar);
        }
    }

    record Subscript(DeflatedExpression value,
                     Token lbracket,
                     List<SubscriptElement> slice,
                     Token rbracket,
                     Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return value.firstToken();
        }

        @Override
        public Token innerLast() {
            return rbracket;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedValue = value.inflate(ctx);
            var afterValue = ctx.parenthesizable(lbracket.whitespaceBefore());
            var open = new LeftSquareBracket(ctx.parenthesizable(lbracket.whitespaceAfter()));
            var elements = Claims.all(ctx, slice);
            var close = new RightSquareBracket(ctx.parenthesizable(rbracket.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.Subscript(inflatedValue, afterValue, open, elements, close, lpar, rpar);
        }
    }

    record UnaryOperation(Token operator, DeflatedExpression expression, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return operator;
        }

        @Override
        public Token innerLast() {
            return expression.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var kind = UnaryKind.fromSymbol(operator.text())
                                .orElseThrow();
            var op = new UnaryOperator(kind, ctx.parenthesizable(operator.whitespaceAfter()));
            var operand = expression.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.UnaryOperation(op, operand, lpar, rpar);
        }
    }

    record BinaryOperation(DeflatedExpression left, Token operator, DeflatedExpression right, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return left.firstToken();
        }

        @Override
        public Token innerLast() {
            return right.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedLeft = left.inflate(ctx);
            var op = new BinaryOperator(BinaryKind.fromSymbol(operator.text())
                                                  .orElseThrow(),
                                        ctx.parenthesizable(operator.whitespaceBefore()),
                                        ctx.parenthesizable(operator.whitespaceAfter()));
            var inflatedRight = right.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.BinaryOperation(inflatedLeft, op, inflatedRight, lpar, rpar);
        }
    }

    record BooleanOperation(DeflatedExpression left, Token operator, DeflatedExpression right, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return left.firstToken();
        }

        @Override
        public Token innerLast() {
            return right.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedLeft = left.inflate(ctx);
            var op = new BooleanOperator(BooleanKind.valueOf(operator.text()
                                                                     .toUpperCase(Locale.ROOT)),
                                         ctx.parenthesizable(operator.whitespaceBefore()),
                                         ctx.parenthesizable(operator.whitespaceAfter()));
            var inflatedRight = right.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.BooleanOperation(inflatedLeft, op, inflatedRight, lpar, rpar);
        }
    }

    record Comparison(DeflatedExpression left, List<ComparisonTarget> comparisons, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return left.firstToken();
        }

        @Override
        public Token innerLast() {
            return comparisons.get(comparisons.size() - 1)
                              .comparator()
                              .lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedLeft = left.inflate(ctx);
            var targets = Claims.all(ctx, comparisons);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Comparison(inflatedLeft, targets, lpar, rpar);
        }
    }

    record IfExp(DeflatedExpression body,
                 Token ifToken,
                 DeflatedExpression test,
                 Token elseToken,
                 DeflatedExpression orelse,
                 Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return body.firstToken();
        }

        @Override
        public Token innerLast() {
            return orelse.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedBody = body.inflate(ctx);
            var beforeIf = ctx.parenthesizable(ifToken.whitespaceBefore());
            var afterIf = ctx.parenthesizable(ifToken.whitespaceAfter());
            var inflatedTest = test.inflate(ctx);
            var beforeElse = ctx.parenthesizable(elseToken.whitespaceBefore());
            var afterElse = ctx.parenthesizable(elseToken.whitespaceAfter());
            var inflatedOrelse = orelse.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.IfExp(inflatedBody, beforeIf, afterIf, inflatedTest, beforeElse, afterElse,
                                        inflatedOrelse, lpar, rpar);
        }
    }

    record Lambda(Token lambda, Parameters params, Token colon, DeflatedExpression body, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lambda;
        }

        @Override
        public Token innerLast() {
            return body.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, InflateCtx.span(lambda, body.lastToken()));
            var lpar = parens.inflateLeft(ctx);
            var afterLambda = ctx.parenthesizable(lambda.whitespaceAfter());
            var inflatedParams = params.inflate(ctx);
            var inflatedColon = Claims.colon(ctx, colon);
            var inflatedBody = body.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Lambda(afterLambda, inflatedParams, inflatedColon, inflatedBody, lpar, rpar, id);
        }
    }

    record Yield(Token keyword, Optional<Token> from, Optional<DeflatedExpression> value, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return keyword;
        }

        @Override
        public Token innerLast() {
            return value.map(DeflatedExpression::lastToken)
                        .orElse(keyword);
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var afterYield = value.isPresent()
                             ? ctx.parenthesizable(keyword.whitespaceAfter())
                             : SimpleWhitespace.EMPTY;
            var afterFrom = from.isPresent()
                            ? ctx.parenthesizable(from.get()
                                                      .whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
            var inflatedValue = value.map(expression -> expression.inflate(ctx));
            var rpar = parens.inflateRight(ctx);
            return new Expression.Yield(afterYield, from.isPresent(), afterFrom, inflatedValue, lpar, rpar);
        }
    }

    record Await(Token await, DeflatedExpression expression, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return await;
        }

        @Override
        public Token innerLast() {
            return expression.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var afterAwait = ctx.parenthesizable(await.whitespaceAfter());
            var inflated = expression.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Await(afterAwait, inflated, lpar, rpar);
        }
    }

    record NamedExpr(DeflatedExpression target, Token walrus, DeflatedExpression value, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return target.firstToken();
        }

        @Override
        public Token innerLast() {
            return value.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflatedTarget = target.inflate(ctx);
            var beforeWalrus = ctx.parenthesizable(walrus.whitespaceBefore());
            var afterWalrus = ctx.parenthesizable(walrus.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.NamedExpr(inflatedTarget, beforeWalrus, afterWalrus, inflatedValue, lpar, rpar);
        }
    }

    /**
     * Tuple; an empty tuple always carries its parentheses.
     */
    record Tuple(List<Element> elements, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return elements.get(0)
                           .firstToken();
        }

        @Override
        public Token innerLast() {
            return elements.get(elements.size() - 1)
                           .lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var inflated = Claims.all(ctx, elements);
            var rpar = parens.inflateRight(ctx);
            return new Expression.Tuple(inflated, lpar, rpar);
        }
    }

    record ListDisplay(Token lbracket, List<Element> elements, Token rbracket, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbracket;
        }

        @Override
        public Token innerLast() {
            return rbracket;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftSquareBracket(ctx.parenthesizable(lbracket.whitespaceAfter()));
            var inflated = Claims.all(ctx, elements);
            var close = new RightSquareBracket(ctx.parenthesizable(rbracket.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.ListDisplay(open, inflated, close, lpar, rpar);
        }
    }

    record SetDisplay(Token lbrace, List<Element> elements, Token rbrace, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbrace;
        }

        @Override
        public Token innerLast() {
            return rbrace;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftCurlyBrace(ctx.parenthesizable(lbrace.whitespaceAfter()));
            var inflated = Claims.all(ctx, elements);
            var close = new RightCurlyBrace(ctx.parenthesizable(rbrace.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.SetDisplay(open, inflated, close, lpar, rpar);
        }
    }

    record DictDisplay(Token lbrace, List<DictElement> elements, Token rbrace, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbrace;
        }

        @Override
        public Token innerLast() {
            return rbrace;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftCurlyBrace(ctx.parenthesizable(lbrace.whitespaceAfter()));
            var inflated = Claims.all(ctx, elements);
            var close = new RightCurlyBrace(ctx.parenthesizable(rbrace.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.DictDisplay(open, inflated, close, lpar, rpar);
        }
    }

    record GeneratorExp(DeflatedExpression elt, CompFor forIn, Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return elt.firstToken();
        }

        @Override
        public Token innerLast() {
            return forIn.lastToken();
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, InflateCtx.span(firstToken(), lastToken()));
            var lpar = parens.inflateLeft(ctx);
            var inflatedElt = elt.inflate(ctx);
            var inflatedFor = forIn.inflate(ctx);
            var rpar = parens.inflateRight(ctx);
            return new Expression.GeneratorExp(inflatedElt, inflatedFor, lpar, rpar, id);
        }
    }

    record ListComp(Token lbracket, DeflatedExpression elt, CompFor forIn, Token rbracket, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbracket;
        }

        @Override
        public Token innerLast() {
            return rbracket;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, InflateCtx.span(lbracket, rbracket));
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftSquareBracket(ctx.parenthesizable(lbracket.whitespaceAfter()));
            var inflatedElt = elt.inflate(ctx);
            var inflatedFor = forIn.inflate(ctx);
            var close = new RightSquareBracket(ctx.parenthesizable(rbracket.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.ListComp(open, inflatedElt, inflatedFor, close, lpar, rpar, id);
        }
    }

    record SetComp(Token lbrace, DeflatedExpression elt, CompFor forIn, Token rbrace, Parens parens)
        implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbrace;
        }

        @Override
        public Token innerLast() {
            return rbrace;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, InflateCtx.span(lbrace, rbrace));
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftCurlyBrace(ctx.parenthesizable(lbrace.whitespaceAfter()));
            var inflatedElt = elt.inflate(ctx);
            var inflatedFor = forIn.inflate(ctx);
            var close = new RightCurlyBrace(ctx.parenthesizable(rbrace.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.SetComp(open, inflatedElt, inflatedFor, close, lpar, rpar, id);
        }
    }

    record DictComp(Token lbrace,
                    DeflatedExpression key,
                    Token colon,
                    DeflatedExpression value,
                    CompFor forIn,
                    Token rbrace,
                    Parens parens) implements DeflatedExpression {
        @Override
        public Token innerFirst() {
            return lbrace;
        }

        @Override
        public Token innerLast() {
            return rbrace;
        }

        @Override
        public Expression inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, InflateCtx.span(lbrace, rbrace));
            var lpar = parens.inflateLeft(ctx);
            var open = new LeftCurlyBrace(ctx.parenthesizable(lbrace.whitespaceAfter()));
            var inflatedKey = key.inflate(ctx);
            var beforeColon = ctx.parenthesizable(colon.whitespaceBefore());
            var afterColon = ctx.parenthesizable(colon.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            var inflatedFor = forIn.inflate(ctx);
            var close = new RightCurlyBrace(ctx.parenthesizable(rbrace.whitespaceBefore()));
            var rpar = parens.inflateRight(ctx);
            return new Expression.DictComp(open, inflatedKey, beforeColon, afterColon, inflatedValue, inflatedFor,
                                           close, lpar, rpar, id);
        }
    }
}
