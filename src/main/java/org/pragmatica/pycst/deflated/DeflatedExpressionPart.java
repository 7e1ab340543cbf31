package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.ExpressionPart;
import org.pragmatica.pycst.tree.Operator.CompKind;
import org.pragmatica.pycst.tree.Operator.CompOperator;
import org.pragmatica.pycst.tree.SimpleWhitespace;

import java.util.List;
import java.util.Optional;

/**
 * Deflated counterparts of {@link ExpressionPart}.
 */
public sealed interface DeflatedExpressionPart {

    /**
     * Last token belonging to this part, including its trailing comma.
     */
    Token lastToken();

    /**
     * @param star {@code *} or {@code **} token of an unpacking argument
     */
    record Arg(Optional<Token> star,
               Optional<Token> keyword,
               Optional<Token> equal,
               DeflatedExpression value,
               Optional<Token> comma) implements DeflatedExpressionPart, Inflatable<ExpressionPart.Arg> {
        @Override
        public Token lastToken() {
            return comma.orElseGet(value::lastToken);
        }

        @Override
        public ExpressionPart.Arg inflate(InflateCtx ctx) {
            var afterStar = star.isPresent()
                            ? ctx.parenthesizable(star.get()
                                                      .whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
            var name = keyword.map(token -> Claims.name(ctx, token));
            var inflatedEqual = equal.map(token -> Claims.assignEqual(ctx, token));
            var inflatedValue = value.inflate(ctx);
            var inflatedComma = Claims.comma(ctx, comma);
            var afterArg = ctx.parenthesizable(lastToken().whitespaceAfter());
            return new ExpressionPart.Arg(star.map(Token::text)
                                              .orElse(""),
                                          afterStar,
                                          name,
                                          inflatedEqual,
                                          inflatedValue,
                                          inflatedComma,
                                          afterArg);
        }
    }

    sealed interface Element extends DeflatedExpressionPart, Inflatable<ExpressionPart.Element> {
        DeflatedExpression value();

        Optional<Token> comma();

        Token firstToken();

        @Override
        default Token lastToken() {
            return comma().orElseGet(() -> value().lastToken());
        }
    }

    record SimpleElement(DeflatedExpression value, Optional<Token> comma) implements Element {
        @Override
        public Token firstToken() {
            return value.firstToken();
        }

        @Override
        public ExpressionPart.Element inflate(InflateCtx ctx) {
            var inflatedValue = value.inflate(ctx);
            return new ExpressionPart.SimpleElement(inflatedValue, Claims.comma(ctx, comma));
        }
    }

    record StarredElement(Token star, DeflatedExpression value, Optional<Token> comma) implements Element {
        @Override
        public Token firstToken() {
            return star;
        }

        @Override
        public ExpressionPart.Element inflate(InflateCtx ctx) {
            var beforeValue = ctx.parenthesizable(star.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            return new ExpressionPart.StarredElement(beforeValue, inflatedValue, Claims.comma(ctx, comma));
        }
    }

    sealed interface DictElement extends DeflatedExpressionPart, Inflatable<ExpressionPart.DictElement> {}

    record KeyValue(DeflatedExpression key, Token colon, DeflatedExpression value, Optional<Token> comma)
        implements DictElement {
        @Override
        public Token lastToken() {
            return comma.orElseGet(value::lastToken);
        }

        @Override
        public ExpressionPart.DictElement inflate(InflateCtx ctx) {
            var inflatedKey = key.inflate(ctx);
            var beforeColon = ctx.parenthesizable(colon.whitespaceBefore());
            var afterColon = ctx.parenthesizable(colon.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            return new ExpressionPart.KeyValue(inflatedKey, beforeColon, afterColon, inflatedValue,
                                               Claims.comma(ctx, comma));
        }
    }

    record StarredDictElement(Token stars, DeflatedExpression value, Optional<Token> comma) implements DictElement {
        @Override
        public Token lastToken() {
            return comma.orElseGet(value::lastToken);
        }

        @Override
        public ExpressionPart.DictElement inflate(InflateCtx ctx) {
            var beforeValue = ctx.parenthesizable(stars.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            return new ExpressionPart.StarredDictElement(beforeValue, inflatedValue, Claims.comma(ctx, comma));
        }
    }

    record SubscriptElement(SliceItem slice, Optional<Token> comma)
        implements DeflatedExpressionPart, Inflatable<ExpressionPart.SubscriptElement> {
        @Override
        public Token lastToken() {
            return comma.orElseGet(slice::lastToken);
        }

        @Override
        public ExpressionPart.SubscriptElement inflate(InflateCtx ctx) {
            var inflatedSlice = slice.inflate(ctx);
            return new ExpressionPart.SubscriptElement(inflatedSlice, Claims.comma(ctx, comma));
        }
    }

    sealed interface SliceItem extends DeflatedExpressionPart, Inflatable<ExpressionPart.SliceItem> {}

    record Index(Optional<Token> star, DeflatedExpression value) implements SliceItem {
        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public ExpressionPart.SliceItem inflate(InflateCtx ctx) {
            var afterStar = star.isPresent()
                            ? ctx.parenthesizable(star.get()
                                                      .whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
            return new ExpressionPart.Index(star.map(Token::text)
                                                .orElse(""),
                                            afterStar,
                                            value.inflate(ctx));
        }
    }

    record Slice(Optional<DeflatedExpression> lower,
                 Token firstColon,
                 Optional<DeflatedExpression> upper,
                 Optional<Token> secondColon,
                 Optional<DeflatedExpression> step) implements SliceItem {
        @Override
        public Token lastToken() {
            if (step.isPresent()) {
                return step.get()
                           .lastToken();
            }
            if (secondColon.isPresent()) {
                return secondColon.get();
            }
            return upper.map(DeflatedExpression::lastToken)
                        .orElse(firstColon);
        }

        @Override
        public ExpressionPart.SliceItem inflate(InflateCtx ctx) {
            var inflatedLower = lower.map(expression -> expression.inflate(ctx));
            var first = Claims.colon(ctx, firstColon);
            var inflatedUpper = upper.map(expression -> expression.inflate(ctx));
            var second = secondColon.map(token -> Claims.colon(ctx, token));
            var inflatedStep = step.map(expression -> expression.inflate(ctx));
            return new ExpressionPart.Slice(inflatedLower, first, inflatedUpper, second, inflatedStep);
        }
    }

    record CompFor(Optional<Token> async,
                   Token forToken,
                   DeflatedExpression target,
                   Token inToken,
                   DeflatedExpression iter,
                   List<CompIf> ifs,
                   Optional<CompFor> innerForIn) implements DeflatedExpressionPart, Inflatable<ExpressionPart.CompFor> {
        @Override
        public Token lastToken() {
            if (innerForIn.isPresent()) {
                return innerForIn.get()
                                 .lastToken();
            }
            return ifs.isEmpty()
                   ? iter.lastToken()
                   : ifs.get(ifs.size() - 1)
                        .lastToken();
        }

        @Override
        public ExpressionPart.CompFor inflate(InflateCtx ctx) {
            var before = ctx.parenthesizable(async.orElse(forToken)
                                                  .whitespaceBefore());
            var asynchronous = async.map(token -> Claims.asynchronous(ctx, token));
            var afterFor = ctx.parenthesizable(forToken.whitespaceAfter());
            var inflatedTarget = target.inflate(ctx);
            var beforeIn = ctx.parenthesizable(inToken.whitespaceBefore());
            var afterIn = ctx.parenthesizable(inToken.whitespaceAfter());
            var inflatedIter = iter.inflate(ctx);
            var inflatedIfs = Claims.all(ctx, ifs);
            var inner = innerForIn.map(compFor -> compFor.inflate(ctx));
            return new ExpressionPart.CompFor(before, asynchronous, afterFor, inflatedTarget, beforeIn, afterIn,
                                              inflatedIter, inflatedIfs, inner);
        }
    }

    record CompIf(Token ifToken, DeflatedExpression test)
        implements DeflatedExpressionPart, Inflatable<ExpressionPart.CompIf> {
        @Override
        public Token lastToken() {
            return test.lastToken();
        }

        @Override
        public ExpressionPart.CompIf inflate(InflateCtx ctx) {
            var before = ctx.parenthesizable(ifToken.whitespaceBefore());
            var beforeTest = ctx.parenthesizable(ifToken.whitespaceAfter());
            return new ExpressionPart.CompIf(before, beforeTest, test.inflate(ctx));
        }
    }

    /**
     * @param second the {@code in} of {@code not in} or the {@code not} of {@code is not}
     */
    record ComparisonTarget(Token operator, Optional<Token> second, DeflatedExpression comparator)
        implements DeflatedExpressionPart, Inflatable<ExpressionPart.ComparisonTarget> {
        @Override
        public Token lastToken() {
            return comparator.lastToken();
        }

        CompKind kind() {
            if (second.isPresent()) {
                return operator.text()
                               .equals("not")
                       ? CompKind.NOT_IN
                       : CompKind.IS_NOT;
            }
            return CompKind.fromSymbol(operator.text())
                           .orElseThrow();
        }

        @Override
        public ExpressionPart.ComparisonTarget inflate(InflateCtx ctx) {
            var before = ctx.parenthesizable(operator.whitespaceBefore());
            var between = second.map(token -> ctx.parenthesizable(operator.whitespaceAfter()));
            var after = ctx.parenthesizable(second.orElse(operator)
                                                  .whitespaceAfter());
            var op = new CompOperator(kind(), before, between, after);
            return new ExpressionPart.ComparisonTarget(op, comparator.inflate(ctx));
        }
    }

    record Parameters(List<ParameterItem> params)
        implements DeflatedExpressionPart, Inflatable<ExpressionPart.Parameters> {
        @Override
        public Token lastToken() {
            return params.get(params.size() - 1)
                         .lastToken();
        }

        @Override
        public ExpressionPart.Parameters inflate(InflateCtx ctx) {
            return new ExpressionPart.Parameters(Claims.all(ctx, params));
        }
    }

    sealed interface ParameterItem extends DeflatedExpressionPart, Inflatable<ExpressionPart.ParameterItem> {}

    record Param(Optional<Token> star,
                 Token name,
                 Optional<Token> colon,
                 Optional<DeflatedExpression> annotation,
                 Optional<Token> equal,
                 Optional<DeflatedExpression> defaultValue,
                 Optional<Token> comma) implements ParameterItem {
        @Override
        public Token lastToken() {
            if (comma.isPresent()) {
                return comma.get();
            }
            if (defaultValue.isPresent()) {
                return defaultValue.get()
                                   .lastToken();
            }
            return annotation.map(DeflatedExpression::lastToken)
                             .orElse(name);
        }

        @Override
        public ExpressionPart.ParameterItem inflate(InflateCtx ctx) {
            var afterStar = star.isPresent()
                            ? ctx.parenthesizable(star.get()
                                                      .whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
            var inflatedName = Claims.name(ctx, name);
            var inflatedAnnotation = colon.map(token -> Claims.annotation(ctx, token, annotation.orElseThrow()));
            var inflatedEqual = equal.map(token -> Claims.assignEqual(ctx, token));
            var inflatedDefault = defaultValue.map(expression -> expression.inflate(ctx));
            var inflatedComma = Claims.comma(ctx, comma);
            var afterParam = ctx.parenthesizable(lastToken().whitespaceAfter());
            return new ExpressionPart.Param(star.map(Token::text)
                                                .orElse(""),
                                            afterStar,
                                            inflatedName,
                                            inflatedAnnotation,
                                            inflatedEqual,
                                            inflatedDefault,
                                            inflatedComma,
                                            afterParam);
        }
    }

    record ParamStar(Token star, Optional<Token> comma) implements ParameterItem {
        @Override
        public Token lastToken() {
            return comma.orElse(star);
        }

        @Override
        public ExpressionPart.ParameterItem inflate(InflateCtx ctx) {
            return new ExpressionPart.ParamStar(Claims.comma(ctx, comma));
        }
    }

    record ParamSlash(Token slash, Optional<Token> comma) implements ParameterItem {
        @Override
        public Token lastToken() {
            return comma.orElse(slash);
        }

        @Override
        public ExpressionPart.ParameterItem inflate(InflateCtx ctx) {
            var inflatedComma = Claims.comma(ctx, comma);
            var after = ctx.parenthesizable(lastToken().whitespaceAfter());
            return new ExpressionPart.ParamSlash(inflatedComma, after);
        }
    }
}
