package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.Punctuation.LeftSquareBracket;
import org.pragmatica.pycst.tree.Punctuation.RightSquareBracket;
import org.pragmatica.pycst.tree.SimpleWhitespace;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.StatementPart;

import java.util.List;
import java.util.Optional;

/**
 * Deflated pieces of compound and import statements.
 */
public sealed interface DeflatedStatementPart {
    record Decorator(Token at, DeflatedExpression decorator, Token newline)
        implements DeflatedStatementPart, Inflatable<StatementPart.Decorator> {
        @Override
        public StatementPart.Decorator inflate(InflateCtx ctx) {
            var leadingLines = ctx.emptyLines(at.whitespaceBefore());
            ctx.indent(at.whitespaceBefore());
            var afterAt = ctx.simple(at.whitespaceAfter());
            var inflated = decorator.inflate(ctx);
            return new StatementPart.Decorator(leadingLines, afterAt, inflated, ctx.trailing(newline));
        }
    }

    record AsName(Token as, DeflatedExpression name) implements DeflatedStatementPart, Inflatable<StatementPart.AsName> {
        @Override
        public StatementPart.AsName inflate(InflateCtx ctx) {
            var beforeAs = ctx.parenthesizable(as.whitespaceBefore());
            var afterAs = ctx.parenthesizable(as.whitespaceAfter());
            return new StatementPart.AsName(beforeAs, afterAs, name.inflate(ctx));
        }
    }

    record ImportAlias(DeflatedExpression name, Optional<AsName> asname, Optional<Token> comma)
        implements DeflatedStatementPart, Inflatable<StatementPart.ImportAlias> {
        public Token lastToken() {
            return asname.map(alias -> alias.name()
                                            .lastToken())
                         .orElseGet(name::lastToken);
        }

        @Override
        public StatementPart.ImportAlias inflate(InflateCtx ctx) {
            var inflatedName = name.inflate(ctx);
            var inflatedAlias = asname.map(alias -> alias.inflate(ctx));
            return new StatementPart.ImportAlias(inflatedName, inflatedAlias, Claims.comma(ctx, comma));
        }
    }

    record NameItem(Token name, Optional<Token> comma) implements DeflatedStatementPart, Inflatable<StatementPart.NameItem> {
        public Token lastToken() {
            return name;
        }

        @Override
        public StatementPart.NameItem inflate(InflateCtx ctx) {
            var inflatedName = Claims.name(ctx, name);
            return new StatementPart.NameItem(inflatedName, Claims.comma(ctx, comma));
        }
    }

    record WithItem(DeflatedExpression item, Optional<AsName> asname, Optional<Token> comma)
        implements DeflatedStatementPart, Inflatable<StatementPart.WithItem> {
        @Override
        public StatementPart.WithItem inflate(InflateCtx ctx) {
            var inflatedItem = item.inflate(ctx);
            var inflatedAlias = asname.map(alias -> alias.inflate(ctx));
            return new StatementPart.WithItem(inflatedItem, inflatedAlias, Claims.comma(ctx, comma));
        }
    }

    /**
     * One {@code except} clause. Whether it is an {@code except*} clause decides which statement
     * the enclosing {@code try} becomes.
     */
    record Handler(Token except,
                   Optional<Token> star,
                   Optional<DeflatedExpression> type,
                   Optional<AsName> name,
                   Token colon,
                   DeflatedSuite body) implements DeflatedStatementPart {
        public boolean starred() {
            return star.isPresent();
        }

        StatementPart.ExceptHandler inflatePlain(InflateCtx ctx) {
            var id = open(ctx);
            var leadingLines = ctx.emptyLines(except.whitespaceBefore());
            ctx.indent(except.whitespaceBefore());
            var afterExcept = type.isPresent()
                              ? ctx.simple(except.whitespaceAfter())
                              : SimpleWhitespace.EMPTY;
            var inflatedType = type.map(expression -> expression.inflate(ctx));
            var inflatedName = name.map(alias -> alias.inflate(ctx));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new StatementPart.ExceptHandler(leadingLines, afterExcept, inflatedType, inflatedName, beforeColon,
                                                   inflatedBody, id);
        }

        StatementPart.ExceptStarHandler inflateStar(InflateCtx ctx) {
            var id = open(ctx);
            var leadingLines = ctx.emptyLines(except.whitespaceBefore());
            ctx.indent(except.whitespaceBefore());
            var afterExcept = ctx.simple(except.whitespaceAfter());
            var afterStar = ctx.simple(star.orElseThrow()
                                           .whitespaceAfter());
            var inflatedType = type.orElseThrow()
                                   .inflate(ctx);
            var inflatedName = name.map(alias -> alias.inflate(ctx));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new StatementPart.ExceptStarHandler(leadingLines, afterExcept, afterStar, inflatedType, inflatedName,
                                                       beforeColon, inflatedBody, id);
        }

        private Optional<NodeId> open(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(except.start().byteOffset(), body.endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            return id;
        }
    }

    record Else(Token keyword, Token colon, DeflatedSuite body)
        implements DeflatedStatementPart, Inflatable<StatementPart.Else> {
        @Override
        public StatementPart.Else inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), body.endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leadingLines = ctx.emptyLines(keyword.whitespaceBefore());
            ctx.indent(keyword.whitespaceBefore());
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new StatementPart.Else(leadingLines, beforeColon, inflatedBody, id);
        }
    }

    record Finally(Token keyword, Token colon, DeflatedSuite body)
        implements DeflatedStatementPart, Inflatable<StatementPart.Finally> {
        @Override
        public StatementPart.Finally inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), body.endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leadingLines = ctx.emptyLines(keyword.whitespaceBefore());
            ctx.indent(keyword.whitespaceBefore());
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new StatementPart.Finally(leadingLines, beforeColon, inflatedBody, id);
        }
    }

    record MatchCase(Token keyword,
                     DeflatedPattern pattern,
                     Optional<Token> ifToken,
                     Optional<DeflatedExpression> guard,
                     Token colon,
                     DeflatedSuite body) implements DeflatedStatementPart, Inflatable<StatementPart.MatchCase> {
        @Override
        public StatementPart.MatchCase inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), body.endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leadingLines = ctx.emptyLines(keyword.whitespaceBefore());
            ctx.indent(keyword.whitespaceBefore());
            var afterCase = ctx.simple(keyword.whitespaceAfter());
            var inflatedPattern = pattern.inflate(ctx);
            var beforeIf = ifToken.isPresent()
                           ? ctx.simple(ifToken.get()
                                               .whitespaceBefore())
                           : SimpleWhitespace.EMPTY;
            var afterIf = ifToken.isPresent()
                          ? ctx.simple(ifToken.get()
                                              .whitespaceAfter())
                          : SimpleWhitespace.EMPTY;
            var inflatedGuard = guard.map(expression -> expression.inflate(ctx));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new StatementPart.MatchCase(leadingLines, afterCase, inflatedPattern, beforeIf, afterIf,
                                               inflatedGuard, beforeColon, inflatedBody, id);
        }
    }

    record TypeParameters(Token lbracket, List<TypeParam> params, Token rbracket)
        implements DeflatedStatementPart, Inflatable<StatementPart.TypeParameters> {
        @Override
        public StatementPart.TypeParameters inflate(InflateCtx ctx) {
            var open = new LeftSquareBracket(ctx.parenthesizable(lbracket.whitespaceAfter()));
            var inflatedParams = Claims.all(ctx, params);
            var close = new RightSquareBracket(ctx.parenthesizable(rbracket.whitespaceBefore()));
            return new StatementPart.TypeParameters(open, inflatedParams, close);
        }
    }

    record TypeParam(TypeVarLike param,
                     Optional<Token> equal,
                     Optional<DeflatedExpression> defaultValue,
                     Optional<Token> comma) implements DeflatedStatementPart, Inflatable<StatementPart.TypeParam> {
        @Override
        public StatementPart.TypeParam inflate(InflateCtx ctx) {
            var inflatedParam = param.inflate(ctx);
            var inflatedEqual = equal.map(token -> Claims.assignEqual(ctx, token));
            var inflatedDefault = defaultValue.map(expression -> expression.inflate(ctx));
            return new StatementPart.TypeParam(inflatedParam, inflatedEqual, inflatedDefault, Claims.comma(ctx, comma));
        }
    }

    sealed interface TypeVarLike extends DeflatedStatementPart {
        StatementPart.TypeVarLike inflate(InflateCtx ctx);
    }

    record TypeVar(Token name, Optional<Token> colon, Optional<DeflatedExpression> bound) implements TypeVarLike {
        @Override
        public StatementPart.TypeVarLike inflate(InflateCtx ctx) {
            var inflatedName = Claims.name(ctx, name);
            var inflatedColon = colon.map(token -> Claims.colon(ctx, token));
            var inflatedBound = bound.map(expression -> expression.inflate(ctx));
            return new StatementPart.TypeVar(inflatedName, inflatedColon, inflatedBound);
        }
    }

    record TypeVarTuple(Token star, Token name) implements TypeVarLike {
        @Override
        public StatementPart.TypeVarLike inflate(InflateCtx ctx) {
            var afterStar = ctx.parenthesizable(star.whitespaceAfter());
            return new StatementPart.TypeVarTuple(afterStar, Claims.name(ctx, name));
        }
    }

    record ParamSpec(Token stars, Token name) implements TypeVarLike {
        @Override
        public StatementPart.TypeVarLike inflate(InflateCtx ctx) {
            var afterStars = ctx.parenthesizable(stars.whitespaceAfter());
            return new StatementPart.ParamSpec(afterStars, Claims.name(ctx, name));
        }
    }
}
