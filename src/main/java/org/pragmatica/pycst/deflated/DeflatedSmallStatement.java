package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.deflated.DeflatedStatementPart.ImportAlias;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.NameItem;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeParameters;
import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.Operator.AugKind;
import org.pragmatica.pycst.tree.Operator.AugOperator;
import org.pragmatica.pycst.tree.Punctuation.Dot;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.Punctuation.Semicolon;
import org.pragmatica.pycst.tree.SimpleWhitespace;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.StatementPart;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deflated counterparts of {@link SmallStatement}. The semicolon that follows a small statement
 * belongs to the enclosing line and is handed over at inflation time.
 */
public sealed interface DeflatedSmallStatement {
    Token firstToken();

    Token lastToken();

    SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon);

    /**
     * Identity and identifier span shared by every small statement.
     */
    private static Optional<NodeId> open(InflateCtx ctx, DeflatedSmallStatement statement) {
        var id = ctx.nextId();
        ctx.recordIdent(id, InflateCtx.span(statement.firstToken(), statement.lastToken()));
        return id;
    }

    private static Optional<Semicolon> semicolon(InflateCtx ctx, Optional<Token> semicolon) {
        return semicolon.map(token -> Claims.semicolon(ctx, token));
    }

    record Pass(Token keyword) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return keyword;
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            return new SmallStatement.Pass(semicolon(ctx, semicolon), id);
        }
    }

    record Break(Token keyword) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return keyword;
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            return new SmallStatement.Break(semicolon(ctx, semicolon), id);
        }
    }

    record Continue(Token keyword) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return keyword;
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            return new SmallStatement.Continue(semicolon(ctx, semicolon), id);
        }
    }

    record Expr(DeflatedExpression value) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return value.firstToken();
        }

        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var inflated = value.inflate(ctx);
            return new SmallStatement.Expr(inflated, semicolon(ctx, semicolon), id);
        }
    }

    record Return(Token keyword, Optional<DeflatedExpression> value) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return value.map(DeflatedExpression::lastToken)
                        .orElse(keyword);
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterReturn = value.isPresent()
                              ? ctx.simple(keyword.whitespaceAfter())
                              : SimpleWhitespace.EMPTY;
            var inflated = value.map(expression -> expression.inflate(ctx));
            return new SmallStatement.Return(afterReturn, inflated, semicolon(ctx, semicolon), id);
        }
    }

    record Assert(Token keyword, DeflatedExpression test, Optional<Token> comma, Optional<DeflatedExpression> msg)
        implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return msg.map(DeflatedExpression::lastToken)
                      .orElseGet(test::lastToken);
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterAssert = ctx.simple(keyword.whitespaceAfter());
            var inflatedTest = test.inflate(ctx);
            var inflatedComma = Claims.comma(ctx, comma);
            var inflatedMsg = msg.map(expression -> expression.inflate(ctx));
            return new SmallStatement.Assert(afterAssert, inflatedTest, inflatedComma, inflatedMsg,
                                             semicolon(ctx, semicolon), id);
        }
    }

    record Import(Token keyword, List<ImportAlias> names) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return names.get(names.size() - 1)
                        .lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterImport = ctx.simple(keyword.whitespaceAfter());
            var aliases = Claims.all(ctx, names);
            return new SmallStatement.Import(afterImport, aliases, semicolon(ctx, semicolon), id);
        }
    }

    /**
     * @param dots {@code .} and {@code ...} tokens of a relative import
     */
    record ImportFrom(Token from,
                      List<Token> dots,
                      Optional<DeflatedExpression> module,
                      Token importToken,
                      Optional<Token> lpar,
                      List<ImportAlias> names,
                      Optional<Token> star,
                      Optional<Token> rpar) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return from;
        }

        @Override
        public Token lastToken() {
            if (rpar.isPresent()) {
                return rpar.get();
            }
            if (star.isPresent()) {
                return star.get();
            }
            return names.get(names.size() - 1)
                        .lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterFrom = ctx.simple(from.whitespaceAfter());
            var relative = relativeDots(ctx);
            var inflatedModule = module.map(expression -> expression.inflate(ctx));
            var beforeImport = ctx.simple(importToken.whitespaceBefore());
            var afterImport = ctx.simple(importToken.whitespaceAfter());
            var open = lpar.map(token -> new LeftParen(ctx.parenthesizable(token.whitespaceAfter())));
            var aliases = Claims.all(ctx, names);
            var close = rpar.map(token -> new RightParen(ctx.parenthesizable(token.whitespaceBefore())));
            return new SmallStatement.ImportFrom(afterFrom, relative, inflatedModule, beforeImport, afterImport,
                                                 open, aliases, star.isPresent(), close,
                                                 semicolon(ctx, semicolon), id);
        }

        /**
         * One dot per character; the whitespace after a {@code ...} token goes to its last dot.
         * Without a module name the whitespace after the last dot belongs to {@code import}.
         */
        private List<Dot> relativeDots(InflateCtx ctx) {
            var result = new ArrayList<Dot>();
            for (int i = 0; i < dots.size(); i++) {
                var token = dots.get(i);
                boolean claimsAfter = module.isPresent() || i < dots.size() - 1;
                var after = claimsAfter
                            ? ctx.simple(token.whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
                for (int dot = 1; dot < token.text()
                                             .length(); dot++) {
                    result.add(Dot.DEFAULT);
                }
                result.add(new Dot(SimpleWhitespace.EMPTY, after));
            }
            return List.copyOf(result);
        }
    }

    /**
     * @param equals the {@code =} token following each target, parallel to {@code targets}
     */
    record Assign(List<DeflatedExpression> targets, List<Token> equals, DeflatedExpression value)
        implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return targets.get(0)
                          .firstToken();
        }

        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var inflatedTargets = new ArrayList<StatementPart.AssignTarget>(targets.size());
            for (int i = 0; i < targets.size(); i++) {
                var target = targets.get(i)
                                    .inflate(ctx);
                var equal = equals.get(i);
                inflatedTargets.add(new StatementPart.AssignTarget(target,
                                                                   ctx.simple(equal.whitespaceBefore()),
                                                                   ctx.simple(equal.whitespaceAfter())));
            }
            var inflatedValue = value.inflate(ctx);
            return new SmallStatement.Assign(List.copyOf(inflatedTargets), inflatedValue,
                                             semicolon(ctx, semicolon), id);
        }
    }

    record AnnAssign(DeflatedExpression target,
                     Token colon,
                     DeflatedExpression annotation,
                     Optional<Token> equal,
                     Optional<DeflatedExpression> value) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return target.firstToken();
        }

        @Override
        public Token lastToken() {
            return value.map(DeflatedExpression::lastToken)
                        .orElseGet(annotation::lastToken);
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var inflatedTarget = target.inflate(ctx);
            var inflatedAnnotation = Claims.annotation(ctx, colon, annotation);
            var inflatedEqual = equal.map(token -> Claims.assignEqual(ctx, token));
            var inflatedValue = value.map(expression -> expression.inflate(ctx));
            return new SmallStatement.AnnAssign(inflatedTarget, inflatedAnnotation, inflatedEqual, inflatedValue,
                                                semicolon(ctx, semicolon), id);
        }
    }

    record AugAssign(DeflatedExpression target, Token operator, DeflatedExpression value)
        implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return target.firstToken();
        }

        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var inflatedTarget = target.inflate(ctx);
            var op = new AugOperator(AugKind.fromSymbol(operator.text())
                                            .orElseThrow(),
                                     ctx.parenthesizable(operator.whitespaceBefore()),
                                     ctx.parenthesizable(operator.whitespaceAfter()));
            var inflatedValue = value.inflate(ctx);
            return new SmallStatement.AugAssign(inflatedTarget, op, inflatedValue, semicolon(ctx, semicolon), id);
        }
    }

    record Del(Token keyword, DeflatedExpression target) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return target.lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterDel = ctx.simple(keyword.whitespaceAfter());
            var inflated = target.inflate(ctx);
            return new SmallStatement.Del(afterDel, inflated, semicolon(ctx, semicolon), id);
        }
    }

    record Global(Token keyword, List<NameItem> names) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return names.get(names.size() - 1)
                        .lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterGlobal = ctx.simple(keyword.whitespaceAfter());
            var items = Claims.all(ctx, names);
            return new SmallStatement.Global(afterGlobal, items, semicolon(ctx, semicolon), id);
        }
    }

    record Nonlocal(Token keyword, List<NameItem> names) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return names.get(names.size() - 1)
                        .lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterNonlocal = ctx.simple(keyword.whitespaceAfter());
            var items = Claims.all(ctx, names);
            return new SmallStatement.Nonlocal(afterNonlocal, items, semicolon(ctx, semicolon), id);
        }
    }

    record Raise(Token keyword, Optional<DeflatedExpression> exc, Optional<Token> from, Optional<DeflatedExpression> cause)
        implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            if (cause.isPresent()) {
                return cause.get()
                            .lastToken();
            }
            return exc.map(DeflatedExpression::lastToken)
                      .orElse(keyword);
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterRaise = exc.isPresent()
                             ? ctx.simple(keyword.whitespaceAfter())
                             : SimpleWhitespace.EMPTY;
            var inflatedExc = exc.map(expression -> expression.inflate(ctx));
            var beforeFrom = from.isPresent()
                             ? ctx.simple(from.get()
                                              .whitespaceBefore())
                             : SimpleWhitespace.EMPTY;
            var afterFrom = from.isPresent()
                            ? ctx.simple(from.get()
                                             .whitespaceAfter())
                            : SimpleWhitespace.EMPTY;
            var inflatedCause = cause.map(expression -> expression.inflate(ctx));
            return new SmallStatement.Raise(afterRaise, inflatedExc, beforeFrom, afterFrom, inflatedCause,
                                            semicolon(ctx, semicolon), id);
        }
    }

    record TypeAlias(Token keyword,
                     Token name,
                     Optional<TypeParameters> typeParameters,
                     Token equal,
                     DeflatedExpression value) implements DeflatedSmallStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Token lastToken() {
            return value.lastToken();
        }

        @Override
        public SmallStatement inflate(InflateCtx ctx, Optional<Token> semicolon) {
            var id = open(ctx, this);
            var afterType = ctx.simple(keyword.whitespaceAfter());
            var inflatedName = Claims.name(ctx, name);
            var afterName = ctx.simple(name.whitespaceAfter());
            var inflatedParameters = typeParameters.map(parameters -> parameters.inflate(ctx));
            var afterParameters = typeParameters.isPresent()
                                  ? ctx.simple(typeParameters.get()
                                                             .rbracket()
                                                             .whitespaceAfter())
                                  : SimpleWhitespace.EMPTY;
            var afterEquals = ctx.simple(equal.whitespaceAfter());
            var inflatedValue = value.inflate(ctx);
            return new SmallStatement.TypeAlias(afterType, inflatedName, afterName, inflatedParameters,
                                                afterParameters, afterEquals, inflatedValue,
                                                semicolon(ctx, semicolon), id);
        }
    }
}
