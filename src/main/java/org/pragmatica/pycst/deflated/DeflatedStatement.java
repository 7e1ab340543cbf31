package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Arg;
import org.pragmatica.pycst.deflated.DeflatedExpressionPart.Parameters;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Decorator;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Else;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Finally;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.Handler;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.MatchCase;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.TypeParameters;
import org.pragmatica.pycst.deflated.DeflatedStatementPart.WithItem;
import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.EmptyLine;
import org.pragmatica.pycst.tree.OrElse;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.RightParen;
import org.pragmatica.pycst.tree.SimpleWhitespace;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.Statement;
import org.pragmatica.pycst.tree.StatementPart;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deflated counterparts of {@link Statement}.
 *
 * <p>Inflation of every statement starts by claiming the blank and comment lines in front of its
 * first token, then the indentation of its own line. Compound statements record their lexical span
 * from the introducing keyword to the end of the last body.
 */
public sealed interface DeflatedStatement {
    Token firstToken();

    Statement inflate(InflateCtx ctx);

    private static List<EmptyLine> leadingLines(InflateCtx ctx, Token first) {
        var lines = ctx.emptyLines(first.whitespaceBefore());
        ctx.indent(first.whitespaceBefore());
        return lines;
    }

    /**
     * @param semicolons separator after each small statement, parallel to {@code body}
     */
    record SimpleStatementLine(List<DeflatedSmallStatement> body, List<Optional<Token>> semicolons, Token newline)
        implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return body.get(0)
                       .firstToken();
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var leading = leadingLines(ctx, firstToken());
            var statements = DeflatedSuite.inflateSmall(ctx, body, semicolons);
            return new Statement.SimpleStatementLine(leading, statements, ctx.trailing(newline));
        }
    }

    record FunctionDef(List<Decorator> decorators,
                       Optional<Token> async,
                       Token def,
                       Token name,
                       Optional<TypeParameters> typeParameters,
                       Token lpar,
                       Parameters params,
                       Token rpar,
                       Optional<Token> arrow,
                       Optional<DeflatedExpression> returns,
                       Token colon,
                       DeflatedSuite body) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return decorators.isEmpty()
                   ? async.orElse(def)
                   : decorators.get(0)
                               .at();
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            var keyword = async.orElse(def);
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), body.endOffset()));
            ctx.recordDefinition(id, Span.of(firstToken().start().byteOffset(), body.endOffset()));
            var leading = ctx.emptyLines(firstToken().whitespaceBefore());
            var inflatedDecorators = Claims.all(ctx, decorators);
            var linesAfterDecorators = decorators.isEmpty()
                                       ? List.<EmptyLine>of()
                                       : ctx.emptyLines(keyword.whitespaceBefore());
            ctx.indent(keyword.whitespaceBefore());
            var asynchronous = async.map(token -> Claims.asynchronous(ctx, token));
            var afterDef = ctx.simple(def.whitespaceAfter());
            var inflatedName = Claims.name(ctx, name);
            var afterName = ctx.simple(name.whitespaceAfter());
            var inflatedTypeParameters = typeParameters.map(parameters -> parameters.inflate(ctx));
            var afterTypeParameters = typeParameters.isPresent()
                                      ? ctx.simple(typeParameters.get()
                                                                 .rbracket()
                                                                 .whitespaceAfter())
                                      : SimpleWhitespace.EMPTY;
            var beforeParams = ctx.parenthesizable(lpar.whitespaceAfter());
            var inflatedParams = params.inflate(ctx);
            var inflatedReturns = arrow.map(token -> Claims.annotation(ctx, token, returns.orElseThrow()));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new Statement.FunctionDef(leading, inflatedDecorators, linesAfterDecorators, asynchronous, afterDef,
                                             inflatedName, afterName, inflatedTypeParameters, afterTypeParameters,
                                             beforeParams, inflatedParams, inflatedReturns, beforeColon, inflatedBody,
                                             id);
        }
    }

    record ClassDef(List<Decorator> decorators,
                    Token keyword,
                    Token name,
                    Optional<TypeParameters> typeParameters,
                    Optional<Token> lpar,
                    List<Arg> arguments,
                    Optional<Token> rpar,
                    Token colon,
                    DeflatedSuite body) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return decorators.isEmpty()
                   ? keyword
                   : decorators.get(0)
                               .at();
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), body.endOffset()));
            ctx.recordDefinition(id, Span.of(firstToken().start().byteOffset(), body.endOffset()));
            var leading = ctx.emptyLines(firstToken().whitespaceBefore());
            var inflatedDecorators = Claims.all(ctx, decorators);
            var linesAfterDecorators = decorators.isEmpty()
                                       ? List.<EmptyLine>of()
                                       : ctx.emptyLines(keyword.whitespaceBefore());
            ctx.indent(keyword.whitespaceBefore());
            var afterClass = ctx.simple(keyword.whitespaceAfter());
            var inflatedName = Claims.name(ctx, name);
            var afterName = ctx.simple(name.whitespaceAfter());
            var inflatedTypeParameters = typeParameters.map(parameters -> parameters.inflate(ctx));
            var afterTypeParameters = typeParameters.isPresent()
                                      ? ctx.simple(typeParameters.get()
                                                                 .rbracket()
                                                                 .whitespaceAfter())
                                      : SimpleWhitespace.EMPTY;
            var open = lpar.map(token -> new LeftParen(ctx.parenthesizable(token.whitespaceAfter())));
            var inflatedArguments = Claims.all(ctx, arguments);
            var close = rpar.map(token -> new RightParen(ctx.parenthesizable(token.whitespaceBefore())));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new Statement.ClassDef(leading, inflatedDecorators, linesAfterDecorators, afterClass, inflatedName,
                                          afterName, inflatedTypeParameters, afterTypeParameters, open,
                                          inflatedArguments, close, beforeColon, inflatedBody, id);
        }
    }

    /**
     * {@code if} statement or, with {@code elif} set, an {@code elif} clause of an enclosing one.
     */
    record If(Token keyword,
              boolean elif,
              DeflatedExpression test,
              Token colon,
              DeflatedSuite body,
              Optional<DeflatedOrElse> orelse) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        /**
         * End of the whole chain, including the trailing {@code elif} and {@code else} clauses.
         */
        public int endOffset() {
            return orelse.map(DeflatedOrElse::endOffset)
                         .orElseGet(body::endOffset);
        }

        @Override
        public Statement.If inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leading = leadingLines(ctx, keyword);
            var beforeTest = ctx.simple(keyword.whitespaceAfter());
            var inflatedTest = test.inflate(ctx);
            var afterTest = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            var inflatedOrElse = orelse.map(clause -> clause.inflate(ctx));
            return new Statement.If(leading, elif, beforeTest, inflatedTest, afterTest, inflatedBody, inflatedOrElse, id);
        }
    }

    /**
     * Continuation of an {@code if}: either an {@code elif} chain or a final {@code else}.
     */
    record DeflatedOrElse(Optional<If> elif, Optional<Else> orelse) {
        public static DeflatedOrElse of(If elif) {
            return new DeflatedOrElse(Optional.of(elif), Optional.empty());
        }

        public static DeflatedOrElse of(Else orelse) {
            return new DeflatedOrElse(Optional.empty(), Optional.of(orelse));
        }

        int endOffset() {
            return elif.map(If::endOffset)
                       .orElseGet(() -> orelse.orElseThrow()
                                              .body()
                                              .endOffset());
        }

        OrElse inflate(InflateCtx ctx) {
            if (elif.isPresent()) {
                return elif.get()
                           .inflate(ctx);
            }
            return orelse.orElseThrow()
                         .inflate(ctx);
        }
    }

    record For(Optional<Token> async,
               Token keyword,
               DeflatedExpression target,
               Token in,
               DeflatedExpression iter,
               Token colon,
               DeflatedSuite body,
               Optional<Else> orelse) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return async.orElse(keyword);
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            var end = orelse.map(clause -> clause.body()
                                                 .endOffset())
                            .orElseGet(body::endOffset);
            ctx.recordLexical(id, Span.of(firstToken().start().byteOffset(), end));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leading = leadingLines(ctx, firstToken());
            var asynchronous = async.map(token -> Claims.asynchronous(ctx, token));
            var afterFor = ctx.simple(keyword.whitespaceAfter());
            var inflatedTarget = target.inflate(ctx);
            var beforeIn = ctx.simple(in.whitespaceBefore());
            var afterIn = ctx.simple(in.whitespaceAfter());
            var inflatedIter = iter.inflate(ctx);
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            var inflatedOrElse = orelse.map(clause -> clause.inflate(ctx));
            return new Statement.For(leading, asynchronous, afterFor, inflatedTarget, beforeIn, afterIn, inflatedIter,
                                     beforeColon, inflatedBody, inflatedOrElse, id);
        }
    }

    record While(Token keyword, DeflatedExpression test, Token colon, DeflatedSuite body, Optional<Else> orelse)
        implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            var end = orelse.map(clause -> clause.body()
                                                 .endOffset())
                            .orElseGet(body::endOffset);
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), end));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leading = leadingLines(ctx, keyword);
            var afterWhile = ctx.simple(keyword.whitespaceAfter());
            var inflatedTest = test.inflate(ctx);
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            var inflatedOrElse = orelse.map(clause -> clause.inflate(ctx));
            return new Statement.While(leading, afterWhile, inflatedTest, beforeColon, inflatedBody, inflatedOrElse, id);
        }
    }

    /**
     * {@code try} statement; becomes a {@link Statement.TryStar} when its handlers are {@code except*} clauses.
     */
    record Try(Token keyword,
               Token colon,
               DeflatedSuite body,
               List<Handler> handlers,
               Optional<Else> orelse,
               Optional<Finally> finalBody) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        private int endOffset() {
            if (finalBody.isPresent()) {
                return finalBody.get()
                                .body()
                                .endOffset();
            }
            if (orelse.isPresent()) {
                return orelse.get()
                             .body()
                             .endOffset();
            }
            if (!handlers.isEmpty()) {
                return handlers.get(handlers.size() - 1)
                               .body()
                               .endOffset();
            }
            return body.endOffset();
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leading = leadingLines(ctx, keyword);
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            boolean star = !handlers.isEmpty() && handlers.get(0)
                                                          .starred();
            if (star) {
                var inflatedHandlers = new ArrayList<StatementPart.ExceptStarHandler>(handlers.size());
                for (var handler : handlers) {
                    inflatedHandlers.add(handler.inflateStar(ctx));
                }
                var inflatedOrElse = orelse.map(clause -> clause.inflate(ctx));
                var inflatedFinally = finalBody.map(clause -> clause.inflate(ctx));
                return new Statement.TryStar(leading, beforeColon, inflatedBody, List.copyOf(inflatedHandlers),
                                             inflatedOrElse, inflatedFinally, id);
            }
            var inflatedHandlers = new ArrayList<StatementPart.ExceptHandler>(handlers.size());
            for (var handler : handlers) {
                inflatedHandlers.add(handler.inflatePlain(ctx));
            }
            var inflatedOrElse = orelse.map(clause -> clause.inflate(ctx));
            var inflatedFinally = finalBody.map(clause -> clause.inflate(ctx));
            return new Statement.Try(leading, beforeColon, inflatedBody, List.copyOf(inflatedHandlers), inflatedOrElse,
                                     inflatedFinally, id);
        }
    }

    record With(Optional<Token> async,
                Token keyword,
                Optional<Token> lpar,
                List<WithItem> items,
                Optional<Token> rpar,
                Token colon,
                DeflatedSuite body) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return async.orElse(keyword);
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(firstToken().start().byteOffset(), body.endOffset()));
            ctx.recordBranch(id, Span.of(colon.end().byteOffset(), body.endOffset()));
            var leading = leadingLines(ctx, firstToken());
            var asynchronous = async.map(token -> Claims.asynchronous(ctx, token));
            var afterWith = ctx.simple(keyword.whitespaceAfter());
            var open = lpar.map(token -> new LeftParen(ctx.parenthesizable(token.whitespaceAfter())));
            var inflatedItems = Claims.all(ctx, items);
            var close = rpar.map(token -> new RightParen(ctx.parenthesizable(token.whitespaceBefore())));
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var inflatedBody = body.inflate(ctx, colon);
            return new Statement.With(leading, asynchronous, afterWith, open, inflatedItems, close, beforeColon,
                                      inflatedBody, id);
        }
    }

    record Match(Token keyword,
                 DeflatedExpression subject,
                 Token colon,
                 Token newline,
                 Token indent,
                 List<MatchCase> cases,
                 Token dedent) implements DeflatedStatement {
        @Override
        public Token firstToken() {
            return keyword;
        }

        @Override
        public Statement inflate(InflateCtx ctx) {
            var id = ctx.nextId();
            ctx.recordLexical(id, Span.of(keyword.start().byteOffset(), dedent.start().byteOffset()));
            var leading = leadingLines(ctx, keyword);
            var afterMatch = ctx.simple(keyword.whitespaceAfter());
            var inflatedSubject = subject.inflate(ctx);
            var beforeColon = ctx.simple(colon.whitespaceBefore());
            var afterColon = ctx.trailing(newline);
            ctx.pushIndent(indent.text());
            var inflatedCases = Claims.all(ctx, cases);
            var footer = ctx.footer(dedent.whitespaceBefore());
            ctx.popIndent();
            return new Statement.Match(leading, afterMatch, inflatedSubject, beforeColon, afterColon,
                                       Optional.of(indent.text()), inflatedCases, footer, id);
        }
    }
}
