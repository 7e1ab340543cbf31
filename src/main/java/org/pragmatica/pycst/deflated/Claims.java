package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.ExpressionPart;
import org.pragmatica.pycst.tree.Punctuation.AssignEqual;
import org.pragmatica.pycst.tree.Punctuation.Asynchronous;
import org.pragmatica.pycst.tree.Punctuation.BitOr;
import org.pragmatica.pycst.tree.Punctuation.Colon;
import org.pragmatica.pycst.tree.Punctuation.Comma;
import org.pragmatica.pycst.tree.Punctuation.Semicolon;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Inflation of single delimiter tokens into punctuation that owns the whitespace on both sides.
 */
final class Claims {
    private Claims() {}

    static <T> List<T> all(InflateCtx ctx, List<? extends Inflatable<T>> items) {
        var result = new ArrayList<T>(items.size());
        for (var item : items) {
            result.add(item.inflate(ctx));
        }
        return List.copyOf(result);
    }

    static Optional<Comma> comma(InflateCtx ctx, Optional<Token> comma) {
        return comma.map(token -> new Comma(ctx.parenthesizable(token.whitespaceBefore()),
                                            ctx.parenthesizable(token.whitespaceAfter())));
    }

    static Colon colon(InflateCtx ctx, Token colon) {
        return new Colon(ctx.parenthesizable(colon.whitespaceBefore()), ctx.parenthesizable(colon.whitespaceAfter()));
    }

    static AssignEqual assignEqual(InflateCtx ctx, Token equal) {
        return new AssignEqual(ctx.parenthesizable(equal.whitespaceBefore()),
                               ctx.parenthesizable(equal.whitespaceAfter()));
    }

    static BitOr bitOr(InflateCtx ctx, Token bar) {
        return new BitOr(ctx.parenthesizable(bar.whitespaceBefore()), ctx.parenthesizable(bar.whitespaceAfter()));
    }

    static Semicolon semicolon(InflateCtx ctx, Token semicolon) {
        return new Semicolon(ctx.simple(semicolon.whitespaceBefore()), ctx.simple(semicolon.whitespaceAfter()));
    }

    static Asynchronous asynchronous(InflateCtx ctx, Token async) {
        return new Asynchronous(ctx.parenthesizable(async.whitespaceAfter()));
    }

    /**
     * Annotation introduced by {@code indicator}, which is a {@code :} or {@code ->} token.
     */
    static ExpressionPart.Annotation annotation(InflateCtx ctx, Token indicator, DeflatedExpression annotation) {
        var before = ctx.parenthesizable(indicator.whitespaceBefore());
        var after = ctx.parenthesizable(indicator.whitespaceAfter());
        return new ExpressionPart.Annotation(indicator.text(), Optional.of(before), Optional.of(after),
                                             annotation.inflate(ctx));
    }

    /**
     * A bare identifier that is not itself parenthesized: attribute names, keywords of calls,
     * definition names.
     */
    static Expression.Name name(InflateCtx ctx, Token token) {
        var id = ctx.nextId();
        ctx.recordIdent(id, InflateCtx.span(token, token));
        return new Expression.Name(token.text(), List.of(), List.of(), id);
    }
}
