package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.Punctuation.LeftParen;
import org.pragmatica.pycst.tree.Punctuation.RightParen;

import java.util.ArrayList;
import java.util.List;

/**
 * Parentheses wrapped around a deflated expression or pattern. The parser adds a pair every time
 * it recognizes a parenthesized group, so the outermost pair is first on the left and last on
 * the right.
 */
public final class Parens {
    private final List<Token> left;
    private final List<Token> right;

    private Parens() {
        this.left = new ArrayList<>();
        this.right = new ArrayList<>();
    }

    public static Parens create() {
        return new Parens();
    }

    public void wrap(Token open, Token close) {
        left.add(0, open);
        right.add(close);
    }

    public boolean isEmpty() {
        return left.isEmpty();
    }

    public Token first() {
        return left.get(0);
    }

    public Token last() {
        return right.get(right.size() - 1);
    }

    List<LeftParen> inflateLeft(InflateCtx ctx) {
        var result = new ArrayList<LeftParen>(left.size());
        for (var token : left) {
            result.add(new LeftParen(ctx.parenthesizable(token.whitespaceAfter())));
        }
        return List.copyOf(result);
    }

    List<RightParen> inflateRight(InflateCtx ctx) {
        var result = new ArrayList<RightParen>(right.size());
        for (var token : right) {
            result.add(new RightParen(ctx.parenthesizable(token.whitespaceBefore())));
        }
        return List.copyOf(result);
    }
}
