package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Statement;

/**
 * A single deflated statement or expression parsed on its own. Like {@link DeflatedModule} it
 * claims its whitespace cells while inflating and can be inflated exactly once.
 */
public final class DeflatedFragment<T> {
    private final Inflatable<T> root;
    private boolean consumed;

    private DeflatedFragment(Inflatable<T> root) {
        this.root = root;
    }

    public static DeflatedFragment<Statement> statement(DeflatedStatement statement) {
        return new DeflatedFragment<>(statement::inflate);
    }

    public static DeflatedFragment<Expression> expression(DeflatedExpression expression) {
        return new DeflatedFragment<>(expression::inflate);
    }

    public boolean consumed() {
        return consumed;
    }

    /**
     * @throws IllegalStateException when this fragment was already inflated
     */
    public T inflate(InflateCtx ctx) {
        if (consumed) {
            throw new IllegalStateException("Deflated fragment was already inflated");
        }
        consumed = true;
        return root.inflate(ctx);
    }
}
