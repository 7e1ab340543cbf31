package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Parse result ready for inflation. Whitespace cells are claimed destructively, so a deflated
 * module can be inflated exactly once.
 */
public final class DeflatedModule {
    private final List<DeflatedStatement> body;
    private final Token endmarker;
    private boolean consumed;

    private DeflatedModule(List<DeflatedStatement> body, Token endmarker) {
        this.body = body;
        this.endmarker = endmarker;
    }

    public static DeflatedModule create(List<DeflatedStatement> body, Token endmarker) {
        return new DeflatedModule(List.copyOf(body), endmarker);
    }

    public int statementCount() {
        return body.size();
    }

    public boolean consumed() {
        return consumed;
    }

    /**
     * @throws IllegalStateException when this module was already inflated
     */
    public Module inflate(InflateCtx ctx, boolean byteOrderMark, String encoding) {
        if (consumed) {
            throw new IllegalStateException("Deflated module was already inflated");
        }
        consumed = true;
        var statements = new ArrayList<Statement>(body.size());
        for (var statement : body) {
            statements.add(statement.inflate(ctx));
        }
        var footer = ctx.moduleFooter(endmarker.whitespaceBefore());
        ctx.verifyConsumed();
        return new Module(List.copyOf(statements), footer, ctx.defaultIndent(), ctx.defaultNewline(), byteOrderMark,
                          encoding);
    }
}
