package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.Statement;
import org.pragmatica.pycst.tree.Suite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Body of a compound statement. {@link #inflate(InflateCtx, Token)} receives the colon that opens
 * the body, whose trailing whitespace the body owns.
 */
public sealed interface DeflatedSuite {
    Suite inflate(InflateCtx ctx, Token colon);

    /**
     * Byte offset where the body ends: the start of the closing dedent for indented blocks and
     * the end of the line break for one-line bodies.
     */
    int endOffset();

    record IndentedBlock(Token newline, Token indent, List<DeflatedStatement> body, Token dedent)
        implements DeflatedSuite {
        @Override
        public Suite inflate(InflateCtx ctx, Token colon) {
            var header = ctx.trailing(newline);
            ctx.pushIndent(indent.text());
            var statements = new ArrayList<Statement>(body.size());
            for (var statement : body) {
                statements.add(statement.inflate(ctx));
            }
            var footer = ctx.footer(dedent.whitespaceBefore());
            ctx.popIndent();
            return new Suite.IndentedBlock(header, Optional.of(indent.text()), List.copyOf(statements), footer);
        }

        @Override
        public int endOffset() {
            return dedent.start()
                         .byteOffset();
        }
    }

    /**
     * @param semicolons separator after each small statement, parallel to {@code body}
     */
    record SimpleStatementSuite(List<DeflatedSmallStatement> body, List<Optional<Token>> semicolons, Token newline)
        implements DeflatedSuite {
        @Override
        public Suite inflate(InflateCtx ctx, Token colon) {
            var leading = ctx.simple(colon.whitespaceAfter());
            var statements = inflateSmall(ctx, body, semicolons);
            return new Suite.SimpleStatementSuite(leading, statements, ctx.trailing(newline));
        }

        @Override
        public int endOffset() {
            return newline.end()
                          .byteOffset();
        }
    }

    static List<SmallStatement> inflateSmall(InflateCtx ctx,
                                             List<DeflatedSmallStatement> body,
                                             List<Optional<Token>> semicolons) {
        var result = new ArrayList<SmallStatement>(body.size());
        for (int i = 0; i < body.size(); i++) {
            result.add(body.get(i)
                           .inflate(ctx, semicolons.get(i)));
        }
        return List.copyOf(result);
    }
}
