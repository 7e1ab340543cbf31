package org.pragmatica.pycst.inflate;

import org.pragmatica.pycst.tree.Span;

import java.util.Optional;

/**
 * Byte spans recorded for one node.
 *
 * @param identSpan   defining range of a simple statement, name or literal
 * @param lexicalSpan keyword (or {@code async}) to end of body for scope-introducing and compound statements
 * @param defSpan     lexical span pulled back to the first decorator; definitions only
 * @param branchSpan  colon to end of body for clauses (if/elif, else, except, finally, case)
 */
public record NodePosition(Optional<Span> identSpan,
                           Optional<Span> lexicalSpan,
                           Optional<Span> defSpan,
                           Optional<Span> branchSpan) {
    public static final NodePosition EMPTY = new NodePosition(Optional.empty(),
                                                              Optional.empty(),
                                                              Optional.empty(),
                                                              Optional.empty());

    public NodePosition withIdentSpan(Span span) {
        return new NodePosition(Optional.of(span), lexicalSpan, defSpan, branchSpan);
    }

    public NodePosition withLexicalSpan(Span span) {
        return new NodePosition(identSpan, Optional.of(span), defSpan, branchSpan);
    }

    public NodePosition withDefSpan(Span span) {
        return new NodePosition(identSpan, lexicalSpan, Optional.of(span), branchSpan);
    }

    public NodePosition withBranchSpan(Span span) {
        return new NodePosition(identSpan, lexicalSpan, defSpan, Optional.of(span));
    }
}
