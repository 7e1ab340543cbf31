package org.pragmatica.pycst.inflate;

import org.pragmatica.pycst.error.InflationException;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tokenizer.WhitespaceCell;
import org.pragmatica.pycst.tree.EmptyLine;
import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.ParenthesizableWhitespace;
import org.pragmatica.pycst.tree.SimpleWhitespace;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.TrailingWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * State threaded through one inflation pass: node identities, the optional position table,
 * the stack of absolute indentation strings and access to the token whitespace cells.
 */
public final class InflateCtx {
    private final List<Token> tokens;
    private final NodeIdGenerator ids;
    private final Optional<PositionTable> positions;
    private final List<String> indents;
    private final String defaultIndent;
    private final String defaultNewline;

    private InflateCtx(List<Token> tokens, boolean capturePositions, String defaultIndent, String defaultNewline) {
        this.tokens = tokens;
        this.ids = NodeIdGenerator.create();
        this.positions = capturePositions
                         ? Optional.of(PositionTable.create())
                         : Optional.empty();
        this.indents = new ArrayList<>();
        this.indents.add("");
        this.defaultIndent = defaultIndent;
        this.defaultNewline = defaultNewline;
    }

    public static InflateCtx create(List<Token> tokens, boolean capturePositions, String defaultIndent, String defaultNewline) {
        return new InflateCtx(tokens, capturePositions, defaultIndent, defaultNewline);
    }

    // === Identity and spans ===

    public Optional<NodeId> nextId() {
        return Optional.of(ids.next());
    }

    public int trackedNodeCount() {
        return ids.count();
    }

    public Optional<PositionTable> positions() {
        return positions;
    }

    public static Span span(Token first, Token last) {
        return Span.of(first.start().byteOffset(), last.end().byteOffset());
    }

    public void recordIdent(Optional<NodeId> id, Span span) {
        id.ifPresent(nodeId -> positions.ifPresent(table -> table.update(nodeId, p -> p.withIdentSpan(span))));
    }

    public void recordLexical(Optional<NodeId> id, Span span) {
        id.ifPresent(nodeId -> positions.ifPresent(table -> table.update(nodeId, p -> p.withLexicalSpan(span))));
    }

    public void recordDefinition(Optional<NodeId> id, Span span) {
        id.ifPresent(nodeId -> positions.ifPresent(table -> table.update(nodeId, p -> p.withDefSpan(span))));
    }

    public void recordBranch(Optional<NodeId> id, Span span) {
        id.ifPresent(nodeId -> positions.ifPresent(table -> table.update(nodeId, p -> p.withBranchSpan(span))));
    }

    // === Indentation ===

    public String absoluteIndent() {
        return indents.get(indents.size() - 1);
    }

    public void pushIndent(String relativeIndent) {
        indents.add(absoluteIndent() + relativeIndent);
    }

    public void popIndent() {
        if (indents.size() == 1) {
            throw new InflationException("Indentation stack underflow");
        }
        indents.remove(indents.size() - 1);
    }

    public String defaultIndent() {
        return defaultIndent;
    }

    public String defaultNewline() {
        return defaultNewline;
    }

    // === Whitespace ===

    public SimpleWhitespace simple(WhitespaceCell cell) {
        return WhitespaceParser.parseSimple(cell);
    }

    public ParenthesizableWhitespace parenthesizable(WhitespaceCell cell) {
        return WhitespaceParser.parseParenthesizable(cell, absoluteIndent());
    }

    public TrailingWhitespace trailing(Token newline) {
        return WhitespaceParser.parseTrailing(newline.whitespaceBefore(), newline.text());
    }

    public List<EmptyLine> emptyLines(WhitespaceCell cell) {
        return WhitespaceParser.parseEmptyLines(cell, absoluteIndent());
    }

    public List<EmptyLine> footer(WhitespaceCell cell) {
        return WhitespaceParser.parseFooter(cell, absoluteIndent());
    }

    public List<EmptyLine> moduleFooter(WhitespaceCell cell) {
        return WhitespaceParser.parseModuleFooter(cell);
    }

    public void indent(WhitespaceCell cell) {
        WhitespaceParser.parseIndent(cell, absoluteIndent());
    }

    /**
     * Every byte between tokens must have been claimed by exactly one whitespace field.
     */
    public void verifyConsumed() {
        if (indents.size() != 1) {
            throw new InflationException("Unbalanced indentation after inflation: " + indents);
        }
        for (var token : tokens) {
            checkCell(token, token.whitespaceBefore());
            checkCell(token, token.whitespaceAfter());
        }
    }

    private static void checkCell(Token token, WhitespaceCell cell) {
        if (!cell.exhausted()) {
            throw new InflationException("Unclaimed whitespace '" + cell.remaining() + "' next to " + token);
        }
    }
}
