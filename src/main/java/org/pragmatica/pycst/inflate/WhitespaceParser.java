package org.pragmatica.pycst.inflate;

import org.pragmatica.pycst.error.InflationException;
import org.pragmatica.pycst.tokenizer.WhitespaceCell;
import org.pragmatica.pycst.tree.Comment;
import org.pragmatica.pycst.tree.EmptyLine;
import org.pragmatica.pycst.tree.Newline;
import org.pragmatica.pycst.tree.ParenthesizableWhitespace;
import org.pragmatica.pycst.tree.ParenthesizedWhitespace;
import org.pragmatica.pycst.tree.SimpleWhitespace;
import org.pragmatica.pycst.tree.TrailingWhitespace;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the raw text of whitespace cells into typed whitespace values.
 *
 * <p>Every function claims a prefix of the cell's unclaimed text and leaves the rest for the
 * next owner. Scanning happens on a copy of the remaining text, so a function that decides not
 * to take anything leaves the cell untouched.
 */
public final class WhitespaceParser {
    private WhitespaceParser() {}

    /**
     * Spaces, tabs, form feeds and backslash continuations.
     */
    public static SimpleWhitespace parseSimple(WhitespaceCell cell) {
        var text = cell.remaining();
        return SimpleWhitespace.of(cell.advance(simpleEnd(text, 0)));
    }

    /**
     * Whitespace that may cross line breaks. Falls back to simple whitespace unless a line break
     * follows the leading spaces and optional comment.
     */
    public static ParenthesizableWhitespace parseParenthesizable(WhitespaceCell cell, String absoluteIndent) {
        var text = cell.remaining();
        int wsEnd = simpleEnd(text, 0);
        int commentEnd = commentEnd(text, wsEnd);
        int newlineEnd = newlineEnd(text, commentEnd);
        if (newlineEnd == commentEnd) {
            return SimpleWhitespace.of(cell.advance(wsEnd));
        }
        var firstLine = new TrailingWhitespace(SimpleWhitespace.of(text.substring(0, wsEnd)),
                                               comment(text, wsEnd, commentEnd),
                                               Newline.of(text.substring(commentEnd, newlineEnd)));
        var lines = new ArrayList<EmptyLine>();
        var ends = new ArrayList<Integer>();
        int index = scanLines(text, newlineEnd, absoluteIndent, lines, ends);
        boolean indent = text.startsWith(absoluteIndent, index);
        if (indent) {
            index += absoluteIndent.length();
        }
        int lastEnd = simpleEnd(text, index);
        var lastLine = SimpleWhitespace.of(text.substring(index, lastEnd));
        cell.advance(lastEnd);
        return new ParenthesizedWhitespace(firstLine, List.copyOf(lines), indent, lastLine);
    }

    /**
     * Rest of a logical line: whitespace, optional comment, then the newline token's text.
     * The cell must hold nothing else.
     */
    public static TrailingWhitespace parseTrailing(WhitespaceCell cell, String newlineText) {
        var text = cell.remaining();
        int wsEnd = simpleEnd(text, 0);
        int commentEnd = commentEnd(text, wsEnd);
        if (commentEnd != text.length()) {
            throw new InflationException("Unclaimed text before end of line: '" + text.substring(commentEnd) + "'");
        }
        cell.advance(commentEnd);
        return new TrailingWhitespace(SimpleWhitespace.of(text.substring(0, wsEnd)),
                                      comment(text, wsEnd, commentEnd),
                                      Newline.of(newlineText));
    }

    /**
     * Complete blank or comment-only lines in front of a statement. The indentation of the
     * statement's own line is left in the cell.
     */
    public static List<EmptyLine> parseEmptyLines(WhitespaceCell cell, String absoluteIndent) {
        var lines = new ArrayList<EmptyLine>();
        var ends = new ArrayList<Integer>();
        int end = scanLines(cell.remaining(), 0, absoluteIndent, lines, ends);
        cell.advance(end);
        return List.copyOf(lines);
    }

    /**
     * Lines that close an indented block: the run of complete empty lines, minus trailing lines
     * that do not start with the block's indentation. Those belong to whatever comes next.
     */
    public static List<EmptyLine> parseFooter(WhitespaceCell cell, String absoluteIndent) {
        var lines = new ArrayList<EmptyLine>();
        var ends = new ArrayList<Integer>();
        scanLines(cell.remaining(), 0, absoluteIndent, lines, ends);
        while (!lines.isEmpty() && !lines.get(lines.size() - 1).indent()) {
            lines.remove(lines.size() - 1);
            ends.remove(ends.size() - 1);
        }
        cell.advance(ends.isEmpty() ? 0 : ends.get(ends.size() - 1));
        return List.copyOf(lines);
    }

    /**
     * Everything after the last statement of a module, including a last line without a line break.
     */
    public static List<EmptyLine> parseModuleFooter(WhitespaceCell cell) {
        var text = cell.remaining();
        var lines = new ArrayList<EmptyLine>();
        var ends = new ArrayList<Integer>();
        int index = scanLines(text, 0, "", lines, ends);
        if (index < text.length()) {
            int wsEnd = simpleEnd(text, index);
            int commentEnd = commentEnd(text, wsEnd);
            lines.add(new EmptyLine(true,
                                    SimpleWhitespace.of(text.substring(index, wsEnd)),
                                    comment(text, wsEnd, commentEnd),
                                    Newline.NONE));
            index = commentEnd;
        }
        cell.advance(index);
        return List.copyOf(lines);
    }

    /**
     * Claim exactly the given indentation. Anything else left in the cell is a bookkeeping defect.
     */
    public static void parseIndent(WhitespaceCell cell, String absoluteIndent) {
        var text = cell.remaining();
        if (!text.equals(absoluteIndent)) {
            throw new InflationException("Expected indentation '" + absoluteIndent + "' but found '" + text + "'");
        }
        cell.advance(text.length());
    }

    private static int scanLines(String text, int index, String absoluteIndent, List<EmptyLine> lines, List<Integer> ends) {
        while (index < text.length()) {
            boolean indent = text.startsWith(absoluteIndent, index);
            int wsStart = indent ? index + absoluteIndent.length() : index;
            int wsEnd = simpleEnd(text, wsStart);
            int commentEnd = commentEnd(text, wsEnd);
            int newlineEnd = newlineEnd(text, commentEnd);
            if (newlineEnd == commentEnd) {
                break;
            }
            lines.add(new EmptyLine(indent,
                                    SimpleWhitespace.of(text.substring(wsStart, wsEnd)),
                                    comment(text, wsEnd, commentEnd),
                                    Newline.of(text.substring(commentEnd, newlineEnd))));
            ends.add(newlineEnd);
            index = newlineEnd;
        }
        return index;
    }

    private static Optional<Comment> comment(String text, int start, int end) {
        return end > start
               ? Optional.of(new Comment(text.substring(start, end)))
               : Optional.empty();
    }

    static int simpleEnd(String text, int index) {
        while (index < text.length()) {
            char c = text.charAt(index);
            if (c == ' ' || c == '\t' || c == '\f') {
                index++;
            } else if (c == '\\' && newlineEnd(text, index + 1) > index + 1) {
                index = newlineEnd(text, index + 1);
            } else {
                break;
            }
        }
        return index;
    }

    static int commentEnd(String text, int index) {
        if (index >= text.length() || text.charAt(index) != '#') {
            return index;
        }
        while (index < text.length() && text.charAt(index) != '\n' && text.charAt(index) != '\r') {
            index++;
        }
        return index;
    }

    static int newlineEnd(String text, int index) {
        if (index >= text.length()) {
            return index;
        }
        if (text.startsWith("\r\n", index)) {
            return index + 2;
        }
        char c = text.charAt(index);
        return c == '\n' || c == '\r' ? index + 1 : index;
    }
}
