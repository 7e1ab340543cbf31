package org.pragmatica.pycst.error;

import org.pragmatica.pycst.tree.SourceLocation;
import org.pragmatica.pycst.tree.SourceSpan;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a tokenizer or parser failure.
 *
 * <p>Example output:
 * <pre>
 * error[E0002]: unexpected ')'
 *   --> module.py:2:5
 *    |
 *  1 | x = (1 +
 *  2 |     )
 *    |     ^ expected expression
 *    |
 * </pre>
 *
 * @param code    error code, {@code E0001} for tokenizer errors and {@code E0002}/{@code E0003} for parser errors
 * @param message headline
 * @param span    offending source range; a point for errors without a token
 * @param label   text printed next to the underline
 * @param notes   trailing {@code = note} lines
 */
public record Diagnostic(String code, String message, SourceSpan span, String label, List<String> notes) {
    private static final int CONTEXT_LINES = 1;

    /**
     * Build the diagnostic for {@code error}; {@code source} decides how wide the underline is.
     */
    public static Diagnostic fromParseError(ParseError error, String source) {
        var span = SourceSpan.at(error.location());
        if (error instanceof ParseError.TokenizeError tokenizeError) {
            return withHints(new Diagnostic("E0001", "invalid token", span, tokenizeError.reason(), List.of()),
                             tokenizeError.reason());
        }
        if (error instanceof ParseError.UnexpectedInput unexpected) {
            return new Diagnostic("E0002",
                                  "unexpected '" + unexpected.found() + "'",
                                  widen(span, unexpected.found(), source),
                                  "expected " + unexpected.expected(),
                                  List.of());
        }
        var eof = (ParseError.UnexpectedEof) error;
        return new Diagnostic("E0003", "unexpected end of input", span, "expected " + eof.expected(), List.of());
    }

    public Diagnostic withHelp(String help) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add("help: " + help);
        return new Diagnostic(code, message, span, label, List.copyOf(newNotes));
    }

    /**
     * Render with the offending line and one line of context above it.
     *
     * @param filename shown in the location line, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\r\n|\r|\n", -1);
        var start = span.start();

        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(start.column()).append("\n");

        int errorLine = Math.min(start.line(), lines.length);
        int firstLine = Math.max(1, errorLine - CONTEXT_LINES);
        int gutterWidth = String.valueOf(errorLine).length();
        var gutter = " ".repeat(gutterWidth + 1) + "|";

        sb.append(gutter).append("\n");
        for (int lineNum = firstLine; lineNum <= errorLine; lineNum++) {
            var content = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(content).append("\n");
            if (lineNum == errorLine) {
                sb.append(gutter).append(" ").append(underline(content)).append("\n");
            }
        }
        sb.append(gutter).append("\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private String underline(String lineContent) {
        int startCol = span.start().column();
        int endCol = span.end().line() == span.start().line()
                     ? span.end().column()
                     : lineContent.length() + 1;
        var marks = " ".repeat(Math.max(0, startCol - 1)) + "^".repeat(Math.max(1, endCol - startCol));
        return label.isEmpty()
               ? marks
               : marks + " " + label;
    }

    private static SourceSpan widen(SourceSpan point, String found, String source) {
        var start = point.start();
        if (found.isEmpty() || found.contains("\n") || !source.startsWith(found, start.offset())) {
            return point;
        }
        var end = SourceLocation.at(start.line(),
                                    start.column() + found.length(),
                                    start.offset() + found.length(),
                                    start.byteOffset() + found.getBytes(StandardCharsets.UTF_8).length);
        return SourceSpan.of(start, end);
    }

    private static Diagnostic withHints(Diagnostic diagnostic, String reason) {
        if (reason.contains("was never closed")) {
            return diagnostic.withHelp("add the matching closing bracket");
        }
        if (reason.contains("unindent does not match")) {
            return diagnostic.withHelp("dedent to the indentation of an enclosing block");
        }
        if (reason.contains("tabs and spaces")) {
            return diagnostic.withHelp("indent with either tabs or spaces, not both");
        }
        return diagnostic;
    }
}
