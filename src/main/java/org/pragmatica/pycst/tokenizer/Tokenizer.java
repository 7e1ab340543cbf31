package org.pragmatica.pycst.tokenizer;

import org.pragmatica.pycst.error.ParseError;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tree.SourceLocation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lexer for Python source.
 *
 * <p>Produces NAME, NUMBER, STRING and OP tokens plus the layout tokens NEWLINE, INDENT, DEDENT
 * and ENDMARKER. Blank and comment-only lines produce no tokens; their text ends up in the
 * whitespace cells between tokens. Inside brackets newlines are insignificant.
 */
public final class Tokenizer {
    private static final int DEFAULT_TOKEN_CAPACITY = 256;

    private static final List<String> OPERATORS = List.of("**=", "//=", ">>=", "<<=", "...", "->", ":=",
                                                          "==", "!=", "<=", ">=", "**", "//", "<<", ">>",
                                                          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
                                                          "+", "-", "*", "/", "%", "@", "&", "|", "^", "~",
                                                          "<", ">", "(", ")", "[", "]", "{", "}", ",", ":",
                                                          ";", ".", "=", "!");

    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "t",
                                                              "br", "rb", "fr", "rf", "tr", "rt");

    private final String source;
    private final int[] byteOffsets;
    private final int[] lineStarts;
    private final List<RawToken> raw;
    private final List<String> indents;
    private final Deque<Integer> brackets;
    private int pos;
    private boolean atLineStart;

    private record RawToken(TokenType type, String text, int start, int end) {
        boolean zeroWidthLayout() {
            return type == TokenType.INDENT || type == TokenType.DEDENT;
        }
    }

    private Tokenizer(String source) {
        this.source = source;
        this.byteOffsets = computeByteOffsets(source);
        this.lineStarts = computeLineStarts(source);
        this.raw = new ArrayList<>(DEFAULT_TOKEN_CAPACITY);
        this.indents = new ArrayList<>();
        this.brackets = new ArrayDeque<>();
        this.pos = 0;
        this.atLineStart = true;
    }

    /**
     * Split source text into tokens. Tokenization is all-or-nothing.
     *
     * @throws PythonParseException with a {@link ParseError.TokenizeError} on bad indentation,
     *                              unterminated literals or brackets, or stray characters
     */
    public static List<Token> tokenize(String source) throws PythonParseException {
        return new Tokenizer(source).tokenizeAll();
    }

    private List<Token> tokenizeAll() throws PythonParseException {
        indents.add("");
        while (pos < source.length()) {
            if (atLineStart) {
                if (skipBlankLine()) {
                    continue;
                }
                handleIndentation();
                atLineStart = false;
            }
            skipWhitespace();
            if (pos >= source.length()) {
                break;
            }
            char c = source.charAt(pos);
            if (c == '#') {
                skipComment();
            } else if (c == '\n' || c == '\r') {
                handleNewline();
            } else {
                scanToken();
            }
        }
        finish();
        return buildTokens();
    }

    // === Layout ===

    private boolean skipBlankLine() {
        int p = pos;
        while (p < source.length() && isIndentChar(source.charAt(p))) {
            p++;
        }
        if (p >= source.length()) {
            pos = p;
            return true;
        }
        char c = source.charAt(p);
        if (c == '#') {
            while (p < source.length() && !isLineBreak(source.charAt(p))) {
                p++;
            }
            pos = skipLineBreak(p);
            return true;
        }
        if (isLineBreak(c)) {
            pos = skipLineBreak(p);
            return true;
        }
        return false;
    }

    private void handleIndentation() throws PythonParseException {
        int p = pos;
        while (p < source.length() && isIndentChar(source.charAt(p))) {
            p++;
        }
        var indentation = source.substring(pos, p);
        var current = indents.get(indents.size() - 1);
        pos = p;
        if (indentation.equals(current)) {
            return;
        }
        if (indentation.startsWith(current)) {
            indents.add(indentation);
            raw.add(new RawToken(TokenType.INDENT, indentation.substring(current.length()), p, p));
            return;
        }
        while (!indentation.equals(indents.get(indents.size() - 1))) {
            var top = indents.get(indents.size() - 1);
            if (top.length() <= indentation.length()) {
                throw error(p, top.isEmpty() || indentation.startsWith(top)
                               ? "unindent does not match any outer indentation level"
                               : "inconsistent use of tabs and spaces in indentation");
            }
            indents.remove(indents.size() - 1);
            raw.add(new RawToken(TokenType.DEDENT, "", p, p));
        }
    }

    private void handleNewline() {
        int end = skipLineBreak(pos);
        if (brackets.isEmpty()) {
            raw.add(new RawToken(TokenType.NEWLINE, source.substring(pos, end), pos, end));
            atLineStart = true;
        }
        pos = end;
    }

    private void skipWhitespace() throws PythonParseException {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isIndentChar(c)) {
                pos++;
            } else if (c == '\\') {
                if (pos + 1 >= source.length()) {
                    throw error(pos, "unexpected end of file after line continuation character");
                }
                if (!isLineBreak(source.charAt(pos + 1))) {
                    throw error(pos, "unexpected character after line continuation character");
                }
                pos = skipLineBreak(pos + 1);
                if (pos >= source.length()) {
                    throw error(pos, "unexpected end of file after line continuation character");
                }
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (pos < source.length() && !isLineBreak(source.charAt(pos))) {
            pos++;
        }
    }

    private void finish() throws PythonParseException {
        if (!brackets.isEmpty()) {
            int open = brackets.peek();
            throw error(open, "'" + source.charAt(open) + "' was never closed");
        }
        var lastReal = raw.stream()
                          .filter(token -> !token.zeroWidthLayout())
                          .reduce((first, second) -> second);
        if (lastReal.isPresent() && lastReal.get().type() != TokenType.NEWLINE) {
            raw.add(new RawToken(TokenType.NEWLINE, "", source.length(), source.length()));
        }
        for (int i = indents.size() - 1; i > 0; i--) {
            raw.add(new RawToken(TokenType.DEDENT, "", source.length(), source.length()));
        }
        raw.add(new RawToken(TokenType.ENDMARKER, "", source.length(), source.length()));
    }

    // === Tokens ===

    private void scanToken() throws PythonParseException {
        int cp = source.codePointAt(pos);
        char c = source.charAt(pos);
        if (isIdentifierStart(cp)) {
            scanNameOrPrefixedString();
        } else if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
            scanNumber();
        } else if (c == '\'' || c == '"') {
            int end = scanString(pos, pos, "");
            emit(TokenType.STRING, pos, end);
        } else {
            scanOperator();
        }
    }

    private void scanNameOrPrefixedString() throws PythonParseException {
        int start = pos;
        int p = pos;
        while (p < source.length()) {
            int cp = source.codePointAt(p);
            if (!isIdentifierPart(cp)) {
                break;
            }
            p += Character.charCount(cp);
        }
        var name = source.substring(start, p);
        if (p < source.length() && isQuote(source.charAt(p)) && STRING_PREFIXES.contains(name.toLowerCase())) {
            int end = scanString(start, p, name.toLowerCase());
            emit(TokenType.STRING, start, end);
            return;
        }
        emit(TokenType.NAME, start, p);
    }

    private void scanNumber() {
        int start = pos;
        int p = pos;
        if (source.charAt(p) == '0' && p + 1 < source.length() && "xXoObB".indexOf(source.charAt(p + 1)) >= 0) {
            p += 2;
            while (p < source.length() && (isHexDigit(source.charAt(p)) || source.charAt(p) == '_')) {
                p++;
            }
            emit(TokenType.NUMBER, start, p);
            return;
        }
        p = skipDigits(p);
        if (p < source.length() && source.charAt(p) == '.') {
            p = skipDigits(p + 1);
        }
        if (p < source.length() && (source.charAt(p) == 'e' || source.charAt(p) == 'E')) {
            int q = p + 1;
            if (q < source.length() && (source.charAt(q) == '+' || source.charAt(q) == '-')) {
                q++;
            }
            if (q < source.length() && isDigit(source.charAt(q))) {
                p = skipDigits(q);
            }
        }
        if (p < source.length() && (source.charAt(p) == 'j' || source.charAt(p) == 'J')) {
            p++;
        }
        emit(TokenType.NUMBER, start, p);
    }

    private int skipDigits(int p) {
        while (p < source.length() && (isDigit(source.charAt(p)) || source.charAt(p) == '_')) {
            p++;
        }
        return p;
    }

    private void scanOperator() throws PythonParseException {
        for (var op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                trackBracket(op);
                emit(TokenType.OP, pos, pos + op.length());
                return;
            }
        }
        throw error(pos, "invalid character '" + new String(Character.toChars(source.codePointAt(pos))) + "'");
    }

    private void trackBracket(String op) throws PythonParseException {
        switch (op) {
            case "(", "[", "{" -> brackets.push(pos);
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw error(pos, "unmatched '" + op + "'");
                }
                char open = source.charAt(brackets.peek());
                if (closerOf(open) != op.charAt(0)) {
                    throw error(pos, "closing parenthesis '" + op + "' does not match opening parenthesis '" + open + "'");
                }
                brackets.pop();
            }
            default -> {
            }
        }
    }

    // === Strings ===

    private int scanString(int start, int quotePos, String prefix) throws PythonParseException {
        char quote = source.charAt(quotePos);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), quotePos);
        int bodyStart = quotePos + (triple ? 3 : 1);
        boolean formatted = prefix.indexOf('f') >= 0 || prefix.indexOf('t') >= 0;
        return formatted
               ? scanFormattedBody(bodyStart, quote, triple, start)
               : scanPlainBody(bodyStart, quote, triple, start);
    }

    private int scanPlainBody(int p, char quote, boolean triple, int start) throws PythonParseException {
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == '\\') {
                p = skipEscape(p);
                continue;
            }
            var closed = closingQuoteEnd(p, quote, triple, start);
            if (closed > 0) {
                return closed;
            }
            p++;
        }
        throw unterminatedString(start, triple);
    }

    private int scanFormattedBody(int p, char quote, boolean triple, int start) throws PythonParseException {
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == '\\') {
                p = skipEscape(p);
                continue;
            }
            if (c == '{') {
                if (p + 1 < source.length() && source.charAt(p + 1) == '{') {
                    p += 2;
                } else {
                    p = scanReplacementField(p + 1, start);
                }
                continue;
            }
            var closed = closingQuoteEnd(p, quote, triple, start);
            if (closed > 0) {
                return closed;
            }
            p++;
        }
        throw unterminatedString(start, triple);
    }

    // Expression part of an f-string replacement field; returns the offset after the closing brace.
    private int scanReplacementField(int p, int start) throws PythonParseException {
        int fieldStart = p;
        int depth = 0;
        while (p < source.length()) {
            char c = source.charAt(p);
            if (isQuote(c)) {
                int prefixStart = p;
                while (prefixStart > fieldStart && Character.isLetter(source.charAt(prefixStart - 1))) {
                    prefixStart--;
                }
                var prefix = source.substring(prefixStart, p).toLowerCase();
                p = scanString(prefixStart, p, STRING_PREFIXES.contains(prefix) ? prefix : "");
                continue;
            }
            switch (c) {
                case '(', '[', '{' -> depth++;
                case ')', ']' -> depth--;
                case '}' -> {
                    if (depth == 0) {
                        return p + 1;
                    }
                    depth--;
                }
                case ':' -> {
                    if (depth == 0) {
                        return scanFormatSpec(p + 1, start);
                    }
                }
                default -> {
                }
            }
            p++;
        }
        throw error(start, "unterminated f-string replacement field");
    }

    private int scanFormatSpec(int p, int start) throws PythonParseException {
        while (p < source.length()) {
            char c = source.charAt(p);
            if (c == '{') {
                p = scanReplacementField(p + 1, start);
                continue;
            }
            if (c == '}') {
                return p + 1;
            }
            p++;
        }
        throw error(start, "unterminated f-string format specifier");
    }

    private int closingQuoteEnd(int p, char quote, boolean triple, int start) throws PythonParseException {
        char c = source.charAt(p);
        if (triple) {
            return source.startsWith(String.valueOf(quote).repeat(3), p) ? p + 3 : -1;
        }
        if (c == quote) {
            return p + 1;
        }
        if (isLineBreak(c)) {
            throw unterminatedString(start, false);
        }
        return -1;
    }

    private int skipEscape(int p) {
        if (p + 1 >= source.length()) {
            return p + 1;
        }
        if (source.charAt(p + 1) == '\r') {
            return skipLineBreak(p + 1);
        }
        return p + 2;
    }

    private PythonParseException unterminatedString(int start, boolean triple) {
        return error(start, triple ? "unterminated triple-quoted string literal" : "unterminated string literal");
    }

    // === Assembly ===

    private void emit(TokenType type, int start, int end) {
        raw.add(new RawToken(type, source.substring(start, end), start, end));
        pos = end;
    }

    private List<Token> buildTokens() {
        var cells = new ArrayList<WhitespaceCell>(raw.size() + 1);
        int previousEnd = 0;
        for (var token : raw) {
            if (!token.zeroWidthLayout()) {
                cells.add(new WhitespaceCell(source, previousEnd, token.start()));
                previousEnd = token.end();
            }
        }
        cells.add(new WhitespaceCell(source, previousEnd, previousEnd));

        var tokens = new ArrayList<Token>(raw.size());
        int index = 0;
        for (var token : raw) {
            var before = cells.get(index);
            var after = token.zeroWidthLayout()
                        ? before
                        : cells.get(index + 1);
            tokens.add(new Token(token.type(), token.text(), location(token.start()), location(token.end()), before, after));
            if (!token.zeroWidthLayout()) {
                index++;
            }
        }
        return List.copyOf(tokens);
    }

    private SourceLocation location(int offset) {
        int line = Arrays.binarySearch(lineStarts, offset);
        if (line < 0) {
            line = -line - 2;
        }
        return SourceLocation.at(line + 1, offset - lineStarts[line] + 1, offset, byteOffsets[offset]);
    }

    private PythonParseException error(int offset, String reason) {
        return new PythonParseException(new ParseError.TokenizeError(location(offset), reason));
    }

    // === Character classes ===

    private int skipLineBreak(int p) {
        if (p >= source.length()) {
            return p;
        }
        if (source.charAt(p) == '\r') {
            return p + 1 < source.length() && source.charAt(p + 1) == '\n' ? p + 2 : p + 1;
        }
        return source.charAt(p) == '\n' ? p + 1 : p;
    }

    private static boolean isIndentChar(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierStart(cp);
    }

    private static boolean isIdentifierPart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp);
    }

    private static char closerOf(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            default -> '}';
        };
    }

    static int[] computeByteOffsets(String source) {
        var offsets = new int[source.length() + 1];
        int bytes = 0;
        for (int i = 0; i < source.length(); i++) {
            offsets[i] = bytes;
            char c = source.charAt(i);
            if (c < 0x80) {
                bytes += 1;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c)) {
                bytes += 4;
            } else if (!Character.isLowSurrogate(c)) {
                bytes += 3;
            }
        }
        offsets[source.length()] = bytes;
        return offsets;
    }

    private static int[] computeLineStarts(String source) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        return starts.stream()
                     .mapToInt(Integer::intValue)
                     .toArray();
    }
}
