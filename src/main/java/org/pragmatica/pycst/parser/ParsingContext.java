package org.pragmatica.pycst.parser;

import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tokenizer.TokenType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state for a single parse: the token cursor and the furthest failure seen so far.
 */
final class ParsingContext {
    private static final Set<String> HARD_KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async",
                                                             "await", "break", "class", "continue", "def", "del",
                                                             "elif", "else", "except", "finally", "for", "from",
                                                             "global", "if", "import", "in", "is", "lambda",
                                                             "nonlocal", "not", "or", "pass", "raise", "return",
                                                             "try", "while", "with", "yield");

    private final List<Token> tokens;
    private final ParserConfig config;
    private int pos;

    // Furthest failure tracking for error reporting
    private int furthestPos;
    private String furthestExpected;

    private ParsingContext(List<Token> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.pos = 0;
        this.furthestPos = 0;
        this.furthestExpected = "";
    }

    static ParsingContext create(List<Token> tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    ParserConfig config() {
        return config;
    }

    // === Cursor ===

    Token peek() {
        return tokens.get(pos);
    }

    Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    Token advance() {
        var token = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    int mark() {
        return pos;
    }

    void reset(int mark) {
        pos = mark;
    }

    // === Token tests ===

    boolean at(TokenType type) {
        return peek().is(type);
    }

    boolean atOp(String op) {
        return peek().isOp(op);
    }

    boolean atKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    /**
     * A NAME token usable as an identifier.
     */
    boolean atIdentifier() {
        return isIdentifier(peek());
    }

    static boolean isIdentifier(Token token) {
        return token.is(TokenType.NAME) && !HARD_KEYWORDS.contains(token.text());
    }

    Optional<Token> acceptOp(String op) {
        return atOp(op)
               ? Optional.of(advance())
               : Optional.empty();
    }

    Optional<Token> acceptKeyword(String keyword) {
        return atKeyword(keyword)
               ? Optional.of(advance())
               : Optional.empty();
    }

    Token expectOp(String op) {
        if (!atOp(op)) {
            throw fail("'" + op + "'");
        }
        return advance();
    }

    Token expectKeyword(String keyword) {
        if (!atKeyword(keyword)) {
            throw fail("'" + keyword + "'");
        }
        return advance();
    }

    Token expect(TokenType type, String expected) {
        if (!at(type)) {
            throw fail(expected);
        }
        return advance();
    }

    Token expectIdentifier() {
        if (!atIdentifier()) {
            throw fail("identifier");
        }
        return advance();
    }

    // === Failures ===

    /**
     * Record a failure at the cursor and return the signal to throw.
     */
    SyntaxFailure fail(String expected) {
        updateFurthest(expected);
        return new SyntaxFailure(peek(), expected, false);
    }

    SyntaxFailure fatal(Token token, String expected) {
        return new SyntaxFailure(token, expected, true);
    }

    void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                               ? expected
                               : furthestExpected + " or " + expected;
        }
    }

    Token furthestToken() {
        return tokens.get(furthestPos);
    }

    String furthestExpected() {
        return furthestExpected;
    }
}
