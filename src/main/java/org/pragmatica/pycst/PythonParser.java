package org.pragmatica.pycst;

import org.pragmatica.pycst.error.Diagnostic;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.parser.ParserConfig;
import org.pragmatica.pycst.parser.PythonGrammarParser;
import org.pragmatica.pycst.parser.PythonVersion;
import org.pragmatica.pycst.tokenizer.Token;
import org.pragmatica.pycst.tokenizer.TokenType;
import org.pragmatica.pycst.tokenizer.Tokenizer;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for parsing Python source into a lossless concrete syntax tree.
 *
 * <p>Example usage:
 * <pre>{@code
 * var module = PythonParser.parseModule("x = 1  # one\n");
 * assert PythonParser.codegen(module).equals("x = 1  # one\n");
 *
 * var parsed = PythonParser.builder()
 *                          .version(PythonVersion.PY312)
 *                          .positions(true)
 *                          .parse(source);
 * }</pre>
 */
public final class PythonParser {
    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    static final String DEFAULT_INDENT = "    ";
    static final String DEFAULT_NEWLINE = "\n";
    static final String DEFAULT_ENCODING = "utf-8";

    private PythonParser() {}

    /**
     * Split source text into tokens.
     */
    public static List<Token> tokenize(String source) throws PythonParseException {
        return Tokenizer.tokenize(source);
    }

    /**
     * Parse a module with the default configuration.
     */
    public static Module parseModule(String source) throws PythonParseException {
        return parseModule(source, ParserConfig.DEFAULT);
    }

    public static Module parseModule(String source, ParserConfig config) throws PythonParseException {
        return parseModuleWithPositions(source, config.withCapturePositions(false)).module();
    }

    /**
     * Parse a module and record node spans in a {@link org.pragmatica.pycst.inflate.PositionTable}.
     * Offsets are UTF-8 byte offsets into the source after a leading byte order mark is removed.
     */
    public static ParsedModule parseModuleWithPositions(String source) throws PythonParseException {
        return parseModuleWithPositions(source, ParserConfig.DEFAULT.withCapturePositions(true));
    }

    public static ParsedModule parseModuleWithPositions(String source, ParserConfig config) throws PythonParseException {
        var byteOrderMark = source.startsWith(Module.BYTE_ORDER_MARK);
        var text = byteOrderMark
                   ? source.substring(Module.BYTE_ORDER_MARK.length())
                   : source;
        var tokens = Tokenizer.tokenize(text);
        log.debug("Tokenized {} chars into {} tokens", text.length(), tokens.size());
        var deflated = PythonGrammarParser.parse(tokens, config);
        var ctx = InflateCtx.create(tokens, config.capturePositions(), detectIndent(tokens),
                                    detectNewline(tokens, config));
        var module = deflated.inflate(ctx, byteOrderMark, config.encoding()
                                                                .orElse(DEFAULT_ENCODING));
        log.debug("Inflated module with {} statements, {} tracked nodes", module.body()
                                                                             .size(), ctx.trackedNodeCount());
        return new ParsedModule(module, ctx.positions(), ctx.trackedNodeCount());
    }

    /**
     * Parse exactly one statement. Blank lines after the statement are not kept.
     */
    public static Statement parseStatement(String source) throws PythonParseException {
        return parseStatement(source, ParserConfig.DEFAULT);
    }

    public static Statement parseStatement(String source, ParserConfig config) throws PythonParseException {
        var tokens = Tokenizer.tokenize(source);
        var deflated = PythonGrammarParser.parseStatement(tokens, config);
        return deflated.inflate(InflateCtx.create(tokens, false, detectIndent(tokens), detectNewline(tokens, config)));
    }

    /**
     * Parse a single expression written without leading indentation.
     */
    public static Expression parseExpression(String source) throws PythonParseException {
        return parseExpression(source, ParserConfig.DEFAULT);
    }

    public static Expression parseExpression(String source, ParserConfig config) throws PythonParseException {
        var tokens = Tokenizer.tokenize(source);
        var deflated = PythonGrammarParser.parseExpression(tokens, config);
        return deflated.inflate(InflateCtx.create(tokens, false, DEFAULT_INDENT, detectNewline(tokens, config)));
    }

    /**
     * Render a module back to source text. Byte-identical to the parsed input.
     */
    public static String codegen(Module module) {
        return module.code();
    }

    /**
     * Format a parse failure as a Rust-style diagnostic.
     *
     * @param label file name shown in the location line, may be {@code null}
     */
    public static String prettifyError(PythonParseException exception, String source, String label) {
        return Diagnostic.fromParseError(exception.error(), source)
                         .format(source, label);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    private static String detectIndent(List<Token> tokens) {
        return tokens.stream()
                     .filter(token -> token.is(TokenType.INDENT))
                     .findFirst()
                     .map(Token::text)
                     .orElse(DEFAULT_INDENT);
    }

    private static String detectNewline(List<Token> tokens, ParserConfig config) {
        return config.defaultNewline()
                     .or(() -> tokens.stream()
                                     .filter(token -> token.is(TokenType.NEWLINE) && !token.text()
                                                                                           .isEmpty())
                                     .findFirst()
                                     .map(Token::text))
                     .orElse(DEFAULT_NEWLINE);
    }

    public static final class Builder {
        private PythonVersion version = PythonVersion.PERMISSIVE;
        private Optional<String> encoding = Optional.empty();
        private Optional<String> newline = Optional.empty();
        private boolean capturePositions = false;

        private Builder() {}

        public Builder version(PythonVersion version) {
            this.version = version;
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = Optional.of(encoding);
            return this;
        }

        public Builder newline(String newline) {
            this.newline = Optional.of(newline);
            return this;
        }

        public Builder positions(boolean capture) {
            this.capturePositions = capture;
            return this;
        }

        public ParserConfig config() {
            return new ParserConfig(version, encoding, newline, capturePositions);
        }

        public ParsedModule parse(String source) throws PythonParseException {
            return parseModuleWithPositions(source, config());
        }
    }
}
