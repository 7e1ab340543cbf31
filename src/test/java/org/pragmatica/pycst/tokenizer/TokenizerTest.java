package org.pragmatica.pycst.tokenizer;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.error.ParseError;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tree.Span;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.pycst.tokenizer.TokenType.DEDENT;
import static org.pragmatica.pycst.tokenizer.TokenType.ENDMARKER;
import static org.pragmatica.pycst.tokenizer.TokenType.INDENT;
import static org.pragmatica.pycst.tokenizer.TokenType.NAME;
import static org.pragmatica.pycst.tokenizer.TokenType.NEWLINE;
import static org.pragmatica.pycst.tokenizer.TokenType.NUMBER;
import static org.pragmatica.pycst.tokenizer.TokenType.OP;
import static org.pragmatica.pycst.tokenizer.TokenType.STRING;

class TokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream()
                     .map(Token::type)
                     .toList();
    }

    @Test
    void tokenize_emptySource_onlyEndmarker() throws PythonParseException {
        var tokens = Tokenizer.tokenize("");

        assertThat(types(tokens)).containsExactly(ENDMARKER);
    }

    @Test
    void tokenize_simpleAssignment_producesExpectedKinds() throws PythonParseException {
        var tokens = Tokenizer.tokenize("x = 1\n");

        assertThat(types(tokens)).containsExactly(NAME, OP, NUMBER, NEWLINE, ENDMARKER);
        assertThat(tokens.get(3).text()).isEqualTo("\n");
    }

    @Test
    void tokenize_missingFinalNewline_zeroWidthNewline() throws PythonParseException {
        var tokens = Tokenizer.tokenize("pass");

        assertThat(types(tokens)).containsExactly(NAME, NEWLINE, ENDMARKER);
        assertThat(tokens.get(1).text()).isEmpty();
    }

    @Test
    void tokenize_indentedBlock_emitsIndentAndDedent() throws PythonParseException {
        var tokens = Tokenizer.tokenize("if x:\n    y\nz\n");

        assertThat(types(tokens)).containsExactly(NAME, NAME, OP, NEWLINE, INDENT, NAME, NEWLINE, DEDENT, NAME,
                                                  NEWLINE, ENDMARKER);
        assertThat(tokens.get(4).text()).isEqualTo("    ");
    }

    @Test
    void tokenize_openBlockAtEof_closedWithDedents() throws PythonParseException {
        var tokens = Tokenizer.tokenize("if a:\n  if b:\n    c");

        assertThat(types(tokens)).endsWith(NAME, NEWLINE, DEDENT, DEDENT, ENDMARKER);
    }

    @Test
    void tokenize_adjacentTokens_shareWhitespaceCell() throws PythonParseException {
        var tokens = Tokenizer.tokenize("a  +  b\n");

        assertThat(tokens.get(0).whitespaceAfter()).isSameAs(tokens.get(1).whitespaceBefore());
        assertThat(tokens.get(1).whitespaceBefore().text()).isEqualTo("  ");
    }

    @Test
    void tokenize_indentToken_usesCellOfNextToken() throws PythonParseException {
        var tokens = Tokenizer.tokenize("if x:\n    y\n");
        var indent = tokens.get(4);
        var name = tokens.get(5);

        assertThat(indent.type()).isEqualTo(INDENT);
        assertThat(indent.whitespaceBefore()).isSameAs(name.whitespaceBefore());
        assertThat(indent.whitespaceAfter()).isSameAs(name.whitespaceBefore());
    }

    @Test
    void tokenize_blankAndCommentLines_produceNoTokens() throws PythonParseException {
        var tokens = Tokenizer.tokenize("# header\n\nx = 1  # trailing\n\n");

        assertThat(types(tokens)).containsExactly(NAME, OP, NUMBER, NEWLINE, ENDMARKER);
        assertThat(tokens.get(0).whitespaceBefore().text()).isEqualTo("# header\n\n");
    }

    @Test
    void tokenize_insideBrackets_newlinesAreInsignificant() throws PythonParseException {
        var tokens = Tokenizer.tokenize("f(a,\n  b)\n");

        assertThat(types(tokens)).containsExactly(NAME, OP, NAME, OP, NAME, OP, NEWLINE, ENDMARKER);
    }

    @Test
    void tokenize_ellipsis_singleToken() throws PythonParseException {
        var tokens = Tokenizer.tokenize("...\n");

        assertThat(tokens.get(0).isOp("...")).isTrue();
    }

    @Test
    void tokenize_prefixedAndTripleQuotedStrings_singleTokens() throws PythonParseException {
        var tokens = Tokenizer.tokenize("rb'a\\'' \"\"\"multi\nline\"\"\" f'{x!r:>{width}}'\n");

        assertThat(types(tokens)).containsExactly(STRING, STRING, STRING, NEWLINE, ENDMARKER);
        assertThat(tokens.get(2).text()).isEqualTo("f'{x!r:>{width}}'");
    }

    @Test
    void tokenize_fStringWithNestedQuotes_singleToken() throws PythonParseException {
        var tokens = Tokenizer.tokenize("f\"{d['key']}\"\n");

        assertThat(types(tokens)).containsExactly(STRING, NEWLINE, ENDMARKER);
    }

    @Test
    void tokenize_numbers_recognizesAllForms() throws PythonParseException {
        var tokens = Tokenizer.tokenize("0xFF 0o17 0b1010 1_000 3.14 .5 1e-3 2j\n");

        assertThat(tokens.subList(0, 8)).extracting(Token::type)
                                        .containsOnly(NUMBER);
        assertThat(tokens.subList(0, 8)).extracting(Token::text)
                                        .containsExactly("0xFF", "0o17", "0b1010", "1_000", "3.14", ".5", "1e-3",
                                                         "2j");
    }

    @Test
    void tokenize_nonAsciiText_tracksCharAndByteOffsets() throws PythonParseException {
        var tokens = Tokenizer.tokenize("é = 1\n");
        var name = tokens.get(0);

        assertThat(name.end().offset()).isEqualTo(1);
        assertThat(name.end().byteOffset()).isEqualTo(2);
        assertThat(tokens.get(1).start().byteOffset()).isEqualTo(3);
    }

    @Test
    void tokenSpan_extractsTextAndConvertsToBytes() throws PythonParseException {
        var source = "é = 1\n";
        var name = Tokenizer.tokenize(source)
                            .get(0);

        assertThat(name.span()
                       .extract(source)).isEqualTo("é");
        assertThat(name.span()
                       .bytes()).isEqualTo(Span.of(0, 2));
    }

    @Test
    void tokenize_lineContinuation_joinsLines() throws PythonParseException {
        var tokens = Tokenizer.tokenize("x = 1 + \\\n    2\n");

        assertThat(types(tokens)).containsExactly(NAME, OP, NUMBER, OP, NUMBER, NEWLINE, ENDMARKER);
    }

    @Test
    void tokenize_dedentToUnknownLevel_fails() {
        assertThatThrownBy(() -> Tokenizer.tokenize("if x:\n    y\n  z\n"))
            .isInstanceOf(PythonParseException.class)
            .satisfies(e -> assertThat(((PythonParseException) e).error()).isInstanceOf(ParseError.TokenizeError.class))
            .hasMessageContaining("unindent does not match");
    }

    @Test
    void tokenize_unterminatedString_fails() {
        assertThatThrownBy(() -> Tokenizer.tokenize("x = 'abc\n"))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("unterminated string literal");
    }

    @Test
    void tokenize_unclosedBracket_fails() {
        assertThatThrownBy(() -> Tokenizer.tokenize("f(1, 2\n"))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("'(' was never closed");
    }

    @Test
    void tokenize_mismatchedBracket_fails() {
        assertThatThrownBy(() -> Tokenizer.tokenize("f(1]\n"))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("does not match");
    }

    @Test
    void tokenize_continuationAtEof_fails() {
        assertThatThrownBy(() -> Tokenizer.tokenize("x = \\"))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("line continuation");
    }
}
