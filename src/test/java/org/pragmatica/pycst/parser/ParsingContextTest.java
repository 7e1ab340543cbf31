package org.pragmatica.pycst.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tokenizer.TokenType;
import org.pragmatica.pycst.tokenizer.Tokenizer;

import static org.assertj.core.api.Assertions.assertThat;

class ParsingContextTest {

    private static ParsingContext context(String source) throws PythonParseException {
        return ParsingContext.create(Tokenizer.tokenize(source), ParserConfig.DEFAULT);
    }

    @Test
    void advance_staysOnEndmarker() throws PythonParseException {
        var ctx = context("x\n");

        ctx.advance();
        ctx.advance();
        ctx.advance();

        assertThat(ctx.at(TokenType.ENDMARKER)).isTrue();
        assertThat(ctx.peek(5)
                      .type()).isEqualTo(TokenType.ENDMARKER);
    }

    @Test
    void markAndReset_restoreCursor() throws PythonParseException {
        var ctx = context("a + b\n");
        var mark = ctx.mark();

        ctx.advance();
        ctx.advance();
        ctx.reset(mark);

        assertThat(ctx.peek()
                      .text()).isEqualTo("a");
    }

    @Test
    void softKeywords_areIdentifiers() throws PythonParseException {
        var ctx = context("match type case class\n");

        assertThat(ParsingContext.isIdentifier(ctx.peek(0))).isTrue();
        assertThat(ParsingContext.isIdentifier(ctx.peek(1))).isTrue();
        assertThat(ParsingContext.isIdentifier(ctx.peek(2))).isTrue();
        assertThat(ParsingContext.isIdentifier(ctx.peek(3))).isFalse();
    }

    @Test
    void acceptOp_consumesOnlyOnMatch() throws PythonParseException {
        var ctx = context("(x)\n");

        assertThat(ctx.acceptOp("[")).isEmpty();
        assertThat(ctx.acceptOp("(")).isPresent();
        assertThat(ctx.atIdentifier()).isTrue();
    }

    @Test
    void failuresAtSamePosition_mergeExpectations() throws PythonParseException {
        var ctx = context("x\n");

        ctx.fail("'('");
        ctx.fail("'['");
        ctx.fail("'('");

        assertThat(ctx.furthestExpected()).isEqualTo("'(' or '['");
        assertThat(ctx.furthestToken()
                      .text()).isEqualTo("x");
    }

    @Test
    void laterFailure_replacesEarlierOne() throws PythonParseException {
        var ctx = context("x y\n");

        ctx.fail("expression");
        ctx.advance();
        ctx.fail("newline");
        ctx.reset(0);
        ctx.fail("statement");

        assertThat(ctx.furthestExpected()).isEqualTo("newline");
        assertThat(ctx.furthestToken()
                      .text()).isEqualTo("y");
    }

    @Test
    void fatalFailure_doesNotTouchFurthest() throws PythonParseException {
        var ctx = context("x\n");

        var failure = ctx.fatal(ctx.peek(), "Python 3.10 or newer");

        assertThat(failure.fatal()).isTrue();
        assertThat(ctx.furthestExpected()).isEmpty();
    }
}
