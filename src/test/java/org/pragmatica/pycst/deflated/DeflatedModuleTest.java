package org.pragmatica.pycst.deflated;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.inflate.InflateCtx;
import org.pragmatica.pycst.parser.ParserConfig;
import org.pragmatica.pycst.parser.PythonGrammarParser;
import org.pragmatica.pycst.tokenizer.Tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeflatedModuleTest {

    @Test
    void inflate_secondCall_isRejected() throws PythonParseException {
        var tokens = Tokenizer.tokenize("x = 1\n");
        var deflated = PythonGrammarParser.parse(tokens, ParserConfig.DEFAULT);

        var module = deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n"), false, "utf-8");

        assertThat(deflated.consumed()).isTrue();
        assertThat(module.code()).isEqualTo("x = 1\n");
        assertThatThrownBy(() -> deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n"), false, "utf-8"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inflate_secondCallOnStatement_isRejected() throws PythonParseException {
        var tokens = Tokenizer.tokenize("x  =  foo( a ,  b )  # c\n");
        var deflated = PythonGrammarParser.parseStatement(tokens, ParserConfig.DEFAULT);

        var statement = deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n"));

        assertThat(deflated.consumed()).isTrue();
        assertThat(statement.code()).isEqualTo("x  =  foo( a ,  b )  # c\n");
        assertThatThrownBy(() -> deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void inflate_secondCallOnExpression_isRejected() throws PythonParseException {
        var tokens = Tokenizer.tokenize("a  +  b");
        var deflated = PythonGrammarParser.parseExpression(tokens, ParserConfig.DEFAULT);

        var expression = deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n"));

        assertThat(expression.code()).isEqualTo("a  +  b");
        assertThatThrownBy(() -> deflated.inflate(InflateCtx.create(tokens, false, "    ", "\n")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parse_keepsOneDeflatedStatementPerLine() throws PythonParseException {
        var tokens = Tokenizer.tokenize("import os\n\ndef f():\n    pass\n");

        var deflated = PythonGrammarParser.parse(tokens, ParserConfig.DEFAULT);

        assertThat(deflated.consumed()).isFalse();
        assertThat(deflated.statementCount()).isEqualTo(2);
    }

    @Test
    void inflate_assignsIdsInPreOrder() throws PythonParseException {
        var tokens = Tokenizer.tokenize("a = b\n");
        var ctx = InflateCtx.create(tokens, true, "    ", "\n");

        PythonGrammarParser.parse(tokens, ParserConfig.DEFAULT)
                           .inflate(ctx, false, "utf-8");

        assertThat(ctx.trackedNodeCount()).isEqualTo(3);
        assertThat(ctx.positions()).isPresent();
    }
}
