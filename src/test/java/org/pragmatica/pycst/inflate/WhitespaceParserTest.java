package org.pragmatica.pycst.inflate;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.error.InflationException;
import org.pragmatica.pycst.tokenizer.WhitespaceCell;
import org.pragmatica.pycst.tree.Comment;
import org.pragmatica.pycst.tree.Newline;
import org.pragmatica.pycst.tree.ParenthesizedWhitespace;
import org.pragmatica.pycst.tree.SimpleWhitespace;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhitespaceParserTest {

    private static WhitespaceCell cell(String text) {
        return new WhitespaceCell(text, 0, text.length());
    }

    @Test
    void parseSimple_claimsSpacesOnly() {
        var cell = cell("  \t# comment");

        var result = WhitespaceParser.parseSimple(cell);

        assertThat(result).isEqualTo(SimpleWhitespace.of("  \t"));
        assertThat(cell.remaining()).isEqualTo("# comment");
    }

    @Test
    void parseSimple_includesLineContinuation() {
        var cell = cell(" \\\n  ");

        var result = WhitespaceParser.parseSimple(cell);

        assertThat(result.value()).isEqualTo(" \\\n  ");
        assertThat(cell.exhausted()).isTrue();
    }

    @Test
    void parseParenthesizable_withoutLineBreak_isSimple() {
        var cell = cell(" ");

        var result = WhitespaceParser.parseParenthesizable(cell, "");

        assertThat(result).isEqualTo(SimpleWhitespace.of(" "));
    }

    @Test
    void parseParenthesizable_acrossLines_keepsEveryPiece() {
        var cell = cell("  # first\n\n    # inner\n    ");

        var result = WhitespaceParser.parseParenthesizable(cell, "");

        assertThat(result).isInstanceOf(ParenthesizedWhitespace.class);
        var parenthesized = (ParenthesizedWhitespace) result;
        assertThat(parenthesized.firstLine().comment()).contains(new Comment("# first"));
        assertThat(parenthesized.emptyLines()).hasSize(2);
        assertThat(parenthesized.lastLine().value()).isEqualTo("    ");
        assertThat(cell.exhausted()).isTrue();
    }

    @Test
    void parseTrailing_commentAndNewline() {
        var cell = cell("  # done");

        var result = WhitespaceParser.parseTrailing(cell, "\r\n");

        assertThat(result.whitespace().value()).isEqualTo("  ");
        assertThat(result.comment()).contains(new Comment("# done"));
        assertThat(result.newline()).isEqualTo(Newline.of("\r\n"));
        assertThat(cell.exhausted()).isTrue();
    }

    @Test
    void parseTrailing_unexpectedText_fails() {
        assertThatThrownBy(() -> WhitespaceParser.parseTrailing(cell(" x"), "\n"))
            .isInstanceOf(InflationException.class);
    }

    @Test
    void parseEmptyLines_leavesIndentationOfStatement() {
        var cell = cell("\n    # note\n    ");

        var lines = WhitespaceParser.parseEmptyLines(cell, "    ");

        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).indent()).isFalse();
        assertThat(lines.get(1).indent()).isTrue();
        assertThat(lines.get(1).comment()).contains(new Comment("# note"));
        assertThat(cell.remaining()).isEqualTo("    ");
    }

    @Test
    void parseFooter_dropsTrailingUnindentedLines() {
        var cell = cell("    # inside\n# outside\n");

        var lines = WhitespaceParser.parseFooter(cell, "    ");

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).comment()).contains(new Comment("# inside"));
        assertThat(cell.remaining()).isEqualTo("# outside\n");
    }

    @Test
    void parseModuleFooter_keepsLastLineWithoutBreak() {
        var cell = cell("\n# tail");

        var lines = WhitespaceParser.parseModuleFooter(cell);

        assertThat(lines).hasSize(2);
        assertThat(lines.get(1).comment()).isEqualTo(Optional.of(new Comment("# tail")));
        assertThat(lines.get(1).newline()).isEqualTo(Newline.NONE);
        assertThat(cell.exhausted()).isTrue();
    }

    @Test
    void parseIndent_exactMatch_claimsIndent() {
        var cell = cell("\t");

        WhitespaceParser.parseIndent(cell, "\t");

        assertThat(cell.exhausted()).isTrue();
    }

    @Test
    void parseIndent_mismatch_fails() {
        assertThatThrownBy(() -> WhitespaceParser.parseIndent(cell("  "), "    "))
            .isInstanceOf(InflationException.class)
            .hasMessageContaining("Expected indentation");
    }
}
