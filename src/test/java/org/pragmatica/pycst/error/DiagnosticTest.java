package org.pragmatica.pycst.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.tree.SourceLocation;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    @Test
    void unexpectedInput_underlinesWholeToken() {
        var source = "x = 1\ny = = 2\n";
        var error = new ParseError.UnexpectedInput(SourceLocation.at(2, 5, 10, 10), "=", "expression");

        var text = Diagnostic.fromParseError(error, source)
                             .format(source, "m.py");

        assertThat(text).isEqualTo("""
            error[E0002]: unexpected '='
              --> m.py:2:5
              |
            1 | x = 1
            2 | y = = 2
              |     ^ expected expression
              |
            """);
    }

    @Test
    void unexpectedInput_multiCharacterToken_widensUnderline() {
        var source = "if True return\n";
        var error = new ParseError.UnexpectedInput(SourceLocation.at(1, 9, 8, 8), "return", "':'");

        var text = Diagnostic.fromParseError(error, source)
                             .format(source, null);

        assertThat(text).contains("  --> 1:9\n")
                        .contains("|         ^^^^^^ expected ':'");
    }

    @Test
    void layoutToken_keepsPointUnderline() {
        var source = "def f(:\n";
        var error = new ParseError.UnexpectedInput(SourceLocation.at(1, 7, 6, 6), "newline", "parameter");

        var diagnostic = Diagnostic.fromParseError(error, source);

        assertThat(diagnostic.span()
                             .length()).isZero();
    }

    @Test
    void unclosedBracket_addsHelpNote() {
        var source = "f(1\n";
        var error = new ParseError.TokenizeError(SourceLocation.at(1, 2, 1, 1), "'(' was never closed");

        var text = Diagnostic.fromParseError(error, source)
                             .format(source, "m.py");

        assertThat(text).startsWith("error[E0001]: invalid token")
                        .contains("^ '(' was never closed")
                        .endsWith("  = help: add the matching closing bracket\n");
    }

    @Test
    void endOfInput_usesOwnCode() {
        var error = new ParseError.UnexpectedEof(SourceLocation.at(2, 1, 9, 9), "indented block");

        var diagnostic = Diagnostic.fromParseError(error, "def f():\n");

        assertThat(diagnostic.code()).isEqualTo("E0003");
        assertThat(diagnostic.label()).isEqualTo("expected indented block");
        assertThat(diagnostic.format("def f():\n", null)).contains("2 | \n");
    }
}
