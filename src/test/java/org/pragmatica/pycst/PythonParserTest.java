package org.pragmatica.pycst;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.pycst.error.ParseError;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.parser.ParserConfig;
import org.pragmatica.pycst.parser.PythonVersion;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.Statement;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonParserTest {

    // === Round trip ===

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "\n",
        "pass",
        "x = 1\n",
        "x  =   1   # spaced out\n",
        "# only a comment",
        "\n\n# leading\n\nx = 1\n\n\n# trailing\n",
        "a = b = c\n",
        "x: int = 5\ny: list[str]\n",
        "total += 1; count -= 2;\n",
        "del a, b[0], c.d\n",
        "import os, sys as system\nimport a.b.c\n",
        "from . import x\nfrom .. import (y,\n    z,)\nfrom ...pkg.mod import *\nfrom a.b import c as d\n",
        "assert x, 'message'\n",
        "raise\nraise ValueError('bad') from err\n",
        "def f():\n    global counter\n    nonlocal a, b\n",
        "return\n",
        "x = 1 if y else 2\n",
        "result = not a and b or c\n",
        "value = -x ** 2 + ~y // 3 % 4 @ m\n",
        "ok = 1 < x <= 10 != y is not None\nmember = a not in b\n",
        "bits = a | b ^ c & d << 1 >> 2\n",
        "call(a, b=1, *args, **kwargs)\n",
        "print(x for x in range(10))\n",
        "obj.attr.method()[0][1:2][::3][a:b:c, ...]\n",
        "items[*idx]\n",
        "f = lambda: 0\ng = lambda x, y=1, *a, z, **k: x\n",
        "t = ()\nu = (1,)\nv = 1, 2\nw = (*a, *b)\n",
        "l = []\nm = [1, 2, 3,]\nn = [*a]\n",
        "d = {}\ne = {'a': 1, **other}\ns = {1, 2}\n",
        "squares = [x * x for x in data if x > 0 if x < 10]\n",
        "pairs = {k: v for k, v in items.items()}\nuniq = {x for x in xs}\n",
        "nested = [y for x in xs for y in x]\n",
        "s = 'a' \"b\" '''c'''\n",
        "f'{name!r:>{width}}'\n",
        "b = b'bytes'\nr = r'raw\\d'\n",
        "if (n := len(a)) > 10:\n    pass\n",
        "x = ...\n",
        "x = (\n    1 +  # first\n    2\n)\n",
        "x = 1 + \\\n    2\n",
        "async def main():\n    await task\n    async for i in it:\n        pass\n    async with lock:\n        pass\n",
        "def gen():\n    yield\n    yield x\n    y = yield from other()\n",
        "def f(a, /, b, *, c: int = 1, **kw) -> None:\n    return a\n",
        "def f(*args: int, **kwargs: str): ...\n",
        "@decorator\n@other.deco(arg)\n\nclass C(Base, metaclass=Meta):\n    '''Doc.'''\n\n    def m(self):\n        return self\n",
        "class Empty: pass\nclass Parens():\n    pass\n",
        "if a:\n    x\nelif b:\n    y\nelif c: z\nelse:\n    w\n",
        "for i, j in pairs:\n    continue\nelse:\n    break\n",
        "while True:\n    x -= 1\nelse:\n    done()\n",
        "try:\n    risky()\nexcept ValueError as e:\n    handle(e)\nexcept (TypeError, KeyError):\n    pass\nexcept:\n    raise\nelse:\n    ok()\nfinally:\n    cleanup()\n",
        "try:\n    x\nfinally:\n    y\n",
        "try:\n    x\nexcept* ValueError as eg:\n    pass\n",
        "with open(p) as f, lock:\n    pass\n",
        "with (\n    open(a) as f,\n    open(b) as g,\n):\n    pass\n",
        "with (yield):\n    pass\n",
        "match command:\n    case [x, y, *rest]:\n        pass\n    case {'k': v, **others}:\n        pass\n    case Point(x=0, y=_) | None:\n        pass\n    case (1 | 2) as n if n > 0:\n        pass\n    case -1 | 1.5 | 2 + 3j | 'text' | a.b:\n        pass\n    case _:\n        pass\n",
        "match = 1\nmatch(x)\n",
        "type Alias = int\ntype Pair[T] = tuple[T, T]\n",
        "def first[T: (int, str), *Ts, **P](x: T) -> T:\n    return x\n",
        "class Box[T = int]:\n    pass\n",
        "if x:\n    if y:\n        a\n    # inside outer\nb\n",
        "def f():\n    x = 1\n\n    # comment in block\n\n\n# comment at module level\ny = 2\n",
        "if x:\n\tpass\n",
        "x = 1\r\ny = 2\r\n",
        "if a:\n  b\n",
        "x = [\n    1,\n    2,\n]\n",
        "print('no newline at end')",
        "def f():\n    pass\n    ",
        "x = 1\n# last line without newline",
    })
    void parseModule_validSource_codegenIsIdentical(String source) throws PythonParseException {
        var module = PythonParser.parseModule(source);

        assertThat(PythonParser.codegen(module)).isEqualTo(source);
    }

    @Test
    void parseModule_byteOrderMark_keptOnModule() throws PythonParseException {
        var source = "\uFEFFx = 1\n";

        var module = PythonParser.parseModule(source);

        assertThat(module.byteOrderMark()).isTrue();
        assertThat(module.code()).isEqualTo(source);
    }

    @Test
    void parseModule_detectsFormattingDefaults() throws PythonParseException {
        var module = PythonParser.parseModule("if x:\r\n\tpass\r\n");

        assertThat(module.defaultIndent()).isEqualTo("\t");
        assertThat(module.defaultNewline()).isEqualTo("\r\n");
        assertThat(module.encoding()).isEqualTo("utf-8");
    }

    @Test
    void parseModule_noIndentedBlock_usesDefaults() throws PythonParseException {
        var module = PythonParser.parseModule("x = 1");

        assertThat(module.defaultIndent()).isEqualTo("    ");
        assertThat(module.defaultNewline()).isEqualTo("\n");
    }

    @Test
    void parseModule_configuredNewlineAndEncoding_recordedOnModule() throws PythonParseException {
        var config = PythonParser.builder()
                                 .newline("\r\n")
                                 .encoding("latin-1")
                                 .config();

        var module = PythonParser.parseModule("x = 1\n", config);

        assertThat(module.defaultNewline()).isEqualTo("\r\n");
        assertThat(module.encoding()).isEqualTo("latin-1");
        assertThat(module.code()).isEqualTo("x = 1\n");
    }

    // === Statements and expressions ===

    @Test
    void parseStatement_compoundStatement_roundTrips() throws PythonParseException {
        var source = "if x:\n    y = 1\n";

        var statement = PythonParser.parseStatement(source);

        assertThat(statement).isInstanceOf(Statement.If.class);
        assertThat(statement.code()).isEqualTo(source);
    }

    @Test
    void parseStatement_twoStatements_fails() {
        assertThatThrownBy(() -> PythonParser.parseStatement("x = 1\ny = 2\n"))
            .isInstanceOf(PythonParseException.class);
    }

    @Test
    void parseExpression_binaryOperation_roundTrips() throws PythonParseException {
        var expression = PythonParser.parseExpression("a  +  b * c");

        assertThat(expression).isInstanceOf(Expression.BinaryOperation.class);
        assertThat(expression.code()).isEqualTo("a  +  b * c");
    }

    @Test
    void parseExpression_commaList_isTuple() throws PythonParseException {
        var expression = PythonParser.parseExpression("1, 2");

        assertThat(expression).isInstanceOf(Expression.Tuple.class);
    }

    @Test
    void parseExpression_trailingStatement_fails() {
        assertThatThrownBy(() -> PythonParser.parseExpression("x = 1"))
            .isInstanceOf(PythonParseException.class);
    }

    // === Positions ===

    @Test
    void parseModuleWithPositions_tracksNodes() throws PythonParseException {
        var parsed = PythonParser.parseModuleWithPositions("def f(x):\n    return x\n");

        assertThat(parsed.positions()).isPresent();
        assertThat(parsed.trackedNodeCount()).isPositive();
        assertThat(parsed.positions()
                         .orElseThrow()
                         .size()).isPositive();
    }

    @Test
    void parseModule_withoutPositions_noTable() throws PythonParseException {
        var parsed = PythonParser.builder()
                                 .positions(false)
                                 .parse("x = 1\n");

        assertThat(parsed.positions()).isEmpty();
        assertThat(parsed.module()).isInstanceOf(Module.class);
    }

    // === Errors ===

    @Test
    void parseModule_unexpectedToken_reportsLocationAndExpectation() {
        assertThatThrownBy(() -> PythonParser.parseModule("x = (1 +\n    )\n"))
            .isInstanceOf(PythonParseException.class)
            .satisfies(e -> {
                var error = ((PythonParseException) e).error();
                assertThat(error).isInstanceOf(ParseError.UnexpectedInput.class);
                assertThat(error.location()
                                .line()).isEqualTo(2);
                assertThat(((ParseError.UnexpectedInput) error).found()).isEqualTo(")");
            });
    }

    @Test
    void parseModule_truncatedBlock_reportsEndOfInput() {
        assertThatThrownBy(() -> PythonParser.parseModule("def f():\n"))
            .isInstanceOf(PythonParseException.class)
            .satisfies(e -> assertThat(((PythonParseException) e).error())
                .isInstanceOf(ParseError.UnexpectedEof.class));
    }

    @Test
    void parseModule_loneStarredExpression_fails() {
        assertThatThrownBy(() -> PythonParser.parseModule("*a\n"))
            .isInstanceOf(PythonParseException.class);
    }

    @Test
    void parseModule_mixedExceptForms_fails() {
        assertThatThrownBy(() -> PythonParser.parseModule("try:\n    x\nexcept* A:\n    y\nexcept B:\n    z\n"))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("not to be mixed");
    }

    @Test
    void parseModule_matchOnOlderVersion_rejected() {
        var config = PythonParser.builder()
                                 .version(PythonVersion.PY39)
                                 .config();

        assertThatThrownBy(() -> PythonParser.parseModule("match x:\n    case 1:\n        pass\n", config))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("Python 3.10");
    }

    @Test
    void parseModule_matchAsNameOnOlderVersion_accepted() throws PythonParseException {
        var config = PythonParser.builder()
                                 .version(PythonVersion.PY38)
                                 .config();

        var module = PythonParser.parseModule("match = 1\n", config);

        assertThat(module.code()).isEqualTo("match = 1\n");
    }

    @Test
    void parseModule_exceptStarOnOlderVersion_rejected() {
        var config = PythonParser.builder()
                                 .version(PythonVersion.PY310)
                                 .config();

        assertThatThrownBy(() -> PythonParser.parseModule("try:\n    x\nexcept* E:\n    y\n", config))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("Python 3.11");
    }

    @Test
    void parseModule_typeAliasOnOlderVersion_rejected() {
        var config = PythonParser.builder()
                                 .version(PythonVersion.PY311)
                                 .config();

        assertThatThrownBy(() -> PythonParser.parseModule("type X = int\n", config))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("Python 3.12");
    }

    @Test
    void parseModule_typeParameterDefaultOnOlderVersion_rejected() {
        var config = PythonParser.builder()
                                 .version(PythonVersion.PY312)
                                 .config();

        assertThatThrownBy(() -> PythonParser.parseModule("def f[T = int](): pass\n", config))
            .isInstanceOf(PythonParseException.class)
            .hasMessageContaining("Python 3.13");
    }

    @Test
    void parseModule_typeParametersOnNewestVersion_accepted() throws PythonParseException {
        var config = new ParserConfig(PythonVersion.PY313, Optional.empty(), Optional.empty(), false);

        var module = PythonParser.parseModule("def f[T = int](): pass\n", config);

        assertThat(module.code()).isEqualTo("def f[T = int](): pass\n");
    }

    @Test
    void prettifyError_rendersRustStyleDiagnostic() {
        var source = "x = (1 +\n    )\n";

        assertThatThrownBy(() -> PythonParser.parseModule(source))
            .isInstanceOf(PythonParseException.class)
            .satisfies(e -> {
                var rendered = PythonParser.prettifyError((PythonParseException) e, source, "module.py");
                assertThat(rendered).startsWith("error[E0002]: unexpected ')'");
                assertThat(rendered).contains("--> module.py:2:5");
                assertThat(rendered).contains("expected expression");
            });
    }
}
