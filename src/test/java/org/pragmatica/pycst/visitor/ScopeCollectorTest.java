package org.pragmatica.pycst.visitor;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.PythonParser;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.Statement;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeCollectorTest {

    private static List<ScopeInfo> scopes(String source) throws PythonParseException {
        return ScopeCollector.collect(PythonParser.parseModuleWithPositions(source), source);
    }

    @Test
    void simpleFunction_moduleAndFunctionScopes() throws PythonParseException {
        var scopes = scopes("def foo():\n    pass");

        assertThat(scopes).hasSize(2);
        var module = scopes.get(0);
        assertThat(module.id()).isEqualTo("scope_0");
        assertThat(module.kind()).isEqualTo(ScopeKind.MODULE);
        assertThat(module.parent()).isEmpty();
        assertThat(module.span()).contains(Span.of(0, 19));
        assertThat(module.depth()).isZero();

        var function = scopes.get(1);
        assertThat(function.id()).isEqualTo("scope_1");
        assertThat(function.kind()).isEqualTo(ScopeKind.FUNCTION);
        assertThat(function.name()).contains("foo");
        assertThat(function.parent()).contains("scope_0");
        assertThat(function.span()).contains(Span.of(0, 19));
        assertThat(function.depth()).isEqualTo(1);
    }

    @Test
    void nestedFunctions_chainParentsAndDepth() throws PythonParseException {
        var scopes = scopes("def outer():\n    def inner():\n        pass\n");

        assertThat(scopes).extracting(ScopeInfo::name)
                          .containsExactly(Optional.empty(), Optional.of("outer"), Optional.of("inner"));
        assertThat(scopes.get(2).parent()).contains("scope_1");
        assertThat(scopes.get(2).depth()).isEqualTo(2);
    }

    @Test
    void classWithMethods_methodsBelongToClass() throws PythonParseException {
        var scopes = scopes("class A:\n    def m(self):\n        pass\n    def n(self):\n        pass\n");

        assertThat(scopes).extracting(ScopeInfo::kind)
                          .containsExactly(ScopeKind.MODULE, ScopeKind.CLASS, ScopeKind.FUNCTION, ScopeKind.FUNCTION);
        assertThat(scopes.get(1).name()).contains("A");
        assertThat(scopes.get(2).parent()).contains("scope_1");
        assertThat(scopes.get(3).parent()).contains("scope_1");
    }

    @Test
    void comprehensions_areAnonymousScopes() throws PythonParseException {
        var scopes = scopes("x = [i for i in range(10)]\ny = {k: v for k, v in z}\nsum(n for n in y)\n");

        assertThat(scopes).extracting(ScopeInfo::kind)
                          .containsExactly(ScopeKind.MODULE, ScopeKind.COMPREHENSION, ScopeKind.COMPREHENSION,
                                           ScopeKind.COMPREHENSION);
        assertThat(scopes.get(1).name()).isEmpty();
        assertThat(scopes.get(1).span()).contains(Span.of(4, 26));
    }

    @Test
    void lambda_spansFromKeywordToBody() throws PythonParseException {
        var scopes = scopes("f = lambda x: x");

        assertThat(scopes).hasSize(2);
        assertThat(scopes.get(1).kind()).isEqualTo(ScopeKind.LAMBDA);
        assertThat(scopes.get(1).span()).contains(Span.of(4, 15));
    }

    @Test
    void globalDeclaration_recordedOnEnclosingFunction() throws PythonParseException {
        var scopes = scopes("x = 1\ndef foo():\n    global x\n    x = 2");

        assertThat(scopes.get(0).globals()).isEmpty();
        assertThat(scopes.get(1).globals()).containsExactly("x");
    }

    @Test
    void nonlocalDeclaration_recordedOnInnerFunction() throws PythonParseException {
        var scopes = scopes("def outer():\n    x = 1\n    def inner():\n        nonlocal x, y\n");

        assertThat(scopes.get(1).nonlocals()).isEmpty();
        assertThat(scopes.get(2).nonlocals()).containsExactly("x", "y");
    }

    @Test
    void withoutPositions_onlyModuleHasSpan() throws PythonParseException {
        var source = "def f():\n    pass\n";
        var collector = ScopeCollector.create(Optional.empty(), source);

        CstWalker.walk(collector, PythonParser.parseModule(source));

        assertThat(collector.scopes()).hasSize(2);
        assertThat(collector.scopes()
                            .get(0)
                            .span()).contains(Span.of(0, 18));
        assertThat(collector.scopes()
                            .get(1)
                            .span()).isEmpty();
    }

    @Test
    void globalOutsideAnyScope_failsLoudly() throws PythonParseException {
        var line = (Statement.SimpleStatementLine) PythonParser.parseStatement("global x\n");
        var global = (SmallStatement.Global) line.body()
                                                 .get(0);
        var collector = ScopeCollector.create(Optional.empty(), "global x\n");

        assertThatThrownBy(() -> collector.visitGlobal(global)).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void moduleSpan_countsUtf8Bytes() throws PythonParseException {
        var scopes = scopes("s = 'ü'\n");

        assertThat(scopes.get(0).span()).contains(Span.of(0, 9));
    }
}
