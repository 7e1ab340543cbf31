package org.pragmatica.pycst.visitor;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.PythonParser;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.Statement;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CstWalkerTest {

    private static final class NameRecorder implements CstVisitor {
        private final List<String> events = new ArrayList<>();
        private final VisitResult onFunction;
        private final String abortAt;

        private NameRecorder(VisitResult onFunction, String abortAt) {
            this.onFunction = onFunction;
            this.abortAt = abortAt;
        }

        @Override
        public VisitResult visitName(Expression.Name node) {
            events.add(node.value());
            return node.value()
                       .equals(abortAt)
                   ? VisitResult.ABORT
                   : VisitResult.CONTINUE;
        }

        @Override
        public VisitResult visitFunctionDef(Statement.FunctionDef node) {
            events.add("def");
            return onFunction;
        }

        @Override
        public void leaveFunctionDef(Statement.FunctionDef node) {
            events.add("/def");
        }

        @Override
        public void leaveModule(Module node) {
            events.add("/module");
        }
    }

    @Test
    void walk_visitsNamesInSourceOrder() throws PythonParseException {
        var recorder = new NameRecorder(VisitResult.CONTINUE, "");

        var completed = CstWalker.walk(recorder, PythonParser.parseModule("a = b + c\nd(e)\n"));

        assertThat(completed).isTrue();
        assertThat(recorder.events).containsExactly("a", "b", "c", "d", "e", "/module");
    }

    @Test
    void walk_skipChildren_stillCallsLeave() throws PythonParseException {
        var recorder = new NameRecorder(VisitResult.SKIP_CHILDREN, "");

        CstWalker.walk(recorder, PythonParser.parseModule("def f(x):\n    y\nz\n"));

        assertThat(recorder.events).containsExactly("def", "/def", "z", "/module");
    }

    @Test
    void walk_abort_stopsWithoutPendingLeaves() throws PythonParseException {
        var recorder = new NameRecorder(VisitResult.CONTINUE, "y");

        var completed = CstWalker.walk(recorder, PythonParser.parseModule("def f(x):\n    y\nz\n"));

        assertThat(completed).isFalse();
        assertThat(recorder.events).containsExactly("def", "f", "x", "y");
    }
}
