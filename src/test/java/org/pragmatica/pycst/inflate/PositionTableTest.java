package org.pragmatica.pycst.inflate;

import org.junit.jupiter.api.Test;
import org.pragmatica.pycst.ParsedModule;
import org.pragmatica.pycst.PythonParser;
import org.pragmatica.pycst.error.PythonParseException;
import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.Statement;
import org.pragmatica.pycst.tree.StatementPart;
import org.pragmatica.pycst.visitor.CstVisitor;
import org.pragmatica.pycst.visitor.CstWalker;
import org.pragmatica.pycst.visitor.VisitResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PositionTableTest {

    private static ParsedModule parse(String source) throws PythonParseException {
        return PythonParser.parseModuleWithPositions(source);
    }

    private static PositionTable table(ParsedModule parsed) {
        return parsed.positions()
                     .orElseThrow();
    }

    private static NodeId idOf(Statement statement) {
        if (statement instanceof Statement.FunctionDef def) {
            return def.id()
                      .orElseThrow();
        }
        if (statement instanceof Statement.If ifStatement) {
            return ifStatement.id()
                              .orElseThrow();
        }
        if (statement instanceof Statement.Try tryStatement) {
            return tryStatement.id()
                               .orElseThrow();
        }
        if (statement instanceof Statement.TryStar tryStar) {
            return tryStar.id()
                          .orElseThrow();
        }
        if (statement instanceof Statement.For forStatement) {
            return forStatement.id()
                               .orElseThrow();
        }
        if (statement instanceof Statement.While whileStatement) {
            return whileStatement.id()
                                 .orElseThrow();
        }
        throw new IllegalArgumentException("No id accessor for " + statement);
    }

    @Test
    void decoratedFunction_defSpanStartsAtDecorator() throws PythonParseException {
        var parsed = parse("@d\ndef f(): pass");
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).defSpan(id)).contains(Span.of(0, 16));
        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(3, 16));
    }

    @Test
    void undecoratedFunction_defSpanEqualsLexicalSpan() throws PythonParseException {
        var parsed = parse("def foo():\n    return 1\n");
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(0, 24));
        assertThat(table(parsed).defSpan(id)).isEqualTo(table(parsed).lexicalSpan(id));
    }

    @Test
    void ifStatement_lexicalSpanCoversElseAndBranchSpanCoversBody() throws PythonParseException {
        var source = "if a:\n    x\nelse:\n    y\nz = 1\n";
        var parsed = parse(source);
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(0, 24));
        assertThat(table(parsed).branchSpan(id)).contains(Span.of(5, 12));
    }

    @Test
    void tryStatement_endsAtFinallyBody() throws PythonParseException {
        var source = "try:\n    a\nexcept E:\n    b\nfinally:\n    c\nx = 1\n";
        var parsed = parse(source);
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(0, 42));
        assertThat(table(parsed).branchSpan(id)).contains(Span.of(4, 11));
    }

    @Test
    void tryStatement_withoutFinally_endsAtElseBody() throws PythonParseException {
        var parsed = parse("try:\n    a\nexcept E:\n    b\nelse:\n    c\nx = 1\n");
        var tryStatement = (Statement.Try) parsed.module()
                                                 .body()
                                                 .get(0);
        var orelse = tryStatement.orelse()
                                 .orElseThrow();

        assertThat(table(parsed).lexicalSpan(idOf(tryStatement))).contains(Span.of(0, 39));
        assertThat(table(parsed).branchSpan(orelse.id()
                                                  .orElseThrow())).contains(Span.of(32, 39));
    }

    @Test
    void tryStatement_withHandlersOnly_endsAtLastHandler() throws PythonParseException {
        var parsed = parse("try:\n    a\nexcept E:\n    b\nexcept:\n    c\nx = 1\n");
        var tryStatement = (Statement.Try) parsed.module()
                                                 .body()
                                                 .get(0);
        var last = tryStatement.handlers()
                               .get(1);

        assertThat(table(parsed).lexicalSpan(idOf(tryStatement))).contains(Span.of(0, 41));
        assertThat(table(parsed).branchSpan(last.id()
                                                .orElseThrow())).contains(Span.of(34, 41));
    }

    @Test
    void tryStarStatement_endsAtLastStarHandler() throws PythonParseException {
        var parsed = parse("try:\n    a\nexcept* E:\n    b\nx = 1\n");
        var statement = parsed.module()
                              .body()
                              .get(0);

        assertThat(statement).isInstanceOf(Statement.TryStar.class);
        assertThat(table(parsed).lexicalSpan(idOf(statement))).contains(Span.of(0, 28));
        var handler = ((Statement.TryStar) statement).handlers()
                                                     .get(0);
        assertThat(table(parsed).branchSpan(handler.id()
                                                   .orElseThrow())).contains(Span.of(21, 28));
    }

    @Test
    void forStatement_lexicalSpanIncludesElse() throws PythonParseException {
        var parsed = parse("for i in x:\n    a\nelse:\n    b\ny\n");
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(0, 30));
        assertThat(table(parsed).branchSpan(id)).contains(Span.of(11, 18));
    }

    @Test
    void whileStatement_lexicalSpanIncludesElse() throws PythonParseException {
        var parsed = parse("while x:\n    a\nelse:\n    b\ny\n");
        var id = idOf(parsed.module()
                            .body()
                            .get(0));

        assertThat(table(parsed).lexicalSpan(id)).contains(Span.of(0, 27));
        assertThat(table(parsed).branchSpan(id)).contains(Span.of(8, 15));
    }

    @Test
    void clauseBranchSpans_lieInsideOwningStatement() throws PythonParseException {
        var parsed = parse("""
            if a:
                x
            elif b:
                y
            else:
                z
            for i in xs:
                pass
            else:
                pass
            while c:
                break
            else:
                pass
            try:
                f()
            except E as e:
                g()
            else:
                h()
            finally:
                k()
            try:
                f()
            except* E:
                g()
            match p:
                case 1:
                    pass
                case _:
                    pass
            """);
        var checker = new ClauseContainment(table(parsed));

        CstWalker.walk(checker, parsed.module());

        assertThat(checker.clauses).isEqualTo(9);
        assertThat(checker.owners).isEmpty();
    }

    @Test
    void simpleStatement_identSpanCoversStatementText() throws PythonParseException {
        var parsed = parse("x = 10\n");
        var line = (Statement.SimpleStatementLine) parsed.module()
                                                         .body()
                                                         .get(0);
        var assign = (SmallStatement.Assign) line.body()
                                                 .get(0);

        assertThat(table(parsed).identSpan(assign.id()
                                                 .orElseThrow())).contains(Span.of(0, 6));
    }

    @Test
    void spans_useUtf8ByteOffsets() throws PythonParseException {
        var parsed = parse("é = 1\n");
        var line = (Statement.SimpleStatementLine) parsed.module()
                                                         .body()
                                                         .get(0);
        var assign = (SmallStatement.Assign) line.body()
                                                 .get(0);

        assertThat(table(parsed).identSpan(assign.id()
                                                 .orElseThrow())).contains(Span.of(0, 6));
    }

    @Test
    void everyRecordedNode_hasOrderedSpansAndKnownId() throws PythonParseException {
        var parsed = parse("""
            @decorator
            class C:
                def m(self, xs):
                    for x in xs:
                        if x:
                            continue
                    while True:
                        break
                    return [y for y in xs], lambda: 0
            """);

        assertThat(table(parsed).size()).isPositive();
        table(parsed).entries()
                     .forEach((id, position) -> {
                         assertThat(id.value()).isBetween(0, parsed.trackedNodeCount() - 1);
                         position.defSpan()
                                 .ifPresent(def -> {
                                     var lexical = position.lexicalSpan()
                                                           .orElseThrow();
                                     assertThat(def.start()).isLessThanOrEqualTo(lexical.start());
                                     assertThat(def.end()).isEqualTo(lexical.end());
                                 });
                         position.branchSpan()
                                 .ifPresent(branch -> position.lexicalSpan()
                                                              .ifPresent(lexical -> {
                                                                  assertThat(branch.start())
                                                                      .isGreaterThanOrEqualTo(lexical.start());
                                                                  assertThat(branch.end())
                                                                      .isLessThanOrEqualTo(lexical.end());
                                                              }));
                     });
    }

    @Test
    void withoutCapture_noTableButIdsStillAssigned() throws PythonParseException {
        var parsed = PythonParser.builder()
                                 .parse("def f(): pass\n");
        var def = (Statement.FunctionDef) parsed.module()
                                                .body()
                                                .get(0);

        assertThat(parsed.positions()).isEmpty();
        assertThat(def.id()).isPresent();
    }

    private static final class ClauseContainment implements CstVisitor {
        private final PositionTable table;
        private final Deque<Span> owners = new ArrayDeque<>();
        private int clauses;

        private ClauseContainment(PositionTable table) {
            this.table = table;
        }

        private VisitResult enter(Optional<NodeId> id) {
            owners.push(table.lexicalSpan(id.orElseThrow())
                             .orElseThrow());
            return VisitResult.CONTINUE;
        }

        private VisitResult clause(Optional<NodeId> id) {
            var branch = table.branchSpan(id.orElseThrow())
                              .orElseThrow();
            var owner = owners.element();
            assertThat(owner.contains(branch)).as("branch %s inside owner %s", branch, owner)
                                              .isTrue();
            table.lexicalSpan(id.orElseThrow())
                 .ifPresent(lexical -> assertThat(owner.contains(lexical)).isTrue());
            clauses++;
            return VisitResult.CONTINUE;
        }

        @Override
        public VisitResult visitIf(Statement.If node) {
            return enter(node.id());
        }

        @Override
        public void leaveIf(Statement.If node) {
            owners.pop();
        }

        @Override
        public VisitResult visitFor(Statement.For node) {
            return enter(node.id());
        }

        @Override
        public void leaveFor(Statement.For node) {
            owners.pop();
        }

        @Override
        public VisitResult visitWhile(Statement.While node) {
            return enter(node.id());
        }

        @Override
        public void leaveWhile(Statement.While node) {
            owners.pop();
        }

        @Override
        public VisitResult visitTry(Statement.Try node) {
            return enter(node.id());
        }

        @Override
        public void leaveTry(Statement.Try node) {
            owners.pop();
        }

        @Override
        public VisitResult visitTryStar(Statement.TryStar node) {
            return enter(node.id());
        }

        @Override
        public void leaveTryStar(Statement.TryStar node) {
            owners.pop();
        }

        @Override
        public VisitResult visitMatch(Statement.Match node) {
            return enter(node.id());
        }

        @Override
        public void leaveMatch(Statement.Match node) {
            owners.pop();
        }

        @Override
        public VisitResult visitElse(StatementPart.Else node) {
            return clause(node.id());
        }

        @Override
        public VisitResult visitExceptHandler(StatementPart.ExceptHandler node) {
            return clause(node.id());
        }

        @Override
        public VisitResult visitExceptStarHandler(StatementPart.ExceptStarHandler node) {
            return clause(node.id());
        }

        @Override
        public VisitResult visitFinally(StatementPart.Finally node) {
            return clause(node.id());
        }

        @Override
        public VisitResult visitMatchCase(StatementPart.MatchCase node) {
            return clause(node.id());
        }
    }
}
