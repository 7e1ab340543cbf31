package org.pragmatica.pycst.visitor;

import org.pragmatica.pycst.ParsedModule;
import org.pragmatica.pycst.inflate.PositionTable;
import org.pragmatica.pycst.tree.Expression;
import org.pragmatica.pycst.tree.Module;
import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.SmallStatement;
import org.pragmatica.pycst.tree.Span;
import org.pragmatica.pycst.tree.Statement;
import org.pragmatica.pycst.tree.StatementPart.NameItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Collects the scopes of a module: the module itself, classes, functions, lambdas and
 * comprehensions including generator expressions. Scope spans are looked up by node identity
 * in the position table.
 */
public final class ScopeCollector implements CstVisitor {
    private static final Logger log = LoggerFactory.getLogger(ScopeCollector.class);

    private final Optional<PositionTable> positions;
    private final int sourceLength;
    private final List<MutableScope> scopes = new ArrayList<>();
    private final Deque<MutableScope> stack = new ArrayDeque<>();
    private int nextScopeId;

    private ScopeCollector(Optional<PositionTable> positions, int sourceLength) {
        this.positions = positions;
        this.sourceLength = sourceLength;
    }

    /**
     * Collector for a tree with spans; {@code source} only provides the module span.
     */
    public static ScopeCollector create(Optional<PositionTable> positions, String source) {
        return new ScopeCollector(positions, source.getBytes(StandardCharsets.UTF_8).length);
    }

    public static List<ScopeInfo> collect(ParsedModule parsed, String source) {
        var collector = create(parsed.positions(), source);
        CstWalker.walk(collector, parsed.module());
        return collector.scopes();
    }

    /**
     * Scopes in discovery order.
     */
    public List<ScopeInfo> scopes() {
        return scopes.stream()
                     .map(MutableScope::freeze)
                     .toList();
    }

    private static final class MutableScope {
        private final String id;
        private final ScopeKind kind;
        private final Optional<String> name;
        private final Optional<String> parent;
        private final Optional<Span> span;
        private final int depth;
        private final List<String> globals = new ArrayList<>();
        private final List<String> nonlocals = new ArrayList<>();

        private MutableScope(String id,
                             ScopeKind kind,
                             Optional<String> name,
                             Optional<String> parent,
                             Optional<Span> span,
                             int depth) {
            this.id = id;
            this.kind = kind;
            this.name = name;
            this.parent = parent;
            this.span = span;
            this.depth = depth;
        }

        ScopeInfo freeze() {
            return new ScopeInfo(id, kind, name, parent, span, depth, List.copyOf(globals), List.copyOf(nonlocals));
        }
    }

    private void enter(ScopeKind kind, Optional<String> name, Optional<Span> span) {
        var parent = Optional.ofNullable(stack.peek())
                             .map(scope -> scope.id);
        var scope = new MutableScope("scope_" + nextScopeId++, kind, name, parent, span, stack.size());
        log.trace("Entering {} scope {} ({})", kind.display(), scope.id, name.orElse("<anonymous>"));
        scopes.add(scope);
        stack.push(scope);
    }

    private void enterNode(ScopeKind kind, Optional<String> name, Optional<NodeId> id) {
        enter(kind, name, id.flatMap(nodeId -> positions.flatMap(table -> table.lexicalSpan(nodeId))));
    }

    private void exit() {
        stack.pop();
    }

    private VisitResult declare(List<NameItem> names, boolean global) {
        var scope = stack.element();
        var target = global
                     ? scope.globals
                     : scope.nonlocals;
        names.forEach(item -> target.add(item.name()
                                             .value()));
        return VisitResult.SKIP_CHILDREN;
    }

    @Override
    public VisitResult visitModule(Module node) {
        enter(ScopeKind.MODULE, Optional.empty(), Optional.of(Span.of(0, sourceLength)));
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveModule(Module node) {
        exit();
    }

    @Override
    public VisitResult visitFunctionDef(Statement.FunctionDef node) {
        enterNode(ScopeKind.FUNCTION, Optional.of(node.name()
                                                      .value()), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveFunctionDef(Statement.FunctionDef node) {
        exit();
    }

    @Override
    public VisitResult visitClassDef(Statement.ClassDef node) {
        enterNode(ScopeKind.CLASS, Optional.of(node.name()
                                                   .value()), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveClassDef(Statement.ClassDef node) {
        exit();
    }

    @Override
    public VisitResult visitLambda(Expression.Lambda node) {
        enterNode(ScopeKind.LAMBDA, Optional.empty(), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveLambda(Expression.Lambda node) {
        exit();
    }

    @Override
    public VisitResult visitListComp(Expression.ListComp node) {
        enterNode(ScopeKind.COMPREHENSION, Optional.empty(), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveListComp(Expression.ListComp node) {
        exit();
    }

    @Override
    public VisitResult visitSetComp(Expression.SetComp node) {
        enterNode(ScopeKind.COMPREHENSION, Optional.empty(), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveSetComp(Expression.SetComp node) {
        exit();
    }

    @Override
    public VisitResult visitDictComp(Expression.DictComp node) {
        enterNode(ScopeKind.COMPREHENSION, Optional.empty(), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveDictComp(Expression.DictComp node) {
        exit();
    }

    @Override
    public VisitResult visitGeneratorExp(Expression.GeneratorExp node) {
        enterNode(ScopeKind.COMPREHENSION, Optional.empty(), node.id());
        return VisitResult.CONTINUE;
    }

    @Override
    public void leaveGeneratorExp(Expression.GeneratorExp node) {
        exit();
    }

    @Override
    public VisitResult visitGlobal(SmallStatement.Global node) {
        return declare(node.names(), true);
    }

    @Override
    public VisitResult visitNonlocal(SmallStatement.Nonlocal node) {
        return declare(node.names(), false);
    }
}
