package org.pragmatica.pycst.visitor;

import org.pragmatica.pycst.tree.Span;

import java.util.List;
import java.util.Optional;

/**
 * One scope found by {@link ScopeCollector}.
 *
 * @param id        {@code scope_N}, numbered in discovery order
 * @param name      function or class name; empty for module, lambda and comprehension scopes
 * @param parent    id of the enclosing scope; empty only for the module scope
 * @param span      lexical span of the scope, empty when positions were not captured
 * @param depth     nesting depth, 0 for the module
 * @param globals   names declared {@code global} directly in this scope
 * @param nonlocals names declared {@code nonlocal} directly in this scope
 */
public record ScopeInfo(String id,
                        ScopeKind kind,
                        Optional<String> name,
                        Optional<String> parent,
                        Optional<Span> span,
                        int depth,
                        List<String> globals,
                        List<String> nonlocals) {}
