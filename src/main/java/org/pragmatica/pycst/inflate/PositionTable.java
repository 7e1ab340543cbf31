package org.pragmatica.pycst.inflate;

import org.pragmatica.pycst.tree.NodeId;
import org.pragmatica.pycst.tree.Span;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Side index from node identity to the byte spans recorded for that node during inflation.
 * Filled by a single inflation pass and read-only afterwards.
 */
public final class PositionTable {
    private final Map<NodeId, NodePosition> positions;

    private PositionTable() {
        this.positions = new HashMap<>();
    }

    static PositionTable create() {
        return new PositionTable();
    }

    public Optional<NodePosition> get(NodeId id) {
        return Optional.ofNullable(positions.get(id));
    }

    public Optional<Span> identSpan(NodeId id) {
        return get(id).flatMap(NodePosition::identSpan);
    }

    public Optional<Span> lexicalSpan(NodeId id) {
        return get(id).flatMap(NodePosition::lexicalSpan);
    }

    public Optional<Span> defSpan(NodeId id) {
        return get(id).flatMap(NodePosition::defSpan);
    }

    public Optional<Span> branchSpan(NodeId id) {
        return get(id).flatMap(NodePosition::branchSpan);
    }

    public int size() {
        return positions.size();
    }

    public Map<NodeId, NodePosition> entries() {
        return Collections.unmodifiableMap(positions);
    }

    void update(NodeId id, UnaryOperator<NodePosition> change) {
        positions.put(id, change.apply(positions.getOrDefault(id, NodePosition.EMPTY)));
    }
}
