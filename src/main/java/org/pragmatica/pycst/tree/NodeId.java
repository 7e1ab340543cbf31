package org.pragmatica.pycst.tree;

/**
 * Stable identity of an inflated node. Assigned once, in pre-order, by a single inflation pass.
 */
public record NodeId(int value) implements Comparable<NodeId> {

    public static NodeId of(int value) {
        return new NodeId(value);
    }

    @Override
    public int compareTo(NodeId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "NodeId(" + value + ")";
    }
}
