package org.pragmatica.pycst.inflate;

import org.pragmatica.pycst.tree.NodeId;

/**
 * Hands out node identities in increasing order. One generator per inflation.
 */
public final class NodeIdGenerator {
    private int next;

    private NodeIdGenerator() {
        this.next = 0;
    }

    public static NodeIdGenerator create() {
        return new NodeIdGenerator();
    }

    public NodeId next() {
        return NodeId.of(next++);
    }

    /**
     * Number of identities handed out so far.
     */
    public int count() {
        return next;
    }
}
