package org.pragmatica.pycst.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens node, optional-node and node-list components into a child list.
 */
final class Children {
    private Children() {}

    static List<Node> of(Object... parts) {
        var result = new ArrayList<Node>();
        for (var part : parts) {
            add(result, part);
        }
        return List.copyOf(result);
    }

    private static void add(List<Node> result, Object part) {
        if (part instanceof Node node) {
            result.add(node);
        } else if (part instanceof Optional<?> optional) {
            optional.ifPresent(value -> add(result, value));
        } else if (part instanceof List<?> list) {
            list.forEach(value -> add(result, value));
        } else {
            throw new IllegalArgumentException("Not a child component: " + part);
        }
    }
}
