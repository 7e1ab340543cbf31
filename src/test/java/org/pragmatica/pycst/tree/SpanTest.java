package org.pragmatica.pycst.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanTest {

    @Test
    void of_endBeforeStart_isRejected() {
        assertThatThrownBy(() -> Span.of(5, 4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptySpan_isAllowed() {
        assertThat(Span.of(3, 3)
                       .length()).isZero();
    }

    @Test
    void contains_checksNesting() {
        var outer = Span.of(0, 10);

        assertThat(outer.contains(Span.of(2, 10))).isTrue();
        assertThat(outer.contains(Span.of(2, 11))).isFalse();
        assertThat(outer.contains(9)).isTrue();
        assertThat(outer.contains(10)).isFalse();
    }

    @Test
    void nodeIds_orderByValue() {
        assertThat(NodeId.of(2)).isGreaterThan(NodeId.of(1));
        assertThat(NodeId.of(0)).isEqualTo(new NodeId(0));
    }
}
