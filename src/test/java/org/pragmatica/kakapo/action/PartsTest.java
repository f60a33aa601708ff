package org.pragmatica.kakapo.action;

import org.junit.jupiter.api.Test;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;
import org.pragmatica.kakapo.tree.Leaf;
import org.pragmatica.kakapo.tree.Text;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PartsTest {

    @Test
    void alternatingParts_splitIntoNodesAndSlots() {
        var parts = Parts.of(List.of(new Leaf("a"), " + ", new Leaf("b"), "-", "c"));

        assertThat(parts.nodes(0, 3, Leaf.class)).extracting(Leaf::text).containsExactly("a", "b");
        assertThat(parts.texts(1, 4)).extracting(Text::text).containsExactly(" + ", "-");
        assertThat(parts.leaves(0, 5)).extracting(Leaf::text).containsExactly("a", "b", "c");
    }

    @Test
    void absentPart_isAnEmptyOptional() {
        var parts = Parts.of(List.of(Parts.ABSENT, new Leaf("x")));

        assertThat(parts.isAbsent(0)).isTrue();
        assertThat(parts.optional(0, Leaf.class)).isEmpty();
        assertThat(parts.optional(1, Leaf.class)).contains(new Leaf("x"));
    }

    @Test
    void wrongKind_isAStructuralViolation() {
        var parts = Parts.of(List.of("text"));

        assertThatThrownBy(() -> parts.node(0, Leaf.class))
            .isInstanceOf(StructuralAssumptionViolation.class)
            .hasMessageContaining("#0");
        assertThatThrownBy(() -> Parts.of(List.of(new Leaf("x"))).string(0))
            .isInstanceOf(StructuralAssumptionViolation.class);
    }
}
