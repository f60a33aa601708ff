package org.pragmatica.kakapo.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.kakapo.Kakapo;
import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void iterate_visitsDescendantsInDocumentOrder() throws ParseException {
        var file = Kakapo.parse("y = f(x) + g(1);");

        assertThat(file.iterate(Call.class).map(call -> call.identifier().text()))
            .containsExactly("y", "f", "x", "g");
    }

    @Test
    void iterate_withSeveralKinds() throws ParseException {
        var file = Kakapo.parse("% head\nx = 1;\nhold on\n% tail");

        assertThat(file.iterate(Comment.class, Command.class).map(Node::text))
            .containsExactly("% head", "hold on", "% tail");
    }

    @Test
    void predecessorAndSuccessor_areTheSurroundingSlots() throws ParseException {
        var file = Kakapo.parse("a = 1;\nb = 2;");
        var first = file.code().constructs().get(0);
        var second = file.code().constructs().get(1);

        assertThat(first.predecessor()).isEmpty();
        assertThat(first.successor()).map(Element::text).contains("\n");
        assertThat(second.predecessor()).map(Text::text).contains("\n");
        assertThat(second.successor()).isEmpty();
    }

    @Test
    void setPredecessor_rewritesSlotInPlace() throws ParseException {
        var file = Kakapo.parse("a = 1;\nb = 2;");

        file.code().constructs().get(1).setPredecessor("\n\n");

        assertThat(file.text()).isEqualTo("a = 1;\n\nb = 2;");
    }

    @Test
    void setPredecessor_withoutSlot_fails() throws ParseException {
        var file = Kakapo.parse("a = 1;");
        var statement = file.code().constructs().get(0);

        assertThatThrownBy(() -> statement.setPredecessor(" "))
            .isInstanceOf(StructuralAssumptionViolation.class);
    }

    @Test
    void parent_pointsAtEnclosingNode() throws ParseException {
        var file = Kakapo.parse("x = f(1);");
        var statement = (Statement) file.code().constructs().get(0);

        assertThat(statement.parent()).containsSame(file.code());
        assertThat(statement.body().parent()).containsSame(statement);
        assertThat(file.parent()).isEmpty();
    }

    @Test
    void parent_listsTheNodeAmongItsChildren_afterBacktracking() throws ParseException {
        // "x" is parsed as an output target, a call and an operand before the parse settles
        var file = Kakapo.parse("if x\n  y = (x + 1) * f(x);\nelse\n  x\nend");

        assertThat(file.descendants()).allSatisfy(node -> assertThat(node.parent().orElseThrow()
                                                                         .nodes()
                                                                         .anyMatch(child -> child == node)).isTrue());
    }

    @Test
    void iterateWithIndent_bodiesAreOneLevelDeeper() throws ParseException {
        var file = Kakapo.parse("if a\n  b;\nelse\n  if c\n    d;\n  end\nend");

        var statementLevels = file.iterateWithIndent()
                                  .filter(indented -> indented.node() instanceof Statement)
                                  .collect(Collectors.toMap(indented -> indented.node().text(), Indented::level));
        var elseLevel = file.iterateWithIndent()
                            .filter(indented -> indented.node() instanceof Leaf leaf && leaf.is("else"))
                            .map(Indented::level)
                            .findFirst();

        assertThat(statementLevels).containsEntry("a", 0)
                                   .containsEntry("b;", 1)
                                   .containsEntry("c", 1)
                                   .containsEntry("d;", 2);
        assertThat(elseLevel).contains(0);
    }

    @Test
    void equality_followsStructureAndText() throws ParseException {
        assertThat(Kakapo.parse("x = [1 2];")).isEqualTo(Kakapo.parse("x = [1 2];"));
        assertThat(Kakapo.parse("x = [1 2];")).isNotEqualTo(Kakapo.parse("x = [1  2];"));
    }

    @Test
    void pretty_dumpsStructure() throws ParseException {
        var dump = Kakapo.parse("if a\nend").pretty();

        assertThat(dump).contains("File[", "If[", "Leaf(if)", "Leaf(end)");
    }

    @Test
    void operation_needsTwoOperands() {
        assertThatThrownBy(() -> new Operation(DelimitedList.single(new Leaf("a"))))
            .isInstanceOf(StructuralAssumptionViolation.class);
    }

    @Test
    void code_rejectsMismatchedSeparators() {
        assertThatThrownBy(() -> Code.of(List.of(new Leaf("a"), new Leaf("b")), List.of()))
            .isInstanceOf(StructuralAssumptionViolation.class)
            .hasMessageContaining("Code");
    }

    @Test
    void toString_showsKindAndText() {
        assertThat(new Leaf("x\n")).hasToString("Leaf('x\\n')");
        assertThat(Text.of("\t")).hasToString("'\\t'");
    }
}
