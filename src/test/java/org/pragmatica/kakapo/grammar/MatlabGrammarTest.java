package org.pragmatica.kakapo.grammar;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.parser.Parser;
import org.pragmatica.kakapo.parser.PegEngine;
import org.pragmatica.kakapo.tree.AnonymousFunction;
import org.pragmatica.kakapo.tree.ArgumentsBlock;
import org.pragmatica.kakapo.tree.Array;
import org.pragmatica.kakapo.tree.Call;
import org.pragmatica.kakapo.tree.Classdef;
import org.pragmatica.kakapo.tree.Command;
import org.pragmatica.kakapo.tree.Comment;
import org.pragmatica.kakapo.tree.File;
import org.pragmatica.kakapo.tree.ForLoop;
import org.pragmatica.kakapo.tree.Function;
import org.pragmatica.kakapo.tree.If;
import org.pragmatica.kakapo.tree.Leaf;
import org.pragmatica.kakapo.tree.Node;
import org.pragmatica.kakapo.tree.Operation;
import org.pragmatica.kakapo.tree.PostfixOperation;
import org.pragmatica.kakapo.tree.PrefixOperation;
import org.pragmatica.kakapo.tree.Properties;
import org.pragmatica.kakapo.tree.Spmd;
import org.pragmatica.kakapo.tree.Statement;
import org.pragmatica.kakapo.tree.Switch;
import org.pragmatica.kakapo.tree.Text;
import org.pragmatica.kakapo.tree.TryCatch;
import org.pragmatica.kakapo.tree.WhileLoop;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatlabGrammarTest {
    private static final Parser PARSER = PegEngine.create(MatlabGrammar.create());

    private static Node parse(String input, String rule) throws ParseException {
        return PARSER.parse(input, rule);
    }

    static Stream<String> keywords() {
        return MatlabGrammar.KEYWORDS.stream();
    }

    private static Node firstConstruct(String input) throws ParseException {
        return ((File) PARSER.parse(input)).code()
                                           .constructs()
                                           .get(0);
    }

    // === Tokens ===

    @Test
    void identifier_isLimitedTo63Characters() throws ParseException {
        var longest = "a".repeat(MatlabGrammar.MAX_IDENTIFIER_LENGTH);

        assertThat(((Call) parse(longest, "Call")).identifier().text()).isEqualTo(longest);
        assertThatThrownBy(() -> parse(longest + "a", "Call")).isInstanceOf(ParseException.class);
    }

    @Test
    void keyword_requiresWordBoundary() throws ParseException {
        assertThat(parse("ending", "Call").text()).isEqualTo("ending");
        assertThat(((Statement) parse("iff = 1", "Statement")).outputs()).isPresent();
        assertThatThrownBy(() -> parse("end", "Call")).isInstanceOf(ParseException.class);
    }

    @ParameterizedTest
    @MethodSource("keywords")
    void keyword_isNeverAnIdentifier(String keyword) {
        assertThatThrownBy(() -> parse(keyword, "Call")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> parse(keyword + " = 1", "Statement")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> PARSER.parse(keyword + " = 1\n")).isInstanceOf(ParseException.class);
    }

    @Test
    void identifier_mayContainNamespaceDots() throws ParseException {
        var call = (Call) parse("pkg.sub.fn(1)", "Call");

        assertThat(call.identifier().text()).isEqualTo("pkg.sub.fn");
        assertThat(call.argumentsList()).isPresent();
    }

    @Test
    void number_forms() throws ParseException {
        assertThat(parse("1.5", "Number").text()).isEqualTo("1.5");
        assertThat(parse(".5", "Number").text()).isEqualTo(".5");
        assertThat(parse("1.", "Number").text()).isEqualTo("1.");
        assertThat(parse("1e-3", "Number").text()).isEqualTo("1e-3");
        assertThat(parse("2i", "Number").text()).isEqualTo("2i");
    }

    @Test
    void elementwiseOperator_afterIntegerIsNotADecimalPoint() throws ParseException {
        var operation = (Operation) parse("1./x", "Expression");

        assertThat(operation.operands().elements()).extracting(Node::text).containsExactly("1", "x");
        assertThat(operation.operands().delimiters()).extracting(Text::text).containsExactly("./");
    }

    @Test
    void string_withEscapedQuotes() throws ParseException {
        assertThat(parse("'it''s'", "StringLiteral")).isEqualTo(new Leaf("'it''s'"));
        assertThat(parse("\"say \"\"hi\"\"\"", "StringLiteral").text()).isEqualTo("\"say \"\"hi\"\"\"");
    }

    @Test
    void comment_keepsMarkerAndBody() throws ParseException {
        var comment = (Comment) parse("% hello", "Comment");

        assertThat(comment.body().text()).isEqualTo(" hello");
        assertThat(comment.text()).isEqualTo("% hello");
    }

    @Test
    void blockComment_spansLinesVerbatim() throws ParseException {
        var file = (File) PARSER.parse("%{\nx=1\n  if\n%}\ny = 2");
        var comment = (Comment) file.code().constructs().get(0);

        assertThat(file.code().constructs()).hasSize(2);
        assertThat(comment.isBlock()).isTrue();
        assertThat(comment.text()).isEqualTo("%{\nx=1\n  if\n%}");
    }

    @Test
    void blockComment_withoutClosingLine_isLineComment() throws ParseException {
        var file = (File) PARSER.parse("%{\nunclosed");
        var comment = (Comment) file.code().constructs().get(0);

        assertThat(comment.isBlock()).isFalse();
        assertThat(comment.text()).isEqualTo("%{");
        assertThat(file.code().constructs()).hasSize(2);
    }

    // === Expressions ===

    @Test
    void operatorChain_isFlat() throws ParseException {
        var operation = (Operation) parse("a + b * c - 1", "Expression");

        assertThat(operation.operands().size()).isEqualTo(4);
        assertThat(operation.operands().delimiters()).extracting(Text::text).containsExactly(" + ", " * ", " - ");
    }

    @Test
    void arrayElements_unaryMinusAfterBlankStartsNewElement() throws ParseException {
        assertThat(((Array) parse("[1 -2]", "Array")).elementsList().size()).isEqualTo(2);
        assertThat(((Array) parse("[1 - 2]", "Array")).elementsList().size()).isEqualTo(1);
        assertThat(((Array) parse("[1-2]", "Array")).elementsList().size()).isEqualTo(1);
    }

    @Test
    void array_keepsRowBreaks() throws ParseException {
        var array = (Array) parse("[1 2\n3 4]", "Array");

        assertThat(array.elementsList().delimiters()).extracting(Text::text).containsExactly(" ", "\n", " ");
        assertThat(array.isCell()).isFalse();
        assertThat(((Array) parse("{1, 'a'}", "Array")).isCell()).isTrue();
    }

    @Test
    void call_chainsArgumentListsAndFields() throws ParseException {
        var call = (Call) parse("s(1).name{2}", "Call");

        assertThat(call.identifier().text()).isEqualTo("s");
        assertThat(call.selectors()).extracting(Node::text).containsExactly("(1)", ".name", "{2}");
    }

    @Test
    void indexing_acceptsEndAndColon() throws ParseException {
        var call = (Call) parse("a(end, :)", "Call");

        assertThat(call.argumentsList().orElseThrow().elementsList().elements())
            .extracting(Node::text)
            .containsExactly("end", ":");
    }

    @Test
    void unaryAndTransposeOperators() throws ParseException {
        var negated = (PrefixOperation) parse("~flag", "Expression");
        var transposed = (PostfixOperation) parse("m.'", "Expression");

        assertThat(negated.operator().text()).isEqualTo("~");
        assertThat(transposed.operand().text()).isEqualTo("m");
        assertThat(transposed.operator().text()).isEqualTo(".'");
    }

    @Test
    void anonymousFunction_withParameters() throws ParseException {
        var function = (AnonymousFunction) parse("@(x, y) x + y", "Expression");

        assertThat(function.parameters().orElseThrow().elementsList().size()).isEqualTo(2);
        assertThat(function.body()).isInstanceOf(Operation.class);
    }

    // === Statements ===

    @Test
    void statement_withOutputList() throws ParseException {
        var statement = (Statement) parse("[a, ~] = size(m);", "Statement");

        var outputs = statement.outputs().orElseThrow();
        assertThat(outputs.elementsList().elements()).extracting(Node::text).containsExactly("a", "~");
        assertThat(statement.body()).isInstanceOf(Call.class);
        assertThat(statement.separator().text()).isEqualTo(";");
        assertThat(outputs.parenthesized().isBare()).isFalse();
        assertThat(((Statement) parse("x = 1", "Statement")).outputs()
                                                           .orElseThrow()
                                                           .parenthesized()
                                                           .isBare()).isTrue();
    }

    @Test
    void emptyStatements_stayInTheGaps() throws ParseException {
        var file = (File) PARSER.parse("x = 1;;\n;\ny = 2\n");
        var block = (If) firstConstruct("if a\n  x = 1;;\nend");

        assertThat(file.code().constructs()).hasSize(2);
        assertThat(file.code().separators()).extracting(Text::text).containsExactly(";\n;\n");
        assertThat(((File) PARSER.parse("x = 1;;")).trailing().text()).isEqualTo(";");
        assertThat(block.body().constructs()).hasSize(1);
        assertThat(block.terminator().orElseThrow().before().text()).isEqualTo(";\n");
    }

    @Test
    void comparison_isNotAnAssignment() throws ParseException {
        var statement = (Statement) parse("x == 1", "Statement");

        assertThat(statement.outputs()).isEmpty();
        assertThat(statement.body()).isInstanceOf(Operation.class);
    }

    @Test
    void controlKeyword_formsStatement() throws ParseException {
        var statement = (Statement) parse("return ;", "Statement");

        assertThat(statement.isControl()).isTrue();
        assertThat(statement.beforeSeparator().text()).isEqualTo(" ");
    }

    @Test
    void commandSyntax() throws ParseException {
        var command = (Command) firstConstruct("import pkg.sub.*");

        assertThat(command.words()).extracting(Leaf::text).containsExactly("import", "pkg.sub.*");
        assertThat(((Command) firstConstruct("hold on")).gaps()).extracting(Text::text).containsExactly(" ");
    }

    // === Blocks ===

    @Test
    void if_withElseIfsAndElse() throws ParseException {
        var block = (If) firstConstruct("if a\n  x = 1;\nelseif b\n  x = 2;\nelseif c\n  x = 3;\nelse\n  x = 4;\nend");

        assertThat(block.condition().text()).isEqualTo("a");
        assertThat(block.elseIfs()).hasSize(2);
        assertThat(block.elseClause()).isPresent();
        assertThat(block.body().constructs()).hasSize(1);
    }

    @Test
    void switch_withCasesAndOtherwise() throws ParseException {
        var block = (Switch) firstConstruct("switch v\n  case 1\n    y = 1;\n  case {2, 3}\n    y = 2;\n  otherwise\n    y = 0;\nend");

        assertThat(block.subject().text()).isEqualTo("v");
        assertThat(block.cases()).hasSize(3);
        assertThat(block.cases().get(1).value().orElseThrow().text()).isEqualTo("{2, 3}");
        assertThat(block.cases().get(2).isOtherwise()).isTrue();
    }

    @Test
    void try_withAndWithoutCatch() throws ParseException {
        var withCatch = (TryCatch) firstConstruct("try\n  risky();\ncatch err\n  disp(err);\nend");
        var withoutCatch = (TryCatch) firstConstruct("try\n  x = 1;\nend");

        assertThat(withCatch.catchClause().orElseThrow().variable()).map(Leaf::text).contains("err");
        assertThat(withoutCatch.catchClause()).isEmpty();
    }

    @Test
    void loops() throws ParseException {
        var parallel = (ForLoop) firstConstruct("parfor i = 1:n\n  r(i) = i;\nend");
        var loop = (WhileLoop) firstConstruct("while k < 10\n  k = k + 1;\nend");

        assertThat(parallel.isParallel()).isTrue();
        assertThat(parallel.iteration().outputs()).isPresent();
        assertThat(loop.condition().text()).isEqualTo("k < 10");
    }

    @Test
    void spmd_withAndWithoutWorkers() throws ParseException {
        var plain = (Spmd) firstConstruct("spmd\n  x = 1\nend");
        var limited = (Spmd) firstConstruct("spmd (4)\n  y = labindex;\nend");

        assertThat(plain.workers()).isEmpty();
        assertThat(plain.body().constructs()).hasSize(1);
        assertThat(limited.afterKeyword().text()).isEqualTo(" ");
        assertThat(limited.workers().orElseThrow().text()).isEqualTo("(4)");
    }

    @Test
    void argumentsBlock_declarations() throws ParseException {
        var function = (Function) firstConstruct("function f(x, opts)\n  arguments\n"
                                                 + "    x (1,1) double {mustBePositive} = 1\n"
                                                 + "    opts.Name string\n  end\nend");
        var arguments = (ArgumentsBlock) function.body().constructs().get(0);
        var declarations = arguments.declarations();

        assertThat(declarations).hasSize(2);
        assertThat(declarations.get(0).name().text()).isEqualTo("x");
        assertThat(declarations.get(0).parts()).extracting(Node::text)
                                               .containsExactly("x", "(1,1)", "double", "{mustBePositive}", "1");
        assertThat(declarations.get(1).name().text()).isEqualTo("opts.Name");
        assertThat(arguments.attributes()).isEmpty();
    }

    @Test
    void classdef_withAttributedProperties() throws ParseException {
        var classdef = (Classdef) firstConstruct("classdef A < handle\n  properties (Access = private)\n    x\n  end\nend");
        var properties = (Properties) classdef.body().constructs().get(0);

        assertThat(classdef.declaration().text()).isEqualTo("A < handle");
        assertThat(properties.attributes().orElseThrow().text()).isEqualTo("(Access = private)");
        assertThat(properties.body().constructs()).hasSize(1);
    }

    @Test
    void function_withoutEnd_hasMissingTerminator() throws ParseException {
        var function = (Function) firstConstruct("function f\n  x = 1;");

        assertThat(function.name()).isEqualTo("f");
        assertThat(function.end().isMissing()).isTrue();
    }

    @Test
    void function_withOutputsAndEnd() throws ParseException {
        var function = (Function) firstConstruct("function [a, b] = swap(b, a)\nend");

        assertThat(function.name()).isEqualTo("swap");
        assertThat(function.signature().outputs()).isPresent();
        assertThat(function.end().isMissing()).isFalse();
        assertThat(function.body().isEmpty()).isTrue();
    }

    @Test
    void functionsWithoutEnd_followEachOther() throws ParseException {
        var file = (File) PARSER.parse("function a\n  x = 1;\n\nfunction b\n  y = 2;\n");

        assertThat(file.code().constructs()).hasSize(2)
                                           .allMatch(Function.class::isInstance);
    }

    // === Errors ===

    @Test
    void parseError_pointsAtFailingLine() {
        assertThatThrownBy(() -> PARSER.parse("x = 1\ny = (2"))
            .isInstanceOfSatisfying(ParseException.class,
                                    e -> assertThat(e.location().line()).isEqualTo(2));
    }
}
