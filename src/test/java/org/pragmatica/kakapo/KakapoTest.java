package org.pragmatica.kakapo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.tree.Function;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class KakapoTest {

    /**
     * Sources covering every construct the grammar knows, shared with the formatter tests.
     */
    public static Stream<String> samples() {
        return Stream.of(
            "x = 1;\n",
            "  a=b+c ; % comment\n\n",
            "function [a, b] = f(x, y)\n  a = x';\n  b = y.^2;\nend\n",
            "if a > 0\n    disp('pos')\nelseif a < 0\n    disp(\"neg\")\nelse\n    disp('zero')\nend\n",
            "for k = 1:10\n    s(k) = k * 2;\nend\n",
            "parfor k = 1:n, r(k) = k; end",
            "while true\n    break;\nend\n",
            "switch mode\n    case 'a'\n        x = 1;\n    case {'b', 'c'}\n        x = 2;\n    otherwise\n        x = 3;\nend\n",
            "try\n    risky();\ncatch e\n    rethrow(e);\nend\n",
            "m = [1, 2; 3 4\n 5 -6];\nc = {};\n",
            "f = @(x) x.^2 + 1;\n",
            "hold on\nimport pkg.sub.*\nglobal counter\n",
            "x = a(end, :);\ny = s(1).name{2};\n",
            "function r = g()\n  r = 1;\n\nfunction h\n  disp x\n",
            "x = 1 + ...\n    2;\n",
            "% leading comment\n\n%another\nz = ~flag & -y;\n",
            "x = 1;;\n;\ny = 2\n",
            "%{\n  block comment\n%}\nx = 1;\n",
            "spmd (2)\n    y = labindex;\nend\n",
            "function f(x)\n    arguments\n        x (1,1) double {mustBePositive} = 1\n    end\nend\n",
            "classdef Point < handle\n    properties (Access = public)\n        x = 0;\n    end\n"
            + "    methods\n        function obj = Point(x)\n            obj.x = x;\n        end\n    end\nend\n"
        );
    }

    @ParameterizedTest
    @MethodSource("samples")
    void parse_thenSerialize_reproducesInput(String input) throws ParseException {
        assertThat(Kakapo.serialize(Kakapo.parse(input))).isEqualTo(input);
    }

    @Test
    void parseFromPath_readsFile(@TempDir Path dir) throws IOException, ParseException {
        var source = dir.resolve("f.m");
        Files.writeString(source, "function f\nend\n");

        var file = Kakapo.parseFromPath(source);

        assertThat(file.code().constructs()).singleElement().isInstanceOf(Function.class);
        assertThat(file.text()).isEqualTo("function f\nend\n");
    }

    @Test
    void format_rewritesTreeInPlace() throws ParseException {
        var file = Kakapo.parse("x=1");

        var formatted = Kakapo.format(file);

        assertThat(formatted).isSameAs(file);
        assertThat(Kakapo.serialize(file)).isEqualTo("x = 1\n");
    }

    @Test
    void formatText_parsesFormatsAndSerializes() throws ParseException {
        assertThat(Kakapo.formatText("y=f( a,b );")).isEqualTo("y = f(a, b);\n");
    }

    @Test
    void emptyInput_isAnEmptyFile() throws ParseException {
        var file = Kakapo.parse("");

        assertThat(file.code().isEmpty()).isTrue();
        assertThat(Kakapo.formatText("")).isEqualTo("\n");
    }

    @Test
    void invalidInput_isRejected() {
        assertThatThrownBy(() -> Kakapo.parse("x = (1"))
            .isInstanceOf(ParseException.class)
            .hasMessageContaining("1:7");
    }
}
