package org.pragmatica.kakapo.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WhitespaceTest {

    @Test
    void core_dropsBlanksAndContinuations() {
        assertThat(Whitespace.core(" ,  ")).isEqualTo(",");
        assertThat(Whitespace.core(", ...\n    ")).isEqualTo(",");
        assertThat(Whitespace.core(" ... anything, really\n ")).isEmpty();
        assertThat(Whitespace.core(" .* ")).isEqualTo(".*");
    }

    @Test
    void breaksLine_ignoresContinuations() {
        assertThat(Whitespace.breaksLine(" \n ")).isTrue();
        assertThat(Whitespace.breaksLine(" ...\n ")).isFalse();
        assertThat(Whitespace.breaksLine("...\n\n")).isTrue();
        assertThat(Whitespace.breaksLine("  ")).isFalse();
    }

    @Test
    void lineStart_keepsBlankLinesAndDropsIndent() {
        assertThat(Whitespace.lineStart("")).isEqualTo("\n");
        assertThat(Whitespace.lineStart("   ")).isEqualTo("\n");
        assertThat(Whitespace.lineStart("\n\t  ")).isEqualTo("\n");
        assertThat(Whitespace.lineStart("\n\n    ")).isEqualTo("\n\n");
    }

    @Test
    void newlines_counted() {
        assertThat(Whitespace.newlines("a\nb\n")).isEqualTo(2);
        assertThat(Whitespace.newlines(" ")).isZero();
    }
}
