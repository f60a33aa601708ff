package org.pragmatica.kakapo.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatterConfigTest {

    @Test
    void defaults() {
        assertThat(FormatterConfig.DEFAULT.maxLineLength()).isEqualTo(120);
        assertThat(FormatterConfig.DEFAULT.indentWidth()).isEqualTo(4);
        assertThat(FormatterConfig.DEFAULT.indent(3)).hasSize(12).isBlank();
    }

    @Test
    void with_returnsModifiedCopy() {
        var config = FormatterConfig.DEFAULT.withIndentWidth(2).withMaxLineLength(80);

        assertThat(config).isEqualTo(new FormatterConfig(80, 2));
        assertThat(FormatterConfig.DEFAULT.indentWidth()).isEqualTo(4);
    }

    @Test
    void invalidValues_areRejected() {
        assertThatThrownBy(() -> FormatterConfig.DEFAULT.withMaxLineLength(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxLineLength");
        assertThatThrownBy(() -> FormatterConfig.DEFAULT.withIndentWidth(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
