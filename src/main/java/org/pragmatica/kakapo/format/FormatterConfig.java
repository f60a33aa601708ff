package org.pragmatica.kakapo.format;

import com.google.common.base.Preconditions;

/**
 * Formatter configuration options.
 *
 * @param maxLineLength longest statement, indentation included, left on one line
 * @param indentWidth   spaces per nesting level
 */
public record FormatterConfig(int maxLineLength, int indentWidth) {
    public static final FormatterConfig DEFAULT = new FormatterConfig(120, 4);

    public FormatterConfig {
        Preconditions.checkArgument(maxLineLength > 0, "maxLineLength must be positive, got %s", maxLineLength);
        Preconditions.checkArgument(indentWidth >= 0, "indentWidth must not be negative, got %s", indentWidth);
    }

    public FormatterConfig withMaxLineLength(int maxLineLength) {
        return new FormatterConfig(maxLineLength, indentWidth);
    }

    public FormatterConfig withIndentWidth(int indentWidth) {
        return new FormatterConfig(maxLineLength, indentWidth);
    }

    public String indent(int level) {
        return " ".repeat(level * indentWidth);
    }
}
