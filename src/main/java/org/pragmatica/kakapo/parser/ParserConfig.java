package org.pragmatica.kakapo.parser;

/**
 * Parser configuration options.
 */
public record ParserConfig(boolean packratEnabled) {
    public static final ParserConfig DEFAULT = new ParserConfig(true);

    public ParserConfig withPackrat(boolean enabled) {
        return new ParserConfig(enabled);
    }
}
