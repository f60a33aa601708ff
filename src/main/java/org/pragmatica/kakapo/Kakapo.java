package org.pragmatica.kakapo;

import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.error.StructuralAssumptionViolation;
import org.pragmatica.kakapo.format.Formatter;
import org.pragmatica.kakapo.grammar.MatlabGrammar;
import org.pragmatica.kakapo.parser.Parser;
import org.pragmatica.kakapo.parser.PegEngine;
import org.pragmatica.kakapo.tree.File;
import org.pragmatica.kakapo.tree.Node;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point: parse MATLAB source into a lossless tree, format it, write it back out.
 *
 * <pre>{@code
 * File file = Kakapo.parse("x=1");
 * Kakapo.format(file);
 * String text = Kakapo.serialize(file); // "x = 1\n"
 * }</pre>
 */
public final class Kakapo {
    private static final Parser PARSER = PegEngine.create(MatlabGrammar.create());

    private Kakapo() {
    }

    /**
     * Parse a whole source file. The result serializes back to exactly {@code text}.
     */
    public static File parse(String text) throws ParseException {
        var root = PARSER.parse(text);
        if (root instanceof File file) {
            return file;
        }
        throw StructuralAssumptionViolation.unexpected("root", root, File.class);
    }

    public static File parseFromPath(Path path) throws ParseException, IOException {
        return parse(Files.readString(path));
    }

    /**
     * Format the tree in place with the default configuration.
     */
    public static File format(File file) {
        return Formatter.create().format(file);
    }

    public static String serialize(Node node) {
        return node.text();
    }

    public static String formatText(String text) throws ParseException {
        return serialize(format(parse(text)));
    }
}
