package org.pragmatica.kakapo.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * MATLAB sources under a path: the path itself when it is a file, otherwise
 * every {@code *.m} file below it, in a stable order.
 */
final class SourceFiles {
    private static final String EXTENSION = ".m";

    private SourceFiles() {
    }

    static List<Path> under(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of(root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                       .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                       .sorted()
                       .collect(Collectors.toList());
        }
    }
}
