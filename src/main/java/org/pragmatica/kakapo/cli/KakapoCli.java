package org.pragmatica.kakapo.cli;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pragmatica.kakapo.Kakapo;
import org.pragmatica.kakapo.error.ParseException;
import org.pragmatica.kakapo.format.Formatter;
import org.pragmatica.kakapo.format.FormatterConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "kakapo",
        mixinStandardHelpOptions = true,
        description = "Formats MATLAB source files in place.")
public final class KakapoCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(KakapoCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_MISSING_PATH = 2;

    @CommandLine.Option(
            names = "--max-line-length",
            description = "Longest line before a call is wrapped (default: ${DEFAULT-VALUE}).")
    private int maxLineLength = FormatterConfig.DEFAULT.maxLineLength();

    @CommandLine.Option(names = "--indent", description = "Spaces per indentation level (default: ${DEFAULT-VALUE}).")
    private int indentWidth = FormatterConfig.DEFAULT.indentWidth();

    @CommandLine.Option(names = "--check", description = "Report files that would change without writing them.")
    private boolean check;

    @CommandLine.Parameters(index = "0", paramLabel = "<path>", description = "A .m file or a directory to walk.")
    private Path path;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KakapoCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        var out = spec.commandLine().getOut();
        if (!Files.exists(path)) {
            out.println(path + " does not exist");
            return EXIT_MISSING_PATH;
        }

        var formatter = Formatter.create(FormatterConfig.DEFAULT
                                             .withMaxLineLength(maxLineLength)
                                             .withIndentWidth(indentWidth));
        var files = SourceFiles.under(path);
        logger.info("Formatting {} file(s) under {}", files.size(), path);

        boolean allSucceeded = true;
        for (var file : files) {
            allSucceeded &= process(file, formatter, out);
        }
        if (allSucceeded) {
            out.println("Ching!");
        }
        out.flush();
        return allSucceeded ? EXIT_OK : EXIT_FAILED;
    }

    private boolean process(Path file, Formatter formatter, PrintWriter out) {
        try {
            var original = Files.readString(file, StandardCharsets.UTF_8);
            var formatted = formatter.format(Kakapo.parse(original)).text();

            if (formatted.equals(original)) {
                out.println(file + " unchanged");
                return true;
            }
            if (check) {
                out.println(file + " would be reformatted");
                return false;
            }
            Files.writeString(file, formatted, StandardCharsets.UTF_8);
            out.println(file + " ok");
            return true;
        } catch (ParseException e) {
            logger.debug("Parse failure in {}", file, e);
            out.println(file + " " + e.getMessage());
            return false;
        } catch (IOException e) {
            logger.warn("Cannot process {}", file, e);
            out.println(file + " " + e.getMessage());
            return false;
        }
    }
}
