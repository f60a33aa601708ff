package org.pragmatica.kakapo.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class KakapoCliTest {

    private final StringWriter output = new StringWriter();

    private int run(String... args) {
        var commandLine = new CommandLine(new KakapoCli());
        commandLine.setOut(new PrintWriter(output, true));
        return commandLine.execute(args);
    }

    @Test
    void directory_formatsEveryMatlabFile(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a.m"), "x=1");
        Files.createDirectories(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub").resolve("b.m"), "y = 2\n");
        Files.writeString(dir.resolve("notes.txt"), "x=1");

        int exitCode = run(dir.toString());

        assertThat(exitCode).isEqualTo(KakapoCli.EXIT_OK);
        assertThat(Files.readString(dir.resolve("a.m"))).isEqualTo("x = 1\n");
        assertThat(Files.readString(dir.resolve("notes.txt"))).isEqualTo("x=1");
        assertThat(output.toString()).contains("a.m ok", "b.m unchanged", "Ching!");
    }

    @Test
    void failingFile_isReportedAndOthersStillFormatted(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("bad.m"), "x = (");
        Files.writeString(dir.resolve("good.m"), "y=2");

        int exitCode = run(dir.toString());

        assertThat(exitCode).isEqualTo(KakapoCli.EXIT_FAILED);
        assertThat(Files.readString(dir.resolve("bad.m"))).isEqualTo("x = (");
        assertThat(Files.readString(dir.resolve("good.m"))).isEqualTo("y = 2\n");
        assertThat(output.toString()).contains("bad.m Unexpected", "good.m ok")
                                     .doesNotContain("Ching!");
    }

    @Test
    void check_reportsWithoutWriting(@TempDir Path dir) throws IOException {
        var source = dir.resolve("a.m");
        Files.writeString(source, "x=1");

        int exitCode = run("--check", source.toString());

        assertThat(exitCode).isEqualTo(KakapoCli.EXIT_FAILED);
        assertThat(Files.readString(source)).isEqualTo("x=1");
        assertThat(output.toString()).contains("would be reformatted");
    }

    @Test
    void options_configureFormatter(@TempDir Path dir) throws IOException {
        var source = dir.resolve("a.m");
        Files.writeString(source, "if a\nb\nend");

        int exitCode = run("--indent", "2", source.toString());

        assertThat(exitCode).isEqualTo(KakapoCli.EXIT_OK);
        assertThat(Files.readString(source)).isEqualTo("if a\n  b\nend\n");
    }

    @Test
    void missingPath_exitsWithDedicatedCode(@TempDir Path dir) {
        int exitCode = run(dir.resolve("nowhere.m").toString());

        assertThat(exitCode).isEqualTo(KakapoCli.EXIT_MISSING_PATH);
        assertThat(output.toString()).contains("does not exist");
    }
}
