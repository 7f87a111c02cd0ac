package org.carball.overbook.cli;

import org.carball.overbook.config.OutputFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OverbookOptimizerCLITest {

    private Path fixture() throws Exception {
        return Paths.get(getClass().getResource("/fixtures/schedule.yml").toURI());
    }

    @Test
    void shouldWriteJsonAndMarkdownReports(@TempDir Path tempDir) throws Exception {
        // Given
        Path output = tempDir.resolve("result.json");

        // When
        int exitCode = OverbookOptimizerCLI.run(new String[]{
                fixture().toString(), "--output", output.toString(), "--format", "both", "--strategy", "conservative"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(tempDir.resolve("result.md")).exists();
        assertThat(Files.readString(output)).contains("\"optimizedSchedule\"");
        assertThat(Files.readString(tempDir.resolve("result.md"))).contains("**Strategy:** conservative");
    }

    @Test
    void shouldTreatEmptyScheduleAsNothingToDo(@TempDir Path tempDir) throws Exception {
        Path schedule = tempDir.resolve("empty.yml");
        Files.writeString(schedule, "date: \"2025-03-10\"\nbookings: []\n");
        Path output = tempDir.resolve("out.json");

        int exitCode = OverbookOptimizerCLI.run(new String[]{schedule.toString(), "-o", output.toString()});

        assertThat(exitCode).isZero();
        assertThat(output).doesNotExist();
    }

    @Test
    void shouldFailOnUnknownOption() throws Exception {
        assertThat(OverbookOptimizerCLI.run(new String[]{fixture().toString(), "--bogus"})).isEqualTo(1);
    }

    @Test
    void shouldFailWithoutArguments() {
        assertThat(OverbookOptimizerCLI.run(new String[0])).isEqualTo(1);
        assertThat(OverbookOptimizerCLI.run(new String[]{"--help"})).isZero();
    }

    @Test
    void shouldParseOptionsAndSkipConfigOverrides(@TempDir Path tempDir) throws Exception {
        // When
        OverbookOptimizerCLI.CliOptions options = OverbookOptimizerCLI.parseArgs(new String[]{
                fixture().toString(), "-f", "markdown", "--config.max-overbook", "0.3",
                "--practice", "clinic-7", "--provider", "dr-lee", "-v",
                "-o", tempDir.resolve("r.md").toString()});

        // Then
        assertThat(options.format).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(options.practiceId).isEqualTo("clinic-7");
        assertThat(options.providerId).isEqualTo("dr-lee");
        assertThat(options.verbose).isTrue();
        assertThat(options.strategy).isNull();
    }

    @Test
    void shouldRejectInvalidFormatAndMissingFile() throws Exception {
        assertThatThrownBy(() -> OverbookOptimizerCLI.parseArgs(new String[]{fixture().toString(), "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
        assertThatThrownBy(() -> OverbookOptimizerCLI.parseArgs(new String[]{"/no/such/schedule.yml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Schedule file not found");
    }

    @Test
    void shouldStripOnlyFileExtension() {
        assertThat(OverbookOptimizerCLI.removeFileExtension("report.json")).isEqualTo("report");
        assertThat(OverbookOptimizerCLI.removeFileExtension("out/report")).isEqualTo("out/report");
        assertThat(OverbookOptimizerCLI.removeFileExtension("my.dir/report")).isEqualTo("my.dir/report");
        assertThat(OverbookOptimizerCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }
}
