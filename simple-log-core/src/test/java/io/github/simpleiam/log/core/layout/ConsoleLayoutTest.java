package io.github.simpleiam.log.core.layout;

import io.github.simpleiam.log.api.Log;
import io.github.simpleiam.log.api.Logger;
import io.github.simpleiam.log.api.config.Options;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConsoleLayout")
class ConsoleLayoutTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should write tab-separated columns with JSON fields last")
    void shouldWriteTabSeparatedColumns() throws IOException {
        Path file = tempDir.resolve("app.log");
        Logger logger = newLogger(file, Options.builder().name("iam"));

        logger.withName("authz").warnw("policy denied", "user", "colin");
        logger.flush();

        String[] columns = Files.readAllLines(file, StandardCharsets.UTF_8).get(0).split("\t");
        assertThat(columns).hasSize(6);
        assertThat(columns[1]).isEqualTo("WARN");
        assertThat(columns[2]).isEqualTo("iam.authz");
        assertThat(columns[3]).startsWith("ConsoleLayoutTest.java:");
        assertThat(columns[4]).isEqualTo("policy denied");
        assertThat(columns[5]).isEqualTo("{\"user\":\"colin\"}");
    }

    @Test
    @DisplayName("should color level names when enabled")
    void shouldColorLevels() throws IOException {
        Path file = tempDir.resolve("color.log");
        Logger logger = newLogger(file, Options.builder().enableColor(true).disableCaller(true));

        logger.info("hello");
        logger.flush();

        String line = Files.readAllLines(file, StandardCharsets.UTF_8).get(0);
        assertThat(line).contains("\u001B[34mINFO\u001B[0m\thello");
        assertThat(line.split("\t")).hasSize(3);
    }

    @Test
    @DisplayName("should render repeated keys and reserved names as plain fields")
    void shouldRenderRepeatedKeys() throws IOException {
        Path file = tempDir.resolve("repeated.log");
        Logger logger = newLogger(file, Options.builder().disableCaller(true));

        logger.withValues("k", "a").withValues("k", "b").errorw("boom", "k", "c", "stacktrace", "user-value");
        logger.flush();

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        String[] columns = lines.get(0).split("\t");
        assertThat(columns[1]).isEqualTo("ERROR");
        assertThat(columns[2]).isEqualTo("boom");
        assertThat(columns[3]).isEqualTo("{\"k\":\"a\",\"k\":\"b\",\"k\":\"c\",\"stacktrace\":\"user-value\"}");
    }

    private Logger newLogger(Path file, Options.OptionsBuilder options) {
        return Log.newLogger(options
                .outputPaths(List.of(file.toString()))
                .samplingInitial(0)
                .build(), status -> { });
    }
}
