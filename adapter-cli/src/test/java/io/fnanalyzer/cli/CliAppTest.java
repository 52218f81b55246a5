package io.fnanalyzer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs the application in-process with captured output streams and an empty environment. */
@DisplayName("CliApp")
class CliAppTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(Map<String, String> env, String... args) {
        CliApp app = new CliApp(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8),
                env::get,
                false);
        return app.run(args);
    }

    private int run(String... args) {
        return run(Map.of(), args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Successful runs")
    class Success {

        @Test
        @DisplayName("Text report with summaries and steps")
        void textReport() {
            int exit = run("x^2 - 4");

            assertThat(exit).isEqualTo(CliApp.EXIT_OK);
            assertThat(stdout())
                    .contains("f(x) = x^2 - 4")
                    .contains("DOMAIN (summary):")
                    .contains("RANGE (summary):" + System.lineSeparator() + "[-4, ∞)")
                    .contains("x-intercepts: (-2, 0), (2, 0)")
                    .doesNotContain("EVALUATION STEP BY STEP");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("Point evaluation prints the formatted value")
        void pointEvaluation() {
            int exit = run("--point", "1.5", "(x+1)/(x-2)");

            assertThat(exit).isEqualTo(CliApp.EXIT_OK);
            assertThat(stdout())
                    .contains("EVALUATION STEP BY STEP")
                    .endsWith("f(3/2) = -5.0000" + System.lineSeparator());
        }

        @Test
        @DisplayName("Point outside the domain prints a warning and still succeeds")
        void outsideDomain() {
            int exit = run("--point", "0", "sqrt(x-1)");

            assertThat(exit).isEqualTo(CliApp.EXIT_OK);
            assertThat(stdout())
                    .contains("WARNING: x = 0 is outside the domain of the function.")
                    .contains("Details: x = 0 is outside the domain [1, ∞)")
                    .contains("f(0) = undefined");
        }

        @Test
        @DisplayName("JSON format")
        void json() {
            int exit = run("--format", "json", "x^2 - 4");

            assertThat(exit).isEqualTo(CliApp.EXIT_OK);
            assertThat(stdout()).contains("\"description\" : \"[-4, ∞)\"").contains("\"strategy\" : \"polynomial\"");
        }

        @Test
        @DisplayName("Config file and env vars reach the analyzer")
        void configApplied(@TempDir Path dir) throws Exception {
            Path config = dir.resolve("fn.yaml");
            Files.writeString(config, "analysis:\n  variable: t\n");

            int exit = run(Map.of("FN_DECIMAL_PLACES", "2"), "--config", config.toString(), "--point", "2", "1/t");

            assertThat(exit).isEqualTo(CliApp.EXIT_OK);
            assertThat(stdout()).contains("f(t) = 1/t").contains("f(2) = 0.50");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Parse error → exit 2 with a caret under the offending token")
        void parseError() {
            int exit = run("x + )");

            assertThat(exit).isEqualTo(CliApp.EXIT_PARSE_ERROR);
            assertThat(stderr().lines())
                    .containsExactly("Error: Unexpected ')' at position 4", "  x + )", "      ^");
            assertThat(stdout()).isEmpty();
        }

        @Test
        @DisplayName("Missing expression → exit 1 with usage")
        void usage() {
            int exit = run();

            assertThat(exit).isEqualTo(CliApp.EXIT_USAGE);
            assertThat(stderr()).contains("Missing EXPRESSION").contains(CliArguments.USAGE);
        }

        @Test
        @DisplayName("Missing config file → exit 1")
        void missingConfig(@TempDir Path dir) {
            int exit = run("--config", dir.resolve("absent.yaml").toString(), "x");

            assertThat(exit).isEqualTo(CliApp.EXIT_USAGE);
            assertThat(stderr()).startsWith("Configuration error: Configuration file not found");
        }
    }
}
