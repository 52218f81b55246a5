package io.fnanalyzer.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CliArguments")
class CliArgumentsTest {

    @Test
    @DisplayName("Expression only → text format, no point, no config")
    void expressionOnly() {
        CliArguments args = CliArguments.parse(new String[] {"x^2 - 4"});

        assertThat(args.expression()).isEqualTo("x^2 - 4");
        assertThat(args.format()).isEqualTo("text");
        assertThat(args.point()).isNull();
        assertThat(args.configPath()).isNull();
    }

    @Test
    @DisplayName("Unquoted words are joined into one expression")
    void joinsWords() {
        CliArguments args = CliArguments.parse(new String[] {"x", "+", "1"});

        assertThat(args.expression()).isEqualTo("x + 1");
    }

    @Test
    @DisplayName("All options")
    void allOptions() {
        CliArguments args = CliArguments.parse(
                new String[] {"--config", "fn.yaml", "--point", "3/2", "--format", "JSON", "(x+1)/(x-2)"});

        assertThat(args.configPath()).isEqualTo(Path.of("fn.yaml"));
        assertThat(args.point()).isEqualTo("3/2");
        assertThat(args.format()).isEqualTo("json");
        assertThat(args.expression()).isEqualTo("(x+1)/(x-2)");
    }

    @Test
    @DisplayName("Missing expression → IllegalArgumentException")
    void missingExpression() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--point", "1"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing EXPRESSION");
    }

    @Test
    @DisplayName("Option without value → IllegalArgumentException")
    void missingValue() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"x", "--point"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--point requires a value");
    }

    @Test
    @DisplayName("Unknown option and bad format are rejected")
    void rejectsUnknown() {
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--verbose", "x"}))
                .hasMessage("Unknown option: --verbose");
        assertThatThrownBy(() -> CliArguments.parse(new String[] {"--format", "xml", "x"}))
                .hasMessage("--format must be 'text' or 'json', got: xml");
    }
}
