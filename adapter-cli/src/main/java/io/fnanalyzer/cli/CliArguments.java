package io.fnanalyzer.cli;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Parsed command line: {@code [--config file.yaml] [--point VALUE] [--format text|json] EXPRESSION}.
 *
 * @param configPath optional YAML configuration file, null when absent
 * @param point      optional point to evaluate at, null when absent
 * @param format     report format, {@code text} or {@code json}
 * @param expression the expression to analyze
 */
public record CliArguments(Path configPath, String point, String format, String expression) {

    public static final String USAGE =
            "Usage: fn-analyzer [--config file.yaml] [--point VALUE] [--format text|json] EXPRESSION";

    public CliArguments {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }

    /**
     * Parses the arguments. Everything that is not an option is joined with spaces into the
     * expression, so {@code x + 1} works without quoting.
     *
     * @throws IllegalArgumentException on unknown options, missing option values or a missing
     *     expression
     */
    public static CliArguments parse(String[] args) {
        Path configPath = null;
        String point = null;
        String format = "text";
        StringBuilder expression = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config":
                    configPath = Path.of(value(args, ++i, arg));
                    break;
                case "--point":
                    point = value(args, ++i, arg);
                    break;
                case "--format":
                    format = value(args, ++i, arg).toLowerCase(Locale.ROOT);
                    if (!format.equals("text") && !format.equals("json")) {
                        throw new IllegalArgumentException("--format must be 'text' or 'json', got: " + format);
                    }
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (expression.length() > 0) {
                        expression.append(' ');
                    }
                    expression.append(arg);
            }
        }
        if (expression.toString().isBlank()) {
            throw new IllegalArgumentException("Missing EXPRESSION");
        }
        return new CliArguments(configPath, point, format, expression.toString());
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
