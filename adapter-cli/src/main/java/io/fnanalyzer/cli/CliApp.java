package io.fnanalyzer.cli;

import io.fnanalyzer.cli.config.CliConfig;
import io.fnanalyzer.cli.config.ConfigLoadException;
import io.fnanalyzer.cli.config.ConfigLoader;
import io.fnanalyzer.cli.report.ReportRenderer;
import io.fnanalyzer.core.engine.FunctionAnalyzer;
import io.fnanalyzer.core.engine.StrategyRegistry;
import io.fnanalyzer.core.error.ExpressionParseException;
import io.fnanalyzer.core.model.AnalysisResult;
import io.fnanalyzer.core.spi.AnalysisListener;
import java.io.PrintStream;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line application: parse arguments, load configuration, configure logging, analyze,
 * print the report.
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_USAGE} on usage or configuration
 * errors, {@value #EXIT_PARSE_ERROR} when the expression or point is rejected.
 */
public final class CliApp {

    private static final Logger LOG = LoggerFactory.getLogger(CliApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PARSE_ERROR = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final boolean configureLogging;

    /**
     * @param out              receives the report
     * @param err              receives error messages
     * @param envLookup        environment variable lookup, {@code null} result means unset
     * @param configureLogging whether to reconfigure Logback from the loaded settings
     */
    public CliApp(PrintStream out, PrintStream err, Function<String, String> envLookup, boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.configureLogging = configureLogging;
    }

    /** Runs one analysis and returns the process exit code. */
    public int run(String[] args) {
        CliArguments arguments;
        CliConfig config;
        try {
            arguments = CliArguments.parse(args);
            config = ConfigLoader.load(arguments.configPath(), envLookup);
        } catch (ConfigLoadException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliArguments.USAGE);
            return EXIT_USAGE;
        }
        if (configureLogging) {
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        }

        FunctionAnalyzer analyzer =
                new FunctionAnalyzer(config.analyzer(), StrategyRegistry.defaults(), new LoggingListener());
        try {
            AnalysisResult result = analyzer.analyze(arguments.expression(), arguments.point());
            ReportRenderer renderer = ReportRenderer.forFormat(arguments.format());
            out.print(renderer.render(result, config.analyzer().decimalPlaces()));
            out.flush();
            return EXIT_OK;
        } catch (ExpressionParseException e) {
            err.println("Error: " + e.getMessage());
            if (e.position() >= 0 && e.input() != null) {
                err.println("  " + e.input());
                err.println("  " + " ".repeat(Math.min(e.position(), e.input().length())) + "^");
            }
            return EXIT_PARSE_ERROR;
        }
    }

    /** Bridges analysis events to the log. */
    private static final class LoggingListener implements AnalysisListener {

        @Override
        public void onAnalysisStarted(AnalysisStartedEvent event) {
            LOG.debug("Analysis started: expression='{}', point='{}'", event.expressionText(), event.pointText());
        }

        @Override
        public void onAnalysisCompleted(AnalysisCompletedEvent event) {
            LOG.debug(
                    "Analysis completed: expression='{}', strategy={}, approximate={}, {}ms",
                    event.expressionText(),
                    event.rangeStrategy(),
                    event.approximate(),
                    event.durationMs());
        }

        @Override
        public void onAnalysisRejected(AnalysisRejectedEvent event) {
            LOG.debug("Analysis rejected: expression='{}', error={}", event.expressionText(), event.errorDetail());
        }
    }
}
