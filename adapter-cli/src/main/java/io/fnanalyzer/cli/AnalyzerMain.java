package io.fnanalyzer.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code fn-analyzer} command. Delegates to {@link CliApp} and exits with its
 * status code; unexpected failures are logged and exit with status 1.
 */
public final class AnalyzerMain {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerMain.class);

    private AnalyzerMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args e.g. {@code --point 1.5 "(x+1)/(x-2)"}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new CliApp(System.out, System.err, System::getenv, true).run(args);
        } catch (Exception e) {
            LOG.error("Analysis failed: {}", e.getMessage(), e);
            status = CliApp.EXIT_USAGE;
        }
        System.exit(status);
    }
}
