package io.formrules.standalone;

import io.formrules.standalone.cli.CommandLine;
import io.formrules.standalone.cli.FormrulesApp;
import io.formrules.standalone.cli.LogbackConfigurator;
import io.formrules.standalone.config.ConfigLoader;
import io.formrules.standalone.config.StandaloneConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the command-line validator.
 *
 * <p>Loads the configuration, configures logging, then delegates to {@link FormrulesApp}. On a
 * startup failure, logs the error and exits with status 1.
 */
public final class FormrulesMain {

    private static final Logger LOG = LoggerFactory.getLogger(FormrulesMain.class);

    private FormrulesMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, e.g. {@code --config formrules.yaml event.json}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            CommandLine commandLine = CommandLine.parse(args);
            StandaloneConfig config = ConfigLoader.load(commandLine.configPath());
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            LOG.info("Configuration loaded from {}", commandLine.configPath());

            FormrulesApp app = FormrulesApp.start(config, commandLine.ruleSetId());
            exitCode = app.run(commandLine.files(), System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            exitCode = FormrulesApp.EXIT_FAILURE;
        }
        System.exit(exitCode);
    }
}
