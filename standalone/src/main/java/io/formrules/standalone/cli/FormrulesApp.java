package io.formrules.standalone.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.formrules.core.engine.ErrorReportBuilder;
import io.formrules.core.engine.FormReader;
import io.formrules.core.engine.RuleSetRegistry;
import io.formrules.core.engine.ValidationEngine;
import io.formrules.core.engine.Validator;
import io.formrules.core.error.FormReadException;
import io.formrules.core.model.ValidationResult;
import io.formrules.core.rule.RuleRegistry;
import io.formrules.core.spec.RuleSetParser;
import io.formrules.standalone.config.ConfigLoadException;
import io.formrules.standalone.config.StandaloneConfig;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line validation run: loads the configured rule sets, validates every given JSON
 * document and prints {@code <file>: OK} or {@code <file>: INVALID} followed by a problem-detail
 * report.
 *
 * <p>Exit codes: {@link #EXIT_VALID} when every document passes, {@link #EXIT_INVALID} when at
 * least one fails validation or is not a JSON object, {@link #EXIT_FAILURE} when a document
 * cannot be read. Configuration errors are thrown from {@link #start}.
 */
public final class FormrulesApp {

    public static final int EXIT_VALID = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID = 2;

    private static final Logger LOG = LoggerFactory.getLogger(FormrulesApp.class);

    private final ValidationEngine engine;
    private final SummaryListener summary;
    private final String ruleSetId;
    private final ObjectWriter reportWriter;
    private final ErrorReportBuilder reportBuilder = new ErrorReportBuilder();

    private FormrulesApp(ValidationEngine engine, SummaryListener summary, String ruleSetId, boolean pretty) {
        this.engine = engine;
        this.summary = summary;
        this.ruleSetId = ruleSetId;
        ObjectMapper mapper = new ObjectMapper();
        this.reportWriter = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    /**
     * Loads every configured rule set and selects the one to validate against.
     *
     * @param config           loaded configuration
     * @param requestedRuleSet rule set id given on the command line, or {@code null}
     * @throws ConfigLoadException if no rule set is configured or the rule set to use is ambiguous
     * @throws io.formrules.core.error.RuleSetException if a rule set file is invalid
     */
    public static FormrulesApp start(StandaloneConfig config, String requestedRuleSet) {
        List<Path> files = ruleSetFiles(config.ruleSets());
        if (files.isEmpty()) {
            throw new ConfigLoadException(
                    "No rule set configured. Set 'rule-sets' in the config file or FORMRULES_RULE_SETS.");
        }

        SummaryListener summary = new SummaryListener();
        ValidationEngine engine = new ValidationEngine(
                new RuleSetParser(RuleRegistry.withDefaults()), new Validator(), new FormReader(), summary);
        engine.reload(files);

        String ruleSetId = selectRuleSet(engine.registry(), requestedRuleSet);
        LOG.info("Rule sets loaded: {}, validating against '{}'", engine.registry().ids(), ruleSetId);
        return new FormrulesApp(engine, summary, ruleSetId, config.outputPretty());
    }

    /** Id of the rule set documents are validated against. */
    public String ruleSetId() {
        return ruleSetId;
    }

    /**
     * Validates the given documents in order.
     *
     * @param documents JSON files
     * @param out       receives one line per valid document, a line and a report per invalid one
     * @return the exit code
     */
    public int run(List<Path> documents, PrintStream out) {
        boolean anyInvalid = false;
        boolean anyFailure = false;

        for (Path document : documents) {
            String json;
            try {
                json = Files.readString(document);
            } catch (IOException e) {
                LOG.error("Cannot read {}: {}", document, e.toString());
                anyFailure = true;
                continue;
            }

            JsonNode report;
            try {
                ValidationResult result = engine.validateJson(ruleSetId, json);
                if (result.isValid()) {
                    out.println(document + ": OK");
                    continue;
                }
                report = reportBuilder.buildReport(result, document.toString());
            } catch (FormReadException e) {
                report = reportBuilder.buildReport(e, document.toString());
            }
            anyInvalid = true;
            out.println(document + ": INVALID");
            out.println(render(report));
        }

        summary.logSummary();
        if (anyFailure) {
            return EXIT_FAILURE;
        }
        return anyInvalid ? EXIT_INVALID : EXIT_VALID;
    }

    private String render(JsonNode report) {
        try {
            return reportWriter.writeValueAsString(report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render report", e);
        }
    }

    private static String selectRuleSet(RuleSetRegistry registry, String requested) {
        if (requested != null) {
            return registry.requireRuleSet(requested).id();
        }
        if (registry.size() != 1) {
            throw new ConfigLoadException(
                    "Several rule sets are loaded " + registry.ids() + ", choose one with --rule-set <id>");
        }
        return registry.ids().iterator().next();
    }

    /** Expands directories into their {@code .yaml}/{@code .yml} files, sorted by name. */
    static List<Path> ruleSetFiles(List<Path> configured) {
        List<Path> files = new ArrayList<>();
        for (Path path : configured) {
            if (!Files.isDirectory(path)) {
                files.add(path);
                continue;
            }
            try (Stream<Path> entries = Files.list(path)) {
                files.addAll(entries.filter(Files::isRegularFile)
                        .filter(FormrulesApp::isYaml)
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new ConfigLoadException("Cannot list rule set directory: " + path, e);
            }
        }
        return files;
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
