package io.formrules.standalone.cli;

import io.formrules.standalone.config.ConfigLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed arguments of {@code formrules [--config file] [--rule-set id] <json-file>...}.
 *
 * @param configPath config file, {@value ConfigLoader#DEFAULT_CONFIG_FILE} when not given
 * @param ruleSetId  rule set to validate against, {@code null} to use the only loaded one
 * @param files      JSON documents to validate, never empty
 */
public record CommandLine(Path configPath, String ruleSetId, List<Path> files) {

    static final String USAGE = "Usage: formrules [--config <file>] [--rule-set <id>] <json-file>...";

    public CommandLine {
        files = List.copyOf(files);
    }

    /**
     * Parses command-line arguments.
     *
     * @throws IllegalArgumentException on an unknown option, a missing option value or when no
     *     file is given
     */
    public static CommandLine parse(String[] args) {
        Path configPath = Path.of(ConfigLoader.DEFAULT_CONFIG_FILE);
        String ruleSetId = null;
        List<Path> files = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = Path.of(requireValue(args, i++));
                case "--rule-set" -> ruleSetId = requireValue(args, i++);
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option '" + arg + "'. " + USAGE);
                    }
                    files.add(Path.of(arg));
                }
            }
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No JSON file to validate. " + USAGE);
        }
        return new CommandLine(configPath, ruleSetId, files);
    }

    private static String requireValue(String[] args, int optionIndex) {
        if (optionIndex + 1 >= args.length) {
            throw new IllegalArgumentException(args[optionIndex] + " requires a value. " + USAGE);
        }
        return args[optionIndex + 1];
    }
}
