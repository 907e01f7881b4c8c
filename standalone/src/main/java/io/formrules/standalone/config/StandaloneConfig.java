package io.formrules.standalone.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration of the command-line validator.
 *
 * <p>Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param ruleSets      rule-set YAML files or directories of rule-set files, in load order
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 * @param outputPretty  whether reports are printed indented
 */
public record StandaloneConfig(List<Path> ruleSets, String loggingFormat, String loggingLevel, boolean outputPretty) {

    public StandaloneConfig {
        ruleSets = List.copyOf(ruleSets);
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link StandaloneConfig}. */
    public static final class Builder {
        private final List<Path> ruleSets = new ArrayList<>();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private boolean outputPretty = true;

        Builder() {}

        public Builder addRuleSet(Path ruleSet) {
            this.ruleSets.add(Objects.requireNonNull(ruleSet, "ruleSet must not be null"));
            return this;
        }

        /** Replaces the configured rule sets. */
        public Builder ruleSets(List<Path> ruleSets) {
            this.ruleSets.clear();
            ruleSets.forEach(this::addRuleSet);
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder outputPretty(boolean outputPretty) {
            this.outputPretty = outputPretty;
            return this;
        }

        public StandaloneConfig build() {
            return new StandaloneConfig(ruleSets, loggingFormat, loggingLevel, outputPretty);
        }
    }
}
