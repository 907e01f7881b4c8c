package io.formrules.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.formrules.core.error.PathSyntaxException;
import io.formrules.core.error.RuleParameterException;
import io.formrules.core.error.RuleSetParseException;
import io.formrules.core.error.UnknownRuleException;
import io.formrules.core.rule.RuleRegistry;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link RuleSet.Builder}: every declaration mistake must be reported while the rule set
 * is built, never while a form is validated.
 */
@DisplayName("RuleSet builder")
class RuleSetBuilderTest {

    private final RuleRegistry registry = RuleRegistry.withDefaults();

    private RuleSet.Builder builder() {
        return RuleSet.builder("event", registry).source("event.yaml");
    }

    @Test
    @DisplayName("builds fields in declaration order")
    void fieldOrder() {
        RuleSet ruleSet = builder()
                .description("Event form")
                .field("title", "required", "string")
                .field("start", "required", "date")
                .field("end", "date", "after:start")
                .build();

        assertThat(ruleSet.id()).isEqualTo("event");
        assertThat(ruleSet.description()).isEqualTo("Event form");
        assertThat(ruleSet.source()).isEqualTo("event.yaml");
        assertThat(ruleSet.fields()).extracting(FieldRules::field).containsExactly("title", "start", "end");
        assertThat(ruleSet.field("end")).hasValueSatisfying(field -> {
            assertThat(field.rules()).extracting(BoundRule::name).containsExactly("date", "after");
            assertThat(field.rules().get(1).parameters()).containsExactly("start");
            assertThat(field.isRequired()).isFalse();
            assertThat(field.declares("after")).isTrue();
        });
        assertThat(ruleSet.field("missing")).isEmpty();
    }

    @Nested
    @DisplayName("Parameter counts")
    class ParameterCounts {

        @Test
        @DisplayName("before without parameter is rejected")
        void beforeWithoutParameter() {
            assertThatThrownBy(() -> builder().field("d", "date", "before"))
                    .isInstanceOfSatisfying(RuleParameterException.class, e -> {
                        assertThat(e.ruleName()).isEqualTo("before");
                        assertThat(e.ruleSetId()).isEqualTo("event");
                        assertThat(e.source()).isEqualTo("event.yaml");
                    })
                    .hasMessageContaining("exactly 1")
                    .hasMessageContaining("got 0");
        }

        @Test
        @DisplayName("before with two parameters is rejected")
        void beforeWithTwoParameters() {
            assertThatThrownBy(() -> builder().field("d", "date", "before:2023-01-01,2023-02-01"))
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("got 2");
        }

        @Test
        @DisplayName("date_between with one parameter is rejected")
        void betweenWithOneParameter() {
            assertThatThrownBy(() -> builder().field("d", "date", "date_between:2023-01-01"))
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("exactly 2");
        }

        @Test
        @DisplayName("required with a parameter is rejected")
        void requiredWithParameter() {
            assertThatThrownBy(() -> builder().field("d", "required:yes"))
                    .isInstanceOf(RuleParameterException.class);
        }
    }

    @Nested
    @DisplayName("Declaration errors")
    class DeclarationErrors {

        @Test
        @DisplayName("unknown rule names the registered rules")
        void unknownRule() {
            assertThatThrownBy(() -> builder().field("d", "uuid"))
                    .isInstanceOfSatisfying(UnknownRuleException.class, e -> assertThat(e.ruleName())
                            .isEqualTo("uuid"))
                    .hasMessageContaining("date_between");
        }

        @Test
        @DisplayName("malformed path carries rule set id and source")
        void malformedPath() {
            assertThatThrownBy(() -> builder().field("a..b", "required"))
                    .isInstanceOfSatisfying(PathSyntaxException.class, e -> {
                        assertThat(e.path()).isEqualTo("a..b");
                        assertThat(e.ruleSetId()).isEqualTo("event");
                        assertThat(e.source()).isEqualTo("event.yaml");
                    });
        }

        @Test
        @DisplayName("invalid date layout is rejected")
        void invalidLayout() {
            assertThatThrownBy(() -> builder().field("d", List.of(RuleDeclaration.of("date", "uuuu-MM-dd{"))))
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("invalid parameters");
        }

        @Test
        @DisplayName("non-numeric size bound is rejected")
        void nonNumericBound() {
            assertThatThrownBy(() -> builder().field("title", "max:ten"))
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("'ten'");
        }

        @Test
        @DisplayName("field declared twice is rejected")
        void duplicateField() {
            RuleSet.Builder builder = builder().field("title", "required");

            assertThatThrownBy(() -> builder.field("title", "string"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("more than once");
        }

        @Test
        @DisplayName("empty rule name in textual declaration")
        void emptyRuleName() {
            assertThatThrownBy(() -> builder().field("title", ":x")).isInstanceOf(RuleSetParseException.class);
        }
    }

    @Nested
    @DisplayName("Field references")
    class References {

        @Test
        @DisplayName("comparison parameter naming an undeclared field is rejected")
        void undeclaredField() {
            RuleSet.Builder builder = builder().field("end", "date", "after:begin");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("'begin'")
                    .hasMessageContaining("neither a declared field nor a literal");
        }

        @Test
        @DisplayName("literal date parameters need no declaration")
        void literal() {
            RuleSet ruleSet = builder()
                    .field("d", "date", "date_between:2023-01-01,2023-12-31T23:59:59")
                    .build();

            assertThat(ruleSet.fields()).hasSize(1);
        }

        @Test
        @DisplayName("reference may be declared after the referring field")
        void forwardReference() {
            RuleSet ruleSet = builder()
                    .field("end", "date", "after:start")
                    .field("start", "date")
                    .build();

            assertThat(ruleSet.fields()).hasSize(2);
        }

        @Test
        @DisplayName("date comparison against a declared array path is rejected")
        void arrayReference() {
            RuleSet.Builder builder = builder().field("events[].start", "date");

            assertThatThrownBy(() -> builder.field("events[].end", "date", "after:events[].start"))
                    .isInstanceOfSatisfying(RuleParameterException.class, e -> assertThat(e.ruleName())
                            .isEqualTo("after"))
                    .hasMessageContaining("'events[].start'")
                    .hasMessageContaining("without arrays");
        }

        @Test
        @DisplayName("date_between rejects a bound that is neither a literal nor a plain field path")
        void betweenMalformedBound() {
            assertThatThrownBy(() -> builder()
                            .field("d", "date", "date_between:2023-01-01,a..b")
                            .build())
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("'a..b'");
        }

        @Test
        @DisplayName("same requires the other field to be declared")
        void sameUndeclared() {
            assertThatThrownBy(() -> builder().field("confirm", "same:password").build())
                    .isInstanceOf(RuleParameterException.class)
                    .hasMessageContaining("'password'");
        }
    }

    @Nested
    @DisplayName("Ordering warning")
    class OrderingWarning {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger logger;

        @BeforeEach
        void attachAppender() {
            logger = (Logger) LoggerFactory.getLogger(RuleSet.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            logger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            logger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        @DisplayName("comparison without preceding date is accepted with a WARN")
        void missingDate() {
            RuleSet ruleSet = builder().field("d", "before:2023-06-01").build();

            assertThat(ruleSet.fields()).hasSize(1);
            assertThat(logAppender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(event -> assertThat(event.getFormattedMessage())
                            .contains("before:2023-06-01")
                            .contains("'d'"));
        }

        @Test
        @DisplayName("comparison after date logs nothing")
        void withDate() {
            builder().field("d", "date", "before:2023-06-01").build();

            assertThat(logAppender.list).noneMatch(event -> event.getLevel() == Level.WARN);
        }
    }
}
