package io.formrules.standalone.cli;

import io.formrules.core.spi.ValidationListener;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tallies engine events for the end-of-run summary. */
final class SummaryListener implements ValidationListener {

    private static final Logger LOG = LoggerFactory.getLogger(SummaryListener.class);

    private final AtomicInteger ruleSetsLoaded = new AtomicInteger();
    private final AtomicInteger validated = new AtomicInteger();
    private final AtomicInteger invalid = new AtomicInteger();
    private final AtomicLong totalDurationMs = new AtomicLong();

    @Override
    public void onRuleSetLoaded(RuleSetLoadedEvent event) {
        ruleSetsLoaded.incrementAndGet();
    }

    @Override
    public void onRuleSetRejected(RuleSetRejectedEvent event) {
        LOG.error("Rule set rejected: source={}, reason={}", event.source(), event.errorDetail());
    }

    @Override
    public void onValidationCompleted(ValidationCompletedEvent event) {
        validated.incrementAndGet();
        if (!event.valid()) {
            invalid.incrementAndGet();
        }
        totalDurationMs.addAndGet(event.durationMs());
    }

    int ruleSetsLoaded() {
        return ruleSetsLoaded.get();
    }

    int validated() {
        return validated.get();
    }

    int invalid() {
        return invalid.get();
    }

    void logSummary() {
        LOG.info(
                "Validated {} document(s): {} valid, {} invalid, {} ms",
                validated.get(),
                validated.get() - invalid.get(),
                invalid.get(),
                totalDurationMs.get());
    }
}
