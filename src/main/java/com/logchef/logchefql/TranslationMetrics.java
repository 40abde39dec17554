package com.logchef.logchefql;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for LogchefQL translation and query assembly
 */
@Component
public class TranslationMetrics {

    static final String TRANSLATIONS = "logchef.query.translations";
    static final String TRANSLATIONS_FAILED = "logchef.query.translations.failed";
    static final String ASSEMBLY_REJECTED = "logchef.query.assembly.rejected";
    static final String TRANSLATION_LATENCY = "logchef.query.translation.latency";

    @Autowired
    MeterRegistry meterRegistry;

    private Counter translations;
    private Timer translationLatency;

    @PostConstruct
    public void init() {
        translations = Counter.builder(TRANSLATIONS)
            .description("Total number of LogchefQL translations")
            .register(meterRegistry);

        translationLatency = Timer.builder(TRANSLATION_LATENCY)
            .description("Latency of LogchefQL translation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofNanos(1000))
            .maximumExpectedValue(Duration.ofMillis(100))
            .register(meterRegistry);
    }

    public void recordTranslation() {
        translations.increment();
    }

    /**
     * Count a translation that ended in an error, tagged by error code
     */
    public void recordFailure(ErrorCode code) {
        Counter.builder(TRANSLATIONS_FAILED)
            .description("Total number of LogchefQL translations that failed")
            .tag("code", code.name())
            .register(meterRegistry)
            .increment();
    }

    /**
     * Count a full query rejected by parameter validation, tagged by error code
     */
    public void recordAssemblyRejected(ErrorCode code) {
        Counter.builder(ASSEMBLY_REJECTED)
            .description("Total number of full queries rejected by parameter validation")
            .tag("code", code.name())
            .register(meterRegistry)
            .increment();
    }

    public Timer.Sample startTranslationTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTranslationLatency(Timer.Sample sample) {
        sample.stop(translationLatency);
    }

    // Getter methods for testing
    public Counter getTranslations() {
        return translations;
    }

    public Timer getTranslationLatency() {
        return translationLatency;
    }
}
