package com.example.alerthistory.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Micrometer instrumentation for suppression queries and silence administration.
 * Fail-open recoveries are counted separately so degraded suppression coverage is visible.
 */
@Component
@RequiredArgsConstructor
public class SuppressionMetrics {

    private final MeterRegistry meterRegistry;

    public void recordSilenceCheck(String result) {
        Counter.builder("alerthistory.silence.checks")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public void recordInhibitionCheck(String result) {
        Counter.builder("alerthistory.inhibition.checks")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    public void recordFailOpen(String query, String reason) {
        Counter.builder("alerthistory.suppression.failopen")
                .tag("query", query)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordSilenceAdmin(String operation) {
        Counter.builder("alerthistory.silences.admin")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public void recordInhibitionStateError(String operation) {
        Counter.builder("alerthistory.inhibition.state.errors")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    public <T> T time(String query, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return call.get();
        } finally {
            sample.stop(Timer.builder("alerthistory.suppression.duration")
                    .tag("query", query)
                    .register(meterRegistry));
        }
    }

    public <T> void gauge(String name, T stateObject, ToDoubleFunction<T> value) {
        meterRegistry.gauge(name, stateObject, value);
    }
}
