package com.example.notifyrelay.service;

import com.example.notifyrelay.model.DeliveryResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RelayMetrics {

    static final String MESSAGES = "relay.messages";
    static final String DELIVERIES = "relay.deliveries";

    private final MeterRegistry meterRegistry;

    public void record(HandlingOutcome outcome) {
        meterRegistry.counter(MESSAGES,
                "outcome", tag(outcome),
                "disposition", outcome.getDisposition().name().toLowerCase(Locale.ROOT))
                .increment();
    }

    public void recordDelivery(DeliveryResult result, Duration elapsed) {
        meterRegistry.timer(DELIVERIES, "outcome", result.getOutcome().name().toLowerCase(Locale.ROOT))
                .record(elapsed);
    }

    /**
     * Messages handled so far, per outcome.
     */
    public Map<String, Long> outcomeCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (HandlingOutcome outcome : HandlingOutcome.values()) {
            Counter counter = meterRegistry.find(MESSAGES).tag("outcome", tag(outcome)).counter();
            counts.put(tag(outcome), counter != null ? (long) counter.count() : 0L);
        }
        return counts;
    }

    private static String tag(HandlingOutcome outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
