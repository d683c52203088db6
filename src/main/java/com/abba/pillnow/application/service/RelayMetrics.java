package com.abba.pillnow.application.service;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class RelayMetrics {

    private final AtomicLong fires = new AtomicLong();
    private final AtomicLong fireSuppressed = new AtomicLong();
    private final AtomicLong publishes = new AtomicLong();
    private final AtomicLong publishFailures = new AtomicLong();
    private final AtomicLong capturesDebounced = new AtomicLong();
    private final AtomicLong ingests = new AtomicLong();
    private final AtomicLong verifierUnreachable = new AtomicLong();
    private final AtomicLong mismatches = new AtomicLong();
    private final AtomicLong alertsSuppressed = new AtomicLong();

    public void fire() {
        fires.incrementAndGet();
    }

    public void fireSuppressed() {
        fireSuppressed.incrementAndGet();
    }

    public void published() {
        publishes.incrementAndGet();
    }

    public void publishFailed() {
        publishFailures.incrementAndGet();
    }

    public void captureDebounced() {
        capturesDebounced.incrementAndGet();
    }

    public void ingested() {
        ingests.incrementAndGet();
    }

    public void verifierUnreachable() {
        verifierUnreachable.incrementAndGet();
    }

    public void mismatch() {
        mismatches.incrementAndGet();
    }

    public void alertSuppressed() {
        alertsSuppressed.incrementAndGet();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("fires", fires.get());
        values.put("firesSuppressed", fireSuppressed.get());
        values.put("publishes", publishes.get());
        values.put("publishFailures", publishFailures.get());
        values.put("capturesDebounced", capturesDebounced.get());
        values.put("ingests", ingests.get());
        values.put("verifierUnreachable", verifierUnreachable.get());
        values.put("mismatches", mismatches.get());
        values.put("alertsSuppressed", alertsSuppressed.get());
        return values;
    }
}
