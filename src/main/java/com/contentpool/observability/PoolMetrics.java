package com.contentpool.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class PoolMetrics {

    private final MeterRegistry registry;

    public PoolMetrics() {
        this(new SimpleMeterRegistry());
    }

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter documentsAccepted() {
        return Counter.builder("contentpool.documents.accepted").register(registry);
    }

    public Counter documentsRejected() {
        return Counter.builder("contentpool.documents.rejected").register(registry);
    }

    /** @param mode one of {@code vector}, {@code keyword}, {@code hybrid} */
    public Timer searchLatency(String mode) {
        return Timer.builder("contentpool.search.latency").tag("mode", mode).register(registry);
    }
}
