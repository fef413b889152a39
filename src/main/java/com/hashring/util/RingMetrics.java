package com.hashring.util;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * Metrics for a hash ring: operation counts, mutation latency and ring size.
 */
public class RingMetrics {

    public static final String RING_TAG = "ring";
    static final String MEMBERS_GAUGE = "hashring.members";
    static final String VIRTUAL_NODES_GAUGE = "hashring.virtual.nodes";

    private final MeterRegistry registry;

    // Counters
    private final Counter addOps;
    private final Counter deleteOps;
    private final Counter getOps;
    private final Counter lookupFailures;

    // Timers
    private final Timer addLatency;
    private final Timer deleteLatency;

    /**
     * Create ring metrics with a simple registry.
     */
    public RingMetrics() {
        this(new SimpleMeterRegistry());
    }

    /**
     * Create ring metrics with a custom registry.
     *
     * @param registry the Micrometer registry to use
     */
    public RingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.addOps = Counter.builder("hashring.ops")
            .tag("operation", "add")
            .description("Total node additions")
            .register(registry);

        this.deleteOps = Counter.builder("hashring.ops")
            .tag("operation", "delete")
            .description("Total node deletions")
            .register(registry);

        this.getOps = Counter.builder("hashring.ops")
            .tag("operation", "get")
            .description("Total key lookups")
            .register(registry);

        this.lookupFailures = Counter.builder("hashring.lookup.failures")
            .description("Lookups against a ring with no nodes")
            .register(registry);

        this.addLatency = Timer.builder("hashring.mutation.latency")
            .tag("operation", "add")
            .description("Node addition latency")
            .register(registry);

        this.deleteLatency = Timer.builder("hashring.mutation.latency")
            .tag("operation", "delete")
            .description("Node deletion latency")
            .register(registry);
    }

    /**
     * Register the size gauges for a ring, tagged with the ring's name.
     * Gauges hold a weak reference to the ring. Counters and timers are shared
     * by every ring bound to this instance.
     *
     * @param ringName      name tagged on the gauges, unique per registry
     * @param ring          the ring to observe
     * @param members       member count of the ring
     * @param virtualNodes  virtual node count of the ring
     * @param <T>           ring type
     * @throws IllegalStateException if the registry already has gauges for this ring name
     */
    public synchronized <T> void bindRing(String ringName, T ring,
                                          ToDoubleFunction<T> members, ToDoubleFunction<T> virtualNodes) {
        if (registry.find(MEMBERS_GAUGE).tag(RING_TAG, ringName).gauge() != null) {
            throw new IllegalStateException("Gauges already registered for ring: " + ringName);
        }

        Gauge.builder(MEMBERS_GAUGE, ring, members)
            .tag(RING_TAG, ringName)
            .description("Nodes currently on the ring")
            .register(registry);

        Gauge.builder(VIRTUAL_NODES_GAUGE, ring, virtualNodes)
            .tag(RING_TAG, ringName)
            .description("Occupied ring positions")
            .register(registry);
    }

    public void recordAdd(long durationNanos) {
        addOps.increment();
        addLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDelete(long durationNanos) {
        deleteOps.increment();
        deleteLatency.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGet() {
        getOps.increment();
    }

    public void recordLookupFailure() {
        lookupFailures.increment();
    }

    public long getTotalAddOps() {
        return (long) addOps.count();
    }

    public long getTotalDeleteOps() {
        return (long) deleteOps.count();
    }

    public long getTotalGetOps() {
        return (long) getOps.count();
    }

    public long getTotalLookupFailures() {
        return (long) lookupFailures.count();
    }

    public double getAddMeanLatencyMs() {
        return addLatency.mean(TimeUnit.MILLISECONDS);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
