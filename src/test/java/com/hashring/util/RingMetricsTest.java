package com.hashring.util;

import com.hashring.cluster.ConsistentHashRing;
import com.hashring.cluster.NoNodesAvailableException;
import com.hashring.cluster.RingConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RingMetricsTest {

    private SimpleMeterRegistry registry;
    private RingMetrics metrics;
    private ConsistentHashRing ring;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RingMetrics(registry);
        ring = new ConsistentHashRing(RingConfig.builder().replicas(10).build(), metrics);
    }

    @Test
    void mutations_incrementCounters() {
        ring.add("node1");
        ring.add("node2");
        ring.delete("node1");

        assertThat(metrics.getTotalAddOps()).isEqualTo(2);
        assertThat(metrics.getTotalDeleteOps()).isEqualTo(1);
        assertThat(metrics.getAddMeanLatencyMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void noOpMutations_areNotRecorded() {
        ring.add("node1");
        ring.add("node1");
        ring.delete("missing");

        assertThat(metrics.getTotalAddOps()).isEqualTo(1);
        assertThat(metrics.getTotalDeleteOps()).isZero();
    }

    @Test
    void lookups_countSuccessesAndFailures() {
        assertThatThrownBy(() -> ring.get("key"))
            .isInstanceOf(NoNodesAvailableException.class);

        ring.add("node1");
        ring.get("key");
        ring.getNodes("key", 2);

        assertThat(metrics.getTotalGetOps()).isEqualTo(2);
        assertThat(metrics.getTotalLookupFailures()).isEqualTo(1);
    }

    @Test
    void gauges_trackRingSize() {
        ring.add("node1");
        ring.add("node2");

        assertThat(registry.find("hashring.members").gauge().value()).isEqualTo(2.0);
        assertThat(registry.find("hashring.virtual.nodes").gauge().value()).isEqualTo(20.0);

        ring.clear();

        assertThat(registry.find("hashring.members").gauge().value()).isZero();
    }

    @Test
    void gauges_areTaggedPerRingOnSharedRegistry() {
        ConsistentHashRing other = new ConsistentHashRing(
            RingConfig.builder().name("sessions").replicas(10).build(), metrics);
        ring.add("node1");
        other.add("node2");
        other.add("node3");

        assertThat(registry.find("hashring.members").gauges()).hasSize(2);
        assertThat(registry.find("hashring.members").tag(RingMetrics.RING_TAG, RingConfig.DEFAULT_NAME)
            .gauge().value()).isEqualTo(1.0);
        assertThat(registry.find("hashring.members").tag(RingMetrics.RING_TAG, "sessions")
            .gauge().value()).isEqualTo(2.0);
        assertThat(registry.find("hashring.virtual.nodes").tag(RingMetrics.RING_TAG, "sessions")
            .gauge().value()).isEqualTo(20.0);
    }

    @Test
    void gauges_duplicateRingNameRejected() {
        RingConfig sameName = RingConfig.builder().replicas(10).build();

        assertThatThrownBy(() -> new ConsistentHashRing(sameName, new RingMetrics(registry)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(RingConfig.DEFAULT_NAME);
    }
}
