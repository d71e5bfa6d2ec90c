package com.missioncontrol.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for realtime fan-out and plan transitions.
 */
@Service
public class RealtimeMetrics {

    public static final String SOCKET = "socket";
    public static final String STREAM = "stream";

    private final MeterRegistry registry;

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one published envelope and how many connections it reached.
     *
     * @param transport {@link #SOCKET} or {@link #STREAM}
     */
    public void recordBroadcast(String transport, String type, int deliveries) {
        Counter.builder("missioncontrol.broadcast.messages")
                .tag("transport", transport)
                .tag("type", type)
                .register(registry)
                .increment();
        Counter.builder("missioncontrol.broadcast.deliveries")
                .tag("transport", transport)
                .register(registry)
                .increment(deliveries);
    }

    public void recordDeliveryFailure(String transport) {
        Counter.builder("missioncontrol.broadcast.failures")
                .description("Sends that failed and dropped the receiving connection")
                .tag("transport", transport)
                .register(registry)
                .increment();
    }

    /**
     * @param result created, approved, rejected or conflict
     */
    public void recordPlanTransition(String result) {
        Counter.builder("missioncontrol.plan.transitions")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void registerConnectionGauge(String transport, Supplier<Number> liveCount) {
        Gauge.builder("missioncontrol.connections.active", liveCount)
                .description("Live realtime connections")
                .tag("transport", transport)
                .register(registry);
    }
}
