package com.crowdorgan.gesture.metrics;

import com.crowdorgan.gesture.domain.GestureEvent;
import com.crowdorgan.gesture.service.GestureEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Gesture Service Metrics
 *
 * <p>Exposed through the Prometheus actuator endpoint:
 * <ul>
 *   <li>{@code gesture.events.emitted} - gestures emitted, tagged by scope and type</li>
 *   <li>{@code gesture.telemetry.received} - telemetry accepted into the inbox, by kind</li>
 *   <li>{@code gesture.telemetry.rejected} - telemetry dropped by the consumers, by kind and reason</li>
 *   <li>{@code gesture.tick.duration} - time spent in one orchestrator tick</li>
 * </ul>
 */
@Service
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class GestureMetricsService implements GestureEventListener {

    private final MeterRegistry meterRegistry;

    private Timer tickTimer;

    @PostConstruct
    public void initMetrics() {
        tickTimer = Timer.builder("gesture.tick.duration")
                .description("Time taken by one detection tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    @Override
    public void onGesture(GestureEvent event) {
        Counter.builder("gesture.events.emitted")
                .description("Gesture events emitted by the detectors")
                .tag("scope", event.getScope().name().toLowerCase())
                .tag("type", event.getTypeTag())
                .register(meterRegistry)
                .increment();
    }

    public void recordTelemetryReceived(String kind) {
        Counter.builder("gesture.telemetry.received")
                .description("Telemetry messages accepted for detection")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordTelemetryRejected(String kind, String reason) {
        Counter.builder("gesture.telemetry.rejected")
                .description("Telemetry messages dropped before detection")
                .tag("kind", kind)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();

        log.debug("Rejected {} telemetry: {}", kind, reason);
    }

    public Timer getTickTimer() {
        return tickTimer;
    }
}
