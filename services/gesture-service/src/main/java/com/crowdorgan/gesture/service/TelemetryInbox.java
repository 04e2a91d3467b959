package com.crowdorgan.gesture.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Hand-off point between the Kafka listener threads and the tick thread. Consumers only ever
 * offer; the orchestrator alone drains, which keeps all detector state on one thread.
 */
@Component
public class TelemetryInbox {

    private final Queue<InboundTelemetry> pending = new ConcurrentLinkedQueue<>();

    public void offer(InboundTelemetry telemetry) {
        pending.offer(telemetry);
    }

    /** Removes and returns everything queued so far, oldest first. */
    public List<InboundTelemetry> drain() {
        List<InboundTelemetry> drained = new ArrayList<>();
        InboundTelemetry next;
        while ((next = pending.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int pendingCount() {
        return pending.size();
    }
}
