package com.crowdorgan.gesture.service;

import com.crowdorgan.gesture.config.GestureProperties;
import com.crowdorgan.gesture.detector.PerformerGestureDetector;
import com.crowdorgan.gesture.detector.RoomGestureDetector;
import com.crowdorgan.gesture.detector.SampleHistory;
import com.crowdorgan.gesture.detector.ZoneGestureDetector;
import com.crowdorgan.gesture.domain.GestureEvent;
import com.crowdorgan.gesture.domain.MotionSample;
import com.crowdorgan.gesture.metrics.GestureMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Gesture Orchestrator
 *
 * <p>Runs the detection tick: drains the telemetry inbox into the history and detectors, prunes
 * performers and cameras that went silent, evaluates performer and room gestures, then hands
 * every emitted event to the registered {@link GestureEventListener}s.
 *
 * <p>All detector state is touched from {@link #tick()} only. The scheduler runs it on a single
 * thread, so no locking is needed; Kafka listener threads interact through the inbox alone.
 * Events leave a tick ordered zone, performer, room.
 */
@Service
@Slf4j
public class GestureOrchestrator {

    private final TelemetryInbox inbox;
    private final SampleHistory sampleHistory;
    private final PerformerGestureDetector performerDetector;
    private final ZoneGestureDetector zoneDetector;
    private final RoomGestureDetector roomDetector;
    private final List<GestureEventListener> listeners;
    private final GestureMetricsService metricsService;
    private final GestureProperties properties;
    private final MonotonicClock clock;

    private final Map<Integer, TrackedPerformer> performers = new TreeMap<>();
    private final Map<Integer, Long> cameraLastSeen = new TreeMap<>();
    private double roomMotion;
    private long ticks;

    private volatile GestureStatusSnapshot status;

    public GestureOrchestrator(TelemetryInbox inbox,
                               SampleHistory sampleHistory,
                               PerformerGestureDetector performerDetector,
                               ZoneGestureDetector zoneDetector,
                               RoomGestureDetector roomDetector,
                               List<GestureEventListener> listeners,
                               GestureMetricsService metricsService,
                               GestureProperties properties,
                               MonotonicClock clock) {
        this.inbox = inbox;
        this.sampleHistory = sampleHistory;
        this.performerDetector = performerDetector;
        this.zoneDetector = zoneDetector;
        this.roomDetector = roomDetector;
        this.listeners = List.copyOf(listeners);
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
        this.status = GestureStatusSnapshot.empty(sampleHistory.getCapacity(),
                properties.getOrchestrator().isSendingEnabled());

        log.info("Gesture orchestrator ready: tick every {} ms, {} listeners, publishing {}",
                properties.getOrchestrator().getTickIntervalMs(), this.listeners.size(),
                properties.getOrchestrator().isSendingEnabled() ? "enabled" : "muted");
    }

    @Scheduled(fixedRateString = "${gesture.orchestrator.tick-interval-ms:16}")
    public void scheduledTick() {
        try {
            metricsService.getTickTimer().record(() -> {
                tick();
            });
        } catch (RuntimeException e) {
            log.error("Gesture tick failed", e);
        }
    }

    /**
     * Run one detection tick.
     *
     * @return the events emitted this tick, in the order listeners received them
     */
    public List<GestureEvent> tick() {
        long now = clock.millis();
        List<GestureEvent> events = new ArrayList<>();

        drainInbox(events);
        prunePerformers(now);
        pruneCameras(now);
        updatePerformerGestures(events);
        events.addAll(roomDetector.update(roomMotion, performers.size(), now));

        for (GestureEvent event : events) {
            dispatch(event);
        }

        ticks++;
        status = GestureStatusSnapshot.builder()
                .trackedPerformers(performers.size())
                .performers(List.copyOf(performers.values()))
                .trackedCameras(cameraLastSeen.size())
                .roomMotion(roomMotion)
                .historyCapacity(sampleHistory.getCapacity())
                .sendingEnabled(properties.getOrchestrator().isSendingEnabled())
                .ticks(ticks)
                .pendingTelemetry(inbox.pendingCount())
                .lastTickAt(now)
                .build();
        return events;
    }

    public GestureStatusSnapshot status() {
        return status;
    }

    private void drainInbox(List<GestureEvent> events) {
        for (InboundTelemetry telemetry : inbox.drain()) {
            if (telemetry instanceof InboundTelemetry.PerformerState state) {
                applyPerformerState(state);
            } else if (telemetry instanceof InboundTelemetry.PerformerDisconnect disconnect) {
                boolean known = performers.containsKey(disconnect.performerId());
                forgetPerformer(disconnect.performerId());
                if (known) {
                    log.info("performer {} removed", disconnect.performerId());
                }
            } else if (telemetry instanceof InboundTelemetry.CameraSnapshot snapshot) {
                if (cameraLastSeen.put(snapshot.cameraId(), snapshot.receivedAt()) == null) {
                    log.info("camera {} started reporting zones", snapshot.cameraId());
                }
                events.addAll(zoneDetector.updateCamera(snapshot.cameraId(), snapshot.zones(), snapshot.receivedAt()));
            } else if (telemetry instanceof InboundTelemetry.RoomMotion motion) {
                roomMotion = motion.motion();
            }
        }
    }

    private void applyPerformerState(InboundTelemetry.PerformerState state) {
        TrackedPerformer previous = performers.put(state.performerId(), TrackedPerformer.builder()
                .performerId(state.performerId())
                .position(state.position())
                .size(state.size())
                .motion(state.motion())
                .energy(state.energy())
                .lastUpdate(state.receivedAt())
                .build());
        if (previous == null) {
            log.debug("performer {} tracked", state.performerId());
        }
        sampleHistory.addSample(state.performerId(), state.position(), state.motion(), state.energy(),
                state.receivedAt());
    }

    private void prunePerformers(long now) {
        long staleMs = properties.getOrchestrator().getPerformerStaleMs();
        Iterator<Map.Entry<Integer, TrackedPerformer>> it = performers.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, TrackedPerformer> entry = it.next();
            long lastUpdate = entry.getValue().getLastUpdate();
            if (now > lastUpdate && now - lastUpdate > staleMs) {
                sampleHistory.removeEntity(entry.getKey());
                performerDetector.removePerformer(entry.getKey());
                it.remove();
                log.info("performer {} went stale after {} ms", entry.getKey(), now - lastUpdate);
            }
        }
    }

    private void pruneCameras(long now) {
        long staleMs = properties.getOrchestrator().getCameraStaleMs();
        Iterator<Map.Entry<Integer, Long>> it = cameraLastSeen.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, Long> entry = it.next();
            if (now > entry.getValue() && now - entry.getValue() > staleMs) {
                zoneDetector.removeCamera(entry.getKey());
                it.remove();
                log.info("camera {} went stale", entry.getKey());
            }
        }
    }

    private void updatePerformerGestures(List<GestureEvent> events) {
        for (Integer performerId : performers.keySet()) {
            List<MotionSample> history = sampleHistory.getHistory(performerId).orElse(List.of());
            if (history.size() < 2) {
                continue;
            }
            events.addAll(performerDetector.updatePerformer(performerId, history));
        }
    }

    private void forgetPerformer(int performerId) {
        performers.remove(performerId);
        sampleHistory.removeEntity(performerId);
        performerDetector.removePerformer(performerId);
    }

    private void dispatch(GestureEvent event) {
        for (GestureEventListener listener : listeners) {
            try {
                listener.onGesture(event);
            } catch (RuntimeException e) {
                log.warn("Gesture listener {} failed for {}: {}", listener.getClass().getSimpleName(),
                        event.getTypeTag(), e.getMessage());
            }
        }
    }
}
