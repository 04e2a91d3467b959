package com.crowdorgan.gesture.detector;

import com.crowdorgan.gesture.domain.ZoneGestureEvent;
import com.crowdorgan.gesture.domain.ZoneGestureType;
import com.crowdorgan.gesture.domain.ZoneGrid;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

import static com.crowdorgan.gesture.detector.GestureMath.MIN_DENOMINATOR;
import static com.crowdorgan.gesture.detector.GestureMath.clamp01;

/**
 * Watches each camera's 4x4 activity grid for crowd-level gestures.
 *
 * <p>Sweeps: for every row and column the index of its hottest cell is tracked across the
 * recent snapshots. When that index drifts monotonically by at least two cells and the line
 * currently has enough contrast, a directional sweep fires for that row or column.
 *
 * <p>Pulses: every cell keeps its previous value and slope. A cell that was rising, is now
 * falling and sits at or above {@code pulseThreshold} has just peaked and fires a pulse.
 *
 * <p>State is held per camera and dropped by {@link #removeCamera(int)}.
 */
public class ZoneGestureDetector {

    private ZoneGestureConfig config;
    private final Map<Integer, CameraState> cameras = new HashMap<>();
    private final CooldownLedger<ZoneGestureType> sweepCooldowns = new CooldownLedger<>();

    public ZoneGestureDetector() {
        this(new ZoneGestureConfig());
    }

    public ZoneGestureDetector(ZoneGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setConfig(ZoneGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Record a snapshot for a camera and evaluate sweeps, then pulses.
     *
     * @return events fired for this snapshot; sweeps first (rows, then columns), then pulses in
     *         cell order
     */
    public List<ZoneGestureEvent> updateCamera(int cameraId, ZoneGrid zones, long timestampMs) {
        Objects.requireNonNull(zones, "zones");
        CameraState camera = cameras.computeIfAbsent(cameraId, id -> new CameraState());

        camera.history.addLast(new ZoneSample(timestampMs, zones));
        long minTimestamp = GestureMath.windowStart(timestampMs, config.getHistoryMs());
        while (!camera.history.isEmpty() && camera.history.peekFirst().timestamp() < minTimestamp) {
            camera.history.pollFirst();
        }

        List<ZoneGestureEvent> events = new ArrayList<>();
        detectSweeps(cameraId, camera.history, events);
        detectPulses(cameraId, camera.pulseTrackers, zones, timestampMs, events);
        return events;
    }

    public void removeCamera(int cameraId) {
        cameras.remove(cameraId);
        sweepCooldowns.remove(cameraId);
    }

    public boolean hasCamera(int cameraId) {
        return cameras.containsKey(cameraId);
    }

    public Set<Integer> cameraIds() {
        return Set.copyOf(cameras.keySet());
    }

    public int historySize(int cameraId) {
        CameraState camera = cameras.get(cameraId);
        return camera == null ? 0 : camera.history.size();
    }

    /** Last time a sweep of the given type fired on a camera. */
    public OptionalLong lastSweepTrigger(int cameraId, ZoneGestureType type) {
        return sweepCooldowns.lastTrigger(cameraId, type);
    }

    /** Last time a pulse fired for one cell of a camera; empty for an unknown camera or cell. */
    public OptionalLong lastPulseTrigger(int cameraId, int zoneIndex) {
        CameraState camera = cameras.get(cameraId);
        if (camera == null || zoneIndex < 0 || zoneIndex >= camera.pulseTrackers.length) {
            return OptionalLong.empty();
        }
        PulseTracker tracker = camera.pulseTrackers[zoneIndex];
        return tracker.triggered ? OptionalLong.of(tracker.lastTrigger) : OptionalLong.empty();
    }

    private void detectSweeps(int cameraId, Deque<ZoneSample> history, List<ZoneGestureEvent> events) {
        if (history.size() < config.getSweepMinSteps()) {
            return;
        }

        ZoneSample latest = history.peekLast();
        long now = latest.timestamp();
        long minTimestamp = GestureMath.windowStart(now, config.getSweepWindowMs());

        // where the hottest cell of every row / column sat in each snapshot
        List<List<Integer>> rowMaxIndices = newIndexLists();
        List<List<Integer>> columnMaxIndices = newIndexLists();
        for (ZoneSample sample : history) {
            if (sample.timestamp() < minTimestamp) {
                continue;
            }
            for (int line = 0; line < ZoneGrid.SIZE; line++) {
                rowMaxIndices.get(line).add(hottestInRow(sample.values(), line));
                columnMaxIndices.get(line).add(hottestInColumn(sample.values(), line));
            }
        }

        for (int row = 0; row < ZoneGrid.SIZE; row++) {
            double range = rowRange(latest.values(), row);
            evaluateSweep(cameraId, rowMaxIndices.get(row), range,
                    ZoneGestureType.rowSweep(true, row), ZoneGestureType.rowSweep(false, row), now, events);
        }
        for (int col = 0; col < ZoneGrid.SIZE; col++) {
            double range = columnRange(latest.values(), col);
            evaluateSweep(cameraId, columnMaxIndices.get(col), range,
                    ZoneGestureType.columnSweep(true, col), ZoneGestureType.columnSweep(false, col), now, events);
        }
    }

    private void evaluateSweep(int cameraId, List<Integer> indices, double range,
                               ZoneGestureType forward, ZoneGestureType backward,
                               long now, List<ZoneGestureEvent> events) {
        if (indices.size() < config.getSweepMinSteps()) {
            return;
        }
        if (range < config.getSweepMinStrength()) {
            // flat lines are noise, whatever their hottest cell does
            return;
        }

        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < indices.size(); i++) {
            if (indices.get(i) < indices.get(i - 1)) {
                increasing = false;
            }
            if (indices.get(i) > indices.get(i - 1)) {
                decreasing = false;
            }
        }
        int delta = indices.get(indices.size() - 1) - indices.get(0);

        ZoneGestureType type;
        if (increasing && delta >= 2) {
            type = forward;
        } else if (decreasing && delta <= -2) {
            type = backward;
        } else {
            return;
        }

        if (sweepCooldowns.canTrigger(cameraId, type, now, config.getSweepCooldownMs())) {
            sweepCooldowns.record(cameraId, type, now);
            events.add(ZoneGestureEvent.builder()
                    .cameraId(cameraId)
                    .type(type)
                    .strength(clamp01(range))
                    .build());
        }
    }

    private void detectPulses(int cameraId, PulseTracker[] trackers, ZoneGrid zones, long timestampMs,
                              List<ZoneGestureEvent> events) {
        for (int zoneIndex = 0; zoneIndex < ZoneGrid.CELLS; zoneIndex++) {
            PulseTracker tracker = trackers[zoneIndex];
            double value = zones.get(zoneIndex);
            if (!tracker.initialized) {
                tracker.initialized = true;
                tracker.prevValue = value;
                tracker.prevSlope = 0.0;
                continue;
            }

            double slope = value - tracker.prevValue;
            boolean rising = tracker.prevSlope > config.getPulseSlopeThreshold();
            boolean falling = slope <= -config.getPulseSlopeThreshold();

            if (rising && falling && value >= config.getPulseThreshold() && tracker.canTrigger(timestampMs, config.getPulseCooldownMs())) {
                tracker.triggered = true;
                tracker.lastTrigger = timestampMs;
                double denominator = Math.max(MIN_DENOMINATOR, 1.0 - config.getPulseThreshold());
                events.add(ZoneGestureEvent.builder()
                        .cameraId(cameraId)
                        .type(ZoneGestureType.PULSE_ZONE)
                        .strength(clamp01((value - config.getPulseThreshold()) / denominator))
                        .zoneIndex(zoneIndex)
                        .build());
            }

            tracker.prevSlope = slope;
            tracker.prevValue = value;
        }
    }

    private static List<List<Integer>> newIndexLists() {
        List<List<Integer>> lists = new ArrayList<>(ZoneGrid.SIZE);
        for (int i = 0; i < ZoneGrid.SIZE; i++) {
            lists.add(new ArrayList<>());
        }
        return lists;
    }

    /** Ties resolve to the lowest column. */
    private static int hottestInRow(ZoneGrid grid, int row) {
        int maxIndex = 0;
        double maxValue = grid.get(row, 0);
        for (int col = 1; col < ZoneGrid.SIZE; col++) {
            if (grid.get(row, col) > maxValue) {
                maxValue = grid.get(row, col);
                maxIndex = col;
            }
        }
        return maxIndex;
    }

    /** Ties resolve to the lowest row. */
    private static int hottestInColumn(ZoneGrid grid, int col) {
        int maxIndex = 0;
        double maxValue = grid.get(0, col);
        for (int row = 1; row < ZoneGrid.SIZE; row++) {
            if (grid.get(row, col) > maxValue) {
                maxValue = grid.get(row, col);
                maxIndex = row;
            }
        }
        return maxIndex;
    }

    private static double rowRange(ZoneGrid grid, int row) {
        double min = grid.get(row, 0);
        double max = min;
        for (int col = 1; col < ZoneGrid.SIZE; col++) {
            min = Math.min(min, grid.get(row, col));
            max = Math.max(max, grid.get(row, col));
        }
        return max - min;
    }

    private static double columnRange(ZoneGrid grid, int col) {
        double min = grid.get(0, col);
        double max = min;
        for (int row = 1; row < ZoneGrid.SIZE; row++) {
            min = Math.min(min, grid.get(row, col));
            max = Math.max(max, grid.get(row, col));
        }
        return max - min;
    }

    private record ZoneSample(long timestamp, ZoneGrid values) {
    }

    private static final class CameraState {
        private final Deque<ZoneSample> history = new ArrayDeque<>();
        private final PulseTracker[] pulseTrackers = new PulseTracker[ZoneGrid.CELLS];

        private CameraState() {
            for (int i = 0; i < pulseTrackers.length; i++) {
                pulseTrackers[i] = new PulseTracker();
            }
        }
    }

    /**
     * Peak tracker for one cell. Its {@code lastTrigger} is the only pulse cooldown record.
     */
    private static final class PulseTracker {
        private boolean initialized;
        private double prevValue;
        private double prevSlope;
        private boolean triggered;
        private long lastTrigger;

        private boolean canTrigger(long now, long cooldownMs) {
            return !triggered || now >= lastTrigger + cooldownMs;
        }
    }
}
