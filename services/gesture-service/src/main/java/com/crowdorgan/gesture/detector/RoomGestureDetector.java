package com.crowdorgan.gesture.detector;

import com.crowdorgan.gesture.domain.RoomGestureEvent;
import com.crowdorgan.gesture.domain.RoomGestureType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import static com.crowdorgan.gesture.detector.GestureMath.MIN_DENOMINATOR;
import static com.crowdorgan.gesture.detector.GestureMath.clamp01;

/**
 * Room-wide gestures from the aggregate motion signal.
 *
 * <p>Eruption is hysteretic: the room must have been calm ({@code eruptionLow}) in the part of
 * the history older than {@code eruptionWindowMs} and loud ({@code eruptionHigh}) inside it.
 * Stillness needs sustained quiet with at least {@code stillnessMinVoices} performers present;
 * after firing it re-arms from the firing tick, so a room that stays still keeps reporting it
 * once per {@code stillnessDurationMs} (subject to cooldown).
 */
public class RoomGestureDetector {

    private RoomGestureConfig config;
    private final Deque<RoomSample> history = new ArrayDeque<>();

    private Long lastEruption;
    private Long lastStillness;
    private Long stillnessStart;

    public RoomGestureDetector() {
        this(new RoomGestureConfig());
    }

    public RoomGestureDetector(RoomGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setConfig(RoomGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<RoomGestureEvent> update(double roomMotion, int activePerformers, long timestampMs) {
        history.addLast(new RoomSample(timestampMs, roomMotion));
        long minTimestamp = GestureMath.windowStart(timestampMs, config.getHistoryMs());
        while (!history.isEmpty() && history.peekFirst().timestamp() < minTimestamp) {
            history.pollFirst();
        }

        long recentStart = GestureMath.windowStart(timestampMs, config.getEruptionWindowMs());
        double previousSum = 0.0;
        int previousCount = 0;
        double recentSum = 0.0;
        int recentCount = 0;
        for (RoomSample sample : history) {
            if (sample.timestamp() < recentStart) {
                previousSum += sample.motion();
                previousCount++;
            } else {
                recentSum += sample.motion();
                recentCount++;
            }
        }
        double previousMean = previousCount > 0 ? previousSum / previousCount : 0.0;
        double recentMean = recentCount > 0 ? recentSum / recentCount : 0.0;

        List<RoomGestureEvent> events = new ArrayList<>(2);
        detectEruption(previousCount, previousMean, recentCount, recentMean, timestampMs, events);
        detectStillness(roomMotion, activePerformers, recentMean, timestampMs, events);
        return events;
    }

    /** Forget all history, cooldowns and the stillness run. */
    public void reset() {
        history.clear();
        lastEruption = null;
        lastStillness = null;
        stillnessStart = null;
    }

    public int historySize() {
        return history.size();
    }

    public boolean isStillnessRunning() {
        return stillnessStart != null;
    }

    private void detectEruption(int previousCount, double previousMean, int recentCount, double recentMean,
                                long now, List<RoomGestureEvent> events) {
        if (previousCount == 0 || recentCount == 0) {
            return;
        }
        if (recentMean < config.getEruptionHigh() || previousMean > config.getEruptionLow()) {
            return;
        }
        if (lastEruption != null && now < lastEruption + config.getEruptionCooldownMs()) {
            return;
        }
        lastEruption = now;
        double denominator = Math.max(MIN_DENOMINATOR, 1.0 - config.getEruptionHigh());
        events.add(RoomGestureEvent.builder()
                .type(RoomGestureType.ERUPTION)
                .strength(clamp01((recentMean - config.getEruptionHigh()) / denominator))
                .build());
    }

    private void detectStillness(double roomMotion, int activePerformers, double recentMean, long now,
                                 List<RoomGestureEvent> events) {
        if (roomMotion <= config.getStillnessMotionThreshold() && activePerformers >= config.getStillnessMinVoices()) {
            if (stillnessStart == null) {
                stillnessStart = now;
            }
        } else {
            stillnessStart = null;
            return;
        }

        if (now - stillnessStart < config.getStillnessDurationMs()) {
            return;
        }
        if (lastStillness != null && now < lastStillness + config.getStillnessCooldownMs()) {
            return;
        }

        lastStillness = now;
        stillnessStart = now;

        double motionComponent = clamp01(1.0 - recentMean / Math.max(MIN_DENOMINATOR, config.getStillnessMotionThreshold()));
        int minVoices = config.getStillnessMinVoices();
        double voiceComponent = clamp01((double) (activePerformers - minVoices) / Math.max(1, minVoices));
        events.add(RoomGestureEvent.builder()
                .type(RoomGestureType.STILLNESS)
                .strength(clamp01(0.6 * motionComponent + 0.4 * voiceComponent))
                .build());
    }

    private record RoomSample(long timestamp, double motion) {
    }
}
