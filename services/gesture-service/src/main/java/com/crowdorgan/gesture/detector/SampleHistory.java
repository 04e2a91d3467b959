package com.crowdorgan.gesture.detector;

import com.crowdorgan.gesture.domain.MotionSample;
import com.crowdorgan.gesture.domain.Vector3;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Capacity-bounded rolling history of motion samples per performer.
 *
 * <p>Each performer owns one ring buffer; once it holds {@code capacity} samples the oldest is
 * evicted for every new one. Velocity is derived here from consecutive samples of the same
 * performer. Not thread-safe: the orchestrator confines it to the tick thread.
 */
public class SampleHistory {

    public static final int DEFAULT_CAPACITY = 45;

    private final Map<Integer, Deque<MotionSample>> histories = new HashMap<>();
    private int capacity;

    public SampleHistory() {
        this(DEFAULT_CAPACITY);
    }

    public SampleHistory(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * Change the per-performer capacity, clamped to at least one sample. Existing buffers that
     * are now too long lose their oldest samples immediately.
     */
    public void setCapacity(int capacity) {
        this.capacity = Math.max(1, capacity);
        for (Deque<MotionSample> history : histories.values()) {
            trim(history);
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public MotionSample addSample(int performerId, Vector3 position, double motion, double energy, long timestampMs) {
        Deque<MotionSample> history = histories.computeIfAbsent(performerId, id -> new ArrayDeque<>(capacity + 1));

        Vector3 velocity = Vector3.ZERO;
        MotionSample previous = history.peekLast();
        if (previous != null && timestampMs > previous.getTimestamp()) {
            double dtSeconds = (timestampMs - previous.getTimestamp()) / 1000.0;
            velocity = position.subtract(previous.getPosition()).divide(dtSeconds);
        }

        MotionSample sample = MotionSample.builder()
                .timestamp(timestampMs)
                .position(position)
                .velocity(velocity)
                .motion(motion)
                .energy(energy)
                .build();
        history.addLast(sample);
        trim(history);
        return sample;
    }

    public void removeEntity(int performerId) {
        histories.remove(performerId);
    }

    /**
     * Read-only snapshot of a performer's samples, oldest first, or empty when the performer is
     * not tracked.
     */
    public Optional<List<MotionSample>> getHistory(int performerId) {
        Deque<MotionSample> history = histories.get(performerId);
        if (history == null) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(history));
    }

    public boolean hasEntity(int performerId) {
        return histories.containsKey(performerId);
    }

    public int size(int performerId) {
        Deque<MotionSample> history = histories.get(performerId);
        return history == null ? 0 : history.size();
    }

    public Set<Integer> entityIds() {
        return Set.copyOf(histories.keySet());
    }

    private void trim(Deque<MotionSample> history) {
        while (history.size() > capacity) {
            history.pollFirst();
        }
    }
}
