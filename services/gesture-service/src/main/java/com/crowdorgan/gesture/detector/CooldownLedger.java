package com.crowdorgan.gesture.detector;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Last-trigger timestamps keyed by (subject id, gesture type).
 *
 * <p>A pair that has never triggered may always trigger. Afterwards it may trigger again once
 * {@code now >= lastTrigger + cooldown}. Not thread-safe; owned by a single detector.
 *
 * @param <T> gesture type enumeration
 */
public class CooldownLedger<T extends Enum<T>> {

    private final Map<Integer, Map<T, Long>> lastTriggers = new HashMap<>();

    public boolean canTrigger(int subjectId, T type, long now, long cooldownMs) {
        Map<T, Long> bySubject = lastTriggers.get(subjectId);
        if (bySubject == null) {
            return true;
        }
        Long last = bySubject.get(type);
        return last == null || now >= last + cooldownMs;
    }

    public void record(int subjectId, T type, long now) {
        lastTriggers.computeIfAbsent(subjectId, id -> new HashMap<>()).put(type, now);
    }

    public OptionalLong lastTrigger(int subjectId, T type) {
        Map<T, Long> bySubject = lastTriggers.get(subjectId);
        if (bySubject == null || !bySubject.containsKey(type)) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(bySubject.get(type));
    }

    public void remove(int subjectId) {
        lastTriggers.remove(subjectId);
    }

    public boolean contains(int subjectId) {
        return lastTriggers.containsKey(subjectId);
    }
}
