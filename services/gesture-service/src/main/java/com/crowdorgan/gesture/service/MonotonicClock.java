package com.crowdorgan.gesture.service;

import java.util.concurrent.TimeUnit;

/**
 * Milliseconds elapsed since the service started. Never goes backwards, unlike wall-clock
 * time, so sample and cooldown arithmetic stays valid across clock adjustments.
 */
public class MonotonicClock {

    private final long originNanos = System.nanoTime();

    public long millis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - originNanos);
    }
}
