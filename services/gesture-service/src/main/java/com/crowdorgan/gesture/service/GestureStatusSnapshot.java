package com.crowdorgan.gesture.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of the orchestrator, published at the end of each tick.
 */
@Value
@Builder
public class GestureStatusSnapshot {
    int trackedPerformers;
    /** Ordered by performer id. */
    List<TrackedPerformer> performers;
    int trackedCameras;
    double roomMotion;
    int historyCapacity;
    boolean sendingEnabled;
    long ticks;
    long pendingTelemetry;
    long lastTickAt;

    public static GestureStatusSnapshot empty(int historyCapacity, boolean sendingEnabled) {
        return GestureStatusSnapshot.builder()
                .performers(List.of())
                .historyCapacity(historyCapacity)
                .sendingEnabled(sendingEnabled)
                .build();
    }
}
