package com.crowdorgan.gesture.service;

import com.crowdorgan.gesture.domain.Vector3;
import com.crowdorgan.gesture.domain.ZoneGrid;

/**
 * Validated telemetry waiting in the {@link TelemetryInbox}, stamped with the time it was
 * received. The stamp becomes the sample timestamp when the orchestrator drains it.
 */
public interface InboundTelemetry {

    long receivedAt();

    record PerformerState(int performerId, Vector3 position, double size, double motion, double energy,
                          long receivedAt) implements InboundTelemetry {
    }

    record PerformerDisconnect(int performerId, long receivedAt) implements InboundTelemetry {
    }

    record CameraSnapshot(int cameraId, ZoneGrid zones, long receivedAt) implements InboundTelemetry {
    }

    record RoomMotion(double motion, long receivedAt) implements InboundTelemetry {
    }
}
