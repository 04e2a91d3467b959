package com.crowdorgan.gesture.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One frame of performer telemetry as stored in the rolling history.
 *
 * <p>Velocity is derived from the previous sample of the same performer when the sample is
 * appended, so detectors never recompute finite differences.
 */
@Value
@Builder
public class MotionSample {

    /** Monotonic milliseconds. */
    long timestamp;

    Vector3 position;

    /** Units per second; zero when the previous sample is missing or not older. */
    Vector3 velocity;

    double motion;

    double energy;
}
