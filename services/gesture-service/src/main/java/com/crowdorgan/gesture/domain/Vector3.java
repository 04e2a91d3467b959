package com.crowdorgan.gesture.domain;

import lombok.Value;

/**
 * Immutable 3D vector used for performer positions and derived velocities.
 */
@Value
public class Vector3 {

    public static final Vector3 ZERO = new Vector3(0.0, 0.0, 0.0);

    double x;
    double y;
    double z;

    public static Vector3 of(double x, double y, double z) {
        return new Vector3(x, y, z);
    }

    public Vector3 subtract(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 divide(double divisor) {
        return new Vector3(x / divisor, y / divisor, z / divisor);
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }
}
