package com.crowdorgan.gesture.detector;

final class GestureMath {

    /** Smallest denominator used when normalising strengths. */
    static final double MIN_DENOMINATOR = 0.01;

    private GestureMath() {
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /** Start of a trailing window, never before time zero. */
    static long windowStart(long now, long windowMs) {
        return now > windowMs ? now - windowMs : 0L;
    }
}
