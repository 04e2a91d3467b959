package com.crowdorgan.gesture.detector;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Settings for {@link ZoneGestureDetector}. Grid values are expected in [0, 1].
 */
@Data
public class ZoneGestureConfig {

    /** How far back each camera's snapshot queue reaches. */
    @PositiveOrZero
    private long historyMs = 2000;

    @PositiveOrZero
    private long sweepWindowMs = 900;

    @Min(2)
    private int sweepMinSteps = 3;

    @PositiveOrZero
    private double sweepMinStrength = 0.25;

    @PositiveOrZero
    private long sweepCooldownMs = 1600;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double pulseThreshold = 0.35;

    @PositiveOrZero
    private double pulseSlopeThreshold = 0.05;

    @PositiveOrZero
    private long pulseCooldownMs = 900;
}
