package com.crowdorgan.gesture.detector;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Thresholds, windows and cooldowns for {@link PerformerGestureDetector}.
 *
 * <p>Positions are normalised stage coordinates with y growing downwards, so a raise is a
 * negative vertical delta. Speeds are units per second.
 */
@Data
public class PerformerGestureConfig {

    @Positive
    private double raiseDeltaY = 0.18;

    @Positive
    private double lowerDeltaY = 0.18;

    @Positive
    private double swipeDeltaX = 0.25;

    @PositiveOrZero
    private double swipeOrthogonality = 1.6;

    @PositiveOrZero
    private double raiseHorizontalLimit = 0.12;

    @PositiveOrZero
    private double swipeVerticalLimit = 0.18;

    @PositiveOrZero
    private double shakeRadius = 0.08;

    @Min(0)
    private int shakeMinSignFlips = 4;

    @Positive
    private double shakeMinMotion = 0.08;

    @PositiveOrZero
    private double burstSpeedThreshold = 1.5;

    @PositiveOrZero
    private double burstMaxSpeed = 3.5;

    @PositiveOrZero
    private double holdMotionThreshold = 0.05;

    @Positive
    private long holdDurationMs = 1200;

    @PositiveOrZero
    private long minWindowMs = 400;

    @PositiveOrZero
    private long maxWindowMs = 1200;

    /** Cooldown shared by raise, lower, swipes and shake. */
    @PositiveOrZero
    private long gestureCooldownMs = 900;

    @PositiveOrZero
    private long burstCooldownMs = 600;

    @PositiveOrZero
    private long holdCooldownMs = 1800;
}
