package com.crowdorgan.gesture.detector;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class RoomGestureConfig {

    @PositiveOrZero
    private long historyMs = 5000;

    /** The "previous" partition must have been at or below this to allow an eruption. */
    @PositiveOrZero
    private double eruptionLow = 0.25;

    @PositiveOrZero
    @DecimalMax("1.0")
    private double eruptionHigh = 0.7;

    @PositiveOrZero
    private long eruptionCooldownMs = 4500;

    /** Length of the "recent" partition, measured back from the newest sample. */
    @PositiveOrZero
    private long eruptionWindowMs = 1200;

    @Positive
    private double stillnessMotionThreshold = 0.22;

    @PositiveOrZero
    private long stillnessDurationMs = 3000;

    @Min(0)
    private int stillnessMinVoices = 3;

    @PositiveOrZero
    private long stillnessCooldownMs = 6000;
}
