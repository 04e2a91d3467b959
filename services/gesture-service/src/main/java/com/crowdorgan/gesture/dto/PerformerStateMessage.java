package com.crowdorgan.gesture.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-frame state for one tracked performer, as published by the tracking rig
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformerStateMessage {
    @NotNull
    private Integer performerId;
    @NotNull
    private Double x;
    @NotNull
    private Double y;
    @NotNull
    private Double z;
    private double size; // carried through for the status view, unused by detection
    @NotNull
    private Double motion;
    private double energy;
}
