package com.crowdorgan.gesture.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Activity heatmap from one camera, row-major. Only 4x4 grids are accepted downstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CameraZonesMessage {
    @NotNull
    private Integer cameraId;
    private int rows;
    private int cols;
    @NotNull
    private List<Double> zones;
}
