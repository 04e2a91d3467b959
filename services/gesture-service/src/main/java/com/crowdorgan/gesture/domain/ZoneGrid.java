package com.crowdorgan.gesture.domain;

import com.crowdorgan.gesture.exception.InvalidZoneGridException;

import java.util.Arrays;
import java.util.List;

/**
 * Validated 4x4 activity grid in row-major order. Instances are immutable; the backing array is
 * copied on the way in and never handed out.
 */
public final class ZoneGrid {

    public static final int SIZE = 4;
    public static final int CELLS = SIZE * SIZE;

    private final double[] values;

    private ZoneGrid(double[] values) {
        this.values = values;
    }

    public static ZoneGrid ofRowMajor(double... values) {
        return of(SIZE, SIZE, values);
    }

    public static ZoneGrid of(int rows, int cols, double[] values) {
        if (rows != SIZE || cols != SIZE) {
            throw new InvalidZoneGridException(
                    String.format("Only %dx%d zone grids are supported, got %dx%d", SIZE, SIZE, rows, cols));
        }
        if (values == null || values.length != CELLS) {
            throw new InvalidZoneGridException(
                    "Zone grid needs " + CELLS + " values, got " + (values == null ? 0 : values.length));
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidZoneGridException("Zone " + i + " is not a finite value: " + values[i]);
            }
        }
        return new ZoneGrid(values.clone());
    }

    public static ZoneGrid of(int rows, int cols, List<? extends Number> values) {
        if (values == null) {
            throw new InvalidZoneGridException("Zone grid values are missing");
        }
        double[] raw = new double[values.size()];
        for (int i = 0; i < raw.length; i++) {
            Number value = values.get(i);
            if (value == null) {
                throw new InvalidZoneGridException("Zone " + i + " is null");
            }
            raw[i] = value.doubleValue();
        }
        return of(rows, cols, raw);
    }

    public double get(int index) {
        return values[index];
    }

    public double get(int row, int col) {
        return values[row * SIZE + col];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZoneGrid)) {
            return false;
        }
        return Arrays.equals(values, ((ZoneGrid) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ZoneGrid" + Arrays.toString(values);
    }
}
