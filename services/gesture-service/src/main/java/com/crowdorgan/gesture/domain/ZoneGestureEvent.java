package com.crowdorgan.gesture.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Gesture recognised on one camera's 4x4 activity grid. Pulses carry the index of the cell
 * that peaked; sweeps cover a whole row or column and carry none.
 */
@Value
@Builder
public class ZoneGestureEvent implements GestureEvent {

    int cameraId;
    ZoneGestureType type;
    double strength;
    Integer zoneIndex;

    public boolean hasZoneIndex() {
        return zoneIndex != null;
    }

    @Override
    public GestureScope getScope() {
        return GestureScope.ZONE;
    }

    @Override
    public String getTypeTag() {
        return type.getTag();
    }
}
