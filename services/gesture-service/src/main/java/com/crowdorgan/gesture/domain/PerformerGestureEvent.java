package com.crowdorgan.gesture.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Gesture recognised for a single performer.
 */
@Value
@Builder
public class PerformerGestureEvent implements GestureEvent {

    int performerId;
    PerformerGestureType type;
    double strength;

    /**
     * Auxiliary payload: final vertical position for raise/lower, hold duration fraction for
     * hold, zero otherwise.
     */
    double extra;

    @Override
    public GestureScope getScope() {
        return GestureScope.PERFORMER;
    }

    @Override
    public String getTypeTag() {
        return type.getTag();
    }
}
