package com.crowdorgan.gesture.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RoomGestureEvent implements GestureEvent {

    RoomGestureType type;
    double strength;

    @Override
    public GestureScope getScope() {
        return GestureScope.ROOM;
    }

    @Override
    public String getTypeTag() {
        return type.getTag();
    }
}
