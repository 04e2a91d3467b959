package com.crowdorgan.gesture.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RoomGestureType {
    ERUPTION("eruption"),
    STILLNESS("stillness");

    private final String tag;
}
