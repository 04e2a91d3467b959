package com.crowdorgan.gesture.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum PerformerGestureType {
    RAISE("raise"),
    LOWER("lower"),
    SWIPE_LEFT("swipe_left"),
    SWIPE_RIGHT("swipe_right"),
    SHAKE("shake"),
    BURST("burst"),
    HOLD("hold");

    private final String tag;
}
