package com.crowdorgan.gesture.domain;

/**
 * What kind of subject a gesture event describes.
 */
public enum GestureScope {
    PERFORMER,
    ZONE,
    ROOM
}
