package com.crowdorgan.gesture.exception;

/**
 * Thrown when a camera snapshot is not a 4x4 grid of finite values.
 */
public class InvalidZoneGridException extends GestureProcessingException {

    public InvalidZoneGridException(String message) {
        super(message);
    }
}
