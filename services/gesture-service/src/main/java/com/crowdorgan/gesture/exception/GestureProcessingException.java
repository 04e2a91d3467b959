package com.crowdorgan.gesture.exception;

/**
 * Base exception for gesture service errors
 */
public class GestureProcessingException extends RuntimeException {

    public GestureProcessingException(String message) {
        super(message);
    }
}
