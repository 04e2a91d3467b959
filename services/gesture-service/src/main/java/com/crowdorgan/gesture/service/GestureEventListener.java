package com.crowdorgan.gesture.service;

import com.crowdorgan.gesture.domain.GestureEvent;

/**
 * Observer notified of every gesture the orchestrator emits, in emission order. Publishing,
 * logging and metrics are all listeners, so the detectors themselves stay free of side effects.
 */
public interface GestureEventListener {

    void onGesture(GestureEvent event);
}
