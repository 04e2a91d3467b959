package com.crowdorgan.gesture.domain;

/**
 * Common view over the three gesture event variants so the orchestrator and its listeners can
 * handle them uniformly. Events are immutable value objects.
 */
public interface GestureEvent {

    GestureScope getScope();

    /** Wire tag from the fixed vocabulary, e.g. {@code raise} or {@code sweep_lr_top}. */
    String getTypeTag();

    /** Always within [0, 1]. */
    double getStrength();
}
