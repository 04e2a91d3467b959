package com.crowdorgan.gesture.service;

import com.crowdorgan.gesture.domain.Vector3;
import lombok.Builder;
import lombok.Value;

/**
 * Latest known state of a performer. Replaced on every state message; drives staleness
 * pruning and is listed in the status view.
 */
@Value
@Builder
public class TrackedPerformer {
    int performerId;
    Vector3 position;
    double size;
    double motion;
    double energy;
    long lastUpdate;
}
