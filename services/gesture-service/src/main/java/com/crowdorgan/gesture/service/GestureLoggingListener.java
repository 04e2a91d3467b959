package com.crowdorgan.gesture.service;

import com.crowdorgan.gesture.domain.GestureEvent;
import com.crowdorgan.gesture.domain.PerformerGestureEvent;
import com.crowdorgan.gesture.domain.ZoneGestureEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
@Slf4j
public class GestureLoggingListener implements GestureEventListener {

    @Override
    public void onGesture(GestureEvent event) {
        if (event instanceof PerformerGestureEvent performerEvent) {
            log.info("performer {} {} strength {} extra {}", performerEvent.getPerformerId(),
                    event.getTypeTag(), format(event.getStrength()), format(performerEvent.getExtra()));
        } else if (event instanceof ZoneGestureEvent zoneEvent) {
            if (zoneEvent.hasZoneIndex()) {
                log.info("cam {} {} zone {} strength {}", zoneEvent.getCameraId(), event.getTypeTag(),
                        zoneEvent.getZoneIndex(), format(event.getStrength()));
            } else {
                log.info("cam {} {} strength {}", zoneEvent.getCameraId(), event.getTypeTag(),
                        format(event.getStrength()));
            }
        } else {
            log.info("room {} strength {}", event.getTypeTag(), format(event.getStrength()));
        }
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
