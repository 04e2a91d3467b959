package com.crowdorgan.gesture.dto;

import com.crowdorgan.gesture.domain.GestureEvent;
import com.crowdorgan.gesture.domain.GestureScope;
import com.crowdorgan.gesture.domain.PerformerGestureEvent;
import com.crowdorgan.gesture.domain.ZoneGestureEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound gesture as published for show control.
 *
 * <p>{@code subjectId} is the performer or camera id and is absent for room gestures.
 * {@code extra} is present on performer gestures, {@code zoneIndex} on zone pulses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GestureMessage {
    private GestureScope scope;
    private Integer subjectId;
    private String type;
    private double strength;
    private Double extra;
    private Integer zoneIndex;
    private long emittedAt;

    public static GestureMessage from(GestureEvent event, long emittedAt) {
        GestureMessageBuilder builder = GestureMessage.builder()
                .scope(event.getScope())
                .type(event.getTypeTag())
                .strength(event.getStrength())
                .emittedAt(emittedAt);

        if (event instanceof PerformerGestureEvent performerEvent) {
            builder.subjectId(performerEvent.getPerformerId())
                    .extra(performerEvent.getExtra());
        } else if (event instanceof ZoneGestureEvent zoneEvent) {
            builder.subjectId(zoneEvent.getCameraId())
                    .zoneIndex(zoneEvent.getZoneIndex());
        }
        return builder.build();
    }
}
