package com.crowdorgan.gesture.kafka;

import com.crowdorgan.gesture.domain.Vector3;
import com.crowdorgan.gesture.domain.ZoneGrid;
import com.crowdorgan.gesture.dto.CameraZonesMessage;
import com.crowdorgan.gesture.dto.PerformerDisconnectMessage;
import com.crowdorgan.gesture.dto.PerformerStateMessage;
import com.crowdorgan.gesture.dto.RoomMotionMessage;
import com.crowdorgan.gesture.exception.InvalidZoneGridException;
import com.crowdorgan.gesture.metrics.GestureMetricsService;
import com.crowdorgan.gesture.service.InboundTelemetry;
import com.crowdorgan.gesture.service.MonotonicClock;
import com.crowdorgan.gesture.service.TelemetryInbox;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Motion Telemetry Consumer
 *
 * Consumes the tracking rig's telemetry topics and queues validated samples for the next
 * detection tick. Telemetry is best effort: malformed or mis-shaped records are logged,
 * counted and acknowledged, never retried.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MotionTelemetryConsumer {

    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final TelemetryInbox inbox;
    private final MonotonicClock clock;
    private final GestureMetricsService metricsService;

    @KafkaListener(
        topics = "${gesture.topics.performer-state:room-performer-state}",
        groupId = "${spring.kafka.consumer.group-id:gesture-service}"
    )
    public void consumePerformerState(@Payload String payload,
                                      @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                                      Acknowledgment acknowledgment) {
        PerformerStateMessage message = parse(payload, PerformerStateMessage.class, "performer_state", topic);
        if (message != null) {
            inbox.offer(new InboundTelemetry.PerformerState(
                    message.getPerformerId(),
                    Vector3.of(message.getX(), message.getY(), message.getZ()),
                    message.getSize(),
                    message.getMotion(),
                    message.getEnergy(),
                    clock.millis()));
            metricsService.recordTelemetryReceived("performer_state");
        }
        acknowledgment.acknowledge();
    }

    @KafkaListener(
        topics = "${gesture.topics.performer-disconnect:room-performer-disconnect}",
        groupId = "${spring.kafka.consumer.group-id:gesture-service}"
    )
    public void consumePerformerDisconnect(@Payload String payload,
                                           @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                                           Acknowledgment acknowledgment) {
        PerformerDisconnectMessage message = parse(payload, PerformerDisconnectMessage.class, "performer_disconnect", topic);
        if (message != null) {
            inbox.offer(new InboundTelemetry.PerformerDisconnect(message.getPerformerId(), clock.millis()));
            metricsService.recordTelemetryReceived("performer_disconnect");
        }
        acknowledgment.acknowledge();
    }

    @KafkaListener(
        topics = "${gesture.topics.camera-zones:room-camera-zones}",
        groupId = "${spring.kafka.consumer.group-id:gesture-service}"
    )
    public void consumeCameraZones(@Payload String payload,
                                   @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                                   Acknowledgment acknowledgment) {
        CameraZonesMessage message = parse(payload, CameraZonesMessage.class, "camera_zones", topic);
        if (message != null) {
            try {
                ZoneGrid grid = ZoneGrid.of(message.getRows(), message.getCols(), message.getZones());
                inbox.offer(new InboundTelemetry.CameraSnapshot(message.getCameraId(), grid, clock.millis()));
                metricsService.recordTelemetryReceived("camera_zones");
            } catch (InvalidZoneGridException e) {
                log.warn("Ignoring zones from camera {}: {}", message.getCameraId(), e.getMessage());
                metricsService.recordTelemetryRejected("camera_zones", "grid_shape");
            }
        }
        acknowledgment.acknowledge();
    }

    @KafkaListener(
        topics = "${gesture.topics.global-motion:room-global-motion}",
        groupId = "${spring.kafka.consumer.group-id:gesture-service}"
    )
    public void consumeGlobalMotion(@Payload String payload,
                                    @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                                    Acknowledgment acknowledgment) {
        RoomMotionMessage message = parse(payload, RoomMotionMessage.class, "global_motion", topic);
        if (message != null) {
            inbox.offer(new InboundTelemetry.RoomMotion(message.getMotion(), clock.millis()));
            metricsService.recordTelemetryReceived("global_motion");
        }
        acknowledgment.acknowledge();
    }

    /**
     * Deserialize and validate a payload; null means the record was rejected and already
     * accounted for.
     */
    private <T> T parse(String payload, Class<T> type, String kind, String topic) {
        T message;
        try {
            message = objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} payload on topic {}: {}", kind, topic, e.getOriginalMessage());
            metricsService.recordTelemetryRejected(kind, "malformed");
            return null;
        }
        if (message == null) {
            log.warn("Empty {} payload on topic {}", kind, topic);
            metricsService.recordTelemetryRejected(kind, "empty");
            return null;
        }

        Set<ConstraintViolation<T>> violations = validator.validate(message);
        if (!violations.isEmpty()) {
            ConstraintViolation<T> first = violations.iterator().next();
            log.warn("Invalid {} payload on topic {}: {} {}", kind, topic, first.getPropertyPath(), first.getMessage());
            metricsService.recordTelemetryRejected(kind, "invalid");
            return null;
        }
        return message;
    }
}
