package com.crowdorgan.gesture.kafka;

import com.crowdorgan.gesture.config.GestureProperties;
import com.crowdorgan.gesture.domain.GestureEvent;
import com.crowdorgan.gesture.dto.GestureMessage;
import com.crowdorgan.gesture.service.GestureEventListener;
import com.crowdorgan.gesture.service.MonotonicClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Gesture Event Publisher
 *
 * Publishes every emitted gesture to its scope's topic for show control. Sends are
 * fire-and-forget: failures are logged, whether the producer rejects the record up front or
 * the send future fails later, and never reach the tick. How long a send may block the tick
 * thread is bounded by the producer's {@code max.block.ms}.
 */
@Component
@Order(3)
@Slf4j
@RequiredArgsConstructor
public class GestureEventPublisher implements GestureEventListener {

    static final String ROOM_KEY = "room";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final GestureProperties properties;
    private final MonotonicClock clock;

    @Override
    public void onGesture(GestureEvent event) {
        if (!properties.getOrchestrator().isSendingEnabled()) {
            return;
        }

        GestureMessage message = GestureMessage.from(event, clock.millis());
        String topic = topicFor(event);
        String key = message.getSubjectId() != null ? String.valueOf(message.getSubjectId()) : ROOM_KEY;

        try {
            kafkaTemplate.send(topic, key, message).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish {} gesture to {}: {}", message.getType(), topic, ex.getMessage());
                } else {
                    log.debug("Published {} gesture to {} with key {}", message.getType(), topic, key);
                }
            });
        } catch (RuntimeException e) {
            // producer gave up within max.block.ms, e.g. broker metadata unavailable
            log.warn("Could not hand {} gesture to the producer for {}: {}", message.getType(), topic, e.getMessage());
        }
    }

    private String topicFor(GestureEvent event) {
        GestureProperties.Topics topics = properties.getTopics();
        return switch (event.getScope()) {
            case PERFORMER -> topics.getPerformerGestures();
            case ZONE -> topics.getZoneGestures();
            case ROOM -> topics.getRoomGestures();
        };
    }
}
