package com.crowdorgan.gesture.config;

import com.crowdorgan.gesture.detector.PerformerGestureDetector;
import com.crowdorgan.gesture.detector.RoomGestureDetector;
import com.crowdorgan.gesture.detector.SampleHistory;
import com.crowdorgan.gesture.detector.ZoneGestureDetector;
import com.crowdorgan.gesture.service.MonotonicClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Gesture Detection Configuration
 *
 * <p>Builds the history buffer and the three detectors from {@link GestureProperties}. The
 * detectors are plain stateful objects; only the orchestrator's tick thread touches them.
 */
@Configuration
@EnableConfigurationProperties(GestureProperties.class)
@Slf4j
public class GestureDetectionConfig {

    @Bean
    public MonotonicClock monotonicClock() {
        return new MonotonicClock();
    }

    @Bean
    public SampleHistory sampleHistory(GestureProperties properties) {
        log.info("Performer history capacity: {} samples", properties.getHistory().getCapacity());
        return new SampleHistory(properties.getHistory().getCapacity());
    }

    @Bean
    public PerformerGestureDetector performerGestureDetector(GestureProperties properties) {
        return new PerformerGestureDetector(properties.getPerformer());
    }

    @Bean
    public ZoneGestureDetector zoneGestureDetector(GestureProperties properties) {
        return new ZoneGestureDetector(properties.getZone());
    }

    @Bean
    public RoomGestureDetector roomGestureDetector(GestureProperties properties) {
        return new RoomGestureDetector(properties.getRoom());
    }
}
