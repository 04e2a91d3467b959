package com.crowdorgan.gesture;

import com.crowdorgan.gesture.config.GestureProperties;
import com.crowdorgan.gesture.service.GestureOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Basic application context test
 */
@SpringBootTest
@ActiveProfiles("test")
class GestureServiceApplicationTests {

    @Autowired
    private GestureOrchestrator orchestrator;

    @Autowired
    private GestureProperties properties;

    @Autowired
    private KafkaProperties kafkaProperties;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(properties.getHistory().getCapacity()).isEqualTo(60);
        assertThat(properties.getOrchestrator().isSendingEnabled()).isFalse();
        assertThat(properties.getZone().getSweepMinSteps()).isEqualTo(3);
    }

    @Test
    void producerSendsCannotStallTheTickForLong() {
        assertThat(kafkaProperties.getProducer().getProperties()).containsEntry("max.block.ms", "200");
    }
}
