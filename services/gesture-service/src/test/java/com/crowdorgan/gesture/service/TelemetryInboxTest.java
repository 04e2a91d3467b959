package com.crowdorgan.gesture.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TelemetryInbox Tests")
class TelemetryInboxTest {

    private final TelemetryInbox inbox = new TelemetryInbox();

    @Test
    @DisplayName("Should drain everything in arrival order and leave the inbox empty")
    void shouldDrainInOrder() {
        // Given
        inbox.offer(new InboundTelemetry.RoomMotion(0.1, 10L));
        inbox.offer(new InboundTelemetry.PerformerDisconnect(3, 20L));
        assertThat(inbox.pendingCount()).isEqualTo(2);

        // When / Then
        assertThat(inbox.drain()).extracting(InboundTelemetry::receivedAt).containsExactly(10L, 20L);
        assertThat(inbox.pendingCount()).isZero();
        assertThat(inbox.drain()).isEmpty();
    }
}
