package com.crowdorgan.gesture.detector;

import com.crowdorgan.gesture.domain.MotionSample;
import com.crowdorgan.gesture.domain.PerformerGestureEvent;
import com.crowdorgan.gesture.domain.PerformerGestureType;
import com.crowdorgan.gesture.domain.Vector3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for PerformerGestureDetector
 *
 * Histories are built through {@link SampleHistory} so velocities are derived the same way
 * they are in production. Positions use stage coordinates with y growing downwards.
 */
@DisplayName("PerformerGestureDetector Tests")
class PerformerGestureDetectorTest {

    private static final int PERFORMER = 1;

    private PerformerGestureDetector detector;
    private SampleHistory history;

    @BeforeEach
    void setUp() {
        detector = new PerformerGestureDetector();
        history = new SampleHistory(60);
    }

    @Nested
    @DisplayName("Raise and lower")
    class RaiseAndLower {

        @Test
        @DisplayName("Should emit exactly one raise when a performer lifts by 0.3 over 500ms")
        void shouldEmitSingleRaiseWhileFedEveryTick() {
            // Given
            List<PerformerGestureEvent> events = new ArrayList<>();

            // When
            for (int step = 0; step <= 5; step++) {
                history.addSample(PERFORMER, Vector3.of(step % 2 == 0 ? 0.0 : 0.02, -0.06 * step, 0.0),
                        0.2, 0.0, step * 100L);
                events.addAll(detector.updatePerformer(PERFORMER, history.getHistory(PERFORMER).orElseThrow()));
            }

            // Then
            assertThat(events).hasSize(1);
            PerformerGestureEvent raise = events.get(0);
            assertThat(raise.getType()).isEqualTo(PerformerGestureType.RAISE);
            assertThat(raise.getTypeTag()).isEqualTo("raise");
            assertThat(raise.getPerformerId()).isEqualTo(PERFORMER);
            assertThat(raise.getStrength()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should report the final vertical position as the raise payload")
        void shouldCarryFinalHeight() {
            // Given
            List<MotionSample> samples = verticalMove(0.0, -0.3);

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, samples);

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.RAISE);
            assertThat(events.get(0).getExtra()).isCloseTo(-0.3, within(1e-9));
        }

        @Test
        @DisplayName("Should emit lower for downward travel")
        void shouldEmitLower() {
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, verticalMove(0.0, 0.3));

            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.LOWER);
            assertThat(events.get(0).getStrength()).isEqualTo(1.0);
            assertThat(events.get(0).getExtra()).isCloseTo(0.3, within(1e-9));
        }

        @Test
        @DisplayName("Should not raise when the hand also drifts sideways")
        void shouldRejectWideRaise() {
            // Given
            for (int step = 0; step <= 5; step++) {
                history.addSample(PERFORMER, Vector3.of(0.04 * step, -0.06 * step, 0.0), 0.2, 0.0, step * 100L);
            }

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).doesNotContain(PerformerGestureType.RAISE);
        }
    }

    @Nested
    @DisplayName("Swipes")
    class Swipes {

        @Test
        @DisplayName("Should emit swipe_right for dominant rightward travel")
        void shouldEmitSwipeRight() {
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, horizontalMove(0.4));

            assertThat(events).extracting(PerformerGestureEvent::getType)
                    .containsExactly(PerformerGestureType.SWIPE_RIGHT);
            assertThat(events.get(0).getStrength()).isEqualTo(1.0);
            assertThat(events.get(0).getExtra()).isZero();
        }

        @Test
        @DisplayName("Should emit swipe_left for dominant leftward travel")
        void shouldEmitSwipeLeft() {
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, horizontalMove(-0.4));

            assertThat(events).extracting(PerformerGestureEvent::getType)
                    .containsExactly(PerformerGestureType.SWIPE_LEFT);
        }

        @Test
        @DisplayName("Should ignore horizontal travel below the swipe distance")
        void shouldIgnoreShortSwipe() {
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, horizontalMove(0.2));

            assertThat(events).isEmpty();
        }
    }

    @Nested
    @DisplayName("Shake, burst and hold")
    class ShakeBurstHold {

        @Test
        @DisplayName("Should emit shake for rapid small oscillation")
        void shouldEmitShake() {
            // Given
            for (int step = 0; step <= 10; step++) {
                history.addSample(PERFORMER, Vector3.of(step % 2 == 0 ? 0.0 : 0.03, 0.0, 0.0), 0.12, 0.0, step * 50L);
            }

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.SHAKE);
            assertThat(events.get(0).getStrength()).isCloseTo(0.75, within(1e-9));
        }

        @Test
        @DisplayName("Should ignore jitter slower than the sign-flip dead zone")
        void shouldIgnoreJitterInsideDeadZone() {
            // Given: 0.0005 per 50ms is 0.01 u/s, under 0.25 * shakeMinMotion = 0.02 u/s
            List<MotionSample> samples = oscillation(0.0005, 0.12);

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, samples);

            // Then
            assertThat(samples.get(1).getVelocity().getX()).isCloseTo(0.01, within(1e-9));
            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Should shake on the same jitter once it is faster than the dead zone")
        void shouldShakeOnJitterAboveDeadZone() {
            // Given: 0.0015 per 50ms is 0.03 u/s
            List<MotionSample> samples = oscillation(0.0015, 0.12);

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, samples);

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.SHAKE);
        }

        @Test
        @DisplayName("Should not shake without direction changes")
        void shouldNotShakeWhenStill() {
            for (int step = 0; step <= 10; step++) {
                history.addSample(PERFORMER, Vector3.ZERO, 0.12, 0.0, step * 50L);
            }

            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            assertThat(events).isEmpty();
        }

        @Test
        @DisplayName("Should emit burst scaled between the speed threshold and maximum")
        void shouldEmitBurst() {
            // Given
            for (int step = 0; step <= 4; step++) {
                history.addSample(PERFORMER, Vector3.ZERO, 0.2, 0.0, step * 100L);
            }
            history.addSample(PERFORMER, Vector3.of(0.2, 0.0, 0.0), 0.2, 0.0, 500L);

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.BURST);
            assertThat(events.get(0).getStrength()).isCloseTo(0.25, within(1e-9));
        }

        @Test
        @DisplayName("Should emit hold after sustained stillness")
        void shouldEmitHold() {
            // Given
            for (int step = 0; step <= 13; step++) {
                history.addSample(PERFORMER, Vector3.of(0.5, 0.5, 0.0), 0.01, 0.0, step * 100L);
            }

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            // Then
            assertThat(events).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.HOLD);
            assertThat(events.get(0).getStrength()).isCloseTo(0.8, within(1e-9));
            assertThat(events.get(0).getExtra()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should measure hold from the last moving sample")
        void shouldRestartHoldAfterMovement() {
            // Given
            for (int step = 0; step <= 13; step++) {
                double motion = step == 5 ? 0.3 : 0.01;
                history.addSample(PERFORMER, Vector3.of(0.5, 0.5, 0.0), motion, 0.0, step * 100L);
            }

            // When
            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER,
                    history.getHistory(PERFORMER).orElseThrow());

            // Then
            assertThat(events).isEmpty();
        }
    }

    @Nested
    @DisplayName("Windowing and cooldowns")
    class WindowingAndCooldowns {

        @Test
        @DisplayName("Should return nothing for missing or too short histories")
        void shouldIgnoreShortHistories() {
            assertThat(detector.updatePerformer(PERFORMER, null)).isEmpty();
            assertThat(detector.updatePerformer(PERFORMER, List.of())).isEmpty();

            history.addSample(PERFORMER, Vector3.ZERO, 0.2, 0.0, 0L);
            assertThat(detector.updatePerformer(PERFORMER, history.getHistory(PERFORMER).orElseThrow())).isEmpty();

            history.addSample(PERFORMER, Vector3.of(0.0, -0.5, 0.0), 0.2, 0.0, 399L);
            assertThat(detector.updatePerformer(PERFORMER, history.getHistory(PERFORMER).orElseThrow())).isEmpty();
            assertThat(detector.hasCooldownState(PERFORMER)).isFalse();
        }

        @Test
        @DisplayName("Should suppress a repeated gesture inside its cooldown")
        void shouldApplyCooldown() {
            // Given
            List<MotionSample> samples = verticalMove(0.0, -0.3);
            assertThat(detector.updatePerformer(PERFORMER, samples)).hasSize(1);

            // When
            List<PerformerGestureEvent> repeated = detector.updatePerformer(PERFORMER, samples);
            List<PerformerGestureEvent> otherPerformer = detector.updatePerformer(2, samples);

            // Then
            assertThat(repeated).isEmpty();
            assertThat(otherPerformer).extracting(PerformerGestureEvent::getType)
                    .containsExactly(PerformerGestureType.RAISE);
        }

        @Test
        @DisplayName("Should fire again once the cooldown has elapsed")
        void shouldFireAfterCooldown() {
            // Given
            detector.updatePerformer(PERFORMER, verticalMove(0L, 0.0, -0.3));

            // When
            List<PerformerGestureEvent> later = detector.updatePerformer(PERFORMER, verticalMove(900L, 0.0, -0.3));

            // Then
            assertThat(later).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.RAISE);
        }

        @Test
        @DisplayName("Should re-fire burst after its own shorter cooldown")
        void shouldApplyBurstCooldown() {
            // Given
            assertThat(detector.updatePerformer(PERFORMER, burstWindow(0L))).hasSize(1);

            // When
            List<PerformerGestureEvent> oneMillisecondEarly = detector.updatePerformer(PERFORMER, burstWindow(599L));
            List<PerformerGestureEvent> atCooldown = detector.updatePerformer(PERFORMER, burstWindow(600L));

            // Then
            assertThat(oneMillisecondEarly).isEmpty();
            assertThat(atCooldown).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.BURST);
        }

        @Test
        @DisplayName("Should hold back a repeated hold for its own longer cooldown")
        void shouldApplyHoldCooldown() {
            // Given
            assertThat(detector.updatePerformer(PERFORMER, holdWindow(0L))).hasSize(1);

            // When
            List<PerformerGestureEvent> oneMillisecondEarly = detector.updatePerformer(PERFORMER, holdWindow(1799L));
            List<PerformerGestureEvent> atCooldown = detector.updatePerformer(PERFORMER, holdWindow(1800L));

            // Then
            assertThat(oneMillisecondEarly).isEmpty();
            assertThat(atCooldown).extracting(PerformerGestureEvent::getType).containsExactly(PerformerGestureType.HOLD);
        }

        @Test
        @DisplayName("Should forget cooldowns when a performer is removed")
        void shouldResetOnRemoval() {
            // Given
            List<MotionSample> samples = verticalMove(0.0, -0.3);
            detector.updatePerformer(PERFORMER, samples);
            assertThat(detector.hasCooldownState(PERFORMER)).isTrue();

            // When
            detector.removePerformer(PERFORMER);
            detector.removePerformer(PERFORMER);

            // Then
            assertThat(detector.hasCooldownState(PERFORMER)).isFalse();
            assertThat(detector.updatePerformer(PERFORMER, samples)).hasSize(1);
        }

        @Test
        @DisplayName("Should clamp strength to one however far the threshold is exceeded")
        void shouldClampStrength() {
            PerformerGestureConfig config = new PerformerGestureConfig();
            config.setRaiseDeltaY(0.01);
            detector.setConfig(config);

            List<PerformerGestureEvent> events = detector.updatePerformer(PERFORMER, verticalMove(0.0, -0.3));

            assertThat(events).allSatisfy(event -> assertThat(event.getStrength()).isBetween(0.0, 1.0));
            assertThat(events.get(0).getStrength()).isEqualTo(1.0);
        }
    }

    private List<MotionSample> verticalMove(double fromY, double toY) {
        return verticalMove(0L, fromY, toY);
    }

    private List<MotionSample> verticalMove(long startMs, double fromY, double toY) {
        SampleHistory buffer = new SampleHistory(60);
        for (int step = 0; step <= 5; step++) {
            double y = fromY + (toY - fromY) * step / 5.0;
            buffer.addSample(PERFORMER, Vector3.of(0.0, y, 0.0), 0.2, 0.0, startMs + step * 100L);
        }
        return buffer.getHistory(PERFORMER).orElseThrow();
    }

    /** Still for 400ms, then a 0.2 jump in 100ms: peak speed 2.0 u/s. Latest sample at startMs + 500. */
    private List<MotionSample> burstWindow(long startMs) {
        SampleHistory buffer = new SampleHistory(60);
        for (int step = 0; step <= 4; step++) {
            buffer.addSample(PERFORMER, Vector3.ZERO, 0.2, 0.0, startMs + step * 100L);
        }
        buffer.addSample(PERFORMER, Vector3.of(0.2, 0.0, 0.0), 0.2, 0.0, startMs + 500L);
        return buffer.getHistory(PERFORMER).orElseThrow();
    }

    /** Motionless for 1300ms. Latest sample at startMs + 1300. */
    private List<MotionSample> holdWindow(long startMs) {
        SampleHistory buffer = new SampleHistory(60);
        for (int step = 0; step <= 13; step++) {
            buffer.addSample(PERFORMER, Vector3.of(0.5, 0.5, 0.0), 0.01, 0.0, startMs + step * 100L);
        }
        return buffer.getHistory(PERFORMER).orElseThrow();
    }

    /** Horizontal back-and-forth of the given amplitude every 50ms for 500ms. */
    private List<MotionSample> oscillation(double amplitude, double motion) {
        SampleHistory buffer = new SampleHistory(60);
        for (int step = 0; step <= 10; step++) {
            buffer.addSample(PERFORMER, Vector3.of(step % 2 == 0 ? 0.0 : amplitude, 0.0, 0.0), motion, 0.0, step * 50L);
        }
        return buffer.getHistory(PERFORMER).orElseThrow();
    }

    private List<MotionSample> horizontalMove(double toX) {
        for (int step = 0; step <= 5; step++) {
            history.addSample(PERFORMER, Vector3.of(toX * step / 5.0, 0.0, 0.0), 0.2, 0.0, step * 100L);
        }
        return history.getHistory(PERFORMER).orElseThrow();
    }
}
