package com.crowdorgan.gesture.detector;

import com.crowdorgan.gesture.domain.MotionSample;
import com.crowdorgan.gesture.domain.PerformerGestureEvent;
import com.crowdorgan.gesture.domain.PerformerGestureType;
import com.crowdorgan.gesture.domain.Vector3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.crowdorgan.gesture.detector.GestureMath.MIN_DENOMINATOR;
import static com.crowdorgan.gesture.detector.GestureMath.clamp01;

/**
 * Names what a single performer just did from the trailing window of their motion history.
 *
 * <p>Every call aggregates the window once (extents, average motion, peak speed, direction
 * flips) and then evaluates each rule independently, so several gestures may fire in the same
 * tick. Each (performer, gesture type) pair has its own cooldown.
 *
 * <p>Rules:
 * <ul>
 *   <li>raise / lower: vertical travel past {@code raiseDeltaY} / {@code lowerDeltaY} with a
 *       narrow horizontal footprint</li>
 *   <li>swipe_left / swipe_right: dominant horizontal travel with little vertical drift</li>
 *   <li>shake: small footprint, enough motion and enough direction flips</li>
 *   <li>burst: peak instantaneous speed above the threshold</li>
 *   <li>hold: sustained low motion for {@code holdDurationMs}</li>
 * </ul>
 */
public class PerformerGestureDetector {

    /** Fraction of {@code shakeMinMotion} a velocity component must exceed to count as a direction. */
    private static final double SIGN_FLIP_DEAD_ZONE = 0.25;

    private PerformerGestureConfig config;
    private final CooldownLedger<PerformerGestureType> cooldowns = new CooldownLedger<>();

    public PerformerGestureDetector() {
        this(new PerformerGestureConfig());
    }

    public PerformerGestureDetector(PerformerGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setConfig(PerformerGestureConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Evaluate the gesture rules against a performer's history, oldest sample first.
     *
     * @return events fired this call, in rule order; empty when the window is too short
     */
    public List<PerformerGestureEvent> updatePerformer(int performerId, List<MotionSample> samples) {
        if (samples == null || samples.size() < 2) {
            return Collections.emptyList();
        }

        MotionSample latest = samples.get(samples.size() - 1);
        long now = latest.getTimestamp();
        long minTimestamp = GestureMath.windowStart(now, config.getMaxWindowMs());

        int startIdx = 0;
        for (int i = 0; i < samples.size(); i++) {
            if (samples.get(i).getTimestamp() >= minTimestamp) {
                startIdx = i;
                break;
            }
        }

        MotionSample startSample = samples.get(startIdx);
        if (now - startSample.getTimestamp() < config.getMinWindowMs()) {
            return Collections.emptyList();
        }

        WindowFeatures features = analyze(samples, startIdx);
        List<PerformerGestureEvent> events = new ArrayList<>();

        detectRaise(performerId, features, now, events);
        detectLower(performerId, features, now, events);
        detectSwipe(performerId, features, now, events);
        detectShake(performerId, features, now, events);
        detectBurst(performerId, features, now, events);
        detectHold(performerId, samples, startIdx, features, now, events);

        return events;
    }

    public void removePerformer(int performerId) {
        cooldowns.remove(performerId);
    }

    public boolean hasCooldownState(int performerId) {
        return cooldowns.contains(performerId);
    }

    private WindowFeatures analyze(List<MotionSample> samples, int startIdx) {
        MotionSample start = samples.get(startIdx);
        MotionSample latest = samples.get(samples.size() - 1);

        double minX = start.getPosition().getX();
        double maxX = minX;
        double minY = start.getPosition().getY();
        double maxY = minY;
        double cumulativeMotion = 0.0;
        double maxSpeed = 0.0;

        double deadZone = config.getShakeMinMotion() * SIGN_FLIP_DEAD_ZONE;
        int signFlips = 0;
        int prevSignX = 0;
        int prevSignY = 0;

        for (int i = startIdx; i < samples.size(); i++) {
            MotionSample sample = samples.get(i);
            Vector3 position = sample.getPosition();
            Vector3 velocity = sample.getVelocity();

            minX = Math.min(minX, position.getX());
            maxX = Math.max(maxX, position.getX());
            minY = Math.min(minY, position.getY());
            maxY = Math.max(maxY, position.getY());
            cumulativeMotion += sample.getMotion();
            maxSpeed = Math.max(maxSpeed, velocity.length());

            // the first sample's velocity points back outside the window
            if (i == startIdx) {
                continue;
            }
            if (Math.abs(velocity.getX()) > deadZone) {
                int sign = velocity.getX() >= 0.0 ? 1 : -1;
                if (prevSignX != 0 && sign != prevSignX) {
                    signFlips++;
                }
                prevSignX = sign;
            }
            if (Math.abs(velocity.getY()) > deadZone) {
                int sign = velocity.getY() >= 0.0 ? 1 : -1;
                if (prevSignY != 0 && sign != prevSignY) {
                    signFlips++;
                }
                prevSignY = sign;
            }
        }

        Vector3 displacement = latest.getPosition().subtract(start.getPosition());
        return new WindowFeatures(
                displacement.getX(),
                displacement.getY(),
                maxX - minX,
                maxY - minY,
                cumulativeMotion / (samples.size() - startIdx),
                maxSpeed,
                signFlips,
                latest.getPosition().getY());
    }

    private void detectRaise(int performerId, WindowFeatures f, long now, List<PerformerGestureEvent> events) {
        if (f.deltaY <= -config.getRaiseDeltaY() && f.horizontalSpan <= config.getRaiseHorizontalLimit()) {
            fire(performerId, PerformerGestureType.RAISE, now, config.getGestureCooldownMs(),
                    clamp01(-f.deltaY / config.getRaiseDeltaY()), f.finalY, events);
        }
    }

    private void detectLower(int performerId, WindowFeatures f, long now, List<PerformerGestureEvent> events) {
        if (f.deltaY >= config.getLowerDeltaY() && f.horizontalSpan <= config.getRaiseHorizontalLimit()) {
            fire(performerId, PerformerGestureType.LOWER, now, config.getGestureCooldownMs(),
                    clamp01(f.deltaY / config.getLowerDeltaY()), f.finalY, events);
        }
    }

    private void detectSwipe(int performerId, WindowFeatures f, long now, List<PerformerGestureEvent> events) {
        double absDeltaX = Math.abs(f.deltaX);
        double absDeltaY = Math.abs(f.deltaY);
        if (absDeltaX >= config.getSwipeDeltaX()
                && absDeltaX > absDeltaY * config.getSwipeOrthogonality()
                && absDeltaY <= config.getSwipeVerticalLimit()) {
            PerformerGestureType type = f.deltaX < 0.0 ? PerformerGestureType.SWIPE_LEFT : PerformerGestureType.SWIPE_RIGHT;
            fire(performerId, type, now, config.getGestureCooldownMs(),
                    clamp01(absDeltaX / config.getSwipeDeltaX()), 0.0, events);
        }
    }

    private void detectShake(int performerId, WindowFeatures f, long now, List<PerformerGestureEvent> events) {
        double radius = Math.max(f.horizontalSpan, f.verticalSpan);
        if (radius <= config.getShakeRadius()
                && f.avgMotion >= config.getShakeMinMotion()
                && f.signFlips >= config.getShakeMinSignFlips()) {
            fire(performerId, PerformerGestureType.SHAKE, now, config.getGestureCooldownMs(),
                    clamp01(f.avgMotion / (config.getShakeMinMotion() * 2.0)), 0.0, events);
        }
    }

    private void detectBurst(int performerId, WindowFeatures f, long now, List<PerformerGestureEvent> events) {
        if (f.maxSpeed >= config.getBurstSpeedThreshold()) {
            double denominator = Math.max(MIN_DENOMINATOR, config.getBurstMaxSpeed() - config.getBurstSpeedThreshold());
            fire(performerId, PerformerGestureType.BURST, now, config.getBurstCooldownMs(),
                    clamp01((f.maxSpeed - config.getBurstSpeedThreshold()) / denominator), 0.0, events);
        }
    }

    private void detectHold(int performerId, List<MotionSample> samples, int startIdx, WindowFeatures f,
                            long now, List<PerformerGestureEvent> events) {
        // most recent sample that was still moving; the whole window counts when none was
        long holdStart = samples.get(startIdx).getTimestamp();
        for (int i = samples.size() - 1; i >= startIdx; i--) {
            if (samples.get(i).getMotion() > config.getHoldMotionThreshold()) {
                holdStart = samples.get(i).getTimestamp();
                break;
            }
        }
        long holdDuration = now - holdStart;

        if (f.avgMotion <= config.getHoldMotionThreshold() && holdDuration >= config.getHoldDurationMs()) {
            double denominator = Math.max(MIN_DENOMINATOR, config.getHoldMotionThreshold());
            fire(performerId, PerformerGestureType.HOLD, now, config.getHoldCooldownMs(),
                    clamp01(1.0 - f.avgMotion / denominator),
                    clamp01((double) holdDuration / config.getHoldDurationMs()),
                    events);
        }
    }

    private void fire(int performerId, PerformerGestureType type, long now, long cooldownMs,
                      double strength, double extra, List<PerformerGestureEvent> events) {
        if (!cooldowns.canTrigger(performerId, type, now, cooldownMs)) {
            return;
        }
        cooldowns.record(performerId, type, now);
        events.add(PerformerGestureEvent.builder()
                .performerId(performerId)
                .type(type)
                .strength(strength)
                .extra(extra)
                .build());
    }

    private record WindowFeatures(double deltaX, double deltaY, double horizontalSpan, double verticalSpan,
                                  double avgMotion, double maxSpeed, int signFlips, double finalY) {
    }
}
