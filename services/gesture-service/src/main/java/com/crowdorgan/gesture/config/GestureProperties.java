package com.crowdorgan.gesture.config;

import com.crowdorgan.gesture.detector.PerformerGestureConfig;
import com.crowdorgan.gesture.detector.RoomGestureConfig;
import com.crowdorgan.gesture.detector.ZoneGestureConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gesture Detection Properties
 *
 * <p>Binds every detector threshold, window and cooldown plus the orchestrator and topic
 * settings from {@code application.yml}. Defaults match the installation's tuned values, so an
 * empty {@code gesture:} block runs the stock vocabulary.
 *
 * <pre>
 * gesture:
 *   history:
 *     capacity: 60
 *   performer:
 *     raise-delta-y: 0.18
 *     gesture-cooldown-ms: 900
 *   zone:
 *     sweep-min-steps: 3
 *   room:
 *     stillness-min-voices: 3
 *   orchestrator:
 *     tick-interval-ms: 16
 *     sending-enabled: true
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gesture")
public class GestureProperties {

    @Valid
    private History history = new History();

    @Valid
    private PerformerGestureConfig performer = new PerformerGestureConfig();

    @Valid
    private ZoneGestureConfig zone = new ZoneGestureConfig();

    @Valid
    private RoomGestureConfig room = new RoomGestureConfig();

    @Valid
    private Orchestrator orchestrator = new Orchestrator();

    @Valid
    private Topics topics = new Topics();

    @Data
    public static class History {
        /**
         * Samples kept per performer (60 frames is one second at 60 fps)
         */
        @Min(1)
        private int capacity = 60;
    }

    @Data
    public static class Orchestrator {
        /**
         * Interval between processing ticks
         */
        @Positive
        private long tickIntervalMs = 16;

        /**
         * Performers silent for longer than this are forgotten
         */
        @Positive
        private long performerStaleMs = 2500;

        /**
         * Cameras silent for longer than this are forgotten
         */
        @Positive
        private long cameraStaleMs = 5000;

        /**
         * When false gestures are still detected, logged and counted but not published
         */
        private boolean sendingEnabled = true;
    }

    @Data
    public static class Topics {
        @NotBlank
        private String performerState = "room-performer-state";

        @NotBlank
        private String performerDisconnect = "room-performer-disconnect";

        @NotBlank
        private String cameraZones = "room-camera-zones";

        @NotBlank
        private String globalMotion = "room-global-motion";

        @NotBlank
        private String performerGestures = "gesture-performer-events";

        @NotBlank
        private String zoneGestures = "gesture-zone-events";

        @NotBlank
        private String roomGestures = "gesture-room-events";
    }
}
