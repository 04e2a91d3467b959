package com.crowdorgan.gesture.controller;

import com.crowdorgan.gesture.service.GestureOrchestrator;
import com.crowdorgan.gesture.service.GestureStatusSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only operator view of the detection loop
 */
@RestController
@RequestMapping("/api/v1/gestures")
@RequiredArgsConstructor
public class GestureStatusController {

    private final GestureOrchestrator orchestrator;

    @GetMapping("/status")
    public ResponseEntity<GestureStatusSnapshot> getStatus() {
        return ResponseEntity.ok(orchestrator.status());
    }
}
