package com.pokerplatform.orchestrator.controller;

import com.pokerplatform.common.health.HealthSnapshot;
import com.pokerplatform.orchestrator.health.HealthMonitor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthMonitor healthMonitor;

    public HealthController(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    /** Latest snapshot, or 204 before the first tick. */
    @GetMapping
    public ResponseEntity<HealthSnapshot> latest() {
        HealthSnapshot snapshot = healthMonitor.getLatestSnapshot();
        return snapshot != null ? ResponseEntity.ok(snapshot) : ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<HealthSnapshot> stream() {
        return healthMonitor.snapshots();
    }
}
