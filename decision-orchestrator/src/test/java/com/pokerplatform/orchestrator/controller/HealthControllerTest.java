package com.pokerplatform.orchestrator.controller;

import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.health.HealthStatus;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import com.pokerplatform.orchestrator.health.HealthMonitor;
import com.pokerplatform.orchestrator.health.PanicStopController;
import com.pokerplatform.orchestrator.health.SafeModeController;
import com.pokerplatform.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

class HealthControllerTest {

    private HealthMonitor monitor;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atEpoch();
        SafeModeController safeMode = new SafeModeController(clock);
        PanicStopController panicStop = new PanicStopController(safeMode, clock);
        monitor = new HealthMonitor(HealthMonitoringSettings.defaults(), safeMode, panicStop, clock);
        monitor.registerCheck("solver", () ->
            new HealthStatus("solver", HealthState.DEGRADED, clock.instant(), "solver stats stale", Map.of(), 3));
        client = WebTestClient.bindToController(new HealthController(monitor)).build();
    }

    @Test
    @DisplayName("before the first tick → 204")
    void noSnapshotYet() {
        client.get().uri("/api/v1/health")
            .exchange()
            .expectStatus().isNoContent();
    }

    @Test
    @DisplayName("latest snapshot is served with lowercase states")
    void latestSnapshot() throws InterruptedException {
        monitor.start();
        try {
            long deadline = System.currentTimeMillis() + 2000;
            while (monitor.getLatestSnapshot() == null && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            client.get().uri("/api/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.overall").isEqualTo("degraded")
                .jsonPath("$.statuses[0].component").isEqualTo("solver")
                .jsonPath("$.statuses[0].consecutiveFailures").isEqualTo(3);
        } finally {
            monitor.stop();
        }
    }
}
