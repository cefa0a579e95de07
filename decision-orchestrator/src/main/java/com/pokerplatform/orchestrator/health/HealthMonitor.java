package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.HealthAggregator;
import com.pokerplatform.common.health.HealthSnapshot;
import com.pokerplatform.common.health.HealthState;
import com.pokerplatform.common.health.HealthStatus;
import com.pokerplatform.common.health.SafeModeState;
import com.pokerplatform.orchestrator.config.HealthMonitoringSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Periodic health tick that drives safe mode.
 *
 * <p>Every {@code health.interval-ms} the monitor runs each registered {@link HealthCheck},
 * folds the statuses into one overall state and publishes a {@link HealthSnapshot}. Only
 * the latest snapshot is retained; subscribers of {@link #snapshots()} see every one.
 *
 * <p>A non-healthy tick puts safe mode on with reason {@code health:<overall>} unless a
 * panic stop already owns it. {@code autoExitHealthyStreak} healthy ticks in a row take an
 * automatic safe mode back off; a manual one is left to the operator.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthMonitoringSettings settings;
    private final SafeModeController safeMode;
    private final PanicStopController panicStop;
    private final Clock clock;

    private final List<Map.Entry<String, HealthCheck>> checks = new CopyOnWriteArrayList<>();
    private final Sinks.Many<HealthSnapshot> sink = Sinks.many().multicast().directBestEffort();

    private volatile HealthSnapshot latest;
    private Disposable ticker;
    private int degradedStreak;
    private int healthyStreak;

    public HealthMonitor(HealthMonitoringSettings settings, SafeModeController safeMode,
                         PanicStopController panicStop, Clock clock) {
        this.settings  = settings;
        this.safeMode  = safeMode;
        this.panicStop = panicStop;
        this.clock     = clock;
    }

    public void registerCheck(String name, HealthCheck check) {
        checks.add(Map.entry(name, check));
        log.info("[HealthMonitor] check registered. name={}", name);
    }

    public synchronized void start() {
        if (ticker != null && !ticker.isDisposed()) {
            return;
        }
        Duration interval = Duration.ofMillis(Math.max(1, settings.intervalMs()));
        ticker = Flux.interval(Duration.ZERO, interval)
            .onBackpressureDrop()
            .subscribe(
                tick -> runChecks(),
                err -> log.error("[HealthMonitor] tick loop terminated. reason={}", err.getMessage(), err));
        log.info("[HealthMonitor] started. intervalMs={} checks={} safeModeEnabled={}",
            interval.toMillis(), checks.size(), settings.safeMode().enabled());
    }

    public synchronized void stop() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
            log.info("[HealthMonitor] stopped.");
        }
    }

    public HealthSnapshot getLatestSnapshot() {
        return latest;
    }

    /** Every snapshot produced from now on. Slow subscribers miss ticks rather than stall the monitor. */
    public Flux<HealthSnapshot> snapshots() {
        return sink.asFlux();
    }

    /** One monitoring tick. */
    synchronized HealthSnapshot runChecks() {
        Instant now = clock.instant();
        List<HealthStatus> statuses = new ArrayList<>(checks.size());
        for (Map.Entry<String, HealthCheck> entry : checks) {
            statuses.add(runCheck(entry.getKey(), entry.getValue(), now));
        }

        HealthState overall = HealthAggregator.computeOverallHealth(statuses);
        HealthSnapshot snapshot = new HealthSnapshot(
            UUID.randomUUID().toString(),
            overall,
            statuses,
            safeMode.getState(),
            panicStop.getReason().orElse(null),
            now);
        latest = snapshot;

        applyTransitions(overall);
        sink.tryEmitNext(snapshot);
        return snapshot;
    }

    private HealthStatus runCheck(String name, HealthCheck check, Instant now) {
        try {
            HealthStatus status = check.run();
            if (status == null) {
                return HealthStatus.checkFailed(name, now, new IllegalStateException("check returned no status"));
            }
            return status.withDefaults(name, now);
        } catch (Exception e) {
            log.warn("[HealthMonitor] check failed. name={} reason={}", name, e.getMessage());
            return HealthStatus.checkFailed(name, now, e);
        }
    }

    private void applyTransitions(HealthState overall) {
        if (!settings.safeMode().enabled()) {
            return;
        }
        if (overall != HealthState.HEALTHY) {
            degradedStreak++;
            healthyStreak = 0;
            if (!panicStop.isActive()) {
                safeMode.enter("health:" + overall.wireName(), false);
            }
            log.debug("[HealthMonitor] unhealthy tick. overall={} degradedStreak={}", overall.wireName(), degradedStreak);
            return;
        }
        healthyStreak++;
        degradedStreak = 0;
        HealthMonitoringSettings.SafeMode config = settings.safeMode();
        if (config.autoExit()
                && healthyStreak >= config.autoExitHealthyStreak()
                && safeMode.getState() instanceof SafeModeState.Active active
                && !active.manual()) {
            log.info("[HealthMonitor] healthy streak reached, leaving safe mode. healthyStreak={}", healthyStreak);
            safeMode.exit(false);
        }
    }

    int degradedStreak() {
        return degradedStreak;
    }

    int healthyStreak() {
        return healthyStreak;
    }
}
