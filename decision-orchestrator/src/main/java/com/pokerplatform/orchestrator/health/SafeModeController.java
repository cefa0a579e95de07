package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.SafeModeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Process-wide safe-mode latch.
 *
 * <ul>
 *   <li>{@link #enter} only transitions from inactive; the first reason is kept.</li>
 *   <li>{@link #exit} clears an automatic entry, but a manual entry needs {@code exit(true)}.</li>
 * </ul>
 *
 * <p>Thread-safe: the monitor tick, panic stop and operator endpoints may race.
 */
public class SafeModeController {

    private static final Logger log = LoggerFactory.getLogger(SafeModeController.class);

    private final Clock clock;
    private SafeModeState state = SafeModeState.INACTIVE;

    public SafeModeController(Clock clock) {
        this.clock = clock;
    }

    public void enter(String reason) {
        enter(reason, false);
    }

    public synchronized void enter(String reason, boolean manual) {
        if (state.active()) {
            return;
        }
        state = new SafeModeState.Active(reason != null ? reason : "unspecified", clock.instant(), manual);
        log.warn("[SafeMode] entered. reason={} manual={}", reason, manual);
    }

    public void exit() {
        exit(false);
    }

    public synchronized void exit(boolean manual) {
        if (!(state instanceof SafeModeState.Active active)) {
            return;
        }
        if (active.manual() && !manual) {
            log.debug("[SafeMode] automatic exit ignored; manual safe mode requires manual exit. reason={}",
                active.reason());
            return;
        }
        state = SafeModeState.INACTIVE;
        log.info("[SafeMode] exited. previousReason={} manual={}", active.reason(), manual);
    }

    public synchronized boolean isActive() {
        return state.active();
    }

    public synchronized SafeModeState getState() {
        return state;
    }
}
