package com.pokerplatform.orchestrator.health;

import com.pokerplatform.common.health.PanicStopReason;
import com.pokerplatform.common.health.PanicStopType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latched panic stop. The first {@link #trigger} wins and also puts safe mode on with
 * reason {@code panic:<type>}; later triggers are ignored until {@link #reset()}.
 *
 * <p>{@link #reset()} clears only the panic latch. Safe mode stays on until an operator,
 * or the health monitor's healthy streak, exits it.
 */
public class PanicStopController implements PanicTrigger {

    private static final Logger log = LoggerFactory.getLogger(PanicStopController.class);

    private final SafeModeController safeMode;
    private final Clock clock;
    private final AtomicReference<PanicStopReason> reason = new AtomicReference<>();

    public PanicStopController(SafeModeController safeMode, Clock clock) {
        this.safeMode = safeMode;
        this.clock = clock;
    }

    @Override
    public void trigger(PanicStopType type, String detail) {
        trigger(new PanicStopReason(type, detail, clock.instant()));
    }

    public void trigger(PanicStopReason panicReason) {
        if (panicReason == null || !reason.compareAndSet(null, panicReason)) {
            return;
        }
        log.error("[PanicStop] triggered. type={} detail={}", panicReason.type().wireName(), panicReason.detail());
        safeMode.enter("panic:" + panicReason.type().wireName(), false);
    }

    public void reset() {
        PanicStopReason previous = reason.getAndSet(null);
        if (previous != null) {
            log.info("[PanicStop] reset. previousType={} safeModeActive={}",
                previous.type().wireName(), safeMode.isActive());
        }
    }

    public boolean isActive() {
        return reason.get() != null;
    }

    public Optional<PanicStopReason> getReason() {
        return Optional.ofNullable(reason.get());
    }
}
