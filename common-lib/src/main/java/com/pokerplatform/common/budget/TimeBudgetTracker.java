package com.pokerplatform.common.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Per-cycle ledger of one wall-clock deadline split across {@link BudgetComponent}s.
 *
 * <h3>Cycle lifecycle</h3>
 * <ol>
 *   <li>{@link #start()} stamps the cycle start and resets every counter.</li>
 *   <li>Stages bracket real work with {@link #startComponent}/{@link #endComponent}.</li>
 *   <li>Call sites compute downstream deadlines from {@link #remaining(BudgetComponent)}
 *       and commit them with {@link #reserve}; unused time goes back via {@link #release}.</li>
 *   <li>{@link #shouldPreempt} is the admission check: once the global deadline is gone,
 *       every stage takes its zero-time path so {@code EXECUTION} still gets to run.</li>
 * </ol>
 *
 * <h3>Overruns</h3>
 * A stage that consumes more than its remaining allocation borrows first from
 * {@code BUFFER}, then from the headroom of the stages after it. A stage that finishes
 * early refills {@code BUFFER} up to its configured size. Borrowing only changes the
 * current cycle's effective allocation; {@link #start()} restores the configured one.
 *
 * <h3>Misuse</h3>
 * Nothing here throws. Before {@link #start()}, {@code remaining} is 0, {@code reserve}
 * fails and {@code shouldPreempt} is true.
 *
 * <p>One cycle at a time per instance. Mutators are synchronized so stages running on
 * different threads can share a tracker, but two concurrent cycles cannot.
 */
public class TimeBudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(TimeBudgetTracker.class);

    public static final long DEFAULT_PREEMPT_EPSILON_MS = 1;
    public static final int DEFAULT_METRICS_WINDOW = 200;

    private final long totalBudgetMs;
    private final BudgetAllocation baseAllocation;
    private final LongSupplier clockMs;
    private final long preemptEpsilonMs;
    private final int metricsWindow;

    private Long cycleStart;
    private final Map<BudgetComponent, Long> effective    = new EnumMap<>(BudgetComponent.class);
    private final Map<BudgetComponent, Long> consumed     = new EnumMap<>(BudgetComponent.class);
    private final Map<BudgetComponent, Long> reserved     = new EnumMap<>(BudgetComponent.class);
    private final Map<BudgetComponent, Long> openBrackets = new EnumMap<>(BudgetComponent.class);
    private final Map<BudgetComponent, Deque<Long>> history = new EnumMap<>(BudgetComponent.class);

    public TimeBudgetTracker() {
        this(BudgetAllocation.DEFAULT_TOTAL_BUDGET_MS, BudgetAllocation.DEFAULTS);
    }

    public TimeBudgetTracker(long totalBudgetMs, BudgetAllocation allocation) {
        this(totalBudgetMs, allocation, () -> System.nanoTime() / 1_000_000L,
             DEFAULT_PREEMPT_EPSILON_MS, DEFAULT_METRICS_WINDOW);
    }

    public TimeBudgetTracker(long totalBudgetMs, BudgetAllocation allocation, LongSupplier clockMs,
                             long preemptEpsilonMs, int metricsWindow) {
        this.totalBudgetMs    = Math.max(0, totalBudgetMs);
        this.baseAllocation   = allocation != null ? allocation : BudgetAllocation.DEFAULTS;
        this.clockMs          = clockMs;
        this.preemptEpsilonMs = Math.max(0, preemptEpsilonMs);
        this.metricsWindow    = Math.max(1, metricsWindow);
        for (BudgetComponent component : BudgetComponent.values()) {
            history.put(component, new ArrayDeque<>());
        }
        resetCycle();
        if (!this.baseAllocation.fitsWithin(this.totalBudgetMs)) {
            log.warn("[TimeBudgetTracker] allocation sum={}ms exceeds total={}ms; global deadline will cap stages",
                this.baseAllocation.sum(), this.totalBudgetMs);
        }
    }

    // ── cycle lifecycle ───────────────────────────────────────────────────────

    /** Begins a new cycle. Discards all accounting from the previous one. */
    public synchronized void start() {
        resetCycle();
        cycleStart = now();
    }

    public synchronized boolean isStarted() {
        return cycleStart != null;
    }

    public synchronized void startComponent(BudgetComponent component) {
        if (cycleStart == null) {
            log.debug("[TimeBudgetTracker] startComponent({}) before start(); ignored", component);
            return;
        }
        openBrackets.put(component, now());
    }

    /**
     * Closes the bracket opened by {@link #startComponent} and charges the elapsed time.
     *
     * @return measured milliseconds, or 0 when no bracket was open
     */
    public synchronized long endComponent(BudgetComponent component) {
        Long startedAt = openBrackets.remove(component);
        if (startedAt == null) {
            return 0;
        }
        long duration = Math.max(0, now() - startedAt);
        recordActual(component, duration);
        return duration;
    }

    /**
     * Charges {@code durationMs} to {@code component} as if it had been measured.
     * Pending reservations are drawn down first.
     */
    public synchronized void recordActual(BudgetComponent component, long durationMs) {
        if (cycleStart == null || durationMs < 0) {
            return;
        }
        long limit = effective.get(component);
        long used = consumed.get(component);
        long remainingBefore = Math.max(0, limit - used);

        long pending = reserved.get(component);
        reserved.put(component, pending - Math.min(pending, durationMs));
        consumed.put(component, used + durationMs);
        pushSample(component, durationMs);

        if (component == BudgetComponent.BUFFER) {
            return;
        }
        if (durationMs > remainingBefore) {
            absorbOverrun(component, durationMs - remainingBefore);
        } else {
            returnToBuffer(remainingBefore - durationMs);
        }
    }

    // ── queries ───────────────────────────────────────────────────────────────

    public synchronized long elapsed() {
        if (cycleStart == null) {
            return 0;
        }
        return Math.max(0, now() - cycleStart);
    }

    /** Global time left in the cycle. */
    public synchronized long remaining() {
        if (cycleStart == null) {
            return 0;
        }
        return Math.max(0, totalBudgetMs - elapsed());
    }

    /**
     * Time the stage may still use: its own unused, unreserved allocation, capped by the
     * time left in the whole cycle.
     */
    public synchronized long remaining(BudgetComponent component) {
        if (cycleStart == null) {
            return 0;
        }
        long own = Math.max(0, effective.get(component) - consumed.get(component) - reserved.get(component));
        return Math.min(own, remaining());
    }

    /**
     * Commits {@code durationMs} to an upcoming call on {@code component}.
     *
     * @return true only when the whole requested amount fits; nothing is committed otherwise
     */
    public synchronized boolean reserve(BudgetComponent component, long durationMs) {
        if (cycleStart == null) {
            return false;
        }
        if (durationMs <= 0) {
            return true;
        }
        if (remaining(component) < durationMs) {
            return false;
        }
        reserved.merge(component, durationMs, Long::sum);
        return true;
    }

    /**
     * Gives unused time back to {@code component}: pending reservation first, then
     * consumption. Neither counter goes below zero.
     */
    public synchronized void release(BudgetComponent component, long durationMs) {
        if (cycleStart == null || durationMs <= 0) {
            return;
        }
        long pending = reserved.get(component);
        long fromPending = Math.min(pending, durationMs);
        reserved.put(component, pending - fromPending);
        long rest = durationMs - fromPending;
        if (rest > 0) {
            consumed.put(component, Math.max(0, consumed.get(component) - rest));
        }
    }

    /**
     * True when the cycle deadline is gone (or within the epsilon of it), or no cycle
     * has been started. The component is then expected to take its zero-time path.
     */
    public synchronized boolean shouldPreempt(BudgetComponent component) {
        if (cycleStart == null) {
            return true;
        }
        return elapsed() + preemptEpsilonMs >= totalBudgetMs;
    }

    public synchronized long consumed(BudgetComponent component) {
        return consumed.get(component);
    }

    public long totalBudgetMs() {
        return totalBudgetMs;
    }

    public BudgetAllocation baseAllocation() {
        return baseAllocation;
    }

    /** Effective allocation for the current cycle, after any borrowing. */
    public synchronized BudgetAllocation allocationSnapshot() {
        return BudgetAllocation.fromMap(effective);
    }

    /** Latency percentiles over the last {@value #DEFAULT_METRICS_WINDOW} (by default) samples. */
    public synchronized BudgetMetrics metricsSnapshot(BudgetComponent component) {
        Deque<Long> samples = history.get(component);
        if (samples.isEmpty()) {
            return BudgetMetrics.EMPTY;
        }
        List<Long> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        return new BudgetMetrics(
            sorted.size(),
            percentile(sorted, 50),
            percentile(sorted, 95),
            percentile(sorted, 99),
            samples.peekLast());
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private void resetCycle() {
        cycleStart = null;
        openBrackets.clear();
        for (BudgetComponent component : BudgetComponent.values()) {
            effective.put(component, baseAllocation.get(component));
            consumed.put(component, 0L);
            reserved.put(component, 0L);
        }
    }

    private void absorbOverrun(BudgetComponent component, long overrun) {
        long left = overrun;
        long buffer = effective.get(BudgetComponent.BUFFER);
        long fromBuffer = Math.min(buffer, left);
        effective.put(BudgetComponent.BUFFER, buffer - fromBuffer);
        left -= fromBuffer;

        BudgetComponent[] order = BudgetComponent.values();
        for (int i = component.ordinal() + 1; i < order.length && left > 0; i++) {
            BudgetComponent downstream = order[i];
            if (downstream == BudgetComponent.BUFFER) {
                continue;
            }
            long limit = effective.get(downstream);
            long headroom = Math.max(0, limit - consumed.get(downstream));
            long taken = Math.min(headroom, left);
            effective.put(downstream, limit - taken);
            left -= taken;
        }
        if (left > 0) {
            log.warn("[TimeBudgetTracker] overrun not covered by downstream budgets. component={} uncoveredMs={}",
                component, left);
        }
    }

    private void returnToBuffer(long surplus) {
        if (surplus <= 0) {
            return;
        }
        long buffer = effective.get(BudgetComponent.BUFFER);
        long headroom = Math.max(0, baseAllocation.buffer() - buffer);
        effective.put(BudgetComponent.BUFFER, buffer + Math.min(surplus, headroom));
    }

    private void pushSample(BudgetComponent component, long durationMs) {
        Deque<Long> samples = history.get(component);
        samples.addLast(durationMs);
        while (samples.size() > metricsWindow) {
            samples.removeFirst();
        }
    }

    private long now() {
        return clockMs.getAsLong();
    }

    static double percentile(List<Long> sorted, int p) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        double rank = (p / 100.0) * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted.get(lower);
        }
        double weight = rank - lower;
        return sorted.get(lower) * (1 - weight) + sorted.get(upper) * weight;
    }
}
