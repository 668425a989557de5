package dev.nuclr.thumbgrid.view;

import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces render triggers (scroll, resize, data updates) into one pending
 * render and caps the render rate.
 *
 * <p>Every trigger re-arms the single pending timer for
 * {@code max(lastRender + minInterval, min(now + delay, burstStart + maxDeferral))},
 * so the latest trigger wins, renders never run closer than
 * {@code minInterval}, and a steady stream of triggers still renders at least
 * once per {@code maxDeferral}.
 *
 * <p>UI thread only.
 */
@Slf4j
public class RenderScheduler {

    public static final long DEFAULT_MAX_DEFERRAL_MS = 250;

    private final UiScheduler ui;
    private final long minIntervalMs;
    private final long maxDeferralMs;
    private final Runnable render;

    private UiScheduler.Cancellable pending;
    private long lastScheduledAt;
    private long lastRenderAt = Long.MIN_VALUE / 2;
    private long burstStartedAt;
    private int renderCount;

    public RenderScheduler(UiScheduler ui, long minIntervalMs, Runnable render) {
        this(ui, minIntervalMs, DEFAULT_MAX_DEFERRAL_MS, render);
    }

    public RenderScheduler(UiScheduler ui, long minIntervalMs, long maxDeferralMs, Runnable render) {
        if (minIntervalMs < 0) throw new IllegalArgumentException("minIntervalMs must be >= 0");
        this.ui = ui;
        this.minIntervalMs = minIntervalMs;
        this.maxDeferralMs = Math.max(minIntervalMs, maxDeferralMs);
        this.render = render;
    }

    /**
     * Request a render no earlier than {@code minDelayMs} from now.
     * Delays of 1 ms or less mean "as soon as the rate limit allows".
     */
    public void scheduleRender(long minDelayMs) {
        long now = ui.nowMillis();
        long delay = minDelayMs <= 1 ? 0 : minDelayMs;

        if (pending == null) {
            burstStartedAt = now;
        } else {
            pending.cancel();
            pending = null;
        }

        long wanted = Math.min(now + delay, burstStartedAt + maxDeferralMs);
        long target = Math.max(wanted, lastRenderAt + minIntervalMs);
        lastScheduledAt = target;
        pending = ui.schedule(Math.max(0, target - now), this::fire);
    }

    public boolean isPending() {
        return pending != null;
    }

    /** Time the pending (or last) render was scheduled for. */
    public long lastScheduledAt() {
        return lastScheduledAt;
    }

    public int renderCount() {
        return renderCount;
    }

    public void cancel() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    private void fire() {
        pending = null;
        lastRenderAt = ui.nowMillis();
        renderCount++;
        try {
            render.run();
        } catch (RuntimeException e) {
            log.error("Render pass failed", e);
        }
    }
}
