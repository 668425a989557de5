package dev.nuclr.thumbgrid.view;

/**
 * Tracks whether the user is actively scrolling.
 *
 * <p>Any scroll input switches to active and restarts the quiet timer. When the
 * timer runs out the tracker goes idle and asks for exactly one render, so the
 * images held back during motion appear once it settles.
 */
public class ScrollActivityTracker {

    public static final long DEFAULT_IDLE_MS = 540;

    private final UiScheduler ui;
    private final long idleMs;
    private final RenderScheduler renderScheduler;

    private boolean active;
    private UiScheduler.Cancellable idleTimer;

    public ScrollActivityTracker(UiScheduler ui, long idleMs, RenderScheduler renderScheduler) {
        this.ui = ui;
        this.idleMs = idleMs;
        this.renderScheduler = renderScheduler;
    }

    public void markScrollActive() {
        active = true;
        if (idleTimer != null) {
            idleTimer.cancel();
        }
        idleTimer = ui.schedule(idleMs, this::markIdle);
    }

    public boolean isScrollActive() {
        return active;
    }

    public void cancel() {
        if (idleTimer != null) {
            idleTimer.cancel();
            idleTimer = null;
        }
        active = false;
    }

    private void markIdle() {
        idleTimer = null;
        active = false;
        renderScheduler.scheduleRender(1);
    }
}
