package dev.nuclr.thumbgrid.view;

import javax.swing.Timer;

/**
 * {@link UiScheduler} on top of non-repeating {@link Timer}s, which fire on the EDT.
 */
public final class SwingUiScheduler implements UiScheduler {

    @Override
    public long nowMillis() {
        return System.nanoTime() / 1_000_000L;
    }

    @Override
    public Cancellable schedule(long delayMs, Runnable task) {
        Timer timer = new Timer((int) Math.max(0, Math.min(delayMs, Integer.MAX_VALUE)), e -> task.run());
        timer.setRepeats(false);
        timer.start();
        return timer::stop;
    }
}
