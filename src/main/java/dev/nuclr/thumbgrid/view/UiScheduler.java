package dev.nuclr.thumbgrid.view;

/**
 * Clock and one-shot timers of the UI thread. Tasks run on the UI thread.
 */
public interface UiScheduler {

    /** Monotonic time in milliseconds. */
    long nowMillis();

    /** Run {@code task} once after {@code delayMs}. */
    Cancellable schedule(long delayMs, Runnable task);

    interface Cancellable {
        void cancel();
    }
}
