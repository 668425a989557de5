package dev.nuclr.thumbgrid.view;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ScrollActivityTrackerTest {

    private ManualUiScheduler ui;
    private AtomicInteger renders;
    private ScrollActivityTracker tracker;

    @BeforeEach
    void setUp() {
        ui = new ManualUiScheduler();
        renders = new AtomicInteger();
        RenderScheduler scheduler = new RenderScheduler(ui, 33, renders::incrementAndGet);
        tracker = new ScrollActivityTracker(ui, 500, scheduler);
    }

    @Test
    void initially_idle() {
        assertThat(tracker.isScrollActive()).isFalse();
    }

    @Test
    void markScrollActive_staysActiveUntilQuietTimeout() {
        tracker.markScrollActive();
        ui.advance(499);

        assertThat(tracker.isScrollActive()).isTrue();
        assertThat(renders.get()).isZero();

        ui.advance(1);
        assertThat(tracker.isScrollActive()).isFalse();
    }

    @Test
    void repeatedScrollInput_restartsTimerAndSettlesWithOneRender() {
        for (int i = 0; i < 10; i++) {
            tracker.markScrollActive();
            ui.advance(100);
        }
        assertThat(tracker.isScrollActive()).isTrue();
        assertThat(renders.get()).isZero();

        ui.advance(1000);

        assertThat(tracker.isScrollActive()).isFalse();
        assertThat(renders.get()).isEqualTo(1);
    }

    @Test
    void cancel_returnsToIdleWithoutRender() {
        tracker.markScrollActive();

        tracker.cancel();
        ui.advance(1000);

        assertThat(tracker.isScrollActive()).isFalse();
        assertThat(renders.get()).isZero();
    }
}
