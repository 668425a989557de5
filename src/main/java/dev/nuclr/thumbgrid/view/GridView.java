package dev.nuclr.thumbgrid.view;

/**
 * What the controller needs from the component that shows the grid.
 * All methods are called on the UI thread.
 */
public interface GridView {

    int viewportWidth();

    int viewportHeight();

    /** Current vertical scroll offset in pixels. */
    int scrollOffset();

    void scrollTo(int offsetPx);

    /** Size of the scrollable virtual content. */
    void setContentSize(int widthPx, int heightPx);

    /** Slots changed; repaint. */
    void slotsUpdated();
}
