package dev.nuclr.thumbgrid.view;

/**
 * Pure geometry of the virtual grid: which rows are visible and how tall the
 * whole result set would be if it were laid out.
 */
public final class ViewportModel {

    /** Extra rows materialised below the viewport to avoid blank flashes. */
    public static final int OVERSCAN_ROWS = 2;

    private ViewportModel() {}

    public static Viewport compute(int scrollOffsetPx,
                                   int viewportWidthPx,
                                   int viewportHeightPx,
                                   int itemCount,
                                   int cardWidthPx,
                                   int cardHeightPx) {
        if (cardWidthPx <= 0 || cardHeightPx <= 0) {
            throw new IllegalArgumentException("Card size must be positive: " + cardWidthPx + "x" + cardHeightPx);
        }
        int columns = Math.max(1, Math.max(0, viewportWidthPx) / cardWidthPx);
        int firstRow = Math.max(0, scrollOffsetPx / cardHeightPx);
        int visibleRows = Math.max(1, Math.max(0, viewportHeightPx) / cardHeightPx + OVERSCAN_ROWS);
        long rows = (Math.max(0L, itemCount) + columns - 1) / columns;
        int virtualHeight = (int) Math.min(Integer.MAX_VALUE, rows * cardHeightPx);
        return new Viewport(firstRow, columns, visibleRows, virtualHeight);
    }

    /**
     * Map a point in content coordinates to a result index.
     *
     * @return the index, or -1 when the point is outside every card
     */
    public static int indexAt(int x, int contentY, int columns, int itemCount, int cardWidthPx, int cardHeightPx) {
        if (itemCount <= 0 || x < 0 || contentY < 0) return -1;
        int col = x / cardWidthPx;
        if (col >= columns) return -1;
        long idx = (long) (contentY / cardHeightPx) * columns + col;
        return idx < itemCount ? (int) idx : -1;
    }
}
