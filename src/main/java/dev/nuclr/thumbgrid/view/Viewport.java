package dev.nuclr.thumbgrid.view;

/**
 * Result of one {@link ViewportModel} computation.
 *
 * @param firstVisibleRow        topmost row intersecting the viewport
 * @param columns                cards per row, at least 1
 * @param visibleRowCount        rows to materialise, including overscan
 * @param virtualContentHeightPx height of the full virtual grid
 */
public record Viewport(int firstVisibleRow, int columns, int visibleRowCount, int virtualContentHeightPx) {

    public int firstVisibleIndex() {
        return firstVisibleRow * columns;
    }

    /** Size of the slot pool for this viewport. */
    public int slotCount() {
        return columns * visibleRowCount;
    }

    public int totalRows(int itemCount) {
        return (itemCount + columns - 1) / columns;
    }
}
