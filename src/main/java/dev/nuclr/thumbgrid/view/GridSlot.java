package dev.nuclr.thumbgrid.view;

import lombok.Getter;

import java.awt.image.BufferedImage;

/**
 * One reusable card of the slot pool. Positions are in content coordinates
 * (the full virtual grid), not viewport coordinates.
 */
@Getter
public final class GridSlot {

    private final int slot;

    private SlotState state = SlotState.HIDDEN;
    private int index = -1;
    private int x;
    private int y;
    private int width;
    private int height;
    private String path;
    private BufferedImage image;

    GridSlot(int slot) {
        this.slot = slot;
    }

    void hide() {
        state = SlotState.HIDDEN;
        index = -1;
        path = null;
        image = null;
    }

    void bind(int index, String path, int x, int y, int width, int height) {
        this.index = index;
        this.path = path;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    void showImage(BufferedImage image) {
        this.image = image;
        this.state = SlotState.IMAGE;
    }

    void showPlaceholder(SlotState placeholder) {
        this.image = null;
        this.state = placeholder;
    }

    public boolean isVisible() {
        return state != SlotState.HIDDEN;
    }
}
