package dev.nuclr.thumbgrid.view;

public enum SlotState {
    /** No result at this position. */
    HIDDEN,
    /** Thumbnail requested or held back while scrolling. */
    LOADING,
    /** Thumbnail image shown. */
    IMAGE,
    /** Source had nothing usable. */
    UNAVAILABLE
}
