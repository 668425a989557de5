package dev.nuclr.thumbgrid.view;

import dev.nuclr.thumbgrid.pipeline.CoverCrop;

/**
 * Fixed layout of one grid card: a preview area exactly the size of a
 * generated thumbnail, one line of path text below it, and padding around both.
 */
public record CardGeometry(int cardWidth, int cardHeight, int padding, int previewWidth, int previewHeight) {

    public static final int PADDING = 8;
    static final int PREVIEW_INSET = 16;
    static final int TEXT_HEIGHT = 38;
    static final int CHROME_HEIGHT = 24;

    /**
     * @param thumbnailSize width of the generated thumbnails, painted 1:1
     * @param minCardWidth  configured card width; widened when the thumbnail needs more room
     */
    public static CardGeometry forThumbnail(int thumbnailSize, int minCardWidth, int aspectWidth, int aspectHeight) {
        int previewW = Math.max(1, thumbnailSize);
        int previewH = CoverCrop.boxHeight(previewW, aspectWidth, aspectHeight);
        int cardW = Math.max(minCardWidth, previewW + PADDING * 2 + PREVIEW_INSET);
        int cardH = previewH + TEXT_HEIGHT + CHROME_HEIGHT;
        return new CardGeometry(cardW, cardH, PADDING, previewW, previewH);
    }
}
