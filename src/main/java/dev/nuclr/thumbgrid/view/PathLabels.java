package dev.nuclr.thumbgrid.view;

import dev.nuclr.thumbgrid.cache.ThumbnailMemoryCache;

import java.util.function.ToIntFunction;

/**
 * Fits file paths into a pixel width by cutting from the left, so the file
 * name stays readable. Results are cached per (path, width).
 */
public class PathLabels {

    static final String ELLIPSIS = "...";
    static final int CACHE_CAPACITY = 4000;

    private record LabelKey(String path, int maxPx) {}

    private final ThumbnailMemoryCache<LabelKey, String> cache = new ThumbnailMemoryCache<>(CACHE_CAPACITY);
    private final ToIntFunction<String> measure;

    /**
     * @param measure pixel width of a string in the label font
     */
    public PathLabels(ToIntFunction<String> measure) {
        this.measure = measure;
    }

    public String fit(String path, int maxPx) {
        LabelKey key = new LabelKey(path, maxPx);
        String label = cache.get(key);
        if (label == null) {
            label = leftEllipsis(path, maxPx);
            cache.put(key, label);
        }
        return label;
    }

    private String leftEllipsis(String text, int maxPx) {
        if (measure.applyAsInt(text) <= maxPx) {
            return text;
        }
        if (measure.applyAsInt(ELLIPSIS) >= maxPx) {
            return ELLIPSIS;
        }
        // binary search on the length of the kept suffix
        int lo = 0, hi = text.length();
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            String candidate = ELLIPSIS + text.substring(text.length() - mid);
            if (measure.applyAsInt(candidate) <= maxPx) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return ELLIPSIS + text.substring(text.length() - lo);
    }
}
