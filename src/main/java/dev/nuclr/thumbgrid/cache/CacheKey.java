package dev.nuclr.thumbgrid.cache;

/**
 * Identifies one rendering of one image: a stable content identifier plus the
 * target thumbnail size. Compared by equality only.
 */
public record CacheKey(String contentKey, int targetSize) {}
