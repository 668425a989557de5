package dev.nuclr.thumbgrid;

/**
 * One entry of a search result set, in display order.
 *
 * @param index       position in the result set
 * @param contentKey  stable content identifier; may be blank when unknown
 * @param displayPath file path shown to the user
 */
public record ResultItem(int index, String contentKey, String displayPath) {

    /** Key used for caching: the content identifier, or the path when there is none. */
    public String cacheId() {
        return (contentKey != null && !contentKey.isBlank()) ? contentKey : displayPath;
    }
}
