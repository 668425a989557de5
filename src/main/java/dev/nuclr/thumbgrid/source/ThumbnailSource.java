package dev.nuclr.thumbgrid.source;

import java.io.IOException;
import java.util.Optional;

/**
 * Supplies source image bytes for a result entry. The bytes must be in a
 * format {@link javax.imageio.ImageIO} can decode.
 *
 * <p>Called only from generation worker threads; implementations must be
 * thread-safe when the pipeline runs more than one worker.
 */
public interface ThumbnailSource {

    /** Human-readable name for logging. */
    String name();

    /**
     * Fetch the source blob for an entry.
     *
     * @param contentKey  stable content identifier, may be blank
     * @param displayPath path of the file, used when the identifier is unknown
     * @return the bytes, or empty when this source has nothing for the entry
     * @throws IOException when the data exists but cannot be read
     */
    Optional<byte[]> fetchSourceBytes(String contentKey, String displayPath) throws IOException;
}
