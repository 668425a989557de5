package dev.nuclr.thumbgrid.source;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks each delegate in order; the first one with data wins.
 */
public class CompositeThumbnailSource implements ThumbnailSource {

    private final List<ThumbnailSource> delegates;

    public CompositeThumbnailSource(List<ThumbnailSource> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public String name() {
        return delegates.stream().map(ThumbnailSource::name).collect(Collectors.joining("+"));
    }

    @Override
    public Optional<byte[]> fetchSourceBytes(String contentKey, String displayPath) throws IOException {
        for (ThumbnailSource s : delegates) {
            Optional<byte[]> bytes = s.fetchSourceBytes(contentKey, displayPath);
            if (bytes.isPresent()) {
                return bytes;
            }
        }
        return Optional.empty();
    }
}
