package dev.nuclr.thumbgrid.pipeline;

/**
 * Outcome of one generation job. {@code bytes} is null when the source had no
 * data or the image could not be decoded; callers treat both the same.
 */
public record CompletedResult(int index, String displayPath, String contentKey, byte[] bytes) {

    public static CompletedResult of(PendingRequest request, byte[] png) {
        return new CompletedResult(request.index(), request.displayPath(), request.contentKey(), png);
    }

    public static CompletedResult absent(PendingRequest request) {
        return new CompletedResult(request.index(), request.displayPath(), request.contentKey(), null);
    }

    public boolean isPresent() {
        return bytes != null;
    }
}
