package dev.nuclr.thumbgrid.pipeline;

import dev.nuclr.thumbgrid.ResultItem;
import dev.nuclr.thumbgrid.cache.CacheKey;
import dev.nuclr.thumbgrid.cache.ThumbnailDiskCache;
import dev.nuclr.thumbgrid.source.ThumbnailSource;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns cache misses into rendered thumbnails without blocking the UI thread.
 *
 * <p>The UI thread calls {@link #request} and {@link #poll}; both touch the
 * inflight set, which is therefore never shared with workers. Workers only
 * see the request queue, the completion queue, the disk cache and the source.
 *
 * <p>With one worker, completions arrive in request order. With more, they
 * may not; callers never rely on order.
 */
@Slf4j
public class GenerationPipeline implements AutoCloseable {

    private final ThumbnailDiskCache diskCache;
    private final ThumbnailSource source;
    private final int targetSize;
    private final int targetHeight;

    private final BlockingQueue<PendingRequest> requests = new LinkedBlockingQueue<>();
    private final Queue<CompletedResult> completions = new ConcurrentLinkedQueue<>();

    // UI thread only
    private final Set<CacheKey> inflight = new HashSet<>();

    private final ExecutorService workers;
    private volatile boolean closed;

    /**
     * @param targetSize   thumbnail box width; also the size part of every cache key
     * @param aspectWidth  box aspect ratio, width part
     * @param aspectHeight box aspect ratio, height part
     * @param workerCount  number of background workers, at least 1
     */
    public GenerationPipeline(ThumbnailDiskCache diskCache,
                              ThumbnailSource source,
                              int targetSize,
                              int aspectWidth,
                              int aspectHeight,
                              int workerCount) {
        if (targetSize < 1) throw new IllegalArgumentException("targetSize must be >= 1");
        if (aspectWidth < 1 || aspectHeight < 1) throw new IllegalArgumentException("aspect must be positive");
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1");
        this.diskCache = diskCache;
        this.source = source;
        this.targetSize = targetSize;
        this.targetHeight = CoverCrop.boxHeight(targetSize, aspectWidth, aspectHeight);
        this.workers = Executors.newFixedThreadPool(workerCount, new WorkerThreadFactory());
        for (int i = 0; i < workerCount; i++) {
            workers.execute(this::workerLoop);
        }
        log.info("Thumbnail pipeline started: {} worker(s), box {}x{}, source {}",
                workerCount, targetSize, targetHeight, source.name());
    }

    // ------------------------------------------------------ UI thread API

    public CacheKey keyFor(String cacheId) {
        return new CacheKey(cacheId, targetSize);
    }

    public int targetSize() {
        return targetSize;
    }

    public int targetHeight() {
        return targetHeight;
    }

    /** Request a thumbnail for a result entry. See {@link #request(int, String, String)}. */
    public boolean request(ResultItem item) {
        return request(item.index(), item.cacheId(), item.displayPath());
    }

    /**
     * Enqueue generation for {@code contentKey} unless a job for the same key
     * is already inflight.
     *
     * @return true if a new job was queued, false if it was deduplicated
     */
    public boolean request(int index, String contentKey, String displayPath) {
        if (closed) return false;
        CacheKey key = keyFor(contentKey);
        if (!inflight.add(key)) {
            return false;
        }
        requests.add(new PendingRequest(index, displayPath, contentKey));
        return true;
    }

    public boolean isInflight(CacheKey key) {
        return inflight.contains(key);
    }

    public int inflightCount() {
        return inflight.size();
    }

    /**
     * Drain up to {@code maxItems} finished jobs without blocking. Each drained
     * key leaves the inflight set, so it may be requested again.
     */
    public List<CompletedResult> poll(int maxItems) {
        List<CompletedResult> drained = new ArrayList<>();
        while (drained.size() < maxItems) {
            CompletedResult r = completions.poll();
            if (r == null) break;
            inflight.remove(keyFor(r.contentKey()));
            drained.add(r);
        }
        return drained;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Thumbnail workers did not stop within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Thumbnail pipeline stopped");
    }

    // ------------------------------------------------------ worker side

    private void workerLoop() {
        while (!closed) {
            PendingRequest req;
            try {
                req = requests.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            CompletedResult result;
            try {
                result = generate(req);
            } catch (Error e) {
                // e.g. StackOverflowError from a deeply nested PDF; the loop keeps serving
                log.error("Thumbnail worker error for {}", req.displayPath(), e);
                result = CompletedResult.absent(req);
            }
            completions.add(result);
        }
    }

    /** Disk cache, then source, then cover crop. Exceptions become absent results. */
    CompletedResult generate(PendingRequest req) {
        CacheKey key = keyFor(req.contentKey());
        try {
            Optional<byte[]> cached = diskCache.read(key);
            if (cached.isPresent()) {
                return CompletedResult.of(req, cached.get());
            }

            Optional<byte[]> raw = source.fetchSourceBytes(req.contentKey(), req.displayPath());
            if (raw.isEmpty()) {
                log.debug("No source data for {}", req.displayPath());
                return CompletedResult.absent(req);
            }

            BufferedImage img = CoverCrop.decode(raw.get());
            byte[] png = CoverCrop.encodePng(CoverCrop.apply(img, targetSize, targetHeight));
            diskCache.write(key, png);
            log.debug("Generated thumbnail for {} ({} bytes)", req.displayPath(), png.length);
            return CompletedResult.of(req, png);
        } catch (Exception e) {
            log.warn("Thumbnail generation failed for {}: {}", req.displayPath(), e.toString());
            return CompletedResult.absent(req);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "thumb-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
