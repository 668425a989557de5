package dev.nuclr.thumbgrid.view;

import dev.nuclr.thumbgrid.ResultItem;
import dev.nuclr.thumbgrid.ThumbnailGridSettings;
import dev.nuclr.thumbgrid.cache.CacheKey;
import dev.nuclr.thumbgrid.cache.ThumbnailMemoryCache;
import dev.nuclr.thumbgrid.pipeline.CompletedResult;
import dev.nuclr.thumbgrid.pipeline.CoverCrop;
import dev.nuclr.thumbgrid.pipeline.GenerationPipeline;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Drives one virtualized thumbnail grid.
 *
 * <p>Owns the memory cache, the slot pool, the render scheduler and the
 * scroll tracker, and talks to the generation pipeline. Thumbnails are
 * resolved memory cache first; misses go to the pipeline, which consults the
 * disk cache before generating.
 *
 * <p>UI thread only. The pipeline's completion queue is drained by a poll
 * timer on the same thread, so no state here is shared with workers.
 */
@Slf4j
public class GridController implements AutoCloseable {

    static final int SCROLL_UNIT_PX = 48;
    static final long WHEEL_FLUSH_MS = 16;
    static final long RESIZE_DELAY_MS = 60;

    private record RenderKey(int firstRow, int columns, int visibleRows, int cardWidth,
                             int itemCount, boolean scrollActive) {}

    private final GenerationPipeline pipeline;
    private final GridView view;
    private final UiScheduler ui;
    private final CardGeometry geometry;

    private final int prefetchBufferRows;
    private final int prefetchBudget;
    private final long pollIntervalMs;
    private final int pollBatch;

    private final ThumbnailMemoryCache<CacheKey, BufferedImage> memoryCache;
    private final RenderScheduler renderScheduler;
    private final ScrollActivityTracker scrollTracker;

    // ---------------------------------------------------------------- state (UI thread)

    private List<ResultItem> results = List.of();
    private final List<GridSlot> slots = new ArrayList<>();
    private final Set<CacheKey> unavailable = new HashSet<>();
    private Viewport viewport = new Viewport(0, 1, 1, 0);
    private RenderKey lastRenderKey;
    private int lastPaintedOffset = -1;
    private boolean repaintRequested;

    private UiScheduler.Cancellable pollTask;
    private UiScheduler.Cancellable wheelFlush;
    private int pendingWheelUnits;
    private boolean closed;

    public GridController(ThumbnailGridSettings settings, GenerationPipeline pipeline, GridView view, UiScheduler ui) {
        this.pipeline = pipeline;
        this.view = view;
        this.ui = ui;
        this.geometry = CardGeometry.forThumbnail(pipeline.targetSize(), settings.getCardWidth(),
                settings.getAspectWidth(), settings.getAspectHeight());
        this.prefetchBufferRows = settings.getPrefetchBufferRows();
        this.prefetchBudget = settings.getPrefetchBudget();
        this.pollIntervalMs = settings.getPollIntervalMs();
        this.pollBatch = settings.getPollBatch();
        this.memoryCache = new ThumbnailMemoryCache<>(settings.getMemoryCacheCapacity());
        this.renderScheduler = new RenderScheduler(ui, settings.getRenderMinIntervalMs(), this::render);
        this.scrollTracker = new ScrollActivityTracker(ui, settings.getScrollIdleMs(), renderScheduler);
    }

    // ============================================================ events

    /** Replace the result set and jump back to the top. */
    public void setResults(List<ResultItem> items) {
        results = List.copyOf(items);
        unavailable.clear();
        lastRenderKey = null;
        view.scrollTo(0);
        log.info("Showing {} result(s)", results.size());
        renderScheduler.scheduleRender(1);
    }

    public void onResize() {
        lastRenderKey = null;
        renderScheduler.scheduleRender(RESIZE_DELAY_MS);
    }

    /** Scrollbar moved or the view was exposed. */
    public void onScroll() {
        renderScheduler.scheduleRender(1);
    }

    /** Mouse wheel or key scrolling; units are coalesced briefly before the view moves. */
    public void onWheel(int units) {
        if (units == 0) return;
        pendingWheelUnits += units;
        scrollTracker.markScrollActive();
        if (wheelFlush == null) {
            wheelFlush = ui.schedule(WHEEL_FLUSH_MS, this::flushWheel);
        }
    }

    // ============================================================ render pass

    /** Lay out the visible slots. Normally invoked through the render scheduler. */
    public void render() {
        if (closed) return;
        int itemCount = results.size();
        Viewport vp = ViewportModel.compute(view.scrollOffset(), view.viewportWidth(), view.viewportHeight(),
                itemCount, geometry.cardWidth(), geometry.cardHeight());
        viewport = vp;
        view.setContentSize(Math.max(1, vp.columns() * geometry.cardWidth()), Math.max(1, vp.virtualContentHeightPx()));
        ensurePool(vp.slotCount());

        boolean scrollActive = scrollTracker.isScrollActive();
        RenderKey key = new RenderKey(vp.firstVisibleRow(), vp.columns(), vp.visibleRowCount(),
                geometry.cardWidth(), itemCount, scrollActive);
        boolean viewChanged = !key.equals(lastRenderKey);
        int offset = view.scrollOffset();
        if (!viewChanged && !repaintRequested) {
            // same slots, but a scroll within the row still moves them on screen
            if (offset != lastPaintedOffset) {
                lastPaintedOffset = offset;
                view.slotsUpdated();
            }
            ensurePoller();
            return;
        }
        if (viewChanged) {
            // a new visibility pass: failed keys get another chance
            unavailable.clear();
        }
        lastRenderKey = key;
        repaintRequested = false;

        Set<String> visibleIds = new HashSet<>();
        int start = vp.firstVisibleIndex();
        for (GridSlot slot : slots) {
            int idx = start + slot.getSlot();
            if (idx >= itemCount) {
                slot.hide();
                continue;
            }
            ResultItem item = results.get(idx);
            String cacheId = item.cacheId();
            visibleIds.add(cacheId);

            int row = slot.getSlot() / vp.columns();
            int col = slot.getSlot() % vp.columns();
            int pad = geometry.padding();
            slot.bind(idx, item.displayPath(),
                    col * geometry.cardWidth() + pad,
                    (vp.firstVisibleRow() + row) * geometry.cardHeight() + pad,
                    geometry.cardWidth() - pad * 2,
                    geometry.cardHeight() - pad * 2);

            if (scrollActive) {
                // no image swaps while positions are moving
                slot.showPlaceholder(SlotState.LOADING);
                continue;
            }
            CacheKey ck = pipeline.keyFor(cacheId);
            BufferedImage img = memoryCache.get(ck);
            if (img != null) {
                slot.showImage(img);
            } else if (unavailable.contains(ck)) {
                slot.showPlaceholder(SlotState.UNAVAILABLE);
            } else {
                slot.showPlaceholder(SlotState.LOADING);
                pipeline.request(idx, cacheId, item.displayPath());
            }
        }

        if (!scrollActive) {
            prefetch(vp, visibleIds);
        }
        lastPaintedOffset = offset;
        view.slotsUpdated();
        ensurePoller();
    }

    /**
     * Queue uncached entries in a band of rows around the viewport, at most
     * {@code prefetchBudget} new requests per pass.
     *
     * @return number of requests issued
     */
    int prefetch(Viewport vp, Set<String> visibleIds) {
        int itemCount = results.size();
        if (itemCount == 0 || prefetchBudget == 0) return 0;

        int lastRow = vp.totalRows(itemCount) - 1;
        int startRow = Math.max(0, vp.firstVisibleRow() - prefetchBufferRows);
        int endRow = Math.min(lastRow, vp.firstVisibleRow() + vp.visibleRowCount() + prefetchBufferRows);
        int start = startRow * vp.columns();
        int end = Math.min(itemCount, (endRow + 1) * vp.columns());

        Set<String> seen = new HashSet<>(visibleIds);
        int issued = 0;
        for (int i = start; i < end && issued < prefetchBudget; i++) {
            ResultItem item = results.get(i);
            String cacheId = item.cacheId();
            if (!seen.add(cacheId)) continue;
            CacheKey ck = pipeline.keyFor(cacheId);
            if (memoryCache.contains(ck) || unavailable.contains(ck)) continue;
            if (pipeline.request(i, cacheId, item.displayPath())) {
                issued++;
            }
        }
        return issued;
    }

    private void ensurePool(int desired) {
        if (slots.size() == desired) return;
        while (slots.size() > desired) {
            slots.remove(slots.size() - 1);
        }
        while (slots.size() < desired) {
            slots.add(new GridSlot(slots.size()));
        }
        lastRenderKey = null;
        log.debug("Slot pool resized to {}", desired);
    }

    // ============================================================ completion polling

    private void ensurePoller() {
        if (pollTask != null || closed) return;
        if (pipeline.inflightCount() == 0) return;
        pollTask = ui.schedule(pollIntervalMs, this::pollCompletions);
    }

    /** Merge finished thumbnails into the memory cache. */
    void pollCompletions() {
        pollTask = null;
        if (closed) return;
        List<CompletedResult> done = pipeline.poll(pollBatch);
        for (CompletedResult r : done) {
            CacheKey key = pipeline.keyFor(r.contentKey());
            BufferedImage img = r.isPresent() ? decode(r.bytes(), r.displayPath()) : null;
            if (img == null) {
                unavailable.add(key);
            } else {
                unavailable.remove(key);
                memoryCache.put(key, img);
            }
        }
        if (!done.isEmpty()) {
            // absent results count too: their slots must leave the loading state
            repaintRequested = true;
            renderScheduler.scheduleRender(1);
        }
        ensurePoller();
    }

    private static BufferedImage decode(byte[] png, String path) {
        try {
            return CoverCrop.decode(png);
        } catch (IOException e) {
            log.warn("Could not decode thumbnail for {}: {}", path, e.getMessage());
            return null;
        }
    }

    private void flushWheel() {
        wheelFlush = null;
        int units = pendingWheelUnits;
        pendingWheelUnits = 0;
        if (units != 0) {
            int max = Math.max(0, viewport.virtualContentHeightPx() - view.viewportHeight());
            int target = Math.max(0, Math.min(max, view.scrollOffset() + units * SCROLL_UNIT_PX));
            view.scrollTo(target);
        }
        renderScheduler.scheduleRender(16);
    }

    // ============================================================ queries

    /** Result index under a viewport point, or -1. */
    public int indexAt(int x, int y) {
        return ViewportModel.indexAt(x, y + view.scrollOffset(), viewport.columns(), results.size(),
                geometry.cardWidth(), geometry.cardHeight());
    }

    public ResultItem itemAt(int index) {
        Objects.checkIndex(index, results.size());
        return results.get(index);
    }

    public int resultCount() {
        return results.size();
    }

    public List<GridSlot> slots() {
        return Collections.unmodifiableList(slots);
    }

    public Viewport viewport() {
        return viewport;
    }

    public CardGeometry geometry() {
        return geometry;
    }

    public boolean isScrollActive() {
        return scrollTracker.isScrollActive();
    }

    ThumbnailMemoryCache<CacheKey, BufferedImage> memoryCache() {
        return memoryCache;
    }

    RenderScheduler renderScheduler() {
        return renderScheduler;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        renderScheduler.cancel();
        scrollTracker.cancel();
        if (pollTask != null) pollTask.cancel();
        if (wheelFlush != null) wheelFlush.cancel();
        pipeline.close();
    }
}
