package dev.nuclr.thumbgrid;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for the thumbnail grid: cache sizes, thumbnail geometry, prefetch
 * and timing parameters.
 *
 * <p>Backed by a .properties file in the platform user config directory.
 * Missing or malformed values fall back to their defaults; numeric values are
 * clamped to a sane range. The file is edited by hand and read once at
 * startup. Instances are created explicitly and handed to the composition root.
 */
@Slf4j
public final class ThumbnailGridSettings {

    public static final String KEY_MEMORY_CACHE_CAPACITY = "thumbgrid.memoryCacheCapacity";
    public static final String KEY_THUMBNAIL_SIZE        = "thumbgrid.thumbnailSize";
    public static final String KEY_ASPECT_WIDTH          = "thumbgrid.aspectWidth";
    public static final String KEY_ASPECT_HEIGHT         = "thumbgrid.aspectHeight";
    public static final String KEY_PREFETCH_BUFFER_ROWS  = "thumbgrid.prefetchBufferRows";
    public static final String KEY_PREFETCH_BUDGET       = "thumbgrid.prefetchBudget";
    public static final String KEY_RENDER_MIN_INTERVAL   = "thumbgrid.renderMinIntervalMs";
    public static final String KEY_SCROLL_IDLE           = "thumbgrid.scrollIdleMs";
    public static final String KEY_POLL_INTERVAL         = "thumbgrid.pollIntervalMs";
    public static final String KEY_POLL_BATCH            = "thumbgrid.pollBatch";
    public static final String KEY_WORKER_THREADS        = "thumbgrid.workerThreads";
    public static final String KEY_CARD_WIDTH            = "thumbgrid.cardWidth";
    public static final String KEY_DISK_CACHE_ENABLED    = "thumbgrid.diskCacheEnabled";
    public static final String KEY_DISK_CACHE_DIR        = "thumbgrid.diskCacheDir";

    private static final int     DEFAULT_MEMORY_CACHE_CAPACITY = 350;
    private static final int     DEFAULT_THUMBNAIL_SIZE        = 200;
    private static final int     DEFAULT_ASPECT_WIDTH          = 16;
    private static final int     DEFAULT_ASPECT_HEIGHT         = 9;
    private static final int     DEFAULT_PREFETCH_BUFFER_ROWS  = 3;
    private static final int     DEFAULT_PREFETCH_BUDGET       = 80;
    private static final int     DEFAULT_RENDER_MIN_INTERVAL   = 33;  // ~30 renders/s
    private static final int     DEFAULT_SCROLL_IDLE           = 540;
    private static final int     DEFAULT_POLL_INTERVAL         = 30;
    private static final int     DEFAULT_POLL_BATCH            = 40;
    private static final int     DEFAULT_WORKER_THREADS        = 1;
    private static final int     DEFAULT_CARD_WIDTH            = 230;
    private static final boolean DEFAULT_DISK_CACHE_ENABLED    = true;

    private static final String SETTINGS_FILE_NAME = "thumbnail-grid.properties";

    private final Properties props = new Properties();
    private final Path file;

    private ThumbnailGridSettings(Path file) {
        this.file = file;
    }

    /** Load settings from the platform user config directory. */
    public static ThumbnailGridSettings load() {
        return load(appDir().resolve(SETTINGS_FILE_NAME));
    }

    /** Load settings from the given file; a missing file yields defaults. */
    public static ThumbnailGridSettings load(Path file) {
        ThumbnailGridSettings settings = new ThumbnailGridSettings(file);
        settings.read();
        return settings;
    }

    /** Settings with every value at its default, not bound to any file. */
    public static ThumbnailGridSettings defaults() {
        return new ThumbnailGridSettings(null);
    }

    // --- Getters ---

    public int getMemoryCacheCapacity() {
        return intValue(KEY_MEMORY_CACHE_CAPACITY, DEFAULT_MEMORY_CACHE_CAPACITY, 1, 100_000);
    }

    public int getThumbnailSize() {
        return intValue(KEY_THUMBNAIL_SIZE, DEFAULT_THUMBNAIL_SIZE, 16, 2048);
    }

    public int getAspectWidth() {
        return intValue(KEY_ASPECT_WIDTH, DEFAULT_ASPECT_WIDTH, 1, 100);
    }

    public int getAspectHeight() {
        return intValue(KEY_ASPECT_HEIGHT, DEFAULT_ASPECT_HEIGHT, 1, 100);
    }

    public int getPrefetchBufferRows() {
        return intValue(KEY_PREFETCH_BUFFER_ROWS, DEFAULT_PREFETCH_BUFFER_ROWS, 0, 100);
    }

    public int getPrefetchBudget() {
        return intValue(KEY_PREFETCH_BUDGET, DEFAULT_PREFETCH_BUDGET, 0, 10_000);
    }

    public int getRenderMinIntervalMs() {
        return intValue(KEY_RENDER_MIN_INTERVAL, DEFAULT_RENDER_MIN_INTERVAL, 0, 1000);
    }

    public int getScrollIdleMs() {
        return intValue(KEY_SCROLL_IDLE, DEFAULT_SCROLL_IDLE, 50, 10_000);
    }

    public int getPollIntervalMs() {
        return intValue(KEY_POLL_INTERVAL, DEFAULT_POLL_INTERVAL, 5, 1000);
    }

    public int getPollBatch() {
        return intValue(KEY_POLL_BATCH, DEFAULT_POLL_BATCH, 1, 1000);
    }

    public int getWorkerThreads() {
        return intValue(KEY_WORKER_THREADS, DEFAULT_WORKER_THREADS, 1, 16);
    }

    public int getCardWidth() {
        return intValue(KEY_CARD_WIDTH, DEFAULT_CARD_WIDTH, 64, 2048);
    }

    public boolean isDiskCacheEnabled() {
        return Boolean.parseBoolean(props.getProperty(KEY_DISK_CACHE_ENABLED, String.valueOf(DEFAULT_DISK_CACHE_ENABLED)));
    }

    public Path getDiskCacheDir() {
        String raw = props.getProperty(KEY_DISK_CACHE_DIR);
        if (raw != null && !raw.isBlank()) {
            return Path.of(raw.trim());
        }
        return appDir().resolve("thumbnail-grid").resolve("cache");
    }

    // --- Loading ---

    private int intValue(String key, int def, int min, int max) {
        String raw = props.getProperty(key);
        if (raw == null) return def;
        try {
            int value = Integer.parseInt(raw.trim());
            return Math.min(Math.max(value, min), max);
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, using default {}", raw, key, def);
            return def;
        }
    }

    private void read() {
        if (file == null || !Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load thumbnail grid settings, using defaults: {}", e.getMessage());
        }
    }

    static Path appDir() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return (appData != null)
                    ? Path.of(appData, "nuclr")
                    : Path.of(System.getProperty("user.home"), "nuclr");
        } else if (os.contains("mac")) {
            return Path.of(System.getProperty("user.home"), "Library", "Application Support", "nuclr");
        } else {
            String xdg = System.getenv("XDG_CONFIG_HOME");
            return (xdg != null)
                    ? Path.of(xdg, "nuclr")
                    : Path.of(System.getProperty("user.home"), ".config", "nuclr");
        }
    }
}
