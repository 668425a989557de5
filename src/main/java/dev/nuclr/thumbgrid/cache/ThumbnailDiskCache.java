package dev.nuclr.thumbgrid.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Persistent, content-addressed store of rendered thumbnails.
 *
 * <p>Layout: {@code <root>/<first 2 hex chars>/<normalizedId>_<size>.png}.
 * Writes land in a uniquely named temp file next to the target and are moved
 * into place, so readers see either no file or the complete file.
 *
 * <p>This is an optimisation layer only. Every I/O failure reads as a miss and
 * writes become no-ops. Safe for concurrent use by several workers.
 */
@Slf4j
public class ThumbnailDiskCache {

    private static final Pattern HEX_ID = Pattern.compile("[0-9a-fA-F]{16,128}");
    private static final String EXTENSION = ".png";

    private final Path root;
    private final boolean enabled;

    public ThumbnailDiskCache(Path root) {
        this(root, true);
    }

    public ThumbnailDiskCache(Path root, boolean enabled) {
        this.root = root;
        this.enabled = enabled;
        if (enabled) {
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                log.warn("Could not create thumbnail cache dir {}: {}", root, e.getMessage());
            }
        }
    }

    /** Pure function of the key. Does not touch the file system. */
    public Path derivePath(CacheKey key) {
        String id = normalizeId(key.contentKey());
        return root.resolve(id.substring(0, 2)).resolve(id + "_" + key.targetSize() + EXTENSION);
    }

    public Optional<byte[]> read(CacheKey key) {
        if (!enabled) return Optional.empty();
        Path p = derivePath(key);
        try {
            if (!Files.isRegularFile(p)) return Optional.empty();
            byte[] data = Files.readAllBytes(p);
            if (data.length == 0) return Optional.empty();
            log.debug("Disk cache hit: {}", p);
            return Optional.of(data);
        } catch (IOException | RuntimeException e) {
            log.debug("Disk cache read failed for {}: {}", p, e.toString());
            return Optional.empty();
        }
    }

    public void write(CacheKey key, byte[] data) {
        if (!enabled || data == null || data.length == 0) return;
        Path p = derivePath(key);
        Path tmp = null;
        try {
            Files.createDirectories(p.getParent());
            tmp = Files.createTempFile(p.getParent(), p.getFileName().toString(), ".tmp");
            Files.write(tmp, data);
            try {
                Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, p, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException | RuntimeException e) {
            log.debug("Disk cache write failed for {}: {}", p, e.toString());
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    /**
     * Canonical lower-case hex form of a content identifier. Hex-like ids of
     * 16..128 chars are kept; anything else is replaced by its SHA-1.
     */
    static String normalizeId(String contentKey) {
        String safe = (contentKey == null || contentKey.isBlank()) ? "unknown" : contentKey.strip();
        if (!HEX_ID.matcher(safe).matches()) {
            safe = sha1Hex(safe);
        }
        return safe.toLowerCase(Locale.ROOT);
    }

    private static String sha1Hex(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-1 is mandatory on every JVM
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove staging file {}: {}", tmp, e.getMessage());
        }
    }
}
