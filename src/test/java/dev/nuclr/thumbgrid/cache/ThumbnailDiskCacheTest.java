package dev.nuclr.thumbgrid.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ThumbnailDiskCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void derivePath_sameKey_returnsSamePath() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);

        Path first = cache.derivePath(new CacheKey("abc123", 200));
        Path second = cache.derivePath(new CacheKey("abc123", 200));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void derivePath_differentKeys_returnDifferentPaths() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);

        assertThat(cache.derivePath(new CacheKey("abc123", 200)))
                .isNotEqualTo(cache.derivePath(new CacheKey("abc124", 200)))
                .isNotEqualTo(cache.derivePath(new CacheKey("abc123", 100)));
    }

    @Test
    void derivePath_hexId_isKeptLowerCasedAndSharded() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);
        String id = "ABCDEF0123456789ABCDEF";

        Path p = cache.derivePath(new CacheKey(id, 200));

        assertThat(p).isEqualTo(tempDir.resolve("ab").resolve("abcdef0123456789abcdef_200.png"));
    }

    @Test
    void derivePath_nonHexId_isHashedToSha1() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);

        Path p = cache.derivePath(new CacheKey("C:\\photos\\cat.jpg", 200));

        String name = p.getFileName().toString();
        assertThat(name).matches("[0-9a-f]{40}_200\\.png");
        assertThat(p.getParent().getFileName().toString()).isEqualTo(name.substring(0, 2));
    }

    @Test
    void normalizeId_blank_usesUnknownPlaceholder() {
        assertThat(ThumbnailDiskCache.normalizeId("  "))
                .isEqualTo(ThumbnailDiskCache.normalizeId("unknown"))
                .hasSize(40);
    }

    @Test
    void read_missingEntry_returnsEmpty() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);

        assertThat(cache.read(new CacheKey("abc123", 200))).isEmpty();
    }

    @Test
    void write_thenRead_returnsSameBytes() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);
        CacheKey key = new CacheKey("abc123", 200);
        byte[] data = {1, 2, 3, 4, 5};

        cache.write(key, data);

        assertThat(cache.read(key)).hasValueSatisfying(b -> assertThat(b).containsExactly(data));
        assertThat(cache.derivePath(key)).exists();
    }

    @Test
    void write_leavesNoStagingFiles() throws IOException {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);
        CacheKey key = new CacheKey("abc123", 200);

        cache.write(key, new byte[]{9, 9, 9});
        cache.write(key, new byte[]{8, 8});

        try (Stream<Path> files = Files.walk(tempDir)) {
            List<Path> regular = files.filter(Files::isRegularFile).collect(Collectors.toList());
            assertThat(regular).containsExactly(cache.derivePath(key));
        }
        assertThat(cache.read(key)).hasValueSatisfying(b -> assertThat(b).containsExactly(8, 8));
    }

    @Test
    void read_emptyFile_isTreatedAsMiss() throws IOException {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);
        CacheKey key = new CacheKey("abc123", 200);
        Path p = cache.derivePath(key);
        Files.createDirectories(p.getParent());
        Files.write(p, new byte[0]);

        assertThat(cache.read(key)).isEmpty();
    }

    @Test
    void disabledCache_neverWritesAndAlwaysMisses() {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir.resolve("off"), false);
        CacheKey key = new CacheKey("abc123", 200);

        cache.write(key, new byte[]{1});

        assertThat(cache.read(key)).isEmpty();
        assertThat(tempDir.resolve("off")).doesNotExist();
    }

    @Test
    void unusableRoot_absorbsErrors() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "occupied");
        ThumbnailDiskCache cache = new ThumbnailDiskCache(blocker);
        CacheKey key = new CacheKey("abc123", 200);

        cache.write(key, new byte[]{1, 2});

        assertThat(cache.read(key)).isEmpty();
    }

    @Test
    void concurrentReader_seesNothingOrCompleteContent() throws Exception {
        ThumbnailDiskCache cache = new ThumbnailDiskCache(tempDir);
        CacheKey key = new CacheKey("0123456789abcdef0123", 200);
        byte[] a = new byte[256 * 1024];
        byte[] b = new byte[256 * 1024];
        Arrays.fill(a, (byte) 'a');
        Arrays.fill(b, (byte) 'b');

        AtomicBoolean done = new AtomicBoolean();
        List<String> violations = new CopyOnWriteArrayList<>();
        CountDownLatch started = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            started.countDown();
            while (!done.get()) {
                Optional<byte[]> seen = cache.read(key);
                seen.ifPresent(bytes -> {
                    if (!Arrays.equals(bytes, a) && !Arrays.equals(bytes, b)) {
                        violations.add("partial read of " + bytes.length + " bytes");
                    }
                });
            }
        });
        reader.start();
        started.await();

        for (int i = 0; i < 50; i++) {
            cache.write(key, (i % 2 == 0) ? a : b);
        }
        done.set(true);
        reader.join();

        assertThat(violations).isEmpty();
    }
}
