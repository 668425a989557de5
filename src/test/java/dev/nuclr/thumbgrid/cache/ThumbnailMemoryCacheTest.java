package dev.nuclr.thumbgrid.cache;

import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThumbnailMemoryCacheTest {

    private static CacheKey key(int i) {
        return new CacheKey("id-" + i, 200);
    }

    @Test
    void put_beyondCapacity_evictsEarliestInserted() {
        int capacity = 5;
        int extra = 3;
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(capacity);

        for (int i = 0; i < capacity + extra; i++) {
            cache.put(key(i), "v" + i);
        }

        assertThat(cache.size()).isEqualTo(capacity);
        IntStream.range(0, extra).forEach(i -> assertThat(cache.contains(key(i))).isFalse());
        IntStream.range(extra, capacity + extra).forEach(i -> assertThat(cache.contains(key(i))).isTrue());
    }

    @Test
    void get_promotesEntry_soItSurvivesNextEviction() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(3);
        cache.put(key(1), "a");
        cache.put(key(2), "b");
        cache.put(key(3), "c");

        assertThat(cache.get(key(1))).isEqualTo("a");
        cache.put(key(4), "d");

        assertThat(cache.contains(key(1))).isTrue();
        assertThat(cache.contains(key(2))).isFalse();
        assertThat(cache.contains(key(3))).isTrue();
        assertThat(cache.contains(key(4))).isTrue();
    }

    @Test
    void put_existingKey_overwritesAndPromotes() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(2);
        cache.put(key(1), "a");
        cache.put(key(2), "b");

        cache.put(key(1), "a2");
        cache.put(key(3), "c");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(key(1))).isEqualTo("a2");
        assertThat(cache.contains(key(2))).isFalse();
    }

    @Test
    void contains_doesNotPromote() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(2);
        cache.put(key(1), "a");
        cache.put(key(2), "b");

        assertThat(cache.contains(key(1))).isTrue();
        cache.put(key(3), "c");

        assertThat(cache.contains(key(1))).isFalse();
    }

    @Test
    void get_missingKey_returnsNull() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(2);

        assertThat(cache.get(key(9))).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    void keysWithDifferentSize_areDistinct() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(4);
        cache.put(new CacheKey("abc", 100), "small");
        cache.put(new CacheKey("abc", 200), "large");

        assertThat(cache.get(new CacheKey("abc", 100))).isEqualTo("small");
        assertThat(cache.get(new CacheKey("abc", 200))).isEqualTo("large");
    }

    @Test
    void constructor_zeroCapacity_isRejected() {
        assertThatThrownBy(() -> new ThumbnailMemoryCache<CacheKey, String>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_removesEverything() {
        ThumbnailMemoryCache<CacheKey, String> cache = new ThumbnailMemoryCache<>(2);
        cache.put(key(1), "a");

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.capacity()).isEqualTo(2);
    }
}
