package trustbridge.core.cache;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

/**
 * Caffeine-backed local cache with an exact TTL.
 *
 * <p>
 * The TTL is an upper bound: an entry is never served after it has elapsed.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private final Cache<K, V> cache;

    /**
     * Create a cache on the system ticker.
     *
     * @param ttl     time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     */
    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    /**
     * Create a cache with a replaceable time source.
     *
     * @param ttl     time-to-live for cache entries
     * @param maxSize the maximum number of entries in the cache
     * @param ticker  time source, replaceable in tests
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
