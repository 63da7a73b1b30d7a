package trustbridge.core.cache;

import java.util.Optional;

/**
 * Local in-memory cache interface with TTL support.
 *
 * <p>
 * Writes are last-writer-wins. Concurrent misses for the same key may each compute and
 * store a value; short TTLs make this acceptable.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    /**
     * Gets a value from the cache.
     *
     * @param key the cache key
     * @return Optional containing the value if present and not expired
     */
    Optional<V> get(K key);

    /**
     * Puts a value into the cache.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Invalidates all entries in the cache.
     */
    void invalidateAll();

    /**
     * Returns the estimated number of entries in the cache.
     *
     * @return estimated entry count
     */
    long estimatedSize();
}
