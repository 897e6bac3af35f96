package ai.foundrystack.backend.service;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value cache with per-entry expiry and pattern-based key listing.
 * Keys are expected to start with a {@link CacheNamespace} prefix.
 */
public interface CacheService {

    /**
     * Reads a value and converts it to the requested type.
     *
     * @param key the full cache key
     * @param type expected value type
     * @return the value, or empty on a miss or when the entry has expired
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Stores a value with the given time-to-live. Reads never extend the expiry.
     *
     * @param key the full cache key
     * @param value value to store, must be JSON-serializable
     * @param ttl time-to-live, must be positive
     * @throws IllegalArgumentException if ttl is null, zero or negative
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Removes a key. Deleting a missing key is not an error.
     *
     * @return true if a key was removed
     */
    boolean delete(String key);

    /**
     * Atomically adds {@code delta} to a counter. When the key does not exist it is created with
     * value {@code delta} and the given time-to-live.
     *
     * @return the counter value after the increment
     */
    long increment(String key, long delta, Duration ttlOnCreate);

    /**
     * Lists keys matching a glob pattern such as {@code blueprint:*}.
     */
    Set<String> keys(String pattern);

    boolean exists(String key);

    /**
     * Exception thrown when the cache backend fails
     */
    class CacheServiceException extends RuntimeException {
        public CacheServiceException(String message) {
            super(message);
        }

        public CacheServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
