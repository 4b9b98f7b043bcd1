package com.phillippitts.docassist.service.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed store for finished results.
 *
 * @param <V> cached value type
 */
public interface ResultCache<V> {

    /** @return the value for the key, or empty if absent or expired */
    Optional<V> get(String key);

    /**
     * Stores a value.
     *
     * @param ttl time to live; {@code null} keeps the entry until removed
     */
    void put(String key, V value, Duration ttl);

    void remove(String key);

    void clear();

    int size();
}
