package com.phillippitts.docassist.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ResultCache} backed by a size-bounded Caffeine cache with a per-entry time to live.
 * Time is read from the supplied {@link Clock}.
 *
 * <p>Thread-safe.
 */
public class InMemoryResultCache<V> implements ResultCache<V> {

    private static final Logger LOG = LogManager.getLogger(InMemoryResultCache.class);

    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;

    private final Cache<String, Entry<V>> entries;

    public InMemoryResultCache(Clock clock) {
        this(clock, DEFAULT_MAXIMUM_SIZE);
    }

    public InMemoryResultCache(Clock clock, long maximumSize) {
        Objects.requireNonNull(clock, "clock");
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive: " + maximumSize);
        }
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryExpiry<V>())
                .ticker(() -> clock.millis() * 1_000_000L)
                .executor(Runnable::run)
                .removalListener((String key, Entry<V> entry, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        LOG.debug("Evicted cache entry ({})", cause);
                    }
                })
                .build();
    }

    @Override
    public Optional<V> get(String key) {
        Entry<V> entry = entries.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new Entry<>(value, ttl));
    }

    @Override
    public void remove(String key) {
        entries.invalidate(key);
    }

    @Override
    public void clear() {
        entries.invalidateAll();
    }

    @Override
    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    private record Entry<V>(V value, Duration ttl) {}

    /** Expires each entry after its own ttl from the last write; reads do not extend it. */
    private static final class EntryExpiry<V> implements Expiry<String, Entry<V>> {

        @Override
        public long expireAfterCreate(String key, Entry<V> entry, long currentTime) {
            return entry.ttl() == null ? Long.MAX_VALUE : entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry<V> entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
