package com.phillippitts.docassist.service.capability;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Keeps a probe result fresh for a short time so that ranking a burst of requests does not
 * hit the backend once per request.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Concurrent callers on an expired entry
 * are serialized by the cache so the delegate is probed once.
 */
public final class CachingCapabilityProbe implements CapabilityProbe {

    private static final Logger LOG = LogManager.getLogger(CachingCapabilityProbe.class);
    private static final String KEY = "capabilities";

    private final LoadingCache<String, List<String>> cache;

    public CachingCapabilityProbe(CapabilityProbe delegate, Duration ttl, Clock clock) {
        Objects.requireNonNull(delegate, "delegate");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(clock, "clock");
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttl)
                .ticker(() -> clock.millis() * 1_000_000L)
                .executor(Runnable::run)
                .build(key -> {
                    List<String> fresh = delegate.availableCapabilities();
                    List<String> result = fresh == null ? List.of() : List.copyOf(fresh);
                    LOG.debug("Capability probe refreshed: {}", result);
                    return result;
                });
    }

    @Override
    public List<String> availableCapabilities() {
        return cache.get(KEY);
    }

    /** Drops the cached result so the next call probes again. */
    public void invalidate() {
        cache.invalidateAll();
    }
}
