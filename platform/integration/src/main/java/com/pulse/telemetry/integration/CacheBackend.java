package com.pulse.telemetry.integration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Minimal key/value cache surface exercised by the verification round trip.
 */
public interface CacheBackend {

    void put(String key, String value);

    Optional<String> get(String key);

    /** Backend name reported in the {@code backend} tag. */
    String name();

    /**
     * In-process Caffeine cache with a short TTL, like the application caches.
     */
    static CacheBackend caffeine(Duration ttl) {
        Cache<String, String> cache = Caffeine.newBuilder()
                .maximumSize(1_000)
                .expireAfterWrite(ttl)
                .build();
        return new CacheBackend() {
            @Override
            public void put(String key, String value) {
                cache.put(key, value);
            }

            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(cache.getIfPresent(key));
            }

            @Override
            public String name() {
                return "CaffeineCache";
            }
        };
    }
}
