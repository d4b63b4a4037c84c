package dev.resumescreener.ai;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Optional;

/**
 * Size- and time-bounded in-process cache of parsed oracle responses.
 */
public class CaffeineOracleResponseCache implements OracleResponseCache {

    private final Cache<String, Object> cache;

    public CaffeineOracleResponseCache(long maxEntries, Duration ttl) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = cache.getIfPresent(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value) {
        if (value != null) {
            cache.put(key, value);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
