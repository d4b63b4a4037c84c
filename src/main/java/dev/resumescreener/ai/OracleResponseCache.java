package dev.resumescreener.ai;

import java.util.Optional;

/**
 * Memoizes validated oracle responses keyed by a content hash of (prompt type, normalized input).
 */
public interface OracleResponseCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value);

    void invalidateAll();

    long size();
}
