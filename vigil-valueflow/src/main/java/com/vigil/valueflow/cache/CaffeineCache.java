package com.vigil.valueflow.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.function.Function;

/**
 * 基于 Caffeine 的有界缓存（线程安全，W-TinyLFU 淘汰）
 */
public final class CaffeineCache<K, V> implements BoundedCache<K, V> {

    private final Cache<K, V> cache;
    private final long capacity;

    public CaffeineCache(long capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.cache = Caffeine.newBuilder()
                .maximumSize(capacity)
                .recordStats()
                .build();
    }

    @Override
    public V getIfPresent(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return cache.get(key, loader);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /** 触发挂起的淘汰后返回条目数 */
    @Override
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats s = cache.stats();
        return new CacheStats(s.hitCount(), s.missCount(), s.evictionCount(), estimatedSize(), capacity);
    }
}
