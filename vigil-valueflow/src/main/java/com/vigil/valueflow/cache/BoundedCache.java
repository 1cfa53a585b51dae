package com.vigil.valueflow.cache;

import java.util.function.Function;

/**
 * 有界缓存：按容量淘汰，记录命中统计
 *
 * @param <K> 键
 * @param <V> 值，应为不可变对象以便跨查询共享
 */
public interface BoundedCache<K, V> {

    /** 缓存中的值，不存在返回 null */
    V getIfPresent(K key);

    /**
     * 取值，不存在时用 loader 计算并缓存。loader 返回 null 时不缓存。
     */
    V get(K key, Function<? super K, ? extends V> loader);

    void invalidateAll();

    long estimatedSize();

    CacheStats stats();
}
