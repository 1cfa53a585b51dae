package com.vigil.valueflow.cache;

/**
 * 缓存统计快照
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long evictions;
    private final long size;
    private final long capacity;

    public CacheStats(long hits, long misses, long evictions, long size, long capacity) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.size = size;
        this.capacity = capacity;
    }

    public long getHits() { return hits; }
    public long getMisses() { return misses; }
    public long getEvictions() { return evictions; }
    public long getSize() { return size; }
    public long getCapacity() { return capacity; }

    public long getRequests() {
        return hits + misses;
    }

    /** 没有请求时为 1.0 */
    public double getHitRatio() {
        long requests = getRequests();
        return requests == 0 ? 1.0 : (double) hits / requests;
    }

    @Override
    public String toString() {
        return String.format("%d/%d entries, %d of %d lookups hit, %d evicted",
                size, capacity, hits, getRequests(), evictions);
    }
}
