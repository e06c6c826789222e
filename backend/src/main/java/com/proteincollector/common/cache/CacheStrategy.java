package com.proteincollector.common.cache;

/**
 * Order in which {@link ResponseCache} picks entries to evict under capacity pressure.
 */
public enum CacheStrategy {
    /** Least recently accessed first. */
    LRU,
    /** Lowest access count first. */
    LFU,
    /** Oldest by creation first. */
    FIFO,
    /** Already expired first, then oldest by creation. */
    TTL
}
