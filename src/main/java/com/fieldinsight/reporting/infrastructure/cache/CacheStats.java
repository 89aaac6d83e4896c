package com.fieldinsight.reporting.infrastructure.cache;

/**
 * @param coalesced  合并到进行中计算的请求数
 * @param storeErrors 存储异常（降级为未命中）次数
 */
public record CacheStats(String store, long hits, long misses, long coalesced, long storeErrors, int inFlight) {
}
