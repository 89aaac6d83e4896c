package com.fieldinsight.reporting.core.exception;

/**
 * 缓存存储不可用
 * 由 ReportCacheManager 捕获并降级为缓存未命中，不会传播给调用方
 */
public class CacheStoreException extends ReportEngineException {

    public CacheStoreException(String message, Throwable cause) {
        super(FailureCategory.EXECUTION, message, cause);
    }
}
