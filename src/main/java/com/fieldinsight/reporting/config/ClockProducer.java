package com.fieldinsight.reporting.config;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * 缓存过期判断和默认时间窗口都从注入的 Clock 取时间，测试中可替换
 */
@Singleton
public class ClockProducer {

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
