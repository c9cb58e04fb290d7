package com.lux032.trackresolver.service.http;

import lombok.extern.slf4j.Slf4j;

import java.util.function.LongSupplier;

/**
 * 单个上游主机的请求间隔与退避状态
 * 同一实例上的 acquire 串行执行,保证相邻请求间隔不小于 minIntervalMs;
 * currentBackoffMs 记录最近一次重试的等待时间,请求成功后归零
 */
@Slf4j
public class RateLimiterState {

    private final long minIntervalMs;
    private final LongSupplier clock;
    private final Sleeper sleeper;
    private long lastRequestTime = Long.MIN_VALUE;
    private long currentBackoffMs;

    public RateLimiterState(long minIntervalMs) {
        this(minIntervalMs, System::currentTimeMillis, Sleeper.SYSTEM);
    }

    public RateLimiterState(long minIntervalMs, LongSupplier clock, Sleeper sleeper) {
        if (minIntervalMs < 0) {
            throw new IllegalArgumentException("minIntervalMs must not be negative");
        }
        this.minIntervalMs = minIntervalMs;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public synchronized void acquire() throws InterruptedException {
        if (minIntervalMs > 0 && lastRequestTime != Long.MIN_VALUE) {
            long timeSinceLastRequest = clock.getAsLong() - lastRequestTime;
            if (timeSinceLastRequest < minIntervalMs) {
                long sleepTime = minIntervalMs - timeSinceLastRequest;
                log.debug("Waiting {} ms to respect API rate limit", sleepTime);
                sleeper.sleep(sleepTime);
            }
        }
        lastRequestTime = clock.getAsLong();
    }

    /**
     * 计算第 retryIndex 次重试的等待时间并记为当前退避
     */
    public synchronized long nextBackoff(RetryPolicy policy, int retryIndex) {
        currentBackoffMs = policy.delayFor(retryIndex);
        return currentBackoffMs;
    }

    public synchronized void resetBackoff() {
        currentBackoffMs = 0;
    }

    public synchronized long getCurrentBackoffMs() {
        return currentBackoffMs;
    }

    public long getMinIntervalMs() {
        return minIntervalMs;
    }
}
