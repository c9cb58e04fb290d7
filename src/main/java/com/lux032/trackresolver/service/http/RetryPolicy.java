package com.lux032.trackresolver.service.http;

import com.lux032.trackresolver.config.ResolverConfig;
import lombok.Builder;
import lombok.Value;

/**
 * 指数退避重试策略
 * 第 n 次重试前等待 min(initialDelayMs * multiplier^n, maxDelayMs)
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    long initialDelayMs = 1000;

    @Builder.Default
    long maxDelayMs = 10000;

    @Builder.Default
    double multiplier = 2.0;

    public static RetryPolicy fromConfig(ResolverConfig config) {
        return RetryPolicy.builder()
            .maxRetries(config.getRetryMaxRetries())
            .initialDelayMs(config.getRetryInitialDelayMs())
            .maxDelayMs(config.getRetryMaxDelayMs())
            .multiplier(config.getRetryBackoffMultiplier())
            .build();
    }

    /**
     * @param retryIndex 从 0 开始的重试序号
     */
    public long delayFor(int retryIndex) {
        double delay = initialDelayMs * Math.pow(multiplier, retryIndex);
        return (long) Math.min(delay, maxDelayMs);
    }

    /**
     * 限流类状态码: 503 (MusicBrainz) 与 429 (Spotify/YouTube)
     */
    public boolean isThrottled(int status) {
        return status == 503 || status == 429;
    }
}
