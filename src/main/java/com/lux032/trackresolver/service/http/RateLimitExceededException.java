package com.lux032.trackresolver.service.http;

import lombok.Getter;

/**
 * 限流或网络错误在重试次数耗尽后仍未恢复
 */
@Getter
public class RateLimitExceededException extends UpstreamException {

    private final int attempts;

    public RateLimitExceededException(String service, int attempts, Throwable lastError) {
        super(service, "gave up after " + attempts + " attempts", lastError);
        this.attempts = attempts;
    }
}
