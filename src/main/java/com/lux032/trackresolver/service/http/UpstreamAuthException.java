package com.lux032.trackresolver.service.http;

import lombok.Getter;

/**
 * 401/403: 访问令牌缺失或过期,不重试
 */
@Getter
public class UpstreamAuthException extends UpstreamException {

    private final int status;

    public UpstreamAuthException(String service, int status) {
        super(service, "unauthorized (HTTP " + status + ")");
        this.status = status;
    }

    public UpstreamAuthException(String service, String message) {
        super(service, message);
        this.status = 0;
    }
}
