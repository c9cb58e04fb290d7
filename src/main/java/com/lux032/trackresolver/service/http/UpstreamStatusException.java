package com.lux032.trackresolver.service.http;

import lombok.Getter;

/**
 * 非限流类的 HTTP 错误状态,立即失败
 */
@Getter
public class UpstreamStatusException extends UpstreamException {

    private final int status;

    public UpstreamStatusException(String service, int status, String message) {
        super(service, "HTTP " + status + (message == null || message.isEmpty() ? "" : " - " + message));
        this.status = status;
    }
}
