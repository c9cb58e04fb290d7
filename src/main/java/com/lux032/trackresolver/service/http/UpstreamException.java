package com.lux032.trackresolver.service.http;

import lombok.Getter;

import java.io.IOException;

/**
 * 上游服务调用失败的基类
 */
@Getter
public class UpstreamException extends IOException {

    private final String service;

    public UpstreamException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public UpstreamException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }
}
