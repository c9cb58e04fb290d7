package com.lux032.trackresolver.model;

/**
 * 失败分类
 */
public enum FailureKind {

    /**
     * 平台确实没有匹配录音
     * 对该平台是终态,触发级联回退
     */
    NOT_FOUND,

    /**
     * 网络或限流错误
     * 由 RateLimitedClient 重试,重试耗尽后按未找到处理
     */
    TRANSIENT,

    /**
     * 令牌缺失或过期
     * 本次运行跳过该平台,不重试
     */
    AUTH,

    /**
     * 缺少艺术家或标题
     * 直接跳过,不会发起网络请求
     */
    MALFORMED_INPUT
}
