package com.lux032.trackresolver.service.platform;

/**
 * 用户访问令牌来源,令牌的获取与刷新由调用方负责
 */
@FunctionalInterface
public interface AccessTokenProvider {

    AccessTokenProvider NONE = () -> null;

    /**
     * @return 当前有效的令牌,未登录或已过期时返回 null
     */
    String getAccessToken();
}
