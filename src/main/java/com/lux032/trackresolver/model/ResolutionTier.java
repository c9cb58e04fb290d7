package com.lux032.trackresolver.model;

/**
 * 匹配由哪一级策略产生,按不确定性递增排列
 */
public enum ResolutionTier {

    /** 已有可信 ID,无需网络请求 */
    DIRECT,

    /** 上游已验证,单条简单搜索 */
    SOFT,

    /** 兜底搜索,前 N 条打分取最优 */
    HARD,

    /** 没有任何一级产生可接受的匹配 */
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
