package com.lux032.trackresolver.model;

/**
 * 一次批量验证或替换运行的结束方式
 * 超时和取消不等同于失败,调用方可以据此区分展示
 */
public enum RunOutcome {
    COMPLETED,
    CANCELLED,
    TIMED_OUT
}
