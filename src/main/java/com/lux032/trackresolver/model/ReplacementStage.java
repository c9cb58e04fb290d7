package com.lux032.trackresolver.model;

/**
 * 自动替换状态机的阶段
 */
public enum ReplacementStage {
    REQUESTING,
    VERIFYING,
    DELETING,
    RETRYING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
