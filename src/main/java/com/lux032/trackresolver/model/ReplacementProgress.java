package com.lux032.trackresolver.model;

import lombok.Value;

/**
 * 自动替换进度事件
 */
@Value
public class ReplacementProgress {
    int round;
    ReplacementStage stage;
    int attempt;
    int totalAttempts;
    String message;
}
