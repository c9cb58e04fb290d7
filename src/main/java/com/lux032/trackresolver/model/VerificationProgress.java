package com.lux032.trackresolver.model;

import lombok.Value;

/**
 * 批量验证进度事件,每处理完一首曲目产生一条
 */
@Value
public class VerificationProgress {
    int current;
    int total;
    int verified;
    int failed;
    String label;
}
