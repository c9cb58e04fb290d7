package com.lux032.trackresolver.model;

import lombok.Value;

import java.util.List;

/**
 * verifyBatch 的返回值: 按输入顺序的曲目结果、汇总,以及本次调用产生的进度事件
 */
@Value
public class BatchVerificationResult {
    List<ResolvedTrack> tracks;
    VerificationSummary summary;
    List<VerificationProgress> progress;
}
