package com.lux032.trackresolver.model;

/**
 * 曲目验证状态
 */
public enum VerificationStatus {
    VERIFIED,
    FAILED,
    SKIPPED
}
