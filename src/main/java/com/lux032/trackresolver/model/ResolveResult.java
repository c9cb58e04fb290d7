package com.lux032.trackresolver.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * TieredResolver 针对单个 (曲目, 平台) 的解析结果
 * 只能通过静态工厂创建,保证 FAILED 与 identifier 为空互为充要条件,
 * DIRECT 的置信度恒为 1.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolveResult {

    Platform platform;
    ResolutionTier tier;
    String identifier;
    Candidate candidate;
    double confidence;
    String reason;
    FailureKind failureKind;

    public static ResolveResult direct(Platform platform, String identifier) {
        requireIdentifier(identifier);
        return new ResolveResult(platform, ResolutionTier.DIRECT, identifier, null, 1.0, null, null);
    }

    public static ResolveResult soft(Candidate candidate, double confidence) {
        return matched(ResolutionTier.SOFT, candidate, confidence);
    }

    public static ResolveResult hard(Candidate candidate, double confidence) {
        return matched(ResolutionTier.HARD, candidate, confidence);
    }

    public static ResolveResult failed(Platform platform, FailureKind kind, String reason) {
        return new ResolveResult(platform, ResolutionTier.FAILED, null, null, 0.0, reason, kind);
    }

    private static ResolveResult matched(ResolutionTier tier, Candidate candidate, double confidence) {
        requireIdentifier(candidate.getId());
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        return new ResolveResult(candidate.getPlatform(), tier, candidate.getId(), candidate, confidence, null, null);
    }

    private static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("resolved identifier must not be empty");
        }
    }

    public boolean isResolved() {
        return tier.isSuccess();
    }
}
