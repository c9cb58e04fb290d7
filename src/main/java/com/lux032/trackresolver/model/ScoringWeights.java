package com.lux032.trackresolver.model;

import lombok.Value;

/**
 * 置信度公式中标题与艺术家的权重,两者之和必须为 1
 */
@Value
public class ScoringWeights {

    /** 多数平台: 标题 70% / 艺术家 30% */
    public static final ScoringWeights TITLE_WEIGHTED = new ScoringWeights(0.7, 0.3);

    /** Spotify 用户搜索变体: 标题 45% / 艺术家 55% */
    public static final ScoringWeights ARTIST_WEIGHTED = new ScoringWeights(0.45, 0.55);

    double titleWeight;
    double artistWeight;

    public ScoringWeights(double titleWeight, double artistWeight) {
        if (titleWeight < 0 || artistWeight < 0 || Math.abs(titleWeight + artistWeight - 1.0) > 1e-9) {
            throw new IllegalArgumentException(
                "weights must be non-negative and sum to 1: title=" + titleWeight + ", artist=" + artistWeight);
        }
        this.titleWeight = titleWeight;
        this.artistWeight = artistWeight;
    }
}
