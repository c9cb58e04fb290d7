package com.lux032.trackresolver.service;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.ScoringWeights;
import com.lux032.trackresolver.util.TextSimilarity;

import java.util.function.Function;

/**
 * 候选置信度 = sim(艺术家) * 艺术家权重 + sim(标题) * 标题权重,结果限制在 [0,1]
 */
public class MatchScorer {

    private final Function<Platform, ScoringWeights> weights;

    public MatchScorer(Function<Platform, ScoringWeights> weights) {
        this.weights = weights;
    }

    public static MatchScorer fromConfig(ResolverConfig config) {
        return new MatchScorer(config::getWeights);
    }

    /**
     * 所有平台都使用标题优先的默认权重
     */
    public static MatchScorer defaults() {
        return new MatchScorer(platform -> ScoringWeights.TITLE_WEIGHTED);
    }

    public double score(Candidate candidate, String artist, String title) {
        ScoringWeights w = weights.apply(candidate.getPlatform());
        double artistMatch = TextSimilarity.similarity(candidate.getArtist(), artist);
        double titleMatch = TextSimilarity.similarity(candidate.getTitle(), title);
        double confidence = artistMatch * w.getArtistWeight() + titleMatch * w.getTitleWeight();
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
