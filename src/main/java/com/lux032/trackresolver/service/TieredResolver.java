package com.lux032.trackresolver.service;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.FailureKind;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.ResolveResult;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.service.http.UpstreamAuthException;
import com.lux032.trackresolver.service.platform.PlatformSearchAdapter;
import com.lux032.trackresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;

/**
 * 三级解析策略
 * <ol>
 *   <li>DIRECT: 查询已带有合法的平台 ID,不发请求,置信度 1.0</li>
 *   <li>SOFT: 来源可信(MusicBrainz 已确认)时做一次 top-1 搜索,置信度需大于软阈值</li>
 *   <li>HARD: top-N 搜索并逐个打分,取最高分(并列取第一个),置信度需不低于硬阈值</li>
 * </ol>
 * 单曲目的任何问题都转换为 FAILED 结果,不向外抛出
 */
@Slf4j
public class TieredResolver {

    private final MatchScorer scorer;
    private final double softThreshold;
    private final double hardThreshold;
    private final int hardSearchLimit;

    public TieredResolver(MatchScorer scorer, double softThreshold, double hardThreshold, int hardSearchLimit) {
        this.scorer = scorer;
        this.softThreshold = softThreshold;
        this.hardThreshold = hardThreshold;
        this.hardSearchLimit = hardSearchLimit;
    }

    public static TieredResolver fromConfig(ResolverConfig config) {
        return new TieredResolver(MatchScorer.fromConfig(config), config.getSoftThreshold(),
            config.getHardThreshold(), config.getHardSearchLimit());
    }

    public ResolveResult resolve(TrackQuery query, PlatformSearchAdapter adapter) {
        Platform platform = adapter.platform();
        if (!query.hasRequiredFields()) {
            return ResolveResult.failed(platform, FailureKind.MALFORMED_INPUT,
                I18nUtil.getMessage("resolve.missing.fields"));
        }

        // TIER 1: 直接使用已有 ID
        String directId = adapter.extractDirectId(query);
        if (directId != null) {
            log.debug("[{}] DIRECT: {} -> {}", platform.getKey(), query.label(), directId);
            return ResolveResult.direct(platform, directId);
        }

        if (!adapter.isAvailable()) {
            return ResolveResult.failed(platform, FailureKind.AUTH,
                I18nUtil.getMessage("resolve.unavailable", platform.getDisplayName()));
        }

        String artist = query.getArtist();
        String title = query.getTitle();

        // TIER 2: 软搜索,仅限可信来源
        if (query.hasTrustedSource()) {
            try {
                Candidate top = adapter.searchTop1(artist, title);
                if (top != null) {
                    double confidence = scorer.score(top, artist, title);
                    if (confidence > softThreshold) {
                        log.debug("[{}] SOFT: {} -> {} ({})", platform.getKey(), query.label(), top.getId(),
                            String.format("%.2f", confidence));
                        return ResolveResult.soft(top, confidence);
                    }
                    log.debug("[{}] SOFT 置信度过低: {}", platform.getKey(), String.format("%.2f", confidence));
                }
            } catch (UpstreamAuthException e) {
                return authFailure(platform, e);
            } catch (IOException | RuntimeException e) {
                log.warn("[{}] 软搜索失败,回退到硬搜索: {} - {}", platform.getKey(), query.label(), e.getMessage());
            }
        }

        // TIER 3: 硬搜索
        try {
            List<Candidate> candidates = adapter.searchTopN(artist, title, hardSearchLimit);
            Candidate best = null;
            double bestConfidence = -1;
            for (Candidate candidate : candidates) {
                double confidence = scorer.score(candidate, artist, title);
                if (confidence > bestConfidence) {
                    best = candidate;
                    bestConfidence = confidence;
                }
            }
            if (best != null && bestConfidence >= hardThreshold) {
                log.debug("[{}] HARD: {} -> {} ({})", platform.getKey(), query.label(), best.getId(),
                    String.format("%.2f", bestConfidence));
                return ResolveResult.hard(best, bestConfidence);
            }
            return ResolveResult.failed(platform, FailureKind.NOT_FOUND,
                I18nUtil.getMessage("resolve.not.found", platform.getDisplayName()));
        } catch (UpstreamAuthException e) {
            return authFailure(platform, e);
        } catch (IOException | RuntimeException e) {
            log.warn("[{}] 硬搜索失败: {} - {}", platform.getKey(), query.label(), e.getMessage());
            return ResolveResult.failed(platform, FailureKind.TRANSIENT,
                I18nUtil.getMessage("resolve.search.error", platform.getDisplayName(), e.getMessage()));
        }
    }

    private static ResolveResult authFailure(Platform platform, UpstreamAuthException e) {
        log.warn("[{}] 访问被拒绝,跳过该平台: {}", platform.getKey(), e.getMessage());
        return ResolveResult.failed(platform, FailureKind.AUTH,
            I18nUtil.getMessage("resolve.unauthorized", platform.getDisplayName()));
    }
}
