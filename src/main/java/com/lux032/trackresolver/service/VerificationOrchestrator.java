package com.lux032.trackresolver.service;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.BatchVerificationResult;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.FailureKind;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.PlatformId;
import com.lux032.trackresolver.model.PlatformIds;
import com.lux032.trackresolver.model.ResolveResult;
import com.lux032.trackresolver.model.ResolvedTrack;
import com.lux032.trackresolver.model.RunOutcome;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.model.VerificationProgress;
import com.lux032.trackresolver.model.VerificationStatus;
import com.lux032.trackresolver.model.VerificationSummary;
import com.lux032.trackresolver.service.http.Sleeper;
import com.lux032.trackresolver.service.platform.PlatformSearchAdapter;
import com.lux032.trackresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 批量验证编排器
 * 按级联顺序(默认 MusicBrainz → Apple Music)逐首验证,
 * 验证成功后补全元数据并到补充平台查找 ID
 */
@Slf4j
public class VerificationOrchestrator {

    private final Map<Platform, PlatformSearchAdapter> adapters;
    private final TieredResolver resolver;
    private final List<Platform> cascade;
    private final List<Platform> enrichment;
    private final long interTrackDelayMs;
    private final Sleeper sleeper;
    private final Duration batchTimeout;

    public VerificationOrchestrator(Map<Platform, PlatformSearchAdapter> adapters, TieredResolver resolver,
                                    List<Platform> cascade, List<Platform> enrichment,
                                    long interTrackDelayMs, Sleeper sleeper) {
        this(adapters, resolver, cascade, enrichment, interTrackDelayMs, sleeper, Duration.ZERO);
    }

    /**
     * @param batchTimeout 未传入 RunControl 时每批的时限,零表示不限时
     */
    public VerificationOrchestrator(Map<Platform, PlatformSearchAdapter> adapters, TieredResolver resolver,
                                    List<Platform> cascade, List<Platform> enrichment,
                                    long interTrackDelayMs, Sleeper sleeper, Duration batchTimeout) {
        if (cascade == null || cascade.isEmpty()) {
            throw new IllegalStateException("verification cascade is empty");
        }
        for (Platform platform : cascade) {
            if (!adapters.containsKey(platform)) {
                throw new IllegalStateException("no adapter registered for cascade platform " + platform.getKey());
            }
        }
        this.adapters = new EnumMap<>(adapters);
        this.resolver = resolver;
        this.cascade = List.copyOf(cascade);
        this.enrichment = List.copyOf(enrichment);
        this.interTrackDelayMs = interTrackDelayMs;
        this.sleeper = sleeper;
        this.batchTimeout = batchTimeout;
    }

    public VerificationOrchestrator(Map<Platform, PlatformSearchAdapter> adapters, TieredResolver resolver,
                                    ResolverConfig config) {
        this(adapters, resolver, config.getCascade(), config.getEnrichment(),
            config.getInterTrackDelayMs(), Sleeper.SYSTEM,
            Duration.ofSeconds(config.getVerificationTimeoutSeconds()));
    }

    Duration getBatchTimeout() {
        return batchTimeout;
    }

    public BatchVerificationResult verifyBatch(List<TrackQuery> tracks) {
        return verifyBatch(tracks, null);
    }

    /**
     * 按配置的时限验证一批曲目
     */
    public BatchVerificationResult verifyBatch(List<TrackQuery> tracks, Consumer<VerificationProgress> onProgress) {
        return verifyBatch(tracks, onProgress, RunControl.withTimeout(batchTimeout));
    }

    /**
     * 顺序验证一批曲目
     * @param onProgress 每处理完一首调用一次,可为空;监听器抛出的异常只记录日志
     * @param runControl 在曲目之间检查,停止后剩余曲目记为 SKIPPED
     */
    public BatchVerificationResult verifyBatch(List<TrackQuery> tracks, Consumer<VerificationProgress> onProgress,
                                               RunControl runControl) {
        int total = tracks.size();
        log.info("开始批量验证 {} 首曲目, 级联: {}", total, cascade);

        VerificationSummary.Accumulator summary = VerificationSummary.accumulator(total);
        List<ResolvedTrack> results = new ArrayList<>(total);
        List<VerificationProgress> progress = new ArrayList<>(total);
        Set<Platform> disabled = EnumSet.noneOf(Platform.class);
        RunOutcome outcome = RunOutcome.COMPLETED;

        for (int i = 0; i < total; i++) {
            if (i > 0 && interTrackDelayMs > 0) {
                try {
                    sleeper.sleep(interTrackDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcome = RunOutcome.CANCELLED;
                    break;
                }
            }
            if (runControl.shouldStop()) {
                outcome = runControl.stopOutcome();
                break;
            }

            TrackQuery track = tracks.get(i);
            ResolvedTrack resolved = verifyTrack(track, disabled);
            results.add(resolved);
            record(summary, resolved);

            VerificationProgress event = new VerificationProgress(
                i + 1, total, summary.getVerified(), summary.getFailed(), track.label());
            progress.add(event);
            notifyListener(onProgress, event);
        }

        if (results.size() < total) {
            log.warn("批量验证提前结束({}),剩余 {} 首未处理", outcome, total - results.size());
            String reason = I18nUtil.getMessage("verify.not.processed");
            for (int i = results.size(); i < total; i++) {
                results.add(ResolvedTrack.builder()
                    .query(tracks.get(i))
                    .status(VerificationStatus.SKIPPED)
                    .artist(tracks.get(i).getArtist())
                    .title(tracks.get(i).getTitle())
                    .platformIds(tracks.get(i).getPlatformIds())
                    .error(reason)
                    .build());
                summary.recordSkipped();
            }
        }

        VerificationSummary built = summary.build(outcome);
        log.info("批量验证完成: 共 {} 首, 成功 {}, 失败 {}, 跳过 {} ({})",
            built.getTotal(), built.getVerified(), built.getFailed(), built.getSkipped(), outcome);
        return new BatchVerificationResult(List.copyOf(results), built, List.copyOf(progress));
    }

    /**
     * 验证单首曲目
     * @param disabled 本批次中已因认证问题停用的平台,会被更新
     */
    ResolvedTrack verifyTrack(TrackQuery track, Set<Platform> disabled) {
        if (!track.hasRequiredFields()) {
            log.debug("缺少艺术家或标题,跳过: {}", track.getId());
            return ResolvedTrack.builder()
                .query(track)
                .status(VerificationStatus.SKIPPED)
                .artist(track.getArtist())
                .title(track.getTitle())
                .platformIds(track.getPlatformIds())
                .error(I18nUtil.getMessage("verify.missing.fields"))
                .build();
        }

        Map<Platform, ResolveResult> resolutions = new EnumMap<>(Platform.class);
        List<String> reasons = new ArrayList<>();
        for (Platform platform : cascade) {
            PlatformSearchAdapter adapter = adapters.get(platform);
            if (disabled.contains(platform)) {
                reasons.add(I18nUtil.getMessage("verify.platform.disabled", platform.getDisplayName()));
                continue;
            }
            if (!adapter.isAvailable()) {
                log.warn("{} 不可用(缺少访问令牌),本批次跳过", platform.getDisplayName());
                disabled.add(platform);
                reasons.add(I18nUtil.getMessage("verify.platform.disabled", platform.getDisplayName()));
                continue;
            }

            ResolveResult result = resolver.resolve(track, adapter);
            resolutions.put(platform, result);
            if (result.isResolved()) {
                return accept(track, adapter, result, resolutions, disabled);
            }
            if (result.getFailureKind() == FailureKind.AUTH) {
                disabled.add(platform);
            }
            reasons.add(result.getReason());
            log.debug("{} 未找到 {}, 尝试下一个平台", platform.getDisplayName(), track.label());
        }

        String reason = I18nUtil.getMessage("verify.failed", String.join("; ", reasons));
        log.info("✗ 验证失败: {} - {}", track.label(), reason);
        return ResolvedTrack.builder()
            .query(track)
            .status(VerificationStatus.FAILED)
            .artist(track.getArtist())
            .title(track.getTitle())
            .album(track.getAlbum())
            .year(track.getYear())
            .platformIds(track.getPlatformIds())
            .resolutions(resolutions)
            .error(reason)
            .build();
    }

    private ResolvedTrack accept(TrackQuery track, PlatformSearchAdapter adapter, ResolveResult result,
                                 Map<Platform, ResolveResult> resolutions, Set<Platform> disabled) {
        Platform platform = adapter.platform();
        Candidate candidate = result.getCandidate() != null
            ? result.getCandidate()
            : Candidate.builder().platform(platform).id(result.getIdentifier()).build();
        try {
            candidate = adapter.lookupDetails(candidate);
        } catch (IOException | RuntimeException e) {
            log.warn("获取 {} 详情失败,使用搜索结果: {}", platform.getDisplayName(), e.getMessage());
        }

        PlatformIds ids = track.getPlatformIds().mergedWith(candidate.getRelatedIds());
        if (platform != Platform.MUSICBRAINZ && ids.get(platform) == null) {
            ids = ids.with(platform, candidate.toPlatformId());
        }

        ResolvedTrack verified = ResolvedTrack.builder()
            .query(track)
            .status(VerificationStatus.VERIFIED)
            .verificationSource(platform)
            .artist(firstNonBlank(candidate.getArtist(), track.getArtist()))
            .title(firstNonBlank(candidate.getTitle(), track.getTitle()))
            .album(firstNonBlank(candidate.getAlbum(), track.getAlbum()))
            .year(firstNonBlank(candidate.year(), track.getYear()))
            .musicBrainzId(platform == Platform.MUSICBRAINZ ? candidate.getId() : track.getMusicBrainzId())
            .isrc(firstNonBlank(candidate.getIsrc(), track.getIsrc()))
            .artworkUrl(candidate.getArtworkUrl())
            .previewUrl(candidate.getPreviewUrl())
            .platformIds(ids)
            .resolutions(resolutions)
            .build();
        log.info("✓ {} 验证成功: {} ({})", platform.getDisplayName(), track.label(), result.getTier());
        return enrich(verified, disabled);
    }

    /**
     * 到补充平台查找 ID,失败只记录日志
     */
    private ResolvedTrack enrich(ResolvedTrack verified, Set<Platform> disabled) {
        TrackQuery enrichedQuery = verified.toQuery();
        PlatformIds ids = verified.getPlatformIds();
        ResolvedTrack.ResolvedTrackBuilder builder = verified.toBuilder();

        for (Platform platform : enrichment) {
            PlatformSearchAdapter adapter = adapters.get(platform);
            if (platform == verified.getVerificationSource() || adapter == null || disabled.contains(platform)) {
                continue;
            }
            if (platform == Platform.MUSICBRAINZ ? verified.getMusicBrainzId() != null : ids.get(platform) != null) {
                continue;
            }
            if (!adapter.isAvailable()) {
                continue;
            }
            try {
                ResolveResult result = lookupByIsrc(adapter, verified.getIsrc());
                if (result == null) {
                    result = resolver.resolve(enrichedQuery, adapter);
                }
                builder.resolution(platform, result);
                if (result.isResolved()) {
                    PlatformId id = result.getCandidate() != null
                        ? result.getCandidate().toPlatformId()
                        : PlatformId.builder().id(result.getIdentifier()).build();
                    if (platform == Platform.MUSICBRAINZ) {
                        builder.musicBrainzId(result.getIdentifier());
                    } else {
                        ids = ids.with(platform, id);
                    }
                    log.debug("补充 {} ID: {} -> {}", platform.getDisplayName(), verified.getQuery().label(),
                        result.getIdentifier());
                } else if (result.getFailureKind() == FailureKind.AUTH) {
                    disabled.add(platform);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("补充 {} 信息失败: {} - {}", platform.getDisplayName(), verified.getQuery().label(),
                    e.getMessage());
            }
        }
        return builder.platformIds(ids).build();
    }

    /**
     * 已知 ISRC 时先按 ISRC 精确查找,适配器不支持时返回 null
     */
    private static ResolveResult lookupByIsrc(PlatformSearchAdapter adapter, String isrc) throws IOException {
        if (isrc == null || isrc.isBlank()) {
            return null;
        }
        Candidate match = adapter.searchByIsrc(isrc);
        return match != null ? ResolveResult.soft(match, 1.0) : null;
    }

    private static void record(VerificationSummary.Accumulator summary, ResolvedTrack resolved) {
        switch (resolved.getStatus()) {
            case VERIFIED:
                summary.recordVerified();
                break;
            case FAILED:
                summary.recordFailed(resolved.getQuery().getArtist(), resolved.getQuery().getTitle(),
                    resolved.getError());
                break;
            default:
                summary.recordSkipped();
                break;
        }
    }

    private static void notifyListener(Consumer<VerificationProgress> onProgress, VerificationProgress event) {
        if (onProgress == null) {
            return;
        }
        try {
            onProgress.accept(event);
        } catch (RuntimeException e) {
            log.warn("进度回调异常: {}", e.getMessage(), e);
        }
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
