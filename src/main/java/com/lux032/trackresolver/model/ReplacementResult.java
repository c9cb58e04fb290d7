package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一轮自动替换的最终结果
 * replacedCount == 原失败数 - stillFailedTracks.size()
 */
@Value
@Builder
public class ReplacementResult {

    boolean success;
    int round;
    int attempts;
    int replacedCount;

    /** 仍未解决的曲目(可能已被替换为同样失败的候选),交由用户手动处理 */
    @Singular
    List<TrackQuery> stillFailedTracks;

    boolean userActionNeeded;

    /** 验证通过、应加入歌单的替换曲目 */
    @Singular
    List<ResolvedTrack> verifiedReplacements;

    /** 已通过删除协作方移除的原曲目 ID */
    @Singular
    List<String> deletedTrackIds;

    RunOutcome outcome;

    @Singular("progressEvent")
    List<ReplacementProgress> progress;
}
