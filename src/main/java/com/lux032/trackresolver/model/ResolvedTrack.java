package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 批量验证后单首曲目的结果
 * 规范字段(artist/title/album/year)在验证成功时取自验证平台,否则保留原值
 */
@Value
@Builder(toBuilder = true)
public class ResolvedTrack {

    @NonNull
    TrackQuery query;

    @NonNull
    VerificationStatus status;

    /** 确认该曲目的平台,未验证时为空 */
    Platform verificationSource;

    String artist;
    String title;
    String album;
    String year;
    String musicBrainzId;
    String isrc;
    String artworkUrl;
    String previewUrl;

    @NonNull
    @Builder.Default
    PlatformIds platformIds = PlatformIds.EMPTY;

    /** 每个尝试过的平台的解析结果 */
    @Singular
    Map<Platform, ResolveResult> resolutions;

    String error;

    public boolean isVerified() {
        return status == VerificationStatus.VERIFIED;
    }

    /**
     * 转换为后续解析(导出到其他平台)使用的查询对象,携带已确认的标识
     */
    public TrackQuery toQuery() {
        return query.toBuilder()
            .artist(artist != null ? artist : query.getArtist())
            .title(title != null ? title : query.getTitle())
            .album(album != null ? album : query.getAlbum())
            .year(year != null ? year : query.getYear())
            .verificationSource(verificationSource != null ? verificationSource : query.getVerificationSource())
            .musicBrainzId(musicBrainzId != null ? musicBrainzId : query.getMusicBrainzId())
            .isrc(isrc != null ? isrc : query.getIsrc())
            .platformIds(platformIds.mergedWith(query.getPlatformIds()))
            .build();
    }
}
