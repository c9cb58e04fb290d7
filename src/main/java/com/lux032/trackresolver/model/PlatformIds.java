package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * 各平台标识的固定结构,每个支持的平台一个可选字段
 */
@Value
@With
@Builder(toBuilder = true)
public class PlatformIds {

    public static final PlatformIds EMPTY = PlatformIds.builder().build();

    PlatformId spotify;
    PlatformId apple;
    PlatformId youtube;
    PlatformId tidal;
    PlatformId qobuz;

    /**
     * 按平台取标识,MusicBrainz 的 MBID 不在此结构中
     */
    public PlatformId get(Platform platform) {
        switch (platform) {
            case SPOTIFY:
                return spotify;
            case APPLE:
                return apple;
            case YOUTUBE:
                return youtube;
            default:
                return null;
        }
    }

    public PlatformIds with(Platform platform, PlatformId id) {
        switch (platform) {
            case SPOTIFY:
                return withSpotify(id);
            case APPLE:
                return withApple(id);
            case YOUTUBE:
                return withYoutube(id);
            default:
                return this;
        }
    }

    /**
     * 合并: 本对象已有的字段优先,缺失的字段从 other 补齐
     */
    public PlatformIds mergedWith(PlatformIds other) {
        if (other == null) {
            return this;
        }
        return PlatformIds.builder()
            .spotify(spotify != null ? spotify : other.spotify)
            .apple(apple != null ? apple : other.apple)
            .youtube(youtube != null ? youtube : other.youtube)
            .tidal(tidal != null ? tidal : other.tidal)
            .qobuz(qobuz != null ? qobuz : other.qobuz)
            .build();
    }

    public boolean isEmpty() {
        return spotify == null && apple == null && youtube == null && tidal == null && qobuz == null;
    }
}
