package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 平台搜索返回的一条候选结果
 */
@Value
@Builder(toBuilder = true)
public class Candidate {

    @NonNull
    Platform platform;

    /** 平台原生 ID (MBID / iTunes trackId / Spotify ID / YouTube videoId) */
    @NonNull
    String id;
    String uri;
    String url;

    /** 平台返回的规范艺术家和标题 */
    String artist;
    String title;
    String album;
    String releaseDate;
    String isrc;
    String previewUrl;
    String artworkUrl;

    /** 平台自身的相关度分数,可能为空 */
    Double score;

    /** MusicBrainz 的 Release ID,用于获取封面 */
    String releaseId;

    /** 从 MusicBrainz URL 关系中提取到的其他平台标识 */
    @NonNull
    @Builder.Default
    PlatformIds relatedIds = PlatformIds.EMPTY;

    public String year() {
        if (releaseDate == null || releaseDate.length() < 4) {
            return null;
        }
        return releaseDate.substring(0, 4);
    }

    public PlatformId toPlatformId() {
        return PlatformId.builder().id(id).uri(uri).url(url).artworkUrl(artworkUrl).build();
    }
}
