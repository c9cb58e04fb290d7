package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 待解析的曲目(不可变)
 * artist 和 title 为必填,其余字段都可能缺失,
 * 上游推荐源给出的信息经常是臆造或拼写错误的
 */
@Value
@Builder(toBuilder = true)
public class TrackQuery {

    /** 调用方的曲目 ID,自动替换删除原曲目时使用 */
    String id;
    String artist;
    String title;
    String album;
    String year;

    /** 已经确认过该曲目的平台,如 MusicBrainz */
    Platform verificationSource;
    String musicBrainzId;
    String isrc;

    /** 导入时带来的原始链接,如 spotify:track:xxx 或 https://youtu.be/xxx */
    String serviceUri;
    String serviceUrl;

    /** 导入时带来的平台原生 ID,来源平台未知;22 位字母数字的视为 Spotify 曲目 ID */
    String serviceId;

    @NonNull
    @Builder.Default
    PlatformIds platformIds = PlatformIds.EMPTY;

    public static TrackQuery of(String artist, String title) {
        return TrackQuery.builder().artist(artist).title(title).build();
    }

    public boolean hasRequiredFields() {
        return artist != null && !artist.isBlank() && title != null && !title.isBlank();
    }

    /**
     * 上游验证源可信: 已被 MusicBrainz 确认或带有 MBID
     */
    public boolean hasTrustedSource() {
        return verificationSource == Platform.MUSICBRAINZ
            || (musicBrainzId != null && !musicBrainzId.isBlank());
    }

    public String label() {
        return artist + " - " + title;
    }
}
