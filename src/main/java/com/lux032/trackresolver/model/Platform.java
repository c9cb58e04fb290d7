package com.lux032.trackresolver.model;

import java.util.Locale;

/**
 * 支持的外部音乐平台
 */
public enum Platform {

    MUSICBRAINZ("musicbrainz", "MusicBrainz"),
    APPLE("apple", "Apple Music"),
    SPOTIFY("spotify", "Spotify"),
    YOUTUBE("youtube", "YouTube");

    private final String key;
    private final String displayName;

    Platform(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * 配置文件中使用的小写标识,如 musicbrainz
     */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 根据配置标识解析平台(忽略大小写,兼容 itunes 别名)
     * @throws IllegalArgumentException 未知平台
     */
    public static Platform fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            if ("itunes".equals(normalized)) {
                return APPLE;
            }
            for (Platform platform : values()) {
                if (platform.key.equals(normalized)) {
                    return platform;
                }
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + key);
    }
}
