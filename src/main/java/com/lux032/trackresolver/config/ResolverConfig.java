package com.lux032.trackresolver.config;

import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.ScoringWeights;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * 曲目解析引擎配置类
 * 默认值写在构造函数中,可由 config.properties 覆盖
 */
@Slf4j
@Data
public class ResolverConfig {

    // MusicBrainz 配置
    private String musicBrainzApiUrl;
    private String coverArtApiUrl;
    private String userAgent;
    private long musicBrainzMinIntervalMs;

    // iTunes Search 配置
    private String itunesApiUrl;
    private long itunesMinIntervalMs;

    // Spotify 配置
    private String spotifyApiUrl;
    private long spotifyMinIntervalMs;

    // YouTube Data API 配置
    private String youtubeApiUrl;
    private String youtubeApiKey;
    private long youtubeMinIntervalMs;

    // HTTP 与重试配置
    private int httpTimeoutSeconds;
    private int retryMaxRetries;
    private long retryInitialDelayMs;
    private long retryMaxDelayMs;
    private double retryBackoffMultiplier;

    // 匹配阈值配置
    private double softThreshold;
    private double hardThreshold;
    private int hardSearchLimit;
    private Map<Platform, ScoringWeights> scoringWeights;

    // 验证级联配置
    private List<Platform> cascade;
    private List<Platform> enrichment;
    private long interTrackDelayMs;
    private long verificationTimeoutSeconds; // 0 表示不限时

    // 自动替换配置
    private int replacementMaxRetries;

    // HTTP 代理配置
    private boolean proxyEnabled;
    private String proxyHost;
    private int proxyPort;

    // 国际化配置
    private String language;

    public ResolverConfig() {
        this.musicBrainzApiUrl = "https://musicbrainz.org/ws/2";
        this.coverArtApiUrl = "https://coverartarchive.org";
        this.userAgent = "TrackResolver/1.0 ( contact@example.com )";
        this.musicBrainzMinIntervalMs = 1000; // MusicBrainz 要求至少1秒间隔

        this.itunesApiUrl = "https://itunes.apple.com";
        this.itunesMinIntervalMs = 0;

        this.spotifyApiUrl = "https://api.spotify.com/v1";
        this.spotifyMinIntervalMs = 50;

        this.youtubeApiUrl = "https://www.googleapis.com/youtube/v3";
        this.youtubeMinIntervalMs = 200;

        this.httpTimeoutSeconds = 30;
        this.retryMaxRetries = 3;
        this.retryInitialDelayMs = 1000;
        this.retryMaxDelayMs = 10000;
        this.retryBackoffMultiplier = 2.0;

        this.softThreshold = 0.5;
        this.hardThreshold = 0.5;
        this.hardSearchLimit = 5;
        this.scoringWeights = new EnumMap<>(Platform.class);

        this.cascade = new ArrayList<>(List.of(Platform.MUSICBRAINZ, Platform.APPLE));
        this.enrichment = new ArrayList<>(List.of(Platform.SPOTIFY, Platform.APPLE));
        this.interTrackDelayMs = 100;
        this.verificationTimeoutSeconds = 0;

        this.replacementMaxRetries = 3;

        this.language = "en_US";
    }

    /**
     * 从配置文件加载,文件不存在时使用默认配置
     */
    public static ResolverConfig load(Path configPath) {
        ResolverConfig config = new ResolverConfig();
        if (!Files.exists(configPath)) {
            log.info("Configuration file {} not found, using default configuration", configPath);
            return config;
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(configPath)) {
            props.load(in);
            config.apply(props);
            log.info("Configuration file loaded: {}", configPath);
        } catch (IOException e) {
            log.error("Failed to read configuration file {}, using defaults", configPath, e);
        }
        return config;
    }

    /**
     * 用 Properties 覆盖当前配置,非法数值会被记录并忽略
     */
    public void apply(Properties props) {
        if (props.containsKey("musicbrainz.apiUrl")) {
            this.musicBrainzApiUrl = props.getProperty("musicbrainz.apiUrl");
        }
        if (props.containsKey("musicbrainz.coverArtApiUrl")) {
            this.coverArtApiUrl = props.getProperty("musicbrainz.coverArtApiUrl");
        }
        if (props.containsKey("musicbrainz.userAgent")) {
            this.userAgent = props.getProperty("musicbrainz.userAgent");
        }
        this.musicBrainzMinIntervalMs = readLong(props, "musicbrainz.minIntervalMs", musicBrainzMinIntervalMs);

        if (props.containsKey("itunes.apiUrl")) {
            this.itunesApiUrl = props.getProperty("itunes.apiUrl");
        }
        this.itunesMinIntervalMs = readLong(props, "itunes.minIntervalMs", itunesMinIntervalMs);

        if (props.containsKey("spotify.apiUrl")) {
            this.spotifyApiUrl = props.getProperty("spotify.apiUrl");
        }
        this.spotifyMinIntervalMs = readLong(props, "spotify.minIntervalMs", spotifyMinIntervalMs);

        if (props.containsKey("youtube.apiUrl")) {
            this.youtubeApiUrl = props.getProperty("youtube.apiUrl");
        }
        if (props.containsKey("youtube.apiKey")) {
            this.youtubeApiKey = props.getProperty("youtube.apiKey");
        }
        this.youtubeMinIntervalMs = readLong(props, "youtube.minIntervalMs", youtubeMinIntervalMs);

        this.httpTimeoutSeconds = readInt(props, "http.timeoutSeconds", httpTimeoutSeconds);
        this.retryMaxRetries = readInt(props, "retry.maxRetries", retryMaxRetries);
        this.retryInitialDelayMs = readLong(props, "retry.initialDelayMs", retryInitialDelayMs);
        this.retryMaxDelayMs = readLong(props, "retry.maxDelayMs", retryMaxDelayMs);
        this.retryBackoffMultiplier = readDouble(props, "retry.backoffMultiplier", retryBackoffMultiplier);

        this.softThreshold = readDouble(props, "resolver.softThreshold", softThreshold);
        this.hardThreshold = readDouble(props, "resolver.hardThreshold", hardThreshold);
        this.hardSearchLimit = readInt(props, "resolver.hardSearchLimit", hardSearchLimit);
        for (Platform platform : Platform.values()) {
            String prefix = "resolver." + platform.getKey() + ".";
            if (props.containsKey(prefix + "titleWeight") || props.containsKey(prefix + "artistWeight")) {
                ScoringWeights current = getWeights(platform);
                double title = readDouble(props, prefix + "titleWeight", current.getTitleWeight());
                double artist = readDouble(props, prefix + "artistWeight", 1.0 - title);
                try {
                    scoringWeights.put(platform, new ScoringWeights(title, artist));
                } catch (IllegalArgumentException e) {
                    log.warn("Invalid scoring weights for {}: {}", platform.getKey(), e.getMessage());
                }
            }
        }

        if (props.containsKey("verification.cascade")) {
            this.cascade = readPlatforms(props.getProperty("verification.cascade"), cascade);
        }
        if (props.containsKey("verification.enrichment")) {
            this.enrichment = readPlatforms(props.getProperty("verification.enrichment"), enrichment);
        }
        this.interTrackDelayMs = readLong(props, "verification.interTrackDelayMs", interTrackDelayMs);
        this.verificationTimeoutSeconds = readLong(props, "verification.timeoutSeconds", verificationTimeoutSeconds);

        this.replacementMaxRetries = readInt(props, "replacement.maxRetries", replacementMaxRetries);

        if (props.containsKey("proxy.enabled")) {
            this.proxyEnabled = Boolean.parseBoolean(props.getProperty("proxy.enabled"));
        }
        if (props.containsKey("proxy.host")) {
            this.proxyHost = props.getProperty("proxy.host");
        }
        this.proxyPort = readInt(props, "proxy.port", proxyPort);

        if (props.containsKey("i18n.language")) {
            this.language = props.getProperty("i18n.language");
        }
    }

    /**
     * 获取平台的打分权重,未配置时使用标题优先的默认权重
     */
    public ScoringWeights getWeights(Platform platform) {
        return scoringWeights.getOrDefault(platform, ScoringWeights.TITLE_WEIGHTED);
    }

    /**
     * 验证配置是否有效
     */
    public boolean isValid() {
        if (cascade == null || cascade.isEmpty()) {
            log.error("Verification cascade not configured");
            return false;
        }
        if (softThreshold < 0 || softThreshold > 1 || hardThreshold < 0 || hardThreshold > 1) {
            log.error("Match thresholds must be within [0,1]: soft={}, hard={}", softThreshold, hardThreshold);
            return false;
        }
        if (hardSearchLimit < 1) {
            log.error("resolver.hardSearchLimit must be at least 1");
            return false;
        }
        if (retryMaxRetries < 0 || retryBackoffMultiplier < 1.0) {
            log.error("Invalid retry configuration: maxRetries={}, multiplier={}", retryMaxRetries, retryBackoffMultiplier);
            return false;
        }
        if (replacementMaxRetries < 1) {
            log.error("replacement.maxRetries must be at least 1");
            return false;
        }
        if (youtubeApiKey == null || youtubeApiKey.isEmpty()) {
            log.warn("YouTube API key not configured, YouTube lookups need a user access token");
        }
        return true;
    }

    private static int readInt(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return fallback;
        }
    }

    private static long readLong(Properties props, String key, long fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return fallback;
        }
    }

    private static double readDouble(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} configuration: {}", key, value);
            return fallback;
        }
    }

    private static List<Platform> readPlatforms(String value, List<Platform> fallback) {
        try {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Platform::fromKey)
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid platform list '{}': {}", value, e.getMessage());
            return fallback;
        }
    }
}
