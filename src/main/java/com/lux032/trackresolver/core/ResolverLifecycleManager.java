package com.lux032.trackresolver.core;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.service.AutoReplacementOrchestrator;
import com.lux032.trackresolver.service.TieredResolver;
import com.lux032.trackresolver.service.VerificationOrchestrator;
import com.lux032.trackresolver.service.http.RateLimitedClient;
import com.lux032.trackresolver.service.platform.AccessTokenProvider;
import com.lux032.trackresolver.service.platform.AppleMusicSearchAdapter;
import com.lux032.trackresolver.service.platform.MusicBrainzSearchAdapter;
import com.lux032.trackresolver.service.platform.PlatformSearchAdapter;
import com.lux032.trackresolver.service.platform.SpotifySearchAdapter;
import com.lux032.trackresolver.service.platform.YouTubeSearchAdapter;
import com.lux032.trackresolver.util.I18nUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 解析引擎生命周期管理器
 * 负责按配置创建 HTTP 客户端、平台适配器和编排器,并在关闭时释放连接
 */
@Slf4j
@Getter
public class ResolverLifecycleManager {

    private final ResolverConfig config;
    private final AccessTokenProvider spotifyTokens;
    private final AccessTokenProvider youtubeTokens;

    private final List<RateLimitedClient> clients = new ArrayList<>();
    private final Map<Platform, PlatformSearchAdapter> adapters = new EnumMap<>(Platform.class);
    private TieredResolver resolver;
    private VerificationOrchestrator verificationOrchestrator;
    private AutoReplacementOrchestrator autoReplacementOrchestrator;

    public ResolverLifecycleManager(ResolverConfig config, AccessTokenProvider spotifyTokens,
                                    AccessTokenProvider youtubeTokens) {
        this.config = config;
        this.spotifyTokens = spotifyTokens != null ? spotifyTokens : AccessTokenProvider.NONE;
        this.youtubeTokens = youtubeTokens != null ? youtubeTokens : AccessTokenProvider.NONE;
    }

    /**
     * 初始化所有服务
     */
    public void initializeServices() {
        // Level 0: 初始化国际化
        I18nUtil.init(config.getLanguage());
        log.info(I18nUtil.getMessage("app.init.i18n", I18nUtil.getCurrentLanguage()));

        if (!config.isValid()) {
            throw new IllegalStateException(I18nUtil.getMessage("app.config.invalid"));
        }

        // Level 1: 每个上游服务独立的限速客户端
        Map<String, String> jsonHeaders = Map.of(
            "User-Agent", config.getUserAgent(),
            "Accept", "application/json");
        RateLimitedClient musicBrainzClient = register(RateLimitedClient.create(
            "MusicBrainz", config, config.getMusicBrainzMinIntervalMs(), jsonHeaders));
        RateLimitedClient coverArtClient = register(RateLimitedClient.create(
            "CoverArtArchive", config, 0, Map.of("User-Agent", config.getUserAgent())));
        RateLimitedClient itunesClient = register(RateLimitedClient.create(
            "iTunes", config, config.getItunesMinIntervalMs(), jsonHeaders));
        RateLimitedClient spotifyClient = register(RateLimitedClient.create(
            "Spotify", config, config.getSpotifyMinIntervalMs(), jsonHeaders));
        RateLimitedClient youtubeClient = register(RateLimitedClient.create(
            "YouTube", config, config.getYoutubeMinIntervalMs(), jsonHeaders));

        // Level 2: 平台适配器
        adapters.put(Platform.MUSICBRAINZ, new MusicBrainzSearchAdapter(
            musicBrainzClient, coverArtClient, config.getMusicBrainzApiUrl(), config.getCoverArtApiUrl()));
        adapters.put(Platform.APPLE, new AppleMusicSearchAdapter(itunesClient, config.getItunesApiUrl()));
        adapters.put(Platform.SPOTIFY, new SpotifySearchAdapter(
            spotifyClient, config.getSpotifyApiUrl(), spotifyTokens));
        adapters.put(Platform.YOUTUBE, new YouTubeSearchAdapter(
            youtubeClient, config.getYoutubeApiUrl(), config.getYoutubeApiKey(), youtubeTokens));
        log.info(I18nUtil.getMessage("app.init.adapters", adapters.keySet()));

        // Level 3: 解析与编排
        resolver = TieredResolver.fromConfig(config);
        verificationOrchestrator = new VerificationOrchestrator(adapters, resolver, config);
        autoReplacementOrchestrator = new AutoReplacementOrchestrator(verificationOrchestrator, config);

        log.info(I18nUtil.getMessage("app.all.services.ready"));
    }

    public PlatformSearchAdapter getAdapter(Platform platform) {
        return adapters.get(platform);
    }

    /**
     * 关闭所有 HTTP 客户端
     */
    public void shutdown() {
        log.info(I18nUtil.getMessage("app.shutting.down"));
        for (RateLimitedClient client : clients) {
            try {
                client.close();
            } catch (IOException e) {
                log.warn(I18nUtil.getMessage("app.shutdown.client.error", client.getService()), e);
            }
        }
        clients.clear();
    }

    private RateLimitedClient register(RateLimitedClient client) {
        clients.add(client);
        return client;
    }
}
