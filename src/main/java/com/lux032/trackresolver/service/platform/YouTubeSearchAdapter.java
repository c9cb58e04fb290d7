package com.lux032.trackresolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.PlatformId;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.service.http.RateLimitedClient;
import com.lux032.trackresolver.service.http.UpstreamAuthException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube Data API v3 适配器
 * 搜索限定音乐分类的视频,视频标题解析为艺术家和歌名后交给打分器
 */
@Slf4j
public class YouTubeSearchAdapter implements PlatformSearchAdapter {

    private static final Pattern VIDEO_ID = Pattern.compile("^[A-Za-z0-9_-]{11}$");
    private static final Pattern WATCH_URL = Pattern.compile("watch\\?(?:.*&)?v=([A-Za-z0-9_-]{11})");
    private static final Pattern SHORT_URL = Pattern.compile("youtu\\.be/([A-Za-z0-9_-]{11})");
    private static final String URI_PREFIX = "youtube:video:";
    private static final String MUSIC_CATEGORY = "10";

    private final RateLimitedClient client;
    private final String apiUrl;
    private final String apiKey;
    private final AccessTokenProvider tokenProvider;
    private final ObjectMapper objectMapper;

    public YouTubeSearchAdapter(RateLimitedClient client, String apiUrl, String apiKey,
                                AccessTokenProvider tokenProvider) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.tokenProvider = tokenProvider;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Platform platform() {
        return Platform.YOUTUBE;
    }

    @Override
    public boolean isAvailable() {
        return !JsonFields.isBlank(apiKey) || tokenProvider.getAccessToken() != null;
    }

    @Override
    public String extractDirectId(TrackQuery query) {
        PlatformId youtube = query.getPlatformIds().getYoutube();
        if (youtube != null) {
            if (isVideoId(youtube.getId())) {
                return youtube.getId();
            }
            String fromUrl = idFromUrl(youtube.getUrl());
            if (fromUrl != null) {
                return fromUrl;
            }
        }
        String serviceUri = query.getServiceUri();
        if (serviceUri != null && serviceUri.startsWith(URI_PREFIX)) {
            String id = serviceUri.substring(URI_PREFIX.length());
            if (isVideoId(id)) {
                return id;
            }
        }
        return idFromUrl(query.getServiceUrl());
    }

    @Override
    public Candidate searchTop1(String artist, String title) throws IOException {
        List<Candidate> candidates = search(artist + " " + title, 1);
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    @Override
    public List<Candidate> searchTopN(String artist, String title, int n) throws IOException {
        return search(title + " " + artist, n);
    }

    private List<Candidate> search(String query, int maxResults) throws IOException {
        StringBuilder url = new StringBuilder(String.format(
            "%s/search?part=snippet&type=video&videoCategoryId=%s&maxResults=%d&q=%s",
            apiUrl, MUSIC_CATEGORY, maxResults, JsonFields.encode(query)));

        Map<String, String> headers = Collections.emptyMap();
        if (!JsonFields.isBlank(apiKey)) {
            url.append("&key=").append(JsonFields.encode(apiKey));
        } else {
            String token = tokenProvider.getAccessToken();
            if (token == null) {
                throw new UpstreamAuthException(client.getService(), "no API key or access token");
            }
            headers = Map.of("Authorization", "Bearer " + token);
        }

        JsonNode root = objectMapper.readTree(client.get(url.toString(), headers));
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            Candidate candidate = parseItem(item);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        log.debug("YouTube 搜索 '{}' 返回 {} 个视频", query, candidates.size());
        return candidates;
    }

    private Candidate parseItem(JsonNode item) {
        String videoId = JsonFields.text(item.path("id"), "videoId");
        if (videoId == null) {
            return null;
        }
        JsonNode snippet = item.path("snippet");
        VideoTitleParser.ParsedTitle parsed =
            VideoTitleParser.parse(VideoTitleParser.unescapeHtml(snippet.path("title").asText("")));
        String artist = parsed.getArtist().isEmpty()
            ? VideoTitleParser.cleanChannel(VideoTitleParser.unescapeHtml(JsonFields.text(snippet, "channelTitle")))
            : parsed.getArtist();

        JsonNode thumbnails = snippet.path("thumbnails");
        String artwork = JsonFields.text(thumbnails.path("high"), "url");
        if (artwork == null) {
            artwork = JsonFields.text(thumbnails.path("default"), "url");
        }

        return Candidate.builder()
            .platform(Platform.YOUTUBE)
            .id(videoId)
            .uri(URI_PREFIX + videoId)
            .url("https://www.youtube.com/watch?v=" + videoId)
            .artist(artist)
            .title(parsed.getTitle())
            .releaseDate(JsonFields.text(snippet, "publishedAt"))
            .artworkUrl(artwork)
            .build();
    }

    static boolean isVideoId(String id) {
        return id != null && VIDEO_ID.matcher(id).matches();
    }

    private static String idFromUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher m = WATCH_URL.matcher(url);
        if (m.find()) {
            return m.group(1);
        }
        m = SHORT_URL.matcher(url);
        return m.find() ? m.group(1) : null;
    }
}
