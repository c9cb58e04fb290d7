package com.lux032.trackresolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.PlatformId;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.service.http.RateLimitedClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Apple Music / iTunes Search API 适配器,无需认证
 */
@Slf4j
public class AppleMusicSearchAdapter implements PlatformSearchAdapter {

    private static final Pattern NUMERIC_ID = Pattern.compile("^\\d+$");
    private static final Pattern TRACK_PARAM = Pattern.compile("[?&]i=(\\d+)");
    private static final Pattern SONG_PATH = Pattern.compile("/song/(?:[^/?]+/)?(\\d+)");
    private static final int ISRC_SEARCH_LIMIT = 5;
    private static final Pattern SMALL_ARTWORK = Pattern.compile("(100x100|60x60|30x30)bb");

    private final RateLimitedClient client;
    private final String apiUrl;
    private final ObjectMapper objectMapper;

    public AppleMusicSearchAdapter(RateLimitedClient client, String apiUrl) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Platform platform() {
        return Platform.APPLE;
    }

    @Override
    public String extractDirectId(TrackQuery query) {
        PlatformId apple = query.getPlatformIds().getApple();
        if (apple != null) {
            if (apple.getId() != null && NUMERIC_ID.matcher(apple.getId()).matches()) {
                return apple.getId();
            }
            String fromUrl = idFromUrl(apple.getUrl());
            if (fromUrl != null) {
                return fromUrl;
            }
        }
        String serviceUrl = query.getServiceUrl();
        if (serviceUrl != null && serviceUrl.contains("apple.com")) {
            return idFromUrl(serviceUrl);
        }
        return null;
    }

    @Override
    public Candidate searchTop1(String artist, String title) throws IOException {
        List<Candidate> candidates = searchTopN(artist, title, 1);
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    @Override
    public List<Candidate> searchTopN(String artist, String title, int n) throws IOException {
        List<Candidate> candidates = searchSongs(artist + " " + title, n, n);
        log.debug("iTunes 搜索 '{} - {}' 返回 {} 首歌曲", artist, title, candidates.size());
        return candidates;
    }

    /**
     * iTunes 的 term 参数也匹配 ISRC,取前 5 条中的第一首歌曲
     */
    @Override
    public Candidate searchByIsrc(String isrc) throws IOException {
        List<Candidate> candidates = searchSongs(isrc, ISRC_SEARCH_LIMIT, 1);
        if (candidates.isEmpty()) {
            log.debug("iTunes 未找到 ISRC {}", isrc);
            return null;
        }
        return candidates.get(0).toBuilder().isrc(isrc).build();
    }

    private List<Candidate> searchSongs(String term, int limit, int wanted) throws IOException {
        String url = String.format("%s/search?term=%s&entity=song&limit=%d",
            apiUrl, JsonFields.encode(term), limit);

        JsonNode root = objectMapper.readTree(client.get(url));
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode result : root.path("results")) {
            // 只保留歌曲结果
            if (!"song".equals(result.path("kind").asText()) || !result.hasNonNull("trackId")) {
                continue;
            }
            candidates.add(parseSong(result));
            if (candidates.size() >= wanted) {
                break;
            }
        }
        return candidates;
    }

    private Candidate parseSong(JsonNode song) {
        String trackId = song.path("trackId").asText();
        return Candidate.builder()
            .platform(Platform.APPLE)
            .id(trackId)
            .url(buildTrackUrl(song, trackId))
            .artist(JsonFields.text(song, "artistName"))
            .title(JsonFields.text(song, "trackName"))
            .album(JsonFields.text(song, "collectionName"))
            .releaseDate(JsonFields.text(song, "releaseDate"))
            .previewUrl(JsonFields.text(song, "previewUrl"))
            .artworkUrl(upgradeArtwork(JsonFields.text(song, "artworkUrl100")))
            .build();
    }

    private static String buildTrackUrl(JsonNode song, String trackId) {
        String trackViewUrl = JsonFields.text(song, "trackViewUrl");
        if (trackViewUrl != null) {
            return trackViewUrl;
        }
        String collectionId = JsonFields.text(song, "collectionId");
        if (collectionId != null) {
            return String.format("https://music.apple.com/us/album/%s?i=%s", collectionId, trackId);
        }
        return "https://music.apple.com/us/song/" + trackId;
    }

    /**
     * 把 100x100 等小尺寸封面地址替换为 600x600
     */
    static String upgradeArtwork(String artworkUrl) {
        if (artworkUrl == null) {
            return null;
        }
        return SMALL_ARTWORK.matcher(artworkUrl).replaceFirst("600x600bb");
    }

    private static String idFromUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher m = TRACK_PARAM.matcher(url);
        if (m.find()) {
            return m.group(1);
        }
        m = SONG_PATH.matcher(url);
        return m.find() ? m.group(1) : null;
    }
}
