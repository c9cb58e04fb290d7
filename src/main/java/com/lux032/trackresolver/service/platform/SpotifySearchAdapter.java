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
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spotify Web API 适配器
 * 需要用户访问令牌,令牌缺失时 isAvailable 返回 false
 */
@Slf4j
public class SpotifySearchAdapter implements PlatformSearchAdapter {

    private static final Pattern TRACK_ID = Pattern.compile("^[A-Za-z0-9]{22}$");
    private static final Pattern TRACK_URL = Pattern.compile("open\\.spotify\\.com/(?:intl-[a-z]+/)?track/([A-Za-z0-9]{22})(?![A-Za-z0-9])");
    private static final String URI_PREFIX = "spotify:track:";

    private final RateLimitedClient client;
    private final String apiUrl;
    private final AccessTokenProvider tokenProvider;
    private final ObjectMapper objectMapper;

    public SpotifySearchAdapter(RateLimitedClient client, String apiUrl, AccessTokenProvider tokenProvider) {
        this.client = client;
        this.apiUrl = apiUrl;
        this.tokenProvider = tokenProvider;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Platform platform() {
        return Platform.SPOTIFY;
    }

    @Override
    public boolean isAvailable() {
        return tokenProvider.getAccessToken() != null;
    }

    /**
     * 依次检查 platformIds、spotify:track: URI、open.spotify.com 链接和导入的原生 ID,ID 必须是 22 位
     */
    @Override
    public String extractDirectId(TrackQuery query) {
        PlatformId spotify = query.getPlatformIds().getSpotify();
        if (spotify != null) {
            if (isTrackId(spotify.getId())) {
                return spotify.getId();
            }
            String fromUri = idFromUri(spotify.getUri());
            if (fromUri != null) {
                return fromUri;
            }
            String fromUrl = idFromUrl(spotify.getUrl());
            if (fromUrl != null) {
                return fromUrl;
            }
        }
        String fromUri = idFromUri(query.getServiceUri());
        if (fromUri != null) {
            return fromUri;
        }
        String fromUrl = idFromUrl(query.getServiceUrl());
        if (fromUrl != null) {
            return fromUrl;
        }
        return isTrackId(query.getServiceId()) ? query.getServiceId() : null;
    }

    @Override
    public Candidate searchTop1(String artist, String title) throws IOException {
        List<Candidate> candidates = search(title + " " + artist, 1);
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    @Override
    public List<Candidate> searchTopN(String artist, String title, int n) throws IOException {
        return search(title + " " + artist, n);
    }

    @Override
    public Candidate searchByIsrc(String isrc) throws IOException {
        List<Candidate> candidates = search("isrc:" + isrc, 1);
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    private List<Candidate> search(String query, int limit) throws IOException {
        String token = tokenProvider.getAccessToken();
        if (token == null) {
            throw new UpstreamAuthException(client.getService(), "no access token");
        }
        String url = String.format("%s/search?q=%s&type=track&limit=%d", apiUrl, JsonFields.encode(query), limit);
        String body = client.get(url, Map.of("Authorization", "Bearer " + token));

        JsonNode root = objectMapper.readTree(body);
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode track : root.path("tracks").path("items")) {
            Candidate candidate = parseTrack(track);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }
        log.debug("Spotify 搜索 '{}' 返回 {} 条结果", query, candidates.size());
        return candidates;
    }

    private Candidate parseTrack(JsonNode track) {
        String id = JsonFields.text(track, "id");
        if (id == null) {
            return null;
        }
        StringBuilder artists = new StringBuilder();
        for (JsonNode artist : track.path("artists")) {
            if (artists.length() > 0) {
                artists.append(", ");
            }
            artists.append(artist.path("name").asText(""));
        }
        JsonNode album = track.path("album");
        JsonNode images = album.path("images");
        String uri = JsonFields.text(track, "uri");

        return Candidate.builder()
            .platform(Platform.SPOTIFY)
            .id(id)
            .uri(uri != null ? uri : URI_PREFIX + id)
            .url(track.path("external_urls").path("spotify").asText("https://open.spotify.com/track/" + id))
            .artist(artists.toString())
            .title(JsonFields.text(track, "name"))
            .album(JsonFields.text(album, "name"))
            .releaseDate(JsonFields.text(album, "release_date"))
            .isrc(JsonFields.text(track.path("external_ids"), "isrc"))
            .previewUrl(JsonFields.text(track, "preview_url"))
            .artworkUrl(images.isArray() && images.size() > 0 ? JsonFields.text(images.get(0), "url") : null)
            .build();
    }

    static boolean isTrackId(String id) {
        return id != null && TRACK_ID.matcher(id).matches();
    }

    private static String idFromUri(String uri) {
        if (uri == null || !uri.startsWith(URI_PREFIX)) {
            return null;
        }
        String id = uri.substring(URI_PREFIX.length());
        return isTrackId(id) ? id : null;
    }

    private static String idFromUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher m = TRACK_URL.matcher(url);
        return m.find() ? m.group(1) : null;
    }
}
