package com.lux032.trackresolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.PlatformId;
import com.lux032.trackresolver.model.PlatformIds;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.service.http.RateLimitedClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MusicBrainz 录音搜索适配器
 * 作为验证级联的首选平台,lookupDetails 会补全 ISRC、专辑、其他平台链接和封面
 */
@Slf4j
public class MusicBrainzSearchAdapter implements PlatformSearchAdapter {

    private static final Pattern MBID = Pattern.compile(
        "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final Pattern LUCENE_OPERATORS = Pattern.compile("[+\\-&|!(){}\\[\\]^\"~*?:\\\\/]");

    // URL 关系中的平台链接
    private static final Pattern SPOTIFY_TRACK = Pattern.compile("open\\.spotify\\.com/track/([A-Za-z0-9]{22})");
    private static final Pattern APPLE_TRACK = Pattern.compile("[?&]i=(\\d+)");
    private static final Pattern APPLE_SONG = Pattern.compile("music\\.apple\\.com/.*/song/(?:[^/]+/)?(\\d+)");
    private static final Pattern TIDAL_TRACK = Pattern.compile("tidal\\.com/(?:browse/)?track/(\\d+)");
    private static final Pattern QOBUZ_TRACK = Pattern.compile("qobuz\\.com/.*track/([A-Za-z0-9]+)");
    private static final Pattern YOUTUBE_VIDEO = Pattern.compile(
        "(?:youtube\\.com/watch\\?v=|youtu\\.be/|music\\.youtube\\.com/watch\\?v=)([A-Za-z0-9_-]{11})");

    private final RateLimitedClient client;
    private final RateLimitedClient coverArtClient;
    private final String apiUrl;
    private final String coverArtApiUrl;
    private final ObjectMapper objectMapper;

    public MusicBrainzSearchAdapter(RateLimitedClient client, RateLimitedClient coverArtClient,
                                    String apiUrl, String coverArtApiUrl) {
        this.client = client;
        this.coverArtClient = coverArtClient;
        this.apiUrl = apiUrl;
        this.coverArtApiUrl = coverArtApiUrl;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Platform platform() {
        return Platform.MUSICBRAINZ;
    }

    @Override
    public String extractDirectId(TrackQuery query) {
        String mbid = query.getMusicBrainzId();
        if (mbid != null && MBID.matcher(mbid.trim()).matches()) {
            return mbid.trim().toLowerCase(Locale.ROOT);
        }
        return null;
    }

    /**
     * 软搜索: 艺术家和标题都按短语精确匹配,只取第一条
     */
    @Override
    public Candidate searchTop1(String artist, String title) throws IOException {
        String query = String.format("artist:\"%s\" AND recording:\"%s\"", escape(artist), escape(title));
        List<Candidate> candidates = search(query, 1);
        log.debug("MusicBrainz 短语搜索 '{} - {}' 返回 {} 条结果", artist, title, candidates.size());
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    /**
     * 硬搜索: 按词分组、不加引号和 AND,拼写有出入的标题也能由 MusicBrainz 自身的排序召回
     */
    @Override
    public List<Candidate> searchTopN(String artist, String title, int n) throws IOException {
        String query = String.format("recording:(%s) artist:(%s)", terms(title), terms(artist));
        List<Candidate> candidates = search(query, n);
        log.debug("MusicBrainz 宽松搜索 '{} - {}' 返回 {} 条结果", artist, title, candidates.size());
        return candidates;
    }

    private List<Candidate> search(String query, int limit) throws IOException {
        String url = String.format("%s/recording/?query=%s&limit=%d&fmt=json",
            apiUrl, JsonFields.encode(query), limit);

        JsonNode root = objectMapper.readTree(client.get(url));
        List<Candidate> candidates = new ArrayList<>();
        for (JsonNode recording : root.path("recordings")) {
            Candidate candidate = parseRecording(recording);
            if (candidate != null) {
                candidates.add(candidate);
            }
            if (candidates.size() >= limit) {
                break;
            }
        }
        return candidates;
    }

    /**
     * 查询录音详情: URL 关系、ISRC、发行信息,再探测 Cover Art Archive 的封面
     */
    @Override
    public Candidate lookupDetails(Candidate candidate) throws IOException {
        String url = String.format("%s/recording/%s?inc=url-rels+artist-credits+releases+isrcs&fmt=json",
            apiUrl, candidate.getId());
        JsonNode root = objectMapper.readTree(client.get(url));

        Candidate.CandidateBuilder builder = candidate.toBuilder();
        String artist = joinArtistCredit(root.path("artist-credit"));
        if (artist != null) {
            builder.artist(artist);
        }
        String title = JsonFields.text(root, "title");
        if (title != null) {
            builder.title(title);
        }

        JsonNode isrcs = root.path("isrcs");
        if (isrcs.isArray() && isrcs.size() > 0) {
            builder.isrc(isrcs.get(0).asText());
        }

        String releaseId = candidate.getReleaseId();
        JsonNode releases = root.path("releases");
        if (releases.isArray() && releases.size() > 0) {
            JsonNode release = releases.get(0);
            releaseId = JsonFields.text(release, "id");
            builder.releaseId(releaseId);
            builder.album(JsonFields.text(release, "title"));
            String date = JsonFields.text(release, "date");
            if (date != null) {
                builder.releaseDate(date);
            }
        }

        builder.relatedIds(extractRelationIds(root.path("relations")).mergedWith(candidate.getRelatedIds()));

        if (releaseId != null && candidate.getArtworkUrl() == null) {
            builder.artworkUrl(findCoverArt(releaseId));
        }
        return builder.build();
    }

    private Candidate parseRecording(JsonNode recording) {
        String id = JsonFields.text(recording, "id");
        if (id == null) {
            return null;
        }
        Candidate.CandidateBuilder builder = Candidate.builder()
            .platform(Platform.MUSICBRAINZ)
            .id(id)
            .url("https://musicbrainz.org/recording/" + id)
            .title(JsonFields.text(recording, "title"))
            .artist(joinArtistCredit(recording.path("artist-credit")))
            .releaseDate(JsonFields.text(recording, "first-release-date"));

        if (recording.has("score")) {
            builder.score(recording.path("score").asDouble() / 100.0);
        }

        JsonNode releases = recording.path("releases");
        if (releases.isArray() && releases.size() > 0) {
            JsonNode release = releases.get(0);
            builder.album(JsonFields.text(release, "title"));
            builder.releaseId(JsonFields.text(release, "id"));
            if (recording.path("first-release-date").isMissingNode()) {
                builder.releaseDate(JsonFields.text(release, "date"));
            }
        }

        JsonNode isrcs = recording.path("isrcs");
        if (isrcs.isArray() && isrcs.size() > 0) {
            builder.isrc(isrcs.get(0).asText());
        }
        return builder.build();
    }

    /**
     * 拼接艺术家署名,保留 joinphrase (如 " feat. ")
     */
    private static String joinArtistCredit(JsonNode artistCredits) {
        if (!artistCredits.isArray() || artistCredits.size() == 0) {
            return null;
        }
        StringBuilder artists = new StringBuilder();
        for (JsonNode credit : artistCredits) {
            String name = JsonFields.text(credit, "name");
            if (name == null) {
                name = credit.path("artist").path("name").asText("");
            }
            artists.append(name);
            artists.append(credit.path("joinphrase").asText(""));
        }
        String joined = artists.toString().trim();
        return joined.isEmpty() ? null : joined;
    }

    /**
     * 从 URL 关系中提取其他平台的曲目标识
     */
    static PlatformIds extractRelationIds(JsonNode relations) {
        PlatformIds.PlatformIdsBuilder ids = PlatformIds.builder();
        for (JsonNode relation : relations) {
            String resource = relation.path("url").path("resource").asText("");
            if (resource.isEmpty()) {
                continue;
            }
            Matcher m;
            if ((m = SPOTIFY_TRACK.matcher(resource)).find()) {
                ids.spotify(PlatformId.builder().id(m.group(1)).uri("spotify:track:" + m.group(1)).url(resource).build());
            } else if (resource.contains("apple.com") && ((m = APPLE_TRACK.matcher(resource)).find()
                    || (m = APPLE_SONG.matcher(resource)).find())) {
                ids.apple(PlatformId.of(m.group(1), resource));
            } else if ((m = TIDAL_TRACK.matcher(resource)).find()) {
                ids.tidal(PlatformId.of(m.group(1), resource));
            } else if ((m = QOBUZ_TRACK.matcher(resource)).find()) {
                ids.qobuz(PlatformId.of(m.group(1), resource));
            } else if ((m = YOUTUBE_VIDEO.matcher(resource)).find()) {
                ids.youtube(PlatformId.of(m.group(1), resource));
            }
        }
        return ids.build();
    }

    /**
     * 依次尝试 500px 与 250px 的正面封面,都不存在时返回 null
     */
    private String findCoverArt(String releaseId) {
        for (String size : new String[]{"front-500", "front-250"}) {
            String url = String.format("%s/release/%s/%s", coverArtApiUrl, releaseId, size);
            try {
                if (coverArtClient.exists(url)) {
                    return url;
                }
            } catch (IOException e) {
                log.debug("封面检查失败: {} - {}", url, e.getMessage());
            }
        }
        return null;
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * 去掉 Lucene 查询运算符,只保留词;转小写以免 AND/OR/NOT 被当作运算符;
     * 没有剩余的词时退回短语
     */
    private static String terms(String value) {
        String plain = LUCENE_OPERATORS.matcher(value).replaceAll(" ").trim()
            .replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return plain.isEmpty() ? "\"" + escape(value) + "\"" : plain;
    }
}
