package com.lux032.trackresolver.service.platform;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * 从 YouTube 视频标题中拆出艺术家和歌名
 * 支持 "Artist - Title"、"Artist | Title"、"Artist: Title"、长短破折号和 "Title by Artist"
 */
final class VideoTitleParser {

    private static final Pattern NOISE_PARENS = Pattern.compile(
        "\\s*\\([^)]*?(official|video|audio|lyric|hd|4k|music video)[^)]*?\\)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOISE_BRACKETS = Pattern.compile(
        "\\s*\\[[^\\]]*?(official|video|audio|lyric|hd|4k|music video)[^\\]]*?\\]\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern BY = Pattern.compile("\\s+by\\s+", Pattern.CASE_INSENSITIVE);
    private static final String[] SEPARATORS = {" - ", " | ", " : ", ": ", " – ", " — "};

    private VideoTitleParser() {
    }

    @Value
    static class ParsedTitle {
        /** 无法识别时为空字符串,由调用方用频道名兜底 */
        String artist;
        String title;
    }

    static ParsedTitle parse(String videoTitle) {
        if (videoTitle == null) {
            return new ParsedTitle("", "");
        }
        String cleaned = NOISE_PARENS.matcher(videoTitle).replaceAll(" ");
        cleaned = NOISE_BRACKETS.matcher(cleaned).replaceAll(" ").trim().replaceAll("\\s{2,}", " ");

        for (String sep : SEPARATORS) {
            int index = cleaned.indexOf(sep);
            if (index > 0) {
                return new ParsedTitle(cleaned.substring(0, index).trim(), cleaned.substring(index + sep.length()).trim());
            }
        }

        String[] parts = BY.split(cleaned, 2);
        if (parts.length == 2) {
            return new ParsedTitle(parts[1].trim(), parts[0].trim());
        }
        return new ParsedTitle("", cleaned);
    }

    /**
     * 去掉自动生成频道的 " - Topic" 和 VEVO 后缀
     */
    static String cleanChannel(String channelTitle) {
        if (channelTitle == null) {
            return "";
        }
        String cleaned = channelTitle.replaceFirst("\\s*-\\s*Topic$", "");
        cleaned = cleaned.replaceFirst("(?i)VEVO$", "");
        return cleaned.trim();
    }

    /**
     * YouTube 返回的标题带 HTML 实体
     */
    static String unescapeHtml(String text) {
        if (text == null) {
            return null;
        }
        return text.replace("&quot;", "\"")
            .replace("&#39;", "'")
            .replace("&#039;", "'")
            .replace("&lt;", "<")
            .replace("&gt;", ">")
            .replace("&amp;", "&");
    }
}
