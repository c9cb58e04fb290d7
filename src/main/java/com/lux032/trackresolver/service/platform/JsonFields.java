package com.lux032.trackresolver.service.platform;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * 解析平台响应时共用的小工具
 */
final class JsonFields {

    private JsonFields() {
    }

    /**
     * 读取文本字段,缺失或为空时返回 null
     */
    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
