package com.lux032.trackresolver.model;

import lombok.Builder;
import lombok.Value;

/**
 * 单个平台上的曲目标识
 */
@Value
@Builder(toBuilder = true)
public class PlatformId {
    String id;
    String uri;
    String url;
    String artworkUrl;

    public static PlatformId of(String id, String url) {
        return PlatformId.builder().id(id).url(url).build();
    }
}
