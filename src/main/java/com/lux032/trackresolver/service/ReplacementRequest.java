package com.lux032.trackresolver.service;

import com.lux032.trackresolver.model.ReplacementProgress;
import com.lux032.trackresolver.model.TrackQuery;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.function.Consumer;

/**
 * 一轮自动替换的参数
 */
@Value
@Builder
public class ReplacementRequest {

    int round;

    /** 本轮需要替换的失败曲目 */
    @Singular
    List<TrackQuery> failedTracks;

    String context;

    /** 为空时使用编排器的默认值(配置项 replacement.maxRetries) */
    Integer maxRetries;

    @NonNull
    ReplacementGenerator generator;

    @NonNull
    TrackDeleter deleter;

    /** 可为空 */
    Consumer<ReplacementProgress> listener;

    @NonNull
    @Builder.Default
    RunControl runControl = RunControl.none();
}
