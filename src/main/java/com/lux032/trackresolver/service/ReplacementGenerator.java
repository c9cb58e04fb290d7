package com.lux032.trackresolver.service;

import com.lux032.trackresolver.model.TrackQuery;

import java.io.IOException;
import java.util.List;

/**
 * 替换曲目来源(通常是推荐服务),由调用方实现
 */
@FunctionalInterface
public interface ReplacementGenerator {

    /**
     * @param count 需要的替换数量
     * @param context 推荐上下文,如原始提示词
     * @return 候选曲目,可能少于 count,不会为 null
     */
    List<TrackQuery> requestReplacements(int count, String context) throws IOException;
}
