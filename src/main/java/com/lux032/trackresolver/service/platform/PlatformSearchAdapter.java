package com.lux032.trackresolver.service.platform;

import com.lux032.trackresolver.model.Candidate;
import com.lux032.trackresolver.model.Platform;
import com.lux032.trackresolver.model.TrackQuery;

import java.io.IOException;
import java.util.List;

/**
 * 平台搜索适配器的统一契约
 * TieredResolver 只通过该接口访问各平台
 */
public interface PlatformSearchAdapter {

    Platform platform();

    /**
     * 从查询已携带的信息中提取平台 ID,不发起网络请求
     * @return 格式合法的 ID,没有时返回 null
     */
    String extractDirectId(TrackQuery query);

    /**
     * 软搜索: 简单查询,只取第一条结果
     */
    Candidate searchTop1(String artist, String title) throws IOException;

    /**
     * 硬搜索: 取前 n 条结果,由调用方打分
     */
    List<Candidate> searchTopN(String artist, String title, int n) throws IOException;

    /**
     * 需要访问令牌的平台在令牌缺失时返回 false
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * 按 ISRC 精确查找,补充查询时优先于模糊搜索;不支持的平台返回 null
     */
    default Candidate searchByIsrc(String isrc) throws IOException {
        return null;
    }

    /**
     * 补全候选的详细信息(ISRC、关联平台 ID、封面等),默认原样返回
     */
    default Candidate lookupDetails(Candidate candidate) throws IOException {
        return candidate;
    }
}
