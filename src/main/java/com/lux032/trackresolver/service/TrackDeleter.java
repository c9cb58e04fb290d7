package com.lux032.trackresolver.service;

import java.io.IOException;
import java.util.List;

/**
 * 从歌单中删除曲目,由调用方实现
 */
@FunctionalInterface
public interface TrackDeleter {

    void deleteTracks(List<String> trackIds) throws IOException;
}
