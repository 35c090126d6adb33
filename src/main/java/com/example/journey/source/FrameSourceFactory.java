package com.example.journey.source;

/**
 * 根据源字符串（设备号、网络地址或本地文件）打开视频源
 */
public interface FrameSourceFactory {

    FrameSource open(String source) throws FrameSourceException;
}
