package com.example.journey.source;

import com.example.journey.model.FrameSize;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * 顺序读取视频帧；read() 会阻塞直到下一帧可用
 */
public interface FrameSource extends AutoCloseable {

    /**
     * @return 下一帧；流结束时为空
     */
    Optional<BufferedImage> read() throws FrameSourceException;

    FrameSize size();

    /**
     * @return 帧率，未知时为0
     */
    double frameRate();

    /**
     * 源描述，用于日志
     */
    String description();

    @Override
    void close();
}
