package com.example.journey.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 单帧处理结果快照
 */
@Value
@Builder(toBuilder = true)
public class FrameSnapshot {

    /** 帧编号 */
    long frameNumber;

    /** 时间戳 */
    Instant timestamp;

    /** 帧宽 */
    int frameWidth;

    /** 帧高 */
    int frameHeight;

    /** 当前帧跟踪到的人数 */
    int currentPersonCount;

    /** 处理时间（毫秒） */
    long processingTimeMs;

    /** 轨迹列表 */
    List<AnnotatedTrack> tracks;

    /** 当前在场的会话ID */
    List<String> activeSessionIds;

    /** 全部会话 */
    List<SessionView> sessions;

    /** 标注后的帧（MJPEG分段） */
    @JsonIgnore
    byte[] frameJpeg;
}
