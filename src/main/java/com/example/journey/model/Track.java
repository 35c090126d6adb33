package com.example.journey.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * 单帧跟踪输出，帧处理完后丢弃；跨帧只保留trackId
 */
@Getter
@RequiredArgsConstructor
@ToString(exclude = "embedding")
public class Track {

    /** 本次运行内稳定的跟踪ID，过期后不复用 */
    private final int trackId;

    private final BoundingBox box;

    private final double confidence;

    /** 外观特征，取自本帧IoU最高的检测；无重叠时为长度0的中性向量 */
    private final float[] embedding;

    /** 全局人员ID */
    @Setter
    private Integer globalPersonId;

    /** 会话ID，未触发ENTRY前为null */
    @Setter
    private String sessionId;

    /** 本帧跨线事件 */
    @Setter
    private CrossingEvent crossEvent;
}
