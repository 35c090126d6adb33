package com.example.journey.dto;

import com.example.journey.model.CrossingEvent;
import com.example.journey.model.Track;
import lombok.Value;

/**
 * 带身份与会话标注的轨迹
 */
@Value
public class AnnotatedTrack {

    /** 跟踪器ID */
    int trackId;

    /** 边界框 [x1, y1, x2, y2] */
    double[] bbox;

    /** 置信度 */
    double confidence;

    /** 全局人员ID */
    Integer globalPersonId;

    /** 会话ID，未进入时为null */
    String sessionId;

    /** 本帧跨线事件 */
    CrossingEvent crossEvent;

    public static AnnotatedTrack from(Track track) {
        return new AnnotatedTrack(track.getTrackId(), track.getBox().toArray(), track.getConfidence(),
                track.getGlobalPersonId(), track.getSessionId(), track.getCrossEvent());
    }
}
