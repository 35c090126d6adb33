package com.example.journey.pipeline;

import com.example.journey.dto.SessionView;
import com.example.journey.model.FrameSize;
import com.example.journey.model.Track;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 单帧流水线输出
 */
@Value
public class FrameResult {

    long frameNumber;

    Instant timestamp;

    FrameSize frameSize;

    /** 已标注身份、会话和跨线事件的轨迹 */
    List<Track> tracks;

    /** 当前在场的会话 */
    List<SessionView> activeSessions;

    /** 全部会话 */
    List<SessionView> sessions;
}
