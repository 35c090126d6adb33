package com.example.journey.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 当前运行的状态快照
 */
@Value
@Builder(toBuilder = true)
public class RunStatus {

    private static final RunStatus IDLE = RunStatus.builder().state(RunState.IDLE).build();

    RunState state;

    /** 视频源 */
    String source;

    /** 开始时间 */
    Instant startTime;

    /** 结束时间 */
    Instant endTime;

    /** 已处理帧数 */
    long framesProcessed;

    /** 错误信息 */
    String error;

    public static RunStatus idle() {
        return IDLE;
    }
}
