package com.example.journey.dto;

import com.example.journey.pipeline.TrackingSettings;
import lombok.Data;

import java.time.Duration;

/**
 * 参数修改请求，为null的字段保持原值
 */
@Data
public class SettingsRequest {

    /** 检测置信度阈值 (0.0-1.0] */
    private Double detectionConfidence;

    /** 身份相似度阈值 (0.0-1.0] */
    private Double similarityThreshold;

    /** 会话超时（毫秒） */
    private Long inactivityTimeoutMs;

    private Double iouThreshold;

    private Integer maxAge;

    /** 跨线去抖间隔（毫秒） */
    private Long crossingDebounceMs;

    public TrackingSettings applyTo(TrackingSettings current) {
        TrackingSettings.TrackingSettingsBuilder builder = current.toBuilder();
        if (detectionConfidence != null) builder.detectionConfidence(detectionConfidence);
        if (similarityThreshold != null) builder.similarityThreshold(similarityThreshold);
        if (inactivityTimeoutMs != null) builder.inactivityTimeout(Duration.ofMillis(inactivityTimeoutMs));
        if (iouThreshold != null) builder.iouThreshold(iouThreshold);
        if (maxAge != null) builder.maxAge(maxAge);
        if (crossingDebounceMs != null) builder.crossingDebounce(Duration.ofMillis(crossingDebounceMs));
        return builder.build();
    }
}
