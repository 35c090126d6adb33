package com.example.journey.pipeline;

import com.example.journey.config.JourneyProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 运行期可调参数，帧间生效
 */
@Value
@Builder(toBuilder = true)
public class TrackingSettings {

    /** 检测置信度阈值 */
    double detectionConfidence;

    /** 身份相似度阈值 */
    double similarityThreshold;

    /** 会话超时 */
    Duration inactivityTimeout;

    /** IoU匹配阈值 */
    double iouThreshold;

    /** 轨迹最大丢失帧数 */
    int maxAge;

    /** 跨线去抖间隔 */
    Duration crossingDebounce;

    public static TrackingSettings from(JourneyProperties properties) {
        return TrackingSettings.builder()
                .detectionConfidence(properties.getDetection().getConfidenceThreshold())
                .similarityThreshold(properties.getIdentity().getSimilarityThreshold())
                .inactivityTimeout(properties.getSession().getInactivityTimeout())
                .iouThreshold(properties.getTracking().getIouThreshold())
                .maxAge(properties.getTracking().getMaxAge())
                .crossingDebounce(properties.getCrossing().getDebounce())
                .build()
                .validate();
    }

    public static TrackingSettings defaults() {
        return from(new JourneyProperties());
    }

    /**
     * 校验参数范围，不合法时抛出 IllegalArgumentException
     */
    public TrackingSettings validate() {
        requireUnitInterval("detectionConfidence", detectionConfidence);
        requireUnitInterval("similarityThreshold", similarityThreshold);
        requireUnitInterval("iouThreshold", iouThreshold);
        if (maxAge < 0) {
            throw new IllegalArgumentException("maxAge不能为负数: " + maxAge);
        }
        if (inactivityTimeout == null || inactivityTimeout.isNegative() || inactivityTimeout.isZero()) {
            throw new IllegalArgumentException("inactivityTimeout必须为正: " + inactivityTimeout);
        }
        if (crossingDebounce == null || crossingDebounce.isNegative()) {
            throw new IllegalArgumentException("crossingDebounce不能为负: " + crossingDebounce);
        }
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value > 0 && value <= 1)) {
            throw new IllegalArgumentException(name + "必须在(0,1]之间: " + value);
        }
    }
}
