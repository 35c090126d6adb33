package com.example.journey.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 应用配置，前缀 journey
 */
@Data
@ConfigurationProperties(prefix = "journey")
public class JourneyProperties {

    private Detection detection = new Detection();

    private Identity identity = new Identity();

    private Tracking tracking = new Tracking();

    private Crossing crossing = new Crossing();

    private Session session = new Session();

    private Inference inference = new Inference();

    private Stream stream = new Stream();

    @Data
    public static class Detection {
        /** 检测置信度阈值 (0.0-1.0) */
        private double confidenceThreshold = 0.55;
    }

    @Data
    public static class Identity {
        /** 身份匹配的余弦相似度阈值 */
        private double similarityThreshold = 0.62;
    }

    @Data
    public static class Tracking {
        /** IoU匹配阈值 */
        private double iouThreshold = 0.3;
        /** 轨迹最多允许丢失的帧数 */
        private int maxAge = 15;
    }

    @Data
    public static class Crossing {
        /** 同一轨迹两次跨线事件的最小间隔 */
        private Duration debounce = Duration.ofMillis(750);
    }

    @Data
    public static class Session {
        /** 超过该时间未出现的会话自动离开 */
        private Duration inactivityTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Inference {
        /** 推理服务地址 */
        private String baseUrl = "http://localhost:8500";
        /** 外观特征维度 */
        private int embeddingDim = 256;
        /** 单次调用超时 */
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Stream {
        /** 读取方等待新帧的最长时间 */
        private Duration readerWait = Duration.ofSeconds(1);
        /** 按视频帧率限速 */
        private boolean paceToFrameRate = true;
    }
}
