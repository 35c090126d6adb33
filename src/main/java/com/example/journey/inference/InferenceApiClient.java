package com.example.journey.inference;

import com.example.journey.config.JourneyProperties;
import com.example.journey.model.BoundingBox;
import com.example.journey.model.Detection;
import com.example.journey.model.FrameSize;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 推理服务客户端，同时提供行人检测和外观特征
 * <p>
 * POST {baseUrl}/detect?confidence=.. 请求体为JPEG，返回 {"detections":[{"bbox":[x1,y1,x2,y2],"confidence":c}]}；
 * POST {baseUrl}/embed 请求体为裁剪后的JPEG，返回 {"embedding":[...]}。
 * 调用失败时检测返回空列表、特征返回中性向量。
 */
@Slf4j
@Component
public class InferenceApiClient implements PersonDetector, AppearanceEmbedder {

    private final WebClient webClient;
    private final Duration timeout;
    private final int embeddingDim;

    public InferenceApiClient(WebClient.Builder webClientBuilder, JourneyProperties properties) {
        JourneyProperties.Inference inference = properties.getInference();
        this.webClient = webClientBuilder
                .baseUrl(inference.getBaseUrl())
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        this.timeout = inference.getTimeout();
        this.embeddingDim = inference.getEmbeddingDim();
        log.info("🔌 推理服务: {} (特征维度 {})", inference.getBaseUrl(), embeddingDim);
    }

    @Override
    public List<Detection> detect(BufferedImage frame, double confidenceThreshold) {
        try {
            byte[] jpeg = FrameImages.toJpeg(frame);
            DetectResponse response = webClient.post()
                    .uri(uriBuilder -> uriBuilder.path("/detect")
                            .queryParam("confidence", confidenceThreshold)
                            .build())
                    .contentType(MediaType.IMAGE_JPEG)
                    .bodyValue(jpeg)
                    .retrieve()
                    .bodyToMono(DetectResponse.class)
                    .block(timeout);

            if (response == null || response.getDetections() == null) {
                return List.of();
            }
            return toDetections(response.getDetections(), confidenceThreshold,
                    new FrameSize(frame.getWidth(), frame.getHeight()));
        } catch (Exception e) {
            log.warn("行人检测失败: {}", e.getMessage());
            return List.of();
        }
    }

    @Override
    public float[] embed(BufferedImage crop) {
        if (crop == null || crop.getWidth() <= 0 || crop.getHeight() <= 0) {
            return neutralVector();
        }
        try {
            EmbedResponse response = webClient.post()
                    .uri("/embed")
                    .contentType(MediaType.IMAGE_JPEG)
                    .bodyValue(FrameImages.toJpeg(crop))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .block(timeout);

            if (response == null || response.getEmbedding() == null || response.getEmbedding().length == 0) {
                return neutralVector();
            }
            return response.getEmbedding();
        } catch (Exception e) {
            log.warn("特征提取失败: {}", e.getMessage());
            return neutralVector();
        }
    }

    @Override
    public float[] neutralVector() {
        return new float[embeddingDim];
    }

    static List<Detection> toDetections(List<DetectionPayload> payloads, double confidenceThreshold, FrameSize frameSize) {
        List<Detection> detections = new ArrayList<>();
        for (DetectionPayload payload : payloads) {
            double[] bbox = payload.getBbox();
            if (bbox == null || bbox.length < 4 || payload.getConfidence() < confidenceThreshold) {
                continue;
            }
            BoundingBox box = BoundingBox.fromArray(bbox).clip(frameSize);
            if (box.area() <= 0) {
                continue;
            }
            detections.add(new Detection(box, payload.getConfidence()));
        }
        return detections;
    }

    @Data
    public static class DetectResponse {
        private List<DetectionPayload> detections;
    }

    @Data
    public static class DetectionPayload {
        /** [x1, y1, x2, y2] */
        private double[] bbox;
        private double confidence;
    }

    @Data
    public static class EmbedResponse {
        private float[] embedding;
    }
}
