package com.example.journey.inference;

import com.example.journey.model.BoundingBox;
import com.example.journey.model.Detection;
import com.example.journey.model.FrameSize;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InferenceApiClientTest {

    private static final FrameSize FRAME = new FrameSize(640, 480);

    @Test
    void filtersLowConfidenceAndClipsBoxes() {
        List<Detection> detections = InferenceApiClient.toDetections(List.of(
                payload(0.9, -10, 20, 100, 500),
                payload(0.4, 10, 10, 50, 50)), 0.55, FRAME);

        assertThat(detections).hasSize(1);
        assertThat(detections.get(0).getBox()).isEqualTo(BoundingBox.of(0, 20, 100, 479));
        assertThat(detections.get(0).getConfidence()).isEqualTo(0.9);
    }

    @Test
    void dropsMalformedAndEmptyBoxes() {
        InferenceApiClient.DetectionPayload shortBox = new InferenceApiClient.DetectionPayload();
        shortBox.setBbox(new double[]{1, 2});
        shortBox.setConfidence(0.99);

        List<Detection> detections = InferenceApiClient.toDetections(List.of(
                shortBox,
                payload(0.9, 700, 500, 800, 600),
                payload(0.9, 50, 50, 40, 90)), 0.5, FRAME);

        assertThat(detections).isEmpty();
    }

    @Test
    void cropIsEmptyOutsideImage() {
        BufferedImage image = new BufferedImage(100, 100, BufferedImage.TYPE_3BYTE_BGR);

        assertThat(FrameImages.crop(image, BoundingBox.of(10, 10, 30, 50)))
                .hasValueSatisfying(crop -> {
                    assertThat(crop.getWidth()).isEqualTo(20);
                    assertThat(crop.getHeight()).isEqualTo(40);
                });
        assertThat(FrameImages.crop(image, BoundingBox.of(150, 150, 200, 200))).isEmpty();
        assertThat(FrameImages.crop(image, BoundingBox.of(10, 10, 10, 50))).isEmpty();
    }

    @Test
    void jpegHasStartOfImageMarker() {
        byte[] jpeg = FrameImages.toJpeg(new BufferedImage(16, 16, BufferedImage.TYPE_INT_ARGB));
        assertThat(jpeg[0]).isEqualTo((byte) 0xFF);
        assertThat(jpeg[1]).isEqualTo((byte) 0xD8);
    }

    private static InferenceApiClient.DetectionPayload payload(double confidence, double... bbox) {
        InferenceApiClient.DetectionPayload payload = new InferenceApiClient.DetectionPayload();
        payload.setBbox(bbox);
        payload.setConfidence(confidence);
        return payload;
    }
}
