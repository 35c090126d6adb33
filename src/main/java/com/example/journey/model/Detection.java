package com.example.journey.model;

import lombok.Value;

/**
 * 单帧行人检测结果，只读
 */
@Value
public class Detection {

    /** 边界框（像素） */
    BoundingBox box;

    /** 置信度 (0-1) */
    double confidence;

    public static Detection of(double x1, double y1, double x2, double y2, double confidence) {
        return new Detection(BoundingBox.of(x1, y1, x2, y2), confidence);
    }
}
