package com.example.journey.model;

import lombok.Value;

/**
 * 轴对齐边界框 [x1, y1, x2, y2]
 */
@Value
public class BoundingBox {

    /** 左上角X坐标 */
    double x1;

    /** 左上角Y坐标 */
    double y1;

    /** 右下角X坐标 */
    double x2;

    /** 右下角Y坐标 */
    double y2;

    public static BoundingBox of(double x1, double y1, double x2, double y2) {
        return new BoundingBox(x1, y1, x2, y2);
    }

    /**
     * 从double数组创建BoundingBox
     */
    public static BoundingBox fromArray(double[] bbox) {
        if (bbox == null || bbox.length < 4) {
            throw new IllegalArgumentException("边界框需要4个坐标");
        }
        return new BoundingBox(bbox[0], bbox[1], bbox[2], bbox[3]);
    }

    public double[] toArray() {
        return new double[]{x1, y1, x2, y2};
    }

    public double width() {
        return Math.max(0, x2 - x1);
    }

    public double height() {
        return Math.max(0, y2 - y1);
    }

    public double area() {
        return width() * height();
    }

    public Point center() {
        return new Point((x1 + x2) / 2, (y1 + y2) / 2);
    }

    /**
     * 计算与另一个边界框的IoU，不重叠或面积为0时返回0
     */
    public double iou(BoundingBox other) {
        if (other == null) return 0.0;

        double ix1 = Math.max(x1, other.x1);
        double iy1 = Math.max(y1, other.y1);
        double ix2 = Math.min(x2, other.x2);
        double iy2 = Math.min(y2, other.y2);

        if (ix2 <= ix1 || iy2 <= iy1) return 0.0;

        double intersection = (ix2 - ix1) * (iy2 - iy1);
        double union = area() + other.area() - intersection;

        return union > 0 ? intersection / union : 0.0;
    }

    /**
     * 裁剪到帧范围内
     */
    public BoundingBox clip(FrameSize frameSize) {
        if (frameSize == null) return this;
        double maxX = Math.max(0, frameSize.getWidth() - 1);
        double maxY = Math.max(0, frameSize.getHeight() - 1);
        return new BoundingBox(
                clamp(x1, maxX), clamp(y1, maxY),
                clamp(x2, maxX), clamp(y2, maxY));
    }

    private static double clamp(double value, double max) {
        return Math.max(0, Math.min(max, value));
    }
}
