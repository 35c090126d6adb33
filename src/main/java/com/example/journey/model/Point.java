package com.example.journey.model;

import lombok.Value;

/**
 * 图像平面上的二维点（像素坐标）
 */
@Value
public class Point {

    double x;

    double y;

    public static Point of(double x, double y) {
        return new Point(x, y);
    }
}
