package com.example.journey.model;

import lombok.Value;

/**
 * 有向出入线，点的顺序决定哪一侧是进入方向
 * <p>
 * 点从 -1 侧移动到 +1 侧记为 ENTRY，反之记为 EXIT。
 */
@Value
public class Line {

    private static final double EPSILON = 1e-6;

    Point p1;

    Point p2;

    public static Line of(double x1, double y1, double x2, double y2) {
        return new Line(Point.of(x1, y1), Point.of(x2, y2));
    }

    /**
     * 点位于直线的哪一侧：(p2 - p1) x (point - p1) 的符号，-1、0 或 +1。
     * 长度为0的线对所有点都返回0。
     */
    public int sideOf(Point point) {
        double cross = (p2.getX() - p1.getX()) * (point.getY() - p1.getY())
                - (p2.getY() - p1.getY()) * (point.getX() - p1.getX());
        if (Math.abs(cross) < EPSILON) {
            return 0;
        }
        return cross > 0 ? 1 : -1;
    }
}
