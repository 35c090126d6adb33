package com.example.journey.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 命名区域，由4个有序顶点组成的多边形
 */
@Getter
@ToString
@EqualsAndHashCode
public class Zone {

    public static final int VERTEX_COUNT = 4;

    private final String name;

    private final List<Point> points;

    public Zone(String name, List<Point> points) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("区域名称不能为空");
        }
        if (points == null || points.size() != VERTEX_COUNT) {
            throw new IllegalArgumentException("区域必须有且只有4个点: " + name);
        }
        this.name = name;
        this.points = List.copyOf(points);
    }

    /**
     * 射线法判断点是否在多边形内（边交叉奇偶性）
     */
    public boolean contains(Point point) {
        double x = point.getX();
        double y = point.getY();
        boolean inside = false;

        int n = points.size();
        double p1x = points.get(0).getX();
        double p1y = points.get(0).getY();
        for (int i = 1; i <= n; i++) {
            double p2x = points.get(i % n).getX();
            double p2y = points.get(i % n).getY();
            // 水平边不满足 y 区间条件，这里 p1y != p2y
            if (y > Math.min(p1y, p2y) && y <= Math.max(p1y, p2y) && x <= Math.max(p1x, p2x)) {
                double xIntersect = (y - p1y) * (p2x - p1x) / (p2y - p1y) + p1x;
                if (p1x == p2x || x <= xIntersect) {
                    inside = !inside;
                }
            }
            p1x = p2x;
            p1y = p2y;
        }
        return inside;
    }
}
