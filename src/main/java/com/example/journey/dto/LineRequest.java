package com.example.journey.dto;

import com.example.journey.model.Line;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 出入线，方向为 p1 到 p2
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineRequest {

    private Double x1;
    private Double y1;
    private Double x2;
    private Double y2;

    public Line toLine() {
        if (x1 == null || y1 == null || x2 == null || y2 == null) {
            throw new IllegalArgumentException("出入线需要 x1, y1, x2, y2 四个坐标");
        }
        if (x1.equals(x2) && y1.equals(y2)) {
            throw new IllegalArgumentException("出入线两端点不能重合");
        }
        return Line.of(x1, y1, x2, y2);
    }

    public static LineRequest from(Line line) {
        return new LineRequest(line.getP1().getX(), line.getP1().getY(),
                line.getP2().getX(), line.getP2().getY());
    }
}
