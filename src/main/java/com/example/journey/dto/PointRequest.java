package com.example.journey.dto;

import com.example.journey.model.Point;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PointRequest {

    private Double x;

    private Double y;

    public Point toPoint() {
        if (x == null || y == null) {
            throw new IllegalArgumentException("点坐标不能为空");
        }
        return Point.of(x, y);
    }
}
