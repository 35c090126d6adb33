package com.example.journey.dto;

import com.example.journey.model.Zone;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ZoneRequest {

    private String name;

    /** 按顺序的4个顶点 */
    private List<PointRequest> points;

    public Zone toZone() {
        if (points == null) {
            throw new IllegalArgumentException("区域顶点不能为空");
        }
        return new Zone(name, points.stream().map(PointRequest::toPoint).toList());
    }

    public static ZoneRequest from(Zone zone) {
        return new ZoneRequest(zone.getName(), zone.getPoints().stream()
                .map(p -> new PointRequest(p.getX(), p.getY()))
                .toList());
    }
}
