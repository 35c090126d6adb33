package com.example.journey.dto;

import com.example.journey.session.ZoneVisit;
import lombok.Value;

import java.time.Instant;

/**
 * 区域到访快照
 */
@Value
public class ZoneVisitView {

    String zoneName;

    Instant entryTime;

    /** 仍在区域内时为null */
    Instant exitTime;

    public static ZoneVisitView from(ZoneVisit visit) {
        return new ZoneVisitView(visit.getZoneName(), visit.getEntryTime(), visit.getExitTime());
    }
}
