package com.example.journey.session;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 一次区域到访记录，exitTime为null表示仍在区域内
 */
@Getter
@ToString
public class ZoneVisit {

    private final String zoneName;

    private final Instant entryTime;

    private Instant exitTime;

    ZoneVisit(String zoneName, Instant entryTime) {
        this.zoneName = zoneName;
        this.entryTime = entryTime;
    }

    public boolean isOpen() {
        return exitTime == null;
    }

    void close(Instant exitTime) {
        this.exitTime = exitTime;
    }
}
