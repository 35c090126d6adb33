package com.example.journey.session;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 顾客会话：首次ENTRY时创建，EXIT或AUTO_EXIT后关闭，关闭后不会重新打开
 */
@Getter
@ToString
public class Session {

    private final String sessionId;

    private Instant entryTime;

    private Instant exitTime;

    private Instant lastSeenTime;

    @Getter(AccessLevel.NONE)
    private final List<SessionEvent> events = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<ZoneVisit> zoneVisits = new ArrayList<>();

    Session(String sessionId) {
        this.sessionId = sessionId;
    }

    public List<SessionEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<ZoneVisit> getZoneVisits() {
        return Collections.unmodifiableList(zoneVisits);
    }

    public boolean isActive() {
        return entryTime != null && exitTime == null;
    }

    void markSeen(Instant now) {
        this.lastSeenTime = now;
    }

    void recordEntry(Instant now) {
        if (entryTime == null) {
            entryTime = now;
        }
        lastSeenTime = now;
        events.add(SessionEvent.ENTRY);
    }

    void recordExit(Instant now) {
        if (exitTime == null) {
            exitTime = now;
        }
        events.add(SessionEvent.EXIT);
    }

    void autoExit(Instant lastSeen) {
        exitTime = lastSeen;
        events.add(SessionEvent.AUTO_EXIT);
    }

    /**
     * @return 是否新开了一次到访
     */
    boolean openZoneVisit(String zoneName, Instant now) {
        for (ZoneVisit visit : zoneVisits) {
            if (visit.getZoneName().equals(zoneName) && visit.isOpen()) {
                return false;
            }
        }
        zoneVisits.add(new ZoneVisit(zoneName, now));
        return true;
    }

    /**
     * 关闭该区域最近一次未结束的到访
     */
    boolean closeZoneVisit(String zoneName, Instant now) {
        for (int i = zoneVisits.size() - 1; i >= 0; i--) {
            ZoneVisit visit = zoneVisits.get(i);
            if (visit.getZoneName().equals(zoneName) && visit.isOpen()) {
                visit.close(now);
                return true;
            }
        }
        return false;
    }
}
