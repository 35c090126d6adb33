package com.example.journey.dto;

import com.example.journey.session.Session;
import com.example.journey.session.SessionEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 会话快照，发布给外部读取方，不可变
 */
@Value
@Builder
public class SessionView {

    /** 会话ID，例如 CUST_001 */
    String sessionId;

    /** 首次进入时间 */
    Instant entryTime;

    /** 离开时间，未离开为null */
    Instant exitTime;

    /** 最后出现时间 */
    Instant lastSeenTime;

    /** 事件日志 */
    List<SessionEvent> events;

    /** 区域到访记录 */
    List<ZoneVisitView> zoneVisits;

    public static SessionView from(Session session) {
        return SessionView.builder()
                .sessionId(session.getSessionId())
                .entryTime(session.getEntryTime())
                .exitTime(session.getExitTime())
                .lastSeenTime(session.getLastSeenTime())
                .events(List.copyOf(session.getEvents()))
                .zoneVisits(session.getZoneVisits().stream().map(ZoneVisitView::from).toList())
                .build();
    }
}
