package com.example.journey.session;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 会话存储
 * <p>
 * 每个全局人员最多一个会话，首次ENTRY时创建；EXIT或超时未出现时关闭。
 * 不存在的人员或会话一律按空操作处理。所有时间由调用方传入，同一帧内使用同一个时刻。
 */
@Slf4j
public class SessionStore {

    public static final Duration DEFAULT_INACTIVITY_TIMEOUT = Duration.ofSeconds(5);

    private static final String SESSION_ID_FORMAT = "CUST_%03d";

    /** personId -> 会话，按创建顺序 */
    private final Map<Integer, Session> sessions = new LinkedHashMap<>();

    private final Map<Integer, Instant> personLastSeen = new HashMap<>();

    private int nextSessionNumber = 1;

    @Getter
    private Duration inactivityTimeout;

    public SessionStore() {
        this(DEFAULT_INACTIVITY_TIMEOUT);
    }

    public SessionStore(Duration inactivityTimeout) {
        setInactivityTimeout(inactivityTimeout);
    }

    public void setInactivityTimeout(Duration inactivityTimeout) {
        if (inactivityTimeout == null || inactivityTimeout.isNegative() || inactivityTimeout.isZero()) {
            throw new IllegalArgumentException("超时时间必须为正: " + inactivityTimeout);
        }
        this.inactivityTimeout = inactivityTimeout;
    }

    /**
     * 记录人员在本帧出现
     */
    public void markSeen(int personId, Instant now) {
        personLastSeen.put(personId, now);
        Session session = sessions.get(personId);
        if (session != null) {
            session.markSeen(now);
        }
    }

    public void onEntry(int personId, Instant now) {
        Session session = sessions.get(personId);
        if (session == null) {
            session = new Session(String.format(SESSION_ID_FORMAT, nextSessionNumber++));
            sessions.put(personId, session);
            log.info("✅ 创建会话 {} (人员 {})", session.getSessionId(), personId);
        }
        personLastSeen.put(personId, now);
        session.recordEntry(now);
    }

    public void onExit(int personId, Instant now) {
        Session session = sessions.get(personId);
        if (session == null) {
            return;
        }
        if (session.getExitTime() == null) {
            log.info("🚪 会话 {} 离开 (人员 {})", session.getSessionId(), personId);
        }
        session.recordExit(now);
    }

    public void onZoneEntry(int personId, String zoneName, Instant now) {
        Session session = sessions.get(personId);
        if (session == null) {
            return;
        }
        if (session.openZoneVisit(zoneName, now)) {
            log.debug("会话 {} 进入区域 {}", session.getSessionId(), zoneName);
        }
    }

    public void onZoneExit(int personId, String zoneName, Instant now) {
        Session session = sessions.get(personId);
        if (session == null) {
            return;
        }
        if (session.closeZoneVisit(zoneName, now)) {
            log.debug("会话 {} 离开区域 {}", session.getSessionId(), zoneName);
        }
    }

    /**
     * 超过 inactivityTimeout 未出现的未关闭会话自动关闭，离开时间记为最后出现时间
     */
    public void markInactiveIfNotSeen(Instant now) {
        for (Map.Entry<Integer, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.getExitTime() != null) {
                continue;
            }
            Instant lastSeen = lastSeenOf(entry.getKey(), session);
            if (lastSeen == null) {
                continue;
            }
            if (Duration.between(lastSeen, now).compareTo(inactivityTimeout) > 0) {
                session.autoExit(lastSeen);
                log.info("⏱️ 会话 {} 超时自动离开 (人员 {}, 最后出现 {})",
                        session.getSessionId(), entry.getKey(), lastSeen);
            }
        }
    }

    /**
     * 当前在场的会话：已进入、未离开且在超时窗口内出现过
     */
    public List<Session> activeSessions(Instant now) {
        markInactiveIfNotSeen(now);

        List<Session> active = new ArrayList<>();
        for (Map.Entry<Integer, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (!session.isActive()) {
                continue;
            }
            Instant lastSeen = lastSeenOf(entry.getKey(), session);
            if (lastSeen == null || Duration.between(lastSeen, now).compareTo(inactivityTimeout) <= 0) {
                active.add(session);
            }
        }
        return active;
    }

    /**
     * 全部历史会话
     */
    public List<Session> allSessions() {
        return List.copyOf(sessions.values());
    }

    public Optional<Session> sessionOf(int personId) {
        return Optional.ofNullable(sessions.get(personId));
    }

    public Optional<String> sessionIdOf(int personId) {
        return sessionOf(personId).map(Session::getSessionId);
    }

    private Instant lastSeenOf(int personId, Session session) {
        Instant lastSeen = personLastSeen.get(personId);
        if (lastSeen != null) {
            return lastSeen;
        }
        return session.getEntryTime() != null ? session.getEntryTime() : session.getLastSeenTime();
    }
}
