package com.example.journey.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private SessionStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStore(Duration.ofSeconds(5));
    }

    @Test
    void entryCreatesSessionWithSequentialIds() {
        store.onEntry(1, T0);
        store.onEntry(2, T0.plusSeconds(1));

        assertThat(store.sessionIdOf(1)).contains("CUST_001");
        assertThat(store.sessionIdOf(2)).contains("CUST_002");

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getEntryTime()).isEqualTo(T0);
        assertThat(session.getEvents()).containsExactly(SessionEvent.ENTRY);
        assertThat(session.isActive()).isTrue();
    }

    @Test
    void repeatedEntryKeepsFirstEntryTime() {
        store.onEntry(1, T0);
        store.onEntry(1, T0.plusSeconds(2));

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getEntryTime()).isEqualTo(T0);
        assertThat(session.getEvents()).containsExactly(SessionEvent.ENTRY, SessionEvent.ENTRY);
        assertThat(store.allSessions()).hasSize(1);
    }

    @Test
    void exitClosesSessionOnce() {
        store.onEntry(1, T0);
        store.onExit(1, T0.plusSeconds(2));
        store.onExit(1, T0.plusSeconds(3));

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getExitTime()).isEqualTo(T0.plusSeconds(2));
        assertThat(session.getEvents()).containsExactly(SessionEvent.ENTRY, SessionEvent.EXIT, SessionEvent.EXIT);
        assertThat(store.activeSessions(T0.plusSeconds(3))).isEmpty();
    }

    @Test
    void closedSessionIsNotReopened() {
        store.onEntry(1, T0);
        store.onExit(1, T0.plusSeconds(1));
        store.onEntry(1, T0.plusSeconds(2));

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getSessionId()).isEqualTo("CUST_001");
        assertThat(session.isActive()).isFalse();
        assertThat(store.activeSessions(T0.plusSeconds(2))).isEmpty();
    }

    @Test
    void exitWithoutSessionIsIgnored() {
        store.onExit(9, T0);
        store.onZoneEntry(9, "shelf", T0);
        store.onZoneExit(9, "shelf", T0);
        store.markSeen(9, T0);

        assertThat(store.allSessions()).isEmpty();
    }

    @Test
    void inactiveSessionIsAutoClosedAtLastSeen() {
        store.onEntry(1, T0);
        store.markSeen(1, T0.plusSeconds(2));

        assertThat(store.activeSessions(T0.plusSeconds(7))).hasSize(1);
        assertThat(store.activeSessions(T0.plusMillis(7001))).isEmpty();

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getExitTime()).isEqualTo(T0.plusSeconds(2));
        assertThat(session.getEvents()).containsExactly(SessionEvent.ENTRY, SessionEvent.AUTO_EXIT);
    }

    @Test
    void seenPersonStaysActive() {
        store.onEntry(1, T0);
        for (int i = 1; i <= 20; i++) {
            store.markSeen(1, T0.plusSeconds(i));
            assertThat(store.activeSessions(T0.plusSeconds(i))).hasSize(1);
        }
        assertThat(store.sessionOf(1).orElseThrow().getLastSeenTime()).isEqualTo(T0.plusSeconds(20));
    }

    @Test
    void zoneVisitsOpenAndClose() {
        store.onEntry(1, T0);
        store.onZoneEntry(1, "shelf", T0.plusSeconds(1));
        store.onZoneEntry(1, "shelf", T0.plusSeconds(2));
        store.onZoneExit(1, "shelf", T0.plusSeconds(3));
        store.onZoneEntry(1, "shelf", T0.plusSeconds(4));

        Session session = store.sessionOf(1).orElseThrow();
        assertThat(session.getZoneVisits()).hasSize(2);
        ZoneVisit first = session.getZoneVisits().get(0);
        assertThat(first.getEntryTime()).isEqualTo(T0.plusSeconds(1));
        assertThat(first.getExitTime()).isEqualTo(T0.plusSeconds(3));
        assertThat(session.getZoneVisits().get(1).isOpen()).isTrue();
    }

    @Test
    void zoneExitWithoutOpenVisitIsIgnored() {
        store.onEntry(1, T0);
        store.onZoneExit(1, "shelf", T0.plusSeconds(1));

        assertThat(store.sessionOf(1).orElseThrow().getZoneVisits()).isEmpty();
    }

    @Test
    void eventLogIsReadOnly() {
        store.onEntry(1, T0);
        Session session = store.sessionOf(1).orElseThrow();

        assertThatThrownBy(() -> session.getEvents().add(SessionEvent.EXIT))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> store.setInactivityTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
