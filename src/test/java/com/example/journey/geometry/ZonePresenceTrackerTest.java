package com.example.journey.geometry;

import com.example.journey.model.Point;
import com.example.journey.model.Zone;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ZonePresenceTrackerTest {

    private final Zone left = square("left", 0, 0, 100);
    private final Zone overlap = square("overlap", 50, 0, 100);
    private final List<Zone> zones = List.of(left, overlap);

    private final ZonePresenceTracker tracker = new ZonePresenceTracker();

    @Test
    void reportsEntryOnceWhileInside() {
        ZoneTransition first = tracker.update(1, Point.of(20, 50), zones);
        assertThat(first.getEntered()).containsExactly("left");
        assertThat(first.getExited()).isEmpty();

        assertThat(tracker.update(1, Point.of(25, 50), zones).isEmpty()).isTrue();
        assertThat(tracker.zonesOf(1)).containsExactly("left");
    }

    @Test
    void pointCanBeInOverlappingZones() {
        ZoneTransition transition = tracker.update(1, Point.of(75, 50), zones);
        assertThat(transition.getEntered()).containsExactly("left", "overlap");
    }

    @Test
    void movingBetweenZonesReportsBothSides() {
        tracker.update(1, Point.of(20, 50), zones);
        ZoneTransition transition = tracker.update(1, Point.of(130, 50), zones);

        assertThat(transition.getEntered()).containsExactly("overlap");
        assertThat(transition.getExited()).containsExactly("left");
    }

    @Test
    void leavingAllZones() {
        tracker.update(1, Point.of(75, 50), zones);
        ZoneTransition transition = tracker.update(1, Point.of(500, 500), zones);

        assertThat(transition.getEntered()).isEmpty();
        assertThat(transition.getExited()).containsExactlyInAnyOrder("left", "overlap");
        assertThat(tracker.zonesOf(1)).isEmpty();
    }

    @Test
    void removedZoneCountsAsExit() {
        tracker.update(1, Point.of(20, 50), zones);
        ZoneTransition transition = tracker.update(1, Point.of(20, 50), List.of(overlap));

        assertThat(transition.getExited()).containsExactly("left");
    }

    @Test
    void retainTracksForgetsMembership() {
        tracker.update(1, Point.of(20, 50), zones);
        tracker.retainTracks(List.of());

        assertThat(tracker.zonesOf(1)).isEmpty();
        assertThat(tracker.update(1, Point.of(20, 50), zones).getEntered()).containsExactly("left");
    }

    private static Zone square(String name, double x, double y, double size) {
        return new Zone(name, List.of(Point.of(x, y), Point.of(x + size, y),
                Point.of(x + size, y + size), Point.of(x, y + size)));
    }
}
