package com.example.journey.geometry;

import com.example.journey.model.CrossingEvent;
import com.example.journey.model.Line;
import com.example.journey.model.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CrossingDetectorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    /** 水平线，线下方（y 较大）为 +1 侧 */
    private static final Line DOOR = Line.of(0, 100, 200, 100);

    private CrossingDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CrossingDetector(Duration.ofMillis(750));
        detector.setLines(List.of(DOOR));
    }

    @Test
    void firstObservationNeverFires() {
        assertThat(detector.evaluate(1, Point.of(50, 150), T0)).isEmpty();
        assertThat(detector.rememberedSide(1, 0)).contains(1);
    }

    @Test
    void negativeToPositiveIsEntry() {
        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).contains(CrossingEvent.ENTRY);
    }

    @Test
    void positiveToNegativeIsExit() {
        detector.evaluate(1, Point.of(50, 150), T0);
        assertThat(detector.evaluate(1, Point.of(50, 50), T0.plusSeconds(1))).contains(CrossingEvent.EXIT);
    }

    @Test
    void pointOnLineKeepsPreviousSide() {
        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.evaluate(1, Point.of(50, 100), T0.plusSeconds(1))).isEmpty();
        assertThat(detector.rememberedSide(1, 0)).contains(-1);

        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(2))).contains(CrossingEvent.ENTRY);
    }

    @Test
    void debounceSuppressesQuickReversal() {
        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusMillis(100))).contains(CrossingEvent.ENTRY);
        assertThat(detector.evaluate(1, Point.of(50, 50), T0.plusMillis(400))).isEmpty();

        // 侧别已更新为 -1，再次进入且超过去抖间隔
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusMillis(900))).contains(CrossingEvent.ENTRY);
    }

    @Test
    void debounceBoundaryIsInclusive() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.evaluate(1, Point.of(50, 150), T0.plusMillis(100));
        assertThat(detector.evaluate(1, Point.of(50, 50), T0.plusMillis(850))).contains(CrossingEvent.EXIT);
    }

    @Test
    void tracksAreIndependent() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.evaluate(2, Point.of(60, 150), T0);

        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusMillis(10))).contains(CrossingEvent.ENTRY);
        assertThat(detector.evaluate(2, Point.of(60, 50), T0.plusMillis(10))).contains(CrossingEvent.EXIT);
    }

    @Test
    void atMostOneEventPerFrameFirstLineWins() {
        Line second = Line.of(0, 120, 200, 120);
        detector.setLines(List.of(DOOR, second));

        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).contains(CrossingEvent.ENTRY);
        // 两条线的侧别都已更新
        assertThat(detector.rememberedSide(1, 1)).contains(1);
    }

    @Test
    void noLinesMeansNoEvents() {
        detector.setLines(List.of());
        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).isEmpty();
    }

    @Test
    void changingLinesResetsSideMemory() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.setLines(List.of(Line.of(0, 300, 200, 300)));

        assertThat(detector.rememberedSide(1, 0)).isEmpty();
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).isEmpty();
    }

    @Test
    void settingSameLinesKeepsSideMemory() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.setLines(List.of(Line.of(0, 100, 200, 100)));

        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).contains(CrossingEvent.ENTRY);
    }

    @Test
    void appendingLineKeepsCrossingInProgress() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.setLines(List.of(DOOR, Line.of(0, 300, 200, 300)));

        assertThat(detector.rememberedSide(1, 0)).contains(-1);
        assertThat(detector.evaluate(1, Point.of(50, 150), T0.plusSeconds(1))).contains(CrossingEvent.ENTRY);
    }

    @Test
    void removingEarlierLineClearsShiftedIndices() {
        Line upper = Line.of(0, 20, 200, 20);
        detector.setLines(List.of(upper, DOOR));
        detector.evaluate(1, Point.of(50, 50), T0);
        assertThat(detector.rememberedSide(1, 0)).contains(1);

        // DOOR 移到序号0，旧的序号0记忆不能当作 DOOR 的侧别
        detector.setLines(List.of(DOOR));
        assertThat(detector.rememberedSide(1, 0)).isEmpty();
        assertThat(detector.rememberedSide(1, 1)).isEmpty();
        assertThat(detector.evaluate(1, Point.of(50, 40), T0.plusSeconds(1))).isEmpty();
    }

    @Test
    void retainTracksDropsExpiredState() {
        detector.evaluate(1, Point.of(50, 50), T0);
        detector.evaluate(2, Point.of(50, 50), T0);
        detector.retainTracks(List.of(2));

        assertThat(detector.trackedCount()).isEqualTo(1);
        assertThat(detector.rememberedSide(1, 0)).isEmpty();
    }
}
