package com.example.journey.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineTest {

    private final Line horizontal = Line.of(0, 100, 200, 100);

    @Test
    void pointsBelowHorizontalLineArePositive() {
        // 图像坐标系 y 轴向下
        assertThat(horizontal.sideOf(Point.of(50, 150))).isEqualTo(1);
        assertThat(horizontal.sideOf(Point.of(50, 50))).isEqualTo(-1);
    }

    @Test
    void pointOnLineIsZero() {
        assertThat(horizontal.sideOf(Point.of(500, 100))).isZero();
        assertThat(horizontal.sideOf(Point.of(50, 100 + 1e-9))).isZero();
    }

    @Test
    void reversingLineFlipsSides() {
        Line reversed = Line.of(200, 100, 0, 100);
        assertThat(reversed.sideOf(Point.of(50, 150))).isEqualTo(-1);
    }

    @Test
    void zeroLengthLineHasNoSides() {
        Line degenerate = Line.of(10, 10, 10, 10);
        assertThat(degenerate.sideOf(Point.of(0, 0))).isZero();
        assertThat(degenerate.sideOf(Point.of(99, 3))).isZero();
    }
}
