package com.starscape.borderframe.features.planframe.domain;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class DimensionPlannerTest {

    @Test
    void shouldOnlyAddBorderWithoutAspectRatio() {
        assertEquals(new CanvasSize(120, 100), DimensionPlanner.plan(100, 80, 10, null));
    }

    @Test
    void shouldPadToSquare() {
        assertEquals(new CanvasSize(120, 120), DimensionPlanner.plan(100, 50, 10, AspectRatio.SQUARE));
        assertEquals(new CanvasSize(110, 110), DimensionPlanner.plan(50, 100, 5, AspectRatio.SQUARE));
    }

    @Test
    void shouldTruncateCrossDimensionForPortrait() {
        assertEquals(new CanvasSize(820, 1025), DimensionPlanner.plan(800, 600, 10, AspectRatio.PORTRAIT));
        assertEquals(new CanvasSize(160, 200), DimensionPlanner.plan(100, 200, 0, AspectRatio.PORTRAIT));
    }

    @Test
    void shouldKeepSizeWhenAlreadyAtRatio() {
        assertEquals(new CanvasSize(500, 500), DimensionPlanner.plan(480, 480, 10, AspectRatio.SQUARE));
    }

    @Test
    void shouldNeverShrinkBelowBorderOnlyMinimum() {
        Random random = new Random(42);
        AspectRatio[] ratios = {
            AspectRatio.SQUARE, AspectRatio.PORTRAIT, AspectRatio.LANDSCAPE,
            AspectRatio.STORY, AspectRatio.BANNER, new AspectRatio(3, 7)
        };
        for (int i = 0; i < 2000; i++) {
            int width = 1 + random.nextInt(5000);
            int height = 1 + random.nextInt(5000);
            int border = random.nextInt(300);
            AspectRatio ratio = ratios[random.nextInt(ratios.length)];

            CanvasSize canvas = DimensionPlanner.plan(width, height, border, ratio);

            int minWidth = width + 2 * border;
            int minHeight = height + 2 * border;
            assertTrue(canvas.width() >= minWidth, () -> "width below minimum for " + canvas);
            assertTrue(canvas.height() >= minHeight, () -> "height below minimum for " + canvas);
            // One axis always stays at its minimum; the other grows towards the ratio
            assertTrue(canvas.width() == minWidth || canvas.height() == minHeight);
            double slack = 1.0 / Math.min(canvas.width(), canvas.height()) + 1e-9;
            double actual = (double) canvas.width() / canvas.height();
            assertTrue(Math.abs(actual - ratio.ratio()) <= ratio.ratio() * slack
                    || canvas.width() == minWidth && canvas.height() == minHeight,
                () -> canvas + " too far from " + ratio);
        }
    }

    @Test
    void shouldDeriveProportionalBorderFromShorterSide() {
        assertEquals(30, DimensionPlanner.proportionalBorder(10, 4000, 3000));
        assertEquals(0, DimensionPlanner.proportionalBorder(10, 50, 99));
        assertEquals(new CanvasSize(4060, 3060), DimensionPlanner.planProportional(4000, 3000, 10, null));
        assertEquals(7, DimensionPlanner.resolveBorder(BorderMode.FIXED, 7, 4000, 3000));
        assertEquals(21, DimensionPlanner.resolveBorder(BorderMode.PROPORTIONAL, 7, 4000, 3000));
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> DimensionPlanner.plan(0, 10, 0, null));
        assertThrows(IllegalArgumentException.class, () -> DimensionPlanner.plan(10, -1, 0, null));
        assertThrows(IllegalArgumentException.class, () -> DimensionPlanner.plan(10, 10, -1, null));
        assertThrows(ArithmeticException.class, () -> DimensionPlanner.plan(Integer.MAX_VALUE, 10, 1, null));
        assertThrows(ArithmeticException.class,
            () -> DimensionPlanner.plan(100000, 1, 0, new AspectRatio(1, 100000)));
        assertThrows(ArithmeticException.class,
            () -> DimensionPlanner.plan(1, 100000, 0, new AspectRatio(100000, 1)));
    }
}
