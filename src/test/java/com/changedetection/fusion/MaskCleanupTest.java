package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMask;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MaskCleanupTest {
    private final MaskCleanup cleanup = new MaskCleanup();

    @Test
    public void removesComponentsBelowMinimumArea() {
        boolean[] pixels = new boolean[50 * 50];
        fill(pixels, 50, 5, 5, 10, 10);
        fill(pixels, 50, 30, 30, 3, 3);
        ChangeMask cleaned = cleanup.clean(ChangeMask.of(50, 50, pixels), new CleanupParameters(50, false, 0, 0));
        assertEquals(100, cleaned.getChangedPixels());
        assertFalse(cleaned.get(31, 31));
    }

    @Test
    public void diagonalNeighboursFormOneComponent() {
        boolean[] pixels = new boolean[10 * 10];
        for (int i = 0; i < 10; i++) pixels[i * 10 + i] = true;
        boolean[] copy = pixels.clone();
        MaskCleanup.removeSmallComponents(copy, 10, 10, 10);
        assertEquals(10, ChangeMask.of(10, 10, copy).getChangedPixels());
        MaskCleanup.removeSmallComponents(copy, 10, 10, 11);
        assertEquals(0, ChangeMask.of(10, 10, copy).getChangedPixels());
    }

    @Test
    public void fillsEnclosedHolesOnly() {
        boolean[] pixels = new boolean[20 * 20];
        fill(pixels, 20, 2, 2, 10, 10);
        fill(pixels, 20, 4, 4, 3, 3, false);
        // open ring touching the border is not a hole
        fill(pixels, 20, 14, 0, 6, 6);
        fill(pixels, 20, 16, 0, 2, 4, false);

        ChangeMask cleaned = cleanup.clean(ChangeMask.of(20, 20, pixels), new CleanupParameters(0, true, 0, 0));

        assertTrue(cleaned.get(5, 5));
        assertFalse(cleaned.get(16, 1));
        assertEquals(100 + 36 - 8, cleaned.getChangedPixels());
    }

    @Test
    public void cleanupIsIdempotent() {
        boolean[] pixels = new boolean[100 * 100];
        fill(pixels, 100, 10, 10, 30, 30);
        fill(pixels, 100, 55, 50, 35, 25);
        fill(pixels, 100, 80, 10, 2, 2);
        fill(pixels, 100, 5, 90, 1, 3);
        CleanupParameters params = new CleanupParameters();

        ChangeMask once = cleanup.clean(ChangeMask.of(100, 100, pixels), params);
        ChangeMask twice = cleanup.clean(once, params);

        assertEquals(once, twice);
        assertTrue(once.get(25, 25));
        assertFalse(once.get(81, 11));
    }

    @Test
    public void zeroRadiiLeaveLargeBlockUntouched() {
        boolean[] pixels = new boolean[60 * 60];
        fill(pixels, 60, 10, 10, 40, 40);
        ChangeMask cleaned = cleanup.clean(ChangeMask.of(60, 60, pixels), new CleanupParameters(50, false, 0, 0));
        assertEquals(1600, cleaned.getChangedPixels());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeRadiusIsRejected() {
        cleanup.clean(ChangeMask.empty(5, 5), new CleanupParameters(0, false, -1, 0));
    }

    private static void fill(boolean[] pixels, int width, int x0, int y0, int w, int h) {
        fill(pixels, width, x0, y0, w, h, true);
    }

    private static void fill(boolean[] pixels, int width, int x0, int y0, int w, int h, boolean value) {
        for (int y = y0; y < y0 + h; y++) {
            for (int x = x0; x < x0 + w; x++) pixels[y * width + x] = value;
        }
    }
}
