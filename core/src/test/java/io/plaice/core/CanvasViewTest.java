package io.plaice.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CanvasViewTest {

    /** 4x3 view at origin (10,20) whose red channel encodes the local index. */
    private static CanvasView sample() {
        int[] px = new int[12];
        for (int i = 0; i < px.length; i++) {
            px[i] = new Rgb(i, 0, 255).pack();
        }
        return new CanvasView(10, 20, 4, 3, px);
    }

    @Test
    void absolute_and_local_addressing_agree() {
        var v = sample();
        assertEquals(new Rgb(5, 0, 255), v.rgbAt(1, 1));
        assertEquals(new Rgb(5, 0, 255), v.rgbAtAbsolute(11, 21));
        assertTrue(v.containsAbsolute(13, 22));
        assertFalse(v.containsAbsolute(14, 22));
        assertThrows(IndexOutOfBoundsException.class, () -> v.rgbAt(4, 0));
    }

    @Test
    void window_is_clipped_to_view() {
        var v = sample();
        var w = v.window(10, 20, 1);
        assertEquals(10, w.originX());
        assertEquals(20, w.originY());
        assertEquals(2, w.width());
        assertEquals(2, w.height());
        assertEquals(new Rgb(5, 0, 255), w.rgbAtAbsolute(11, 21));

        assertTrue(v.window(100, 100, 2).isEmpty());
    }

    @Test
    void stats_summarize_channels() {
        var s = sample().stats();
        assertEquals(5.5, s.mean(0), 1e-9);
        assertEquals(0, s.min(0));
        assertEquals(11, s.max(0));
        assertEquals(255.0, s.mean(2), 1e-9);
        assertEquals(0.0, s.stddev(2), 1e-9);
        assertNull(CanvasView.empty(0, 0).stats());
    }

    @Test
    void pixels_are_defensively_copied() {
        int[] px = {Rgb.BLACK.pack()};
        var v = new CanvasView(0, 0, 1, 1, px);
        px[0] = new Rgb(1, 2, 3).pack();
        assertEquals(Rgb.BLACK, v.rgbAt(0, 0));
        v.packedPixels()[0] = 99;
        assertEquals(Rgb.BLACK, v.rgbAt(0, 0));
    }

    @Test
    void rgb_pack_round_trip_and_validation() {
        var c = new Rgb(12, 34, 56);
        assertEquals(c, Rgb.unpack(c.pack()));
        assertEquals(new Rgb(0, 255, 7), Rgb.clamped(-3, 300, 7));
        assertThrows(IllegalArgumentException.class, () -> new Rgb(256, 0, 0));
    }
}
