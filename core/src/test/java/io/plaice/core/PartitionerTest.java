package io.plaice.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionerTest {

    private static boolean covered(List<TileBounds> tiles, int x, int y) {
        for (TileBounds t : tiles) {
            if (t.contains(x, y)) return true;
        }
        return false;
    }

    @Test
    void union_of_tiles_covers_every_cell() {
        int[][] sizes = {{1, 1}, {1, 7}, {7, 1}, {2, 3}, {5, 5}, {16, 9}, {31, 17}, {64, 64}};
        for (int n = 1; n <= 40; n++) {
            for (int[] s : sizes) {
                for (double overlap : new double[]{0.0, 0.4, 0.6}) {
                    var tiles = Partitioner.partition(n, s[0], s[1], overlap);
                    assertEquals(n, tiles.size());
                    for (int y = 0; y < s[1]; y++) {
                        for (int x = 0; x < s[0]; x++) {
                            assertTrue(covered(tiles, x, y),
                                    "n=%d size=%dx%d overlap=%s missing (%d,%d)".formatted(n, s[0], s[1], overlap, x, y));
                        }
                    }
                }
            }
        }
    }

    @Test
    void tiles_stay_inside_canvas() {
        var tiles = Partitioner.partition(7, 20, 11, 0.9);
        for (TileBounds t : tiles) {
            assertTrue(t.x0() >= 0 && t.x1() <= 20, t.toString());
            assertTrue(t.y0() >= 0 && t.y1() <= 11, t.toString());
        }
    }

    @Test
    void determinism_same_inputs_same_tiles() {
        assertEquals(Partitioner.partition(9, 224, 224, 0.4), Partitioner.partition(9, 224, 224, 0.4));
    }

    @Test
    void four_workers_on_square_canvas() {
        // cols=2, rows=2, base 5x5, overlap floor(5*0.4)=2
        var tiles = Partitioner.partition(4, 10, 10, 0.4);
        assertEquals(new TileBounds(0, 7, 0, 7), tiles.get(0));
        assertEquals(new TileBounds(3, 10, 0, 7), tiles.get(1));
        assertEquals(new TileBounds(0, 7, 3, 10), tiles.get(2));
        assertEquals(new TileBounds(3, 10, 3, 10), tiles.get(3));
    }

    @Test
    void single_worker_owns_whole_canvas() {
        assertEquals(List.of(new TileBounds(0, 4, 0, 4)), Partitioner.partition(1, 4, 4));
    }

    @Test
    void last_worker_of_short_row_stretches_to_edge() {
        // 3 workers: cols=2 rows=2; worker 2 is alone on the bottom row.
        var tiles = Partitioner.partition(3, 10, 10, 0.0);
        assertEquals(new TileBounds(0, 10, 5, 10), tiles.get(2));
    }

    @Test
    void stretched_tile_overlap_follows_its_own_width() {
        // 5 workers on 30x20: cols=3 rows=2, base tile 10x10; worker 4 stretches over [10,30).
        var tiles = Partitioner.partition(5, 30, 20, 0.25);
        assertEquals(new TileBounds(5, 30, 8, 20), tiles.get(4));
        assertEquals(new TileBounds(8, 22, 0, 12), tiles.get(1));
    }

    @Test
    void degenerate_canvas_yields_empty_tiles() {
        for (TileBounds t : Partitioner.partition(3, 0, 5)) {
            assertTrue(t.isEmpty());
        }
        // More workers than columns of pixels: some tiles end up empty but coverage holds.
        var tiles = Partitioner.partition(9, 1, 1, 0.4);
        assertTrue(tiles.stream().anyMatch(TileBounds::isEmpty));
        assertTrue(covered(tiles, 0, 0));
    }

    @Test
    void invalid_configuration_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(0, 4, 4));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(2, -1, 4));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(2, 4, 4, -0.1));
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(2, 4, 4, Double.NaN));
    }

    @Test
    void ceil_sqrt_matches_definition() {
        assertEquals(1, Partitioner.ceilSqrt(1));
        assertEquals(2, Partitioner.ceilSqrt(2));
        assertEquals(2, Partitioner.ceilSqrt(4));
        assertEquals(3, Partitioner.ceilSqrt(5));
        assertEquals(4, Partitioner.ceilSqrt(16));
        assertEquals(5, Partitioner.ceilSqrt(17));
    }
}
