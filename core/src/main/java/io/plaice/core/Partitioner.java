package io.plaice.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a canvas into one overlapping rectangular tile per worker.
 * <p>
 * Layout:
 *  - cols = ceil(sqrt(N)), rows = ceil(N / cols).
 *  - Worker i sits at col = i mod cols, row = i div cols.
 *  - Base tile is ceil(W / cols) x ceil(H / rows).
 *  - When the last row is not full, its last worker stretches to the right
 *    canvas edge so no column of that row is left without an owner.
 *  - Every tile then grows by floor(tileW * overlap) horizontally and
 *    floor(tileH * overlap) vertically on each side, clipped to the canvas.
 *    A stretched tile grows by overlap times its own (stretched) width.
 * <p>
 * Properties:
 *  - Deterministic: same (N, W, H, overlap) gives the same tiles.
 *  - Coverage: for N >= 1 and W, H >= 1 the union of tiles is the whole canvas.
 *  - Tiles that fall outside a tiny canvas come back empty; their workers idle.
 */
public final class Partitioner {

    public static final double DEFAULT_OVERLAP_RATIO = 0.4;

    private Partitioner() {
        // utility
    }

    public static List<TileBounds> partition(int workers, int width, int height) {
        return partition(workers, width, height, DEFAULT_OVERLAP_RATIO);
    }

    public static List<TileBounds> partition(int workers, int width, int height, double overlapRatio) {
        if (workers <= 0) throw new IllegalArgumentException("workers must be > 0, got " + workers);
        if (width < 0 || height < 0) throw new IllegalArgumentException("canvas size must be >= 0");
        if (!Double.isFinite(overlapRatio) || overlapRatio < 0.0) {
            throw new IllegalArgumentException("overlapRatio must be finite and >= 0, got " + overlapRatio);
        }

        int cols = ceilSqrt(workers);
        int rows = (workers + cols - 1) / cols;

        List<TileBounds> tiles = new ArrayList<>(workers);
        if (width == 0 || height == 0) {
            for (int i = 0; i < workers; i++) {
                tiles.add(TileBounds.EMPTY);
            }
            return List.copyOf(tiles);
        }

        int tileW = Math.max(1, ceilDiv(width, cols));
        int tileH = Math.max(1, ceilDiv(height, rows));
        int overlapW = (int) Math.floor(tileW * overlapRatio);
        int overlapH = (int) Math.floor(tileH * overlapRatio);
        int lastIndex = workers - 1;

        for (int i = 0; i < workers; i++) {
            int col = i % cols;
            int row = i / cols;

            long x0 = (long) col * tileW;
            long y0 = (long) row * tileH;
            long x1 = Math.min(width, x0 + tileW);
            long y1 = Math.min(height, y0 + tileH);

            int growW = overlapW;
            // Last worker of a short last row owns the rest of that row.
            if (i == lastIndex && col < cols - 1) {
                x1 = width;
                growW = (int) Math.floor((x1 - x0) * overlapRatio);
            }

            if (x0 >= x1 || y0 >= y1) {
                tiles.add(TileBounds.EMPTY);
                continue;
            }

            tiles.add(new TileBounds(
                    (int) Math.max(0, x0 - growW),
                    (int) Math.min(width, x1 + growW),
                    (int) Math.max(0, y0 - overlapH),
                    (int) Math.min(height, y1 + overlapH)
            ));
        }
        return List.copyOf(tiles);
    }

    static int ceilSqrt(int n) {
        int c = (int) Math.sqrt(n);
        while ((long) c * c < n) {
            c++;
        }
        while (c > 1 && (long) (c - 1) * (c - 1) >= n) {
            c--;
        }
        return c;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
