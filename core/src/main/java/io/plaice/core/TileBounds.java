package io.plaice.core;

/**
 * Axis-aligned half-open rectangle [x0,x1) x [y0,y1) assigned to one worker.
 * A tile with x1 <= x0 or y1 <= y0 has zero area; its worker idles.
 */
public record TileBounds(int x0, int x1, int y0, int y1) {

    public static final TileBounds EMPTY = new TileBounds(0, 0, 0, 0);

    public int width() {
        return Math.max(0, x1 - x0);
    }

    public int height() {
        return Math.max(0, y1 - y0);
    }

    public long area() {
        return (long) width() * height();
    }

    public boolean isEmpty() {
        return width() == 0 || height() == 0;
    }

    public boolean contains(int x, int y) {
        return x >= x0 && x < x1 && y >= y0 && y < y1;
    }
}
