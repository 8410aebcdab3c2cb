package io.plaice.storage;

import io.plaice.core.CanvasView;
import io.plaice.core.Rgb;
import io.plaice.core.TileBounds;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared pixel grid plus a monotonic version counter ("age").
 * <p>
 * Concurrency:
 *  - Each cell is one packed RGB int in an AtomicIntegerArray, so a reader
 *    never observes a half-written color.
 *  - Reads of a rectangle are not snapshot-consistent across cells; a read
 *    racing with the aggregator may mix colors from two cycles.
 *  - Only the aggregator thread writes cells and advances the age.
 * <p>
 * Coordinates: x in [0,width), y in [0,height), row-major storage.
 */
public final class Canvas {

    private final int width;
    private final int height;
    private final AtomicIntegerArray cells;
    private final AtomicLong age;

    public Canvas(int width, int height) {
        this(width, height, 0L);
    }

    private Canvas(int width, int height, long initialAge) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("canvas size must be >= 0, got " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("canvas too large: " + width + "x" + height);
        }
        if (initialAge < 0) {
            throw new IllegalArgumentException("age must be >= 0");
        }
        this.width = width;
        this.height = height;
        this.cells = new AtomicIntegerArray(width * height);
        this.age = new AtomicLong(initialAge);
    }

    /**
     * Seed a canvas from a previously exported frame. The view's origin is
     * ignored; its size becomes the canvas size.
     */
    public static Canvas restore(CanvasView frame, long age) {
        Objects.requireNonNull(frame, "frame");
        Canvas c = new Canvas(frame.width(), frame.height(), age);
        int[] px = frame.packedPixels();
        for (int i = 0; i < px.length; i++) {
            c.cells.set(i, px[i]);
        }
        return c;
    }

    public int width() { return width; }

    public int height() { return height; }

    public TileBounds bounds() {
        return new TileBounds(0, width, 0, height);
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Copy of the sub-rectangle starting at (x0, y0) of size w x h, clipped
     * to the canvas. Parts outside the canvas are dropped; a rectangle fully
     * outside gives an empty view. Never throws for bad rectangles.
     */
    public CanvasView read(int x0, int y0, int w, int h) {
        long cx0 = Math.max(0L, x0);
        long cy0 = Math.max(0L, y0);
        long cx1 = Math.min(width, (long) x0 + Math.max(0, w));
        long cy1 = Math.min(height, (long) y0 + Math.max(0, h));
        if (cx1 <= cx0 || cy1 <= cy0) {
            return CanvasView.empty((int) Math.min(cx0, width), (int) Math.min(cy0, height));
        }
        int rw = (int) (cx1 - cx0);
        int rh = (int) (cy1 - cy0);
        int[] out = new int[rw * rh];
        for (int row = 0; row < rh; row++) {
            int base = (int) ((cy0 + row) * width + cx0);
            for (int col = 0; col < rw; col++) {
                out[row * rw + col] = cells.get(base + col);
            }
        }
        return new CanvasView((int) cx0, (int) cy0, rw, rh, out);
    }

    /** Read restricted to a tile. */
    public CanvasView read(TileBounds tile) {
        return read(tile.x0(), tile.y0(), tile.width(), tile.height());
    }

    /** Copy of the whole canvas. */
    public CanvasView snapshot() {
        return read(0, 0, width, height);
    }

    public Rgb get(int x, int y) {
        checkBounds(x, y);
        return Rgb.unpack(cells.get(y * width + x));
    }

    /**
     * Set one cell.
     *
     * @throws IndexOutOfBoundsException if (x, y) is outside the canvas; never clamps.
     */
    public void write(int x, int y, Rgb color) {
        Objects.requireNonNull(color, "color");
        checkBounds(x, y);
        cells.set(y * width + x, color.pack());
    }

    public long age() {
        return age.get();
    }

    /** Advance the version counter by one and return the new age. */
    public long incrementAge() {
        return age.incrementAndGet();
    }

    /**
     * Write the full grid as a PNG file.
     *
     * @throws UncheckedIOException if the image cannot be written; the grid is unaffected.
     */
    public void export(Path path) {
        PngCodec.write(snapshot(), path);
    }

    private void checkBounds(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException(
                    "cell (%d,%d) outside canvas %dx%d".formatted(x, y, width, height));
        }
    }
}
