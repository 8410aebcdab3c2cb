package io.plaice.core;

import java.util.Arrays;

/**
 * Immutable copy of a rectangular region of the canvas.
 * <p>
 * The view remembers where it came from (originX, originY) so callers can
 * address cells either locally (0..width, 0..height) or by absolute canvas
 * coordinates. Pixels are stored row-major in packed RGB form.
 * <p>
 * Invariants:
 *  - width, height >= 0 and pixels.length == width * height.
 *  - Defensive copies are taken on input and output.
 */
public final class CanvasView {

    private final int originX;
    private final int originY;
    private final int width;
    private final int height;
    private final int[] pixels;

    public CanvasView(int originX, int originY, int width, int height, int[] packedPixels) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("width and height must be >= 0");
        }
        if (packedPixels == null || packedPixels.length != width * height) {
            throw new IllegalArgumentException("expected " + (width * height) + " pixels");
        }
        this.originX = originX;
        this.originY = originY;
        this.width = width;
        this.height = height;
        this.pixels = Arrays.copyOf(packedPixels, packedPixels.length);
    }

    /** Empty view anchored at the given origin. */
    public static CanvasView empty(int originX, int originY) {
        return new CanvasView(originX, originY, 0, 0, new int[0]);
    }

    public int originX() { return originX; }

    public int originY() { return originY; }

    public int width() { return width; }

    public int height() { return height; }

    public boolean isEmpty() { return width == 0 || height == 0; }

    public TileBounds bounds() {
        return new TileBounds(originX, originX + width, originY, originY + height);
    }

    public Rgb rgbAt(int localX, int localY) {
        if (localX < 0 || localX >= width || localY < 0 || localY >= height) {
            throw new IndexOutOfBoundsException(
                    "(%d,%d) outside %dx%d view".formatted(localX, localY, width, height));
        }
        return Rgb.unpack(pixels[localY * width + localX]);
    }

    public Rgb rgbAtAbsolute(int x, int y) {
        return rgbAt(x - originX, y - originY);
    }

    public boolean containsAbsolute(int x, int y) {
        return bounds().contains(x, y);
    }

    /** Packed pixels, row-major (copy). */
    public int[] packedPixels() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    /**
     * Square field of view of the given radius around absolute (cx, cy),
     * clipped to this view. An out-of-view center yields a clipped or empty view.
     */
    public CanvasView window(int cx, int cy, int radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius must be >= 0");
        }
        int x0 = Math.max(originX, cx - radius);
        int y0 = Math.max(originY, cy - radius);
        int x1 = Math.min(originX + width, cx + radius + 1);
        int y1 = Math.min(originY + height, cy + radius + 1);
        if (x1 <= x0 || y1 <= y0) {
            return empty(Math.max(originX, cx), Math.max(originY, cy));
        }
        int w = x1 - x0;
        int h = y1 - y0;
        int[] out = new int[w * h];
        for (int row = 0; row < h; row++) {
            int src = (y0 - originY + row) * width + (x0 - originX);
            System.arraycopy(pixels, src, out, row * w, w);
        }
        return new CanvasView(x0, y0, w, h, out);
    }

    /** Per-channel statistics over all pixels; null for an empty view. */
    public ChannelStats stats() {
        if (isEmpty()) {
            return null;
        }
        double[] sum = new double[3];
        double[] sumSq = new double[3];
        int[] min = {255, 255, 255};
        int[] max = {0, 0, 0};
        for (int p : pixels) {
            Rgb c = Rgb.unpack(p);
            for (int ch = 0; ch < 3; ch++) {
                int v = c.channel(ch);
                sum[ch] += v;
                sumSq[ch] += (double) v * v;
                min[ch] = Math.min(min[ch], v);
                max[ch] = Math.max(max[ch], v);
            }
        }
        int n = pixels.length;
        double[] mean = new double[3];
        double[] std = new double[3];
        for (int ch = 0; ch < 3; ch++) {
            mean[ch] = sum[ch] / n;
            std[ch] = Math.sqrt(Math.max(0.0, sumSq[ch] / n - mean[ch] * mean[ch]));
        }
        return new ChannelStats(mean, std, min, max);
    }

    /**
     * Per-channel summary of a view (index 0 = red, 1 = green, 2 = blue).
     */
    public record ChannelStats(double[] mean, double[] stddev, int[] min, int[] max) {

        public ChannelStats {
            mean = mean.clone();
            stddev = stddev.clone();
            min = min.clone();
            max = max.clone();
        }

        public double mean(int ch) { return mean[ch]; }

        public double stddev(int ch) { return stddev[ch]; }

        public int min(int ch) { return min[ch]; }

        public int max(int ch) { return max[ch]; }

        /** Mean of the three channel standard deviations. */
        public double meanStddev() {
            return (stddev[0] + stddev[1] + stddev[2]) / 3.0;
        }
    }
}
