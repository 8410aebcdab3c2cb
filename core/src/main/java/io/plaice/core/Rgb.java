package io.plaice.core;

/**
 * Immutable 8-bit RGB color.
 * <p>
 * Packed form (used by the canvas for per-cell atomic storage):
 *   bits 16..23 = red, 8..15 = green, 0..7 = blue.
 */
public record Rgb(int r, int g, int b) {

    public static final Rgb BLACK = new Rgb(0, 0, 0);

    public Rgb {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    /** Build a color, clamping each channel into [0,255]. */
    public static Rgb clamped(long r, long g, long b) {
        return new Rgb(clamp(r), clamp(g), clamp(b));
    }

    public static Rgb unpack(int packed) {
        return new Rgb((packed >>> 16) & 0xFF, (packed >>> 8) & 0xFF, packed & 0xFF);
    }

    public int pack() {
        return (r << 16) | (g << 8) | b;
    }

    public int channel(int index) {
        return switch (index) {
            case 0 -> r;
            case 1 -> g;
            case 2 -> b;
            default -> throw new IllegalArgumentException("channel index must be 0..2, got " + index);
        };
    }

    private static int clamp(long v) {
        return (int) Math.max(0L, Math.min(255L, v));
    }

    private static void checkChannel(String name, int v) {
        if (v < 0 || v > 255) {
            throw new IllegalArgumentException(name + " must be in [0,255], got " + v);
        }
    }
}
