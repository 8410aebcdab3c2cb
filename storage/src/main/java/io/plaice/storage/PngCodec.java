package io.plaice.storage;

import io.plaice.core.CanvasView;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * PNG encoding for canvas views.
 * <p>
 * Atomicity:
 *   - We write to "<name>.tmp" first,
 *   - then move over the destination, atomically where the file system allows.
 */
public final class PngCodec {

    private PngCodec() {
        // utility
    }

    public static void write(CanvasView view, Path path) {
        if (view.isEmpty()) {
            throw new IllegalArgumentException("cannot encode an empty view as PNG");
        }
        BufferedImage img = new BufferedImage(view.width(), view.height(), BufferedImage.TYPE_INT_RGB);
        img.setRGB(0, 0, view.width(), view.height(), view.packedPixels(), 0, view.width());

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (var out = Files.newOutputStream(tmp)) {
                if (!ImageIO.write(img, "png", out)) {
                    throw new IOException("no PNG writer available");
                }
            }
            moveIntoPlace(tmp, path);
        } catch (IOException e) {
            deleteAfterFailure(tmp, e);
            throw new UncheckedIOException("failed to write frame " + path, e);
        }
    }

    public static CanvasView read(Path path) {
        try {
            BufferedImage img = ImageIO.read(path.toFile());
            if (img == null) {
                throw new IOException("not a readable image: " + path);
            }
            int w = img.getWidth();
            int h = img.getHeight();
            int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
            for (int i = 0; i < argb.length; i++) {
                argb[i] &= 0xFFFFFF;
            }
            return new CanvasView(0, 0, w, h, argb);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read frame " + path, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path dst) throws IOException {
        try {
            Files.move(tmp, dst, ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, dst, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteAfterFailure(Path p, IOException cause) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }
}
