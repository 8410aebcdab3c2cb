package io.plaice.storage;

import io.plaice.core.CanvasView;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * PNG frames in a single directory.
 * <p>
 * Layout:
 *   frame-0001.png, frame-0002.png, ...   one per cycle, zero-padded to 4 digits
 *                                         (wider once the age passes 9999)
 *   final.png                             written on shutdown
 * <p>
 * Files are written through {@link PngCodec}, i.e. tmp file then move.
 */
public final class FileFrameStore implements FrameStore {

    public static final String FINAL_NAME = "final.png";

    private static final Pattern FRAME = Pattern.compile("frame-(\\d+)\\.png");

    private final Path dir;

    public FileFrameStore(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create frames directory " + dir, e);
        }
    }

    public Path dir() {
        return dir;
    }

    public static String frameName(long age) {
        return String.format(Locale.ROOT, "frame-%04d.png", age);
    }

    @Override
    public String writeFrame(CanvasView frame, long age) {
        if (age < 0) throw new IllegalArgumentException("age must be >= 0");
        String name = frameName(age);
        PngCodec.write(frame, dir.resolve(name));
        return name;
    }

    @Override
    public String writeFinal(CanvasView frame) {
        PngCodec.write(frame, dir.resolve(FINAL_NAME));
        return FINAL_NAME;
    }

    @Override
    public LoadedFrame loadLatest() {
        Path latest;
        try (Stream<Path> files = Files.list(dir)) {
            latest = files
                    .filter(p -> FRAME.matcher(p.getFileName().toString()).matches())
                    .max(Comparator.comparingLong(FileFrameStore::ageOf))
                    .orElse(null);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list frames in " + dir, e);
        }
        if (latest == null) {
            return null;
        }
        return new LoadedFrame(latest.getFileName().toString(), ageOf(latest), PngCodec.read(latest));
    }

    private static long ageOf(Path p) {
        Matcher m = FRAME.matcher(p.getFileName().toString());
        if (!m.matches()) {
            throw new IllegalArgumentException("not a frame file: " + p);
        }
        return Long.parseLong(m.group(1));
    }
}
