package io.plaice.server;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.plaice.server.agent.ProposerKind;
import io.plaice.server.dto.JsonRunConfig;
import io.plaice.server.sync.AggregatorSettings;
import io.plaice.server.sync.SyncOptions;
import io.plaice.server.sync.WorkerTiming;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of one run, from CLI flags and/or a JSON file.
 *
 * Covers:
 *  - canvas:      width, height, resume (seed canvas from the latest frame)
 *  - workers:     workers, overlapRatio, throttle/idle/backoff millis, seed
 *  - aggregation: queueWaitMillis, ageLimit (0 = unbounded), confidenceFloor,
 *                 maxStaleness (negative = off)
 *  - frames:      framesDir, exportEvery
 *  - proposals:   proposer (neighborhood | target), targetImage, topX
 *  - admin:       httpPort (0 = no HTTP server)
 */
public record RunConfig(
        int width,
        int height,
        int workers,
        double overlapRatio,
        long queueWaitMillis,
        long ageLimit,
        double confidenceFloor,
        long maxStaleness,
        String framesDir,
        int exportEvery,
        long throttleMillis,
        long idleMillis,
        long backoffMillis,
        Long seed,
        int httpPort,
        ProposerKind proposer,
        String targetImage,
        int topX,
        boolean resume
) {

    public RunConfig {
        if (width < 0 || height < 0) throw new IllegalArgumentException("width and height must be >= 0");
        if (workers <= 0) throw new IllegalArgumentException("workers must be > 0");
        if (!Double.isFinite(overlapRatio) || overlapRatio < 0) throw new IllegalArgumentException("overlapRatio must be >= 0");
        if (queueWaitMillis < 0) throw new IllegalArgumentException("queueWaitMillis must be >= 0");
        if (ageLimit < 0) throw new IllegalArgumentException("ageLimit must be >= 0");
        if (!(confidenceFloor > 0) || !Double.isFinite(confidenceFloor)) {
            throw new IllegalArgumentException("confidenceFloor must be > 0");
        }
        Objects.requireNonNull(framesDir, "framesDir");
        if (exportEvery <= 0) throw new IllegalArgumentException("exportEvery must be > 0");
        if (throttleMillis < 0 || idleMillis < 0 || backoffMillis < 0) {
            throw new IllegalArgumentException("sleep intervals must be >= 0");
        }
        if (httpPort < 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
        Objects.requireNonNull(proposer, "proposer");
        if (proposer == ProposerKind.TARGET && (targetImage == null || targetImage.isBlank())) {
            throw new IllegalArgumentException("proposer 'target' needs --target-image");
        }
        if (topX <= 0) throw new IllegalArgumentException("topX must be > 0");
    }

    public static RunConfig defaults() {
        return from(new JsonRunConfig());
    }

    /**
     * Parse CLI flags. If {@code --config <path>} is present the JSON file is
     * loaded first and the remaining flags override it, wherever they appear.
     *
     * Supported flags:
     *   --config, -c <path>     --width, -W <px>          --height, -H <px>
     *   --workers, -n <count>   --overlap <ratio>         --queue-wait-ms <ms>
     *   --age-limit <cycles>    --confidence-floor <w>    --max-staleness <versions>
     *   --frames, -o <dir>      --export-every <cycles>   --throttle-ms <ms>
     *   --idle-ms <ms>          --backoff-ms <ms>         --seed <long>
     *   --http-port, -p <port>  --proposer <kind>         --target-image <png>
     *   --top-x <count>         --resume                  --help, -h
     */
    public static RunConfig fromArgs(String[] args) {
        JsonRunConfig c = new JsonRunConfig();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                c = readJson(Path.of(value(args, i)));
            }
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();
                case "--config", "-c" -> i++;
                case "--width", "-W" -> c.width = parseInt(args, i++);
                case "--height", "-H" -> c.height = parseInt(args, i++);
                case "--workers", "-n" -> c.workers = parseInt(args, i++);
                case "--overlap" -> c.overlapRatio = parseDouble(args, i++);
                case "--queue-wait-ms" -> c.queueWaitMillis = parseLong(args, i++);
                case "--age-limit" -> c.ageLimit = parseLong(args, i++);
                case "--confidence-floor" -> c.confidenceFloor = parseDouble(args, i++);
                case "--max-staleness" -> c.maxStaleness = parseLong(args, i++);
                case "--frames", "-o" -> c.framesDir = value(args, i++);
                case "--export-every" -> c.exportEvery = parseInt(args, i++);
                case "--throttle-ms" -> c.throttleMillis = parseLong(args, i++);
                case "--idle-ms" -> c.idleMillis = parseLong(args, i++);
                case "--backoff-ms" -> c.backoffMillis = parseLong(args, i++);
                case "--seed" -> c.seed = parseLong(args, i++);
                case "--http-port", "-p" -> c.httpPort = parseInt(args, i++);
                case "--proposer" -> c.proposer = value(args, i++);
                case "--target-image" -> c.targetImage = value(args, i++);
                case "--top-x" -> c.topX = parseInt(args, i++);
                case "--resume" -> c.resume = true;
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return from(c);
    }

    public static RunConfig fromJsonFile(Path path) {
        return from(readJson(path));
    }

    public static RunConfig from(JsonRunConfig c) {
        return new RunConfig(
                c.width,
                c.height,
                c.workers,
                c.overlapRatio,
                c.queueWaitMillis,
                c.ageLimit,
                c.confidenceFloor,
                c.maxStaleness,
                c.framesDir,
                c.exportEvery,
                c.throttleMillis,
                c.idleMillis,
                c.backoffMillis,
                c.seed,
                c.httpPort,
                ProposerKind.parse(Objects.requireNonNull(c.proposer, "proposer")),
                c.targetImage,
                c.topX,
                c.resume
        );
    }

    public Path framesPath() {
        return Path.of(framesDir);
    }

    public SyncOptions toSyncOptions() {
        return new SyncOptions(
                overlapRatio,
                confidenceFloor,
                new AggregatorSettings(Duration.ofMillis(queueWaitMillis), ageLimit, maxStaleness),
                new WorkerTiming(Duration.ofMillis(idleMillis), Duration.ofMillis(throttleMillis), Duration.ofMillis(backoffMillis)),
                exportEvery,
                seed
        );
    }

    // ---------- parsing helpers ----------

    private static JsonRunConfig readJson(Path path) {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            return mapper.readValue(path.toFile(), JsonRunConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load RunConfig from " + path, e);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String[] args, int i) {
        String v = value(args, i);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v, e);
        }
    }

    private static long parseLong(String[] args, int i) {
        String v = value(args, i);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v, e);
        }
    }

    private static double parseDouble(String[] args, int i) {
        String v = value(args, i);
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + args[i] + ": " + v, e);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: plaice [options]

            Options:
              --config,   -c   JSON config file; other flags override it
              --width,    -W   Canvas width in pixels (default: 224)
              --height,   -H   Canvas height in pixels (default: 224)
              --workers,  -n   Number of workers (default: 16)
              --overlap        Tile overlap ratio per side (default: 0.4)
              --queue-wait-ms  Longest wait for proposals per cycle (default: 2000)
              --age-limit      Stop after this many cycles, 0 = never (default: 500)
              --confidence-floor  Weight for non-positive confidences (default: 0.01)
              --max-staleness  Drop proposals older than N versions, <0 = off (default: -1)
              --frames,   -o   Frames directory (default: ./frames)
              --export-every   Export a frame every N cycles (default: 1)
              --throttle-ms    Worker pause per iteration (default: 10)
              --idle-ms        Worker pause when its tile is empty (default: 10)
              --backoff-ms     Worker pause after a proposal error (default: 500)
              --seed           Seed for reproducible sampling (optional)
              --http-port, -p  Admin HTTP port, 0 = disabled (default: 0)
              --proposer       neighborhood | target (default: neighborhood)
              --target-image   Reference PNG for the target proposer
              --top-x          Cells proposed per call by the target proposer (default: 10)
              --resume         Continue from the latest frame in the frames directory
              --help,     -h   Show this help message
            """);
        System.exit(0);
    }
}
