package io.plaice.bench;

import io.plaice.core.Proposal;
import io.plaice.core.ProposalRequest;
import io.plaice.core.ProposalSource;
import io.plaice.core.Rgb;
import io.plaice.core.TileBounds;
import io.plaice.server.sync.AggregatorSettings;
import io.plaice.server.sync.CycleStats;
import io.plaice.server.sync.SyncOptions;
import io.plaice.server.sync.Synchronizer;
import io.plaice.server.sync.WorkerStats;
import io.plaice.server.sync.WorkerTiming;
import io.plaice.storage.Canvas;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * In-process throughput benchmark of the coordination core.
 *
 * Runs a Synchronizer with a synthetic proposal source (random colors on
 * random cells of each worker's tile, no I/O) and no frame export, then
 * reports cycles/s, proposals/s and batch-size percentiles.
 *
 * Usage:
 *   java -cp bench.jar io.plaice.bench.SyncBench \
 *     --workers 16 \
 *     --width 224 --height 224 \
 *     --duration-seconds 10 \
 *     --proposals-per-call 4 \
 *     --throttle-ms 0 \
 *     --queue-wait-ms 5
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with one row per observed cycle:
 *       age,batch_size,cells_written
 */
public final class SyncBench {

    private SyncBench() {
        // no-op
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        int workers = Integer.parseInt(cfg.getOrDefault("workers", "16"));
        int width = Integer.parseInt(cfg.getOrDefault("width", "224"));
        int height = Integer.parseInt(cfg.getOrDefault("height", "224"));
        int durationSeconds = Integer.parseInt(cfg.getOrDefault("duration-seconds", "10"));
        int perCall = Integer.parseInt(cfg.getOrDefault("proposals-per-call", "4"));
        long throttleMs = Long.parseLong(cfg.getOrDefault("throttle-ms", "0"));
        long queueWaitMs = Long.parseLong(cfg.getOrDefault("queue-wait-ms", "5"));

        if (perCall <= 0) {
            throw new IllegalArgumentException("proposals-per-call must be > 0");
        }
        runBenchmark(workers, width, height, durationSeconds, perCall, throttleMs, queueWaitMs);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void runBenchmark(
            int workers,
            int width,
            int height,
            int durationSeconds,
            int perCall,
            long throttleMs,
            long queueWaitMs
    ) throws InterruptedException {

        SyncOptions opts = SyncOptions.defaults()
                .withAggregator(new AggregatorSettings(Duration.ofMillis(queueWaitMs), 0, -1))
                .withTiming(new WorkerTiming(Duration.ofMillis(1), Duration.ofMillis(throttleMs), Duration.ofMillis(10)));

        var sync = new Synchronizer(new Canvas(width, height), workers, id -> syntheticSource(perCall), opts, null);

        // Polling only sees the latest cycle; with a short queue wait some cycles are skipped.
        List<CycleStats> observed = new ArrayList<>();
        long lastSeenAge = -1;

        long start = System.nanoTime();
        long end = start + TimeUnit.SECONDS.toNanos(durationSeconds);
        sync.startRun();
        while (System.nanoTime() < end) {
            CycleStats c = sync.lastCycle();
            if (c != null && c.age() != lastSeenAge) {
                observed.add(c);
                lastSeenAge = c.age();
            }
            Thread.sleep(1);
        }
        sync.stop();
        double elapsedSec = (System.nanoTime() - start) / 1e9;

        long offered = 0;
        long iterations = 0;
        for (WorkerStats w : sync.workerStats()) {
            offered += w.proposalsOffered();
            iterations += w.iterations();
        }

        summarizeAndPrint(observed, sync.canvas().age(), offered, iterations, elapsedSec);
    }

    private static ProposalSource syntheticSource(int perCall) {
        return (ProposalRequest req) -> {
            ThreadLocalRandom rnd = ThreadLocalRandom.current();
            TileBounds t = req.view().bounds();
            List<Proposal> out = new ArrayList<>(perCall);
            for (int i = 0; i < perCall; i++) {
                out.add(new Proposal(
                        req.workerId(),
                        t.x0() + rnd.nextInt(t.width()),
                        t.y0() + rnd.nextInt(t.height()),
                        new Rgb(rnd.nextInt(256), rnd.nextInt(256), rnd.nextInt(256)),
                        rnd.nextDouble(),
                        req.version()
                ));
            }
            return out;
        };
    }

    private static void summarizeAndPrint(
            List<CycleStats> observed,
            long cycles,
            long offered,
            long iterations,
            double elapsedSec
    ) {
        List<Double> batches = new ArrayList<>(observed.size());
        for (CycleStats c : observed) {
            batches.add((double) c.batchSize());
        }
        Collections.sort(batches);

        System.err.printf(
                "cycles=%d (%.2f/s), proposals=%d (%.2f/s), iterations=%d, batch p50=%.1f p95=%.1f p99=%.1f (%d cycles sampled)%n",
                cycles, cycles / elapsedSec,
                offered, offered / elapsedSec,
                iterations,
                percentile(batches, 0.50), percentile(batches, 0.95), percentile(batches, 0.99),
                observed.size()
        );

        System.out.println("age,batch_size,cells_written");
        for (CycleStats c : observed) {
            System.out.printf("%d,%d,%d%n", c.age(), c.batchSize(), c.cellsWritten());
        }
    }

    private static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
