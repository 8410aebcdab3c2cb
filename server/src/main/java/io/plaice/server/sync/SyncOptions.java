package io.plaice.server.sync;

import io.plaice.core.Partitioner;
import io.plaice.core.WeightedAverageMerger;

import java.util.Objects;

/**
 * Everything a {@link Synchronizer} needs besides the canvas and the proposal sources.
 *
 * @param overlapRatio    tile growth per side, as a fraction of the base tile size.
 * @param confidenceFloor weight substituted for non-positive confidences.
 * @param aggregator      drain wait, age limit, staleness bound.
 * @param timing          worker sleep intervals.
 * @param exportEvery     export a frame every N cycles.
 * @param seed            base seed for worker target sampling; null = unseeded.
 */
public record SyncOptions(
        double overlapRatio,
        double confidenceFloor,
        AggregatorSettings aggregator,
        WorkerTiming timing,
        int exportEvery,
        Long seed
) {

    public SyncOptions {
        Objects.requireNonNull(aggregator, "aggregator");
        Objects.requireNonNull(timing, "timing");
        if (exportEvery <= 0) throw new IllegalArgumentException("exportEvery must be > 0");
    }

    public static SyncOptions defaults() {
        return new SyncOptions(
                Partitioner.DEFAULT_OVERLAP_RATIO,
                WeightedAverageMerger.DEFAULT_CONFIDENCE_FLOOR,
                AggregatorSettings.DEFAULTS,
                WorkerTiming.DEFAULTS,
                1,
                null
        );
    }

    public SyncOptions withAggregator(AggregatorSettings a) {
        return new SyncOptions(overlapRatio, confidenceFloor, a, timing, exportEvery, seed);
    }

    public SyncOptions withTiming(WorkerTiming t) {
        return new SyncOptions(overlapRatio, confidenceFloor, aggregator, t, exportEvery, seed);
    }

    public SyncOptions withOverlapRatio(double ratio) {
        return new SyncOptions(ratio, confidenceFloor, aggregator, timing, exportEvery, seed);
    }

    public SyncOptions withSeed(Long s) {
        return new SyncOptions(overlapRatio, confidenceFloor, aggregator, timing, exportEvery, s);
    }
}
