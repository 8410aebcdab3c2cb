package io.plaice.server.sync;

import io.plaice.core.TileBounds;

/**
 * Point-in-time counters of one worker loop.
 */
public record WorkerStats(
        int workerId,
        TileBounds tile,
        long iterations,
        long proposalsOffered,
        long proposalsDropped,
        long emptyResults,
        long errors
) {}
