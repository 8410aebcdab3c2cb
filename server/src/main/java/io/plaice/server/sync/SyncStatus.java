package io.plaice.server.sync;

import java.util.List;

/**
 * Read-only view of a running (or finished) synchronizer, for the admin API.
 */
public record SyncStatus(
        SyncState state,
        boolean running,
        int width,
        int height,
        long age,
        int queued,
        long cycles,
        long exportFailures,
        CycleStats lastCycle,
        String failure,
        List<WorkerStats> workers
) {}
