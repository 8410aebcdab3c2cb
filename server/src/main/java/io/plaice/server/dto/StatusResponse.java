package io.plaice.server.dto;

import java.util.List;

/**
 * JSON response for GET /status.
 * Example shape:
 * {
 *   "state": "RUNNING",
 *   "running": true,
 *   "width": 224, "height": 224,
 *   "age": 42,
 *   "queued": 17,
 *   "cycles": 42,
 *   "exportFailures": 0,
 *   "lastCycle": { "age": 42, "batchSize": 120, "cellsWritten": 97, "staleDropped": 0, "frameId": "frame-0042.png" },
 *   "failure": null,
 *   "workers": [ { "workerId": 0, "tile": [0, 84, 0, 84], "iterations": 311, ... }, ... ]
 * }
 */
public class StatusResponse {

    public String state;
    public boolean running;
    public int width;
    public int height;
    public long age;
    public int queued;
    public long cycles;
    public long exportFailures;
    public CycleRecord lastCycle;
    public String failure;
    public List<WorkerRecord> workers;

    public static class CycleRecord {
        public long age;
        public int batchSize;
        public int cellsWritten;
        public int staleDropped;
        public String frameId;
    }

    public static class WorkerRecord {
        public int workerId;
        /** x0, x1, y0, y1 (half-open). */
        public int[] tile;
        public long iterations;
        public long proposalsOffered;
        public long proposalsDropped;
        public long emptyResults;
        public long errors;
    }
}
