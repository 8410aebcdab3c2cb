package io.plaice.server.sync;

/**
 * Outcome of one completed aggregation cycle.
 *
 * @param age          canvas age reached by this cycle.
 * @param batchSize    proposals drained.
 * @param cellsWritten distinct cells written.
 * @param staleDropped proposals discarded by the staleness filter.
 * @param frameId      exported frame, or null if none was written.
 */
public record CycleStats(long age, int batchSize, int cellsWritten, int staleDropped, String frameId) {}
