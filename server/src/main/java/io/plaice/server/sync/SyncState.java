package io.plaice.server.sync;

/** Lifecycle of a {@link Synchronizer}; transitions only move forward. */
public enum SyncState {
    IDLE,
    PARTITIONED,
    RUNNING,
    STOPPED
}
