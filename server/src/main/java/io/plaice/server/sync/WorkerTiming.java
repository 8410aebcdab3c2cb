package io.plaice.server.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Sleep intervals of a worker loop.
 *
 * @param idle     wait between checks when the worker's tile is empty.
 * @param throttle pause after every iteration; bounds the queue growth rate.
 * @param backoff  extra pause after the proposal source failed.
 */
public record WorkerTiming(Duration idle, Duration throttle, Duration backoff) {

    public static final WorkerTiming DEFAULTS = new WorkerTiming(
            Duration.ofMillis(10),
            Duration.ofMillis(10),
            Duration.ofMillis(500)
    );

    public WorkerTiming {
        Objects.requireNonNull(idle, "idle");
        Objects.requireNonNull(throttle, "throttle");
        Objects.requireNonNull(backoff, "backoff");
        if (idle.isNegative() || throttle.isNegative() || backoff.isNegative()) {
            throw new IllegalArgumentException("worker sleep intervals must be >= 0");
        }
    }
}
