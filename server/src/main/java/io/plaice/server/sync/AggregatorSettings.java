package io.plaice.server.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Knobs of the aggregation loop.
 *
 * @param queueWait    longest time one drain waits for proposals.
 * @param ageLimit     age at which the run stops by itself; 0 = no limit.
 * @param maxStaleness proposals computed more than this many versions ago are
 *                     discarded; negative = keep everything.
 */
public record AggregatorSettings(Duration queueWait, long ageLimit, long maxStaleness) {

    public static final AggregatorSettings DEFAULTS = new AggregatorSettings(Duration.ofSeconds(2), 0L, -1L);

    public AggregatorSettings {
        Objects.requireNonNull(queueWait, "queueWait");
        if (queueWait.isNegative()) throw new IllegalArgumentException("queueWait must be >= 0");
        if (ageLimit < 0) throw new IllegalArgumentException("ageLimit must be >= 0");
    }

    public boolean hasAgeLimit() {
        return ageLimit > 0;
    }

    public boolean filtersStale() {
        return maxStaleness >= 0;
    }
}
