package io.plaice.server.agent;

import io.plaice.core.AgentProfile;
import io.plaice.core.CanvasView;
import io.plaice.core.ProposalSource;
import io.plaice.server.RunConfig;
import io.plaice.storage.PngCodec;

import java.nio.file.Path;
import java.util.Random;
import java.util.function.IntFunction;

/**
 * Builds one proposal source per worker from the run configuration.
 */
public final class ProposalSources {

    private ProposalSources() {
        // utility
    }

    public static IntFunction<ProposalSource> forConfig(RunConfig cfg) {
        return switch (cfg.proposer()) {
            case NEIGHBORHOOD -> neighborhood(cfg.seed());
            case TARGET -> target(PngCodec.read(Path.of(cfg.targetImage())), cfg.topX());
        };
    }

    /**
     * Neighborhood agents with randomized profiles. With a seed, profile i and
     * its noise stream are reproducible.
     */
    public static IntFunction<ProposalSource> neighborhood(Long seed) {
        return workerId -> {
            Random rnd = seed == null ? new Random() : new Random(seed ^ (0x9E3779B97F4A7C15L * (workerId + 1)));
            return new NeighborhoodProposer(AgentProfile.random(workerId, rnd), rnd);
        };
    }

    /** All workers share one immutable reference image. */
    public static IntFunction<ProposalSource> target(CanvasView reference, int topX) {
        return workerId -> new TargetImageProposer(reference, topX);
    }
}
