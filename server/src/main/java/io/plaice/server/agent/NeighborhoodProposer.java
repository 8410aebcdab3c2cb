package io.plaice.server.agent;

import io.plaice.core.AgentProfile;
import io.plaice.core.CanvasView;
import io.plaice.core.CellPos;
import io.plaice.core.Proposal;
import io.plaice.core.ProposalRequest;
import io.plaice.core.ProposalSource;
import io.plaice.core.Rgb;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Local, model-free proposal source driven by an {@link AgentProfile}.
 * <p>
 * For the sampled target cell it looks at the square field of view around it
 * and blends three candidate colors per channel:
 *  - smoothness: the local mean,
 *  - contrast:   the mean pushed away from mid-gray,
 *  - edge:       the local extreme on the side the target already leans to,
 * weighted by the profile's biases, then adds Gaussian noise scaled by the
 * temperature. Confidence is high in uniform neighborhoods and low in busy
 * ones, and lower for hot (high temperature) agents.
 */
public final class NeighborhoodProposer implements ProposalSource {

    static final double NOISE_SCALE = 32.0;
    static final double SPREAD_SCALE = 32.0;

    private final AgentProfile profile;
    private final Random random;

    public NeighborhoodProposer(AgentProfile profile, Random random) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.random = Objects.requireNonNull(random, "random");
    }

    public AgentProfile profile() {
        return profile;
    }

    @Override
    public List<Proposal> propose(ProposalRequest request) {
        CellPos target = request.target();
        CanvasView view = request.view();
        if (!view.containsAbsolute(target.x(), target.y())) {
            return List.of();
        }
        CanvasView fov = view.window(target.x(), target.y(), profile.fovRadius());
        CanvasView.ChannelStats stats = fov.stats();
        if (stats == null) {
            return List.of();
        }
        Rgb current = view.rgbAtAbsolute(target.x(), target.y());

        double ws = profile.biasSmoothness();
        double wc = profile.biasContrast();
        double we = profile.biasEdge();
        double total = ws + wc + we;

        long[] out = new long[3];
        for (int ch = 0; ch < 3; ch++) {
            double mean = stats.mean(ch);
            double value;
            if (total <= 0.0) {
                value = mean;
            } else {
                double contrast = mean + (mean - 127.5) * 0.5;
                double edge = current.channel(ch) >= mean ? stats.max(ch) : stats.min(ch);
                value = (ws * mean + wc * contrast + we * edge) / total;
            }
            value += random.nextGaussian() * profile.temperature() * NOISE_SCALE;
            out[ch] = Math.round(value);
        }

        double uniformity = 1.0 / (1.0 + stats.meanStddev() / SPREAD_SCALE);
        double confidence = uniformity * (1.0 - 0.5 * profile.temperature());

        return List.of(request.proposeTarget(Rgb.clamped(out[0], out[1], out[2]), confidence));
    }
}
