package io.plaice.server.agent;

import io.plaice.core.CanvasView;
import io.plaice.core.Proposal;
import io.plaice.core.ProposalRequest;
import io.plaice.core.ProposalSource;
import io.plaice.core.Rgb;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Proposal source that steers the canvas toward a reference image.
 * <p>
 * Per call it compares the worker's tile with the same region of the
 * reference, keeps the topX cells with the largest color distance, and
 * proposes the reference color for each of them. Confidence is the distance
 * normalized to [0,1], so badly wrong cells win conflicts against nearly
 * right ones. Cells outside the reference image are ignored.
 */
public final class TargetImageProposer implements ProposalSource {

    private static final double MAX_DISTANCE = Math.sqrt(3.0) * 255.0;

    private final CanvasView reference;
    private final int topX;

    public TargetImageProposer(CanvasView reference, int topX) {
        this.reference = Objects.requireNonNull(reference, "reference");
        if (topX <= 0) throw new IllegalArgumentException("topX must be > 0");
        this.topX = topX;
    }

    @Override
    public List<Proposal> propose(ProposalRequest request) {
        CanvasView view = request.view();
        // min-heap on distance so the smallest of the kept cells is evicted first
        PriorityQueue<Candidate> best = new PriorityQueue<>(Comparator.comparingDouble(Candidate::distance));

        for (int ly = 0; ly < view.height(); ly++) {
            for (int lx = 0; lx < view.width(); lx++) {
                int x = view.originX() + lx;
                int y = view.originY() + ly;
                if (!reference.containsAbsolute(x, y)) {
                    continue;
                }
                Rgb want = reference.rgbAtAbsolute(x, y);
                double d = distance(view.rgbAt(lx, ly), want);
                if (d == 0.0) {
                    continue;
                }
                if (best.size() < topX) {
                    best.add(new Candidate(x, y, want, d));
                } else if (d > best.peek().distance()) {
                    best.poll();
                    best.add(new Candidate(x, y, want, d));
                }
            }
        }

        List<Proposal> out = new ArrayList<>(best.size());
        for (Candidate c : best) {
            out.add(new Proposal(request.workerId(), c.x(), c.y(), c.color(), c.distance() / MAX_DISTANCE, request.version()));
        }
        return out;
    }

    static double distance(Rgb a, Rgb b) {
        double dr = a.r() - b.r();
        double dg = a.g() - b.g();
        double db = a.b() - b.b();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    private record Candidate(int x, int y, Rgb color, double distance) {}
}
