package io.plaice.core;

import java.util.Objects;

/**
 * Input handed to a {@link ProposalSource} for one worker iteration.
 *
 * @param workerId id of the calling worker (to stamp on proposals).
 * @param view     copy of the worker's tile; {@code view.originX/originY} is the tile origin.
 * @param target   cell the worker sampled inside its tile this iteration.
 * @param version  canvas age read together with the view.
 */
public record ProposalRequest(int workerId, CanvasView view, CellPos target, long version) {

    public ProposalRequest {
        Objects.requireNonNull(view, "view");
        Objects.requireNonNull(target, "target");
    }

    public CellPos origin() {
        return new CellPos(view.originX(), view.originY());
    }

    /** Convenience for sources that produce a single proposal for the target cell. */
    public Proposal proposeTarget(Rgb color, double confidence) {
        return new Proposal(workerId, target.x(), target.y(), color, confidence, version);
    }
}
