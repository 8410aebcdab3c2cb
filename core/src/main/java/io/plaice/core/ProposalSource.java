package io.plaice.core;

import java.util.List;

/**
 * Decision procedure that turns a worker's local view into color proposals.
 * <p>
 * The coordination core treats this as opaque:
 *  - it may be slow, remote, or non-deterministic,
 *  - it may legitimately return an empty list,
 *  - it may throw; callers contain the failure and keep running.
 * <p>
 * One instance is built per worker, so implementations may keep per-worker
 * state without synchronization.
 */
@FunctionalInterface
public interface ProposalSource {

    List<Proposal> propose(ProposalRequest request) throws Exception;
}
