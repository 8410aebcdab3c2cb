package io.plaice.core;

import java.util.List;
import java.util.Map;

/**
 * Pure function that resolves one batch of proposals into at most one color per cell.
 * <p>
 * Implementations must not depend on the order of the batch: concurrent
 * proposals for the same cell are unordered and have no notion of recency.
 */
public interface ProposalMerger {

    /**
     * @param batch all proposals drained in one cycle (may be empty).
     * @return cell -> resolved color; cells with nothing to act on are absent.
     */
    Map<CellPos, Rgb> merge(List<Proposal> batch);
}
