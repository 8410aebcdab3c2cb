package io.plaice.core;

import java.util.Objects;

/**
 * One worker's suggested color for one canvas cell.
 * <p>
 * Fields:
 *  - workerId:      producer of the proposal.
 *  - x, y:          absolute target cell.
 *  - color:         proposed color.
 *  - confidence:    weight used when blending; conceptually in [0,1]. Non-positive
 *                   values are kept as-is here and floored by the merger.
 *  - canvasVersion: canvas age observed when the proposal was computed.
 * <p>
 * Proposals live for at most one aggregation cycle and are never persisted.
 */
public record Proposal(int workerId, int x, int y, Rgb color, double confidence, long canvasVersion) {

    public Proposal {
        Objects.requireNonNull(color, "color");
        if (canvasVersion < 0) {
            throw new IllegalArgumentException("canvasVersion must be >= 0");
        }
    }

    public CellPos cell() {
        return new CellPos(x, y);
    }
}
