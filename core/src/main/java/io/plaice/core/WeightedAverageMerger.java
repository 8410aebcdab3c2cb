package io.plaice.core;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Confidence-weighted blend of all proposals that target the same cell.
 * <p>
 * Algorithm, per cell with entries {(rgb_k, c_k)}:
 *  - c_k <= 0 or non-finite is replaced by the confidence floor.
 *  - channel = round(sum(channel_k * c_k) / sum(c_k)), rounding half up,
 *    clamped to [0,255].
 *  - A cell whose total weight is 0 is skipped.
 * <p>
 * With equal confidences the result is the plain arithmetic mean of the
 * proposed colors. A single proposal reproduces its own color exactly.
 */
public final class WeightedAverageMerger implements ProposalMerger {

    public static final double DEFAULT_CONFIDENCE_FLOOR = 0.01;

    private final double confidenceFloor;

    public WeightedAverageMerger() {
        this(DEFAULT_CONFIDENCE_FLOOR);
    }

    public WeightedAverageMerger(double confidenceFloor) {
        if (!(confidenceFloor > 0.0) || !Double.isFinite(confidenceFloor)) {
            throw new IllegalArgumentException("confidenceFloor must be finite and > 0, got " + confidenceFloor);
        }
        this.confidenceFloor = confidenceFloor;
    }

    public double confidenceFloor() {
        return confidenceFloor;
    }

    /** Weight actually used for a raw confidence value. */
    public double effectiveWeight(double confidence) {
        return (confidence > 0.0 && Double.isFinite(confidence)) ? confidence : confidenceFloor;
    }

    @Override
    public Map<CellPos, Rgb> merge(List<Proposal> batch) {
        if (batch == null || batch.isEmpty()) {
            return Map.of();
        }

        Map<CellPos, Accumulator> byCell = new HashMap<>();
        for (Proposal p : batch) {
            byCell.computeIfAbsent(p.cell(), c -> new Accumulator())
                    .add(p.color(), effectiveWeight(p.confidence()));
        }

        Map<CellPos, Rgb> out = new LinkedHashMap<>(byCell.size() * 2);
        for (Map.Entry<CellPos, Accumulator> e : byCell.entrySet()) {
            Rgb blended = e.getValue().result();
            if (blended != null) {
                out.put(e.getKey(), blended);
            }
        }
        return out;
    }

    private static final class Accumulator {
        private double r;
        private double g;
        private double b;
        private double weight;

        void add(Rgb c, double w) {
            r += c.r() * w;
            g += c.g() * w;
            b += c.b() * w;
            weight += w;
        }

        Rgb result() {
            if (weight == 0.0) {
                return null;
            }
            return Rgb.clamped(Math.round(r / weight), Math.round(g / weight), Math.round(b / weight));
        }
    }
}
