package io.plaice.server.agent;

import java.util.Locale;

/** Built-in proposal sources selectable from configuration. */
public enum ProposerKind {
    /** {@link NeighborhoodProposer}: local statistics plus agent biases. */
    NEIGHBORHOOD,
    /** {@link TargetImageProposer}: converge toward a reference image. */
    TARGET;

    public static ProposerKind parse(String s) {
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown proposer '" + s + "', expected neighborhood or target", e);
        }
    }
}
