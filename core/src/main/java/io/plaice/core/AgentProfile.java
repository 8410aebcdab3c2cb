package io.plaice.core;

import java.util.Random;

/**
 * Per-worker personality used by the built-in proposal sources.
 *
 * @param agentId        worker id this profile belongs to.
 * @param fovRadius      half-size of the square neighborhood the agent looks at.
 * @param temperature    amount of random variation in [0,1]; 0 = conservative.
 * @param biasContrast   pull away from the local mean, in [0,1].
 * @param biasSmoothness pull toward the local mean, in [0,1].
 * @param biasEdge       preference for the local extreme colors, in [0,1].
 */
public record AgentProfile(
        int agentId,
        int fovRadius,
        double temperature,
        double biasContrast,
        double biasSmoothness,
        double biasEdge
) {

    public static final int DEFAULT_FOV_RADIUS = 3;
    public static final double DEFAULT_TEMPERATURE = 0.5;

    public AgentProfile {
        if (fovRadius < 0) throw new IllegalArgumentException("fovRadius must be >= 0");
        checkUnit("temperature", temperature);
        checkUnit("biasContrast", biasContrast);
        checkUnit("biasSmoothness", biasSmoothness);
        checkUnit("biasEdge", biasEdge);
    }

    /** Default radius and temperature, biases drawn uniformly from [0,1). */
    public static AgentProfile random(int agentId, Random rnd) {
        return new AgentProfile(
                agentId,
                DEFAULT_FOV_RADIUS,
                DEFAULT_TEMPERATURE,
                rnd.nextDouble(),
                rnd.nextDouble(),
                rnd.nextDouble()
        );
    }

    private static void checkUnit(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in [0,1], got " + v);
        }
    }
}
