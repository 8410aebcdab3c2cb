package io.plaice.storage;

/**
 * Frame export policy: export after every N completed cycles.
 * <p>
 * N = 1 exports every cycle. Decisions depend only on the age, so the policy
 * is stateless and safe to share.
 */
public final class ExportPolicy {

    public static final ExportPolicy EVERY_CYCLE = new ExportPolicy(1);

    private final int everyCycles;

    public ExportPolicy(int everyCycles) {
        if (everyCycles <= 0) throw new IllegalArgumentException("everyCycles must be > 0");
        this.everyCycles = everyCycles;
    }

    public int everyCycles() {
        return everyCycles;
    }

    /** Call with the age just reached. */
    public boolean shouldExport(long age) {
        return age > 0 && age % everyCycles == 0;
    }
}
