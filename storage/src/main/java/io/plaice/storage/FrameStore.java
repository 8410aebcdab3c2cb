package io.plaice.storage;

import io.plaice.core.CanvasView;

/**
 * Durable sink for canvas frames.
 * <p>
 * One frame is written per completed aggregation cycle, tagged with the age
 * the canvas reached in that cycle. On restart the latest frame can seed a
 * new canvas so a run picks up where it left off.
 */
public interface FrameStore {

    /**
     * Persist a full copy of the canvas for the given age.
     *
     * @return frame identifier (e.g., file name).
     */
    String writeFrame(CanvasView frame, long age);

    /** Persist the frame written when the run is shut down. */
    String writeFinal(CanvasView frame);

    /** Load the highest-age frame if present; null otherwise. */
    LoadedFrame loadLatest();

    /** Simple holder for frame id, age and pixels. */
    record LoadedFrame(String id, long age, CanvasView frame) {}
}
