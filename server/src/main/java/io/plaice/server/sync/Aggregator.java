package io.plaice.server.sync;

import io.plaice.core.CellPos;
import io.plaice.core.Proposal;
import io.plaice.core.ProposalMerger;
import io.plaice.core.Rgb;
import io.plaice.storage.Canvas;
import io.plaice.storage.ExportPolicy;
import io.plaice.storage.FrameStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single consumer that turns proposal batches into canvas versions.
 * <p>
 * One loop iteration is one cycle:
 *  1) stop if the flag is cleared or the age limit is reached,
 *  2) drain a batch (bounded wait); an empty batch is a no-op,
 *  3) drop stale proposals if a staleness bound is configured,
 *  4) merge per cell (confidence-weighted, never last-write-wins),
 *  5) write the merged cells,
 *  6) advance the age by exactly one,
 *  7) export a frame; an export failure is logged and the cycle still counts.
 * <p>
 * On exit the aggregator clears the running flag and joins every worker
 * thread, so once this thread has terminated no worker is left running.
 * A canvas bounds violation is fatal and is kept as {@link #failure()}.
 */
public final class Aggregator implements Runnable {

    private static final Logger log = Logger.getLogger(Aggregator.class.getName());

    private final Canvas canvas;
    private final ProposalQueue queue;
    private final ProposalMerger merger;
    private final AtomicBoolean running;
    private final AggregatorSettings settings;
    private final FrameStore frames;      // may be null: no export
    private final ExportPolicy exportPolicy;
    private final List<Thread> workers;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong exportFailures = new AtomicLong();
    private volatile CycleStats lastCycle;
    private volatile Throwable failure;

    public Aggregator(
            Canvas canvas,
            ProposalQueue queue,
            ProposalMerger merger,
            AtomicBoolean running,
            AggregatorSettings settings,
            FrameStore frames,
            ExportPolicy exportPolicy,
            List<Thread> workers
    ) {
        this.canvas = Objects.requireNonNull(canvas, "canvas");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.running = Objects.requireNonNull(running, "running");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.frames = frames;
        this.exportPolicy = Objects.requireNonNull(exportPolicy, "exportPolicy");
        this.workers = List.copyOf(workers);
    }

    @Override
    public void run() {
        log.info(() -> "aggregator started at age " + canvas.age());
        try {
            while (running.get()) {
                if (ageLimitReached()) {
                    log.info(() -> "age limit " + settings.ageLimit() + " reached, stopping");
                    break;
                }
                runCycle();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("aggregator interrupted, stopping");
        } catch (RuntimeException e) {
            failure = e;
            log.log(Level.SEVERE, "aggregator failed at age " + canvas.age(), e);
        } finally {
            running.set(false);
            joinWorkers();
            log.info(() -> "aggregator stopped at age " + canvas.age() + " after " + cycles.get() + " cycles");
        }
    }

    /**
     * Drain once and apply the batch.
     *
     * @return stats of the completed cycle, or null when nothing was applied.
     */
    public CycleStats runCycle() throws InterruptedException {
        List<Proposal> batch = queue.drain(settings.queueWait());
        if (batch.isEmpty()) {
            return null;
        }
        if (!running.get()) {
            log.fine(() -> "discarding " + batch.size() + " proposals drained after stop");
            return null;
        }

        long currentAge = canvas.age();
        List<Proposal> usable = batch;
        int stale = 0;
        if (settings.filtersStale()) {
            usable = new ArrayList<>(batch.size());
            for (Proposal p : batch) {
                if (currentAge - p.canvasVersion() > settings.maxStaleness()) {
                    stale++;
                } else {
                    usable.add(p);
                }
            }
        }

        Map<CellPos, Rgb> merged = merger.merge(usable);
        // A batch is applied whole or not at all.
        for (CellPos cell : merged.keySet()) {
            if (!canvas.inBounds(cell.x(), cell.y())) {
                throw new IndexOutOfBoundsException(
                        "merged cell (%d,%d) outside %dx%d canvas".formatted(cell.x(), cell.y(), canvas.width(), canvas.height()));
            }
        }
        for (Map.Entry<CellPos, Rgb> e : merged.entrySet()) {
            canvas.write(e.getKey().x(), e.getKey().y(), e.getValue());
        }

        long age = canvas.incrementAge();
        cycles.incrementAndGet();

        String frameId = exportPolicy.shouldExport(age) ? export(age) : null;

        CycleStats stats = new CycleStats(age, batch.size(), merged.size(), stale, frameId);
        lastCycle = stats;
        log.fine(() -> "cycle " + stats);
        return stats;
    }

    public CycleStats lastCycle() {
        return lastCycle;
    }

    public long cyclesCompleted() {
        return cycles.get();
    }

    public long exportFailures() {
        return exportFailures.get();
    }

    /** Fatal error that ended the loop, or null. */
    public Throwable failure() {
        return failure;
    }

    // ---------- internals ----------

    private boolean ageLimitReached() {
        return settings.hasAgeLimit() && canvas.age() >= settings.ageLimit();
    }

    private String export(long age) {
        if (frames == null) {
            return null;
        }
        try {
            return frames.writeFrame(canvas.snapshot(), age);
        } catch (RuntimeException e) {
            exportFailures.incrementAndGet();
            log.log(Level.WARNING, "frame export failed at age " + age + ", continuing", e);
            return null;
        }
    }

    private void joinWorkers() {
        boolean interrupted = false;
        for (Thread t : workers) {
            while (t.isAlive()) {
                try {
                    t.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
