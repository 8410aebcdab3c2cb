package io.plaice.server.sync;

import io.plaice.core.CanvasView;
import io.plaice.core.CellPos;
import io.plaice.core.Proposal;
import io.plaice.core.ProposalRequest;
import io.plaice.core.ProposalSource;
import io.plaice.core.TileBounds;
import io.plaice.storage.Canvas;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Body of one worker thread.
 * <p>
 * Each iteration, while the shared running flag is set:
 *  1) empty tile: sleep the idle interval and retry,
 *  2) sample a target cell uniformly inside the tile,
 *  3) read the tile and the canvas age,
 *  4) ask the proposal source (no lock is held during the call),
 *  5) offer in-canvas proposals to the queue; on failure log and back off,
 *  6) sleep the throttle interval.
 * <p>
 * The flag is only checked at the top of an iteration, so an in-flight
 * iteration finishes its current step before the loop exits. An interrupt
 * ends the loop immediately.
 */
public final class WorkerLoop implements Runnable {

    private static final Logger log = Logger.getLogger(WorkerLoop.class.getName());

    private static final long EMPTY_LOG_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(5);

    private final int workerId;
    private final TileBounds tile;
    private final Canvas canvas;
    private final ProposalSource source;
    private final ProposalQueue queue;
    private final AtomicBoolean running;
    private final WorkerTiming timing;
    private final Random random;

    private final AtomicLong iterations = new AtomicLong();
    private final AtomicLong offered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong emptyResults = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    // Rate-limited "nothing proposed" logging; touched only by the worker thread.
    private long lastEmptyLogNanos;
    private long emptySinceLastLog;

    public WorkerLoop(
            int workerId,
            TileBounds tile,
            Canvas canvas,
            ProposalSource source,
            ProposalQueue queue,
            AtomicBoolean running,
            WorkerTiming timing,
            Random random
    ) {
        this.workerId = workerId;
        this.tile = Objects.requireNonNull(tile, "tile");
        this.canvas = Objects.requireNonNull(canvas, "canvas");
        this.source = Objects.requireNonNull(source, "source");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.running = Objects.requireNonNull(running, "running");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.random = Objects.requireNonNull(random, "random");
        this.lastEmptyLogNanos = System.nanoTime();
    }

    public int workerId() {
        return workerId;
    }

    public TileBounds tile() {
        return tile;
    }

    @Override
    public void run() {
        log.fine(() -> "worker " + workerId + " started on " + tile);
        while (running.get()) {
            if (!step()) {
                break;
            }
        }
        log.fine(() -> "worker " + workerId + " stopped after " + iterations.get() + " iterations");
    }

    /**
     * One iteration, including its sleeps.
     *
     * @return false if the thread was interrupted and the loop should end.
     */
    public boolean step() {
        iterations.incrementAndGet();

        if (tile.isEmpty()) {
            return pause(timing.idle());
        }

        CellPos target = new CellPos(
                tile.x0() + random.nextInt(tile.width()),
                tile.y0() + random.nextInt(tile.height())
        );
        CanvasView view = canvas.read(tile);
        long version = canvas.age();

        List<Proposal> proposals;
        try {
            proposals = source.propose(new ProposalRequest(workerId, view, target, version));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            errors.incrementAndGet();
            log.log(Level.WARNING, "worker " + workerId + ": proposal source failed, backing off " + timing.backoff(), e);
            return pause(timing.backoff()) && pause(timing.throttle());
        }

        if (proposals == null || proposals.isEmpty()) {
            noteEmpty();
        } else {
            enqueue(proposals);
        }
        return pause(timing.throttle());
    }

    public WorkerStats stats() {
        return new WorkerStats(
                workerId,
                tile,
                iterations.get(),
                offered.get(),
                dropped.get(),
                emptyResults.get(),
                errors.get()
        );
    }

    // ---------- internals ----------

    private void enqueue(List<Proposal> proposals) {
        List<Proposal> accepted = new ArrayList<>(proposals.size());
        for (Proposal p : proposals) {
            if (p != null && canvas.inBounds(p.x(), p.y())) {
                accepted.add(p);
            } else {
                dropped.incrementAndGet();
                log.fine(() -> "worker " + workerId + ": dropping proposal outside canvas: " + p);
            }
        }
        if (accepted.isEmpty()) {
            return;
        }
        if (queue.offer(accepted)) {
            offered.addAndGet(accepted.size());
        } else {
            // Queue closed by stop(); the flag check at the top ends the loop.
            dropped.addAndGet(accepted.size());
        }
    }

    private void noteEmpty() {
        emptyResults.incrementAndGet();
        emptySinceLastLog++;
        long now = System.nanoTime();
        if (now - lastEmptyLogNanos >= EMPTY_LOG_INTERVAL_NANOS) {
            long n = emptySinceLastLog;
            log.fine(() -> "worker " + workerId + ": " + n + " empty proposal results in the last "
                    + TimeUnit.NANOSECONDS.toSeconds(EMPTY_LOG_INTERVAL_NANOS) + "s");
            lastEmptyLogNanos = now;
            emptySinceLastLog = 0;
        }
    }

    private static boolean pause(Duration d) {
        if (d.isZero()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
