package io.plaice.server.sync;

import io.plaice.core.Partitioner;
import io.plaice.core.ProposalSource;
import io.plaice.core.TileBounds;
import io.plaice.core.WeightedAverageMerger;
import io.plaice.storage.Canvas;
import io.plaice.storage.ExportPolicy;
import io.plaice.storage.FrameStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lifecycle controller for one run: owns the canvas, the running flag, the
 * worker threads and the aggregator thread.
 * <p>
 * States: IDLE -> PARTITIONED -> RUNNING -> STOPPED.
 *  - start():    compute tiles and build (not launch) the threads; idempotent.
 *  - startRun(): set the flag and launch workers + aggregator; idempotent while running.
 *  - stop():     clear the flag, close the queue, and return only after the
 *                aggregator (which joins every worker) has terminated.
 * <p>
 * A run also ends by itself when the aggregator reaches the age limit;
 * {@link #awaitCompletion(Duration)} waits for that. stop() is still the call
 * that writes the final frame.
 */
public final class Synchronizer {

    private static final Logger log = Logger.getLogger(Synchronizer.class.getName());

    private final Canvas canvas;
    private final int workerCount;
    private final IntFunction<ProposalSource> sources;
    private final SyncOptions options;
    private final FrameStore frames;   // may be null: no export

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ProposalQueue queue = new ProposalQueue();

    // guarded by this
    private SyncState state = SyncState.IDLE;
    private List<TileBounds> tiles = List.of();
    private final List<WorkerLoop> loops = new ArrayList<>();
    private final List<Thread> workerThreads = new ArrayList<>();
    private Aggregator aggregator;
    private Thread aggregatorThread;

    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * @param canvas      shared canvas; exclusively owned by this synchronizer from now on.
     * @param workerCount number of workers (one tile and one thread each), > 0.
     * @param sources     builds the proposal source of worker i.
     * @param options     tuning knobs.
     * @param frames      frame sink, or null to skip exports.
     */
    public Synchronizer(
            Canvas canvas,
            int workerCount,
            IntFunction<ProposalSource> sources,
            SyncOptions options,
            FrameStore frames
    ) {
        this.canvas = Objects.requireNonNull(canvas, "canvas");
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0, got " + workerCount);
        }
        this.workerCount = workerCount;
        this.sources = Objects.requireNonNull(sources, "sources");
        this.options = Objects.requireNonNull(options, "options");
        this.frames = frames;
    }

    /** Partition the canvas and build worker threads without starting them. */
    public synchronized void start() {
        if (state != SyncState.IDLE) {
            return;
        }
        List<TileBounds> newTiles = Partitioner.partition(workerCount, canvas.width(), canvas.height(), options.overlapRatio());

        // Published only once every source was built.
        List<WorkerLoop> newLoops = new ArrayList<>(workerCount);
        List<Thread> newThreads = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            ProposalSource source = Objects.requireNonNull(sources.apply(i), "proposal source for worker " + i);
            var loop = new WorkerLoop(i, newTiles.get(i), canvas, source, queue, running, options.timing(), randomFor(i));
            newLoops.add(loop);
            newThreads.add(new Thread(loop, "plaice-worker-" + i));
        }

        tiles = newTiles;
        loops.addAll(newLoops);
        workerThreads.addAll(newThreads);

        aggregator = new Aggregator(
                canvas,
                queue,
                new WeightedAverageMerger(options.confidenceFloor()),
                running,
                options.aggregator(),
                frames,
                new ExportPolicy(options.exportEvery()),
                workerThreads
        );
        aggregatorThread = new Thread(aggregator, "plaice-aggregator");

        state = SyncState.PARTITIONED;
        log.info(() -> "partitioned %dx%d canvas into %d tiles".formatted(canvas.width(), canvas.height(), workerCount));
    }

    /** Launch workers and the aggregator. */
    public synchronized void startRun() {
        if (state == SyncState.RUNNING) {
            return;
        }
        if (state == SyncState.STOPPED) {
            throw new IllegalStateException("synchronizer already stopped");
        }
        start();
        running.set(true);
        for (Thread t : workerThreads) {
            t.start();
        }
        aggregatorThread.start();
        state = SyncState.RUNNING;
        log.info(() -> "run started with " + workerCount + " workers at age " + canvas.age());
    }

    /**
     * Stop the run and wait until every thread has terminated. Idempotent:
     * concurrent and later callers also block until the first stop is done.
     * Writes the final frame if the run was started and a frame store is set.
     */
    public void stop() {
        SyncState previous;
        Thread aggThread;
        synchronized (this) {
            if (state == SyncState.STOPPED) {
                previous = null;
                aggThread = null;
            } else {
                previous = state;
                state = SyncState.STOPPED;
                aggThread = aggregatorThread;
            }
        }
        if (previous == null) {
            awaitUninterruptibly(stopped);
            return;
        }

        try {
            running.set(false);
            queue.close();

            if (previous != SyncState.RUNNING) {
                log.info("stopped before the run was started");
                return;
            }

            joinUninterruptibly(aggThread);
            writeFinalFrame();
            log.info(() -> "run stopped at age " + canvas.age());
        } finally {
            stopped.countDown();
        }
    }

    /**
     * Wait for the run to end on its own (age limit or fatal error).
     *
     * @return true if the aggregator has terminated.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        Thread aggThread;
        synchronized (this) {
            if (state == SyncState.IDLE || state == SyncState.PARTITIONED) {
                return false;
            }
            aggThread = aggregatorThread;
        }
        if (aggThread == null) {
            return true;
        }
        aggThread.join(Math.max(1L, timeout.toMillis()));
        return !aggThread.isAlive();
    }

    public synchronized SyncState state() {
        return state;
    }

    public boolean isRunning() {
        return running.get();
    }

    public Canvas canvas() {
        return canvas;
    }

    public synchronized List<TileBounds> tiles() {
        return tiles;
    }

    /** Stats of the most recent completed cycle, or null. */
    public synchronized CycleStats lastCycle() {
        return aggregator == null ? null : aggregator.lastCycle();
    }

    /** Fatal aggregator error, or null. */
    public synchronized Throwable failure() {
        return aggregator == null ? null : aggregator.failure();
    }

    public synchronized List<WorkerStats> workerStats() {
        List<WorkerStats> out = new ArrayList<>(loops.size());
        for (WorkerLoop l : loops) {
            out.add(l.stats());
        }
        return out;
    }

    public synchronized SyncStatus status() {
        Throwable f = failure();
        return new SyncStatus(
                state,
                running.get(),
                canvas.width(),
                canvas.height(),
                canvas.age(),
                queue.size(),
                aggregator == null ? 0 : aggregator.cyclesCompleted(),
                aggregator == null ? 0 : aggregator.exportFailures(),
                lastCycle(),
                f == null ? null : f.toString(),
                workerStats()
        );
    }

    // ---------- internals ----------

    private Random randomFor(int workerId) {
        Long seed = options.seed();
        return seed == null ? new Random() : new Random(seed * 31L + workerId);
    }

    private void writeFinalFrame() {
        if (frames == null || canvas.width() == 0 || canvas.height() == 0) {
            return;
        }
        try {
            String id = frames.writeFinal(canvas.snapshot());
            log.info(() -> "final frame written: " + id);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "final frame export failed", e);
        }
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        boolean interrupted = false;
        while (latch.getCount() > 0) {
            try {
                latch.await();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static void joinUninterruptibly(Thread t) {
        boolean interrupted = false;
        while (t.isAlive()) {
            try {
                t.join();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
