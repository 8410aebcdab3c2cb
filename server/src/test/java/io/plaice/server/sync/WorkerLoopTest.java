package io.plaice.server.sync;

import io.plaice.core.Proposal;
import io.plaice.core.ProposalRequest;
import io.plaice.core.ProposalSource;
import io.plaice.core.Rgb;
import io.plaice.core.TileBounds;
import io.plaice.storage.Canvas;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerLoopTest {

    private static final WorkerTiming NO_SLEEP = new WorkerTiming(Duration.ZERO, Duration.ZERO, Duration.ZERO);

    private final Canvas canvas = new Canvas(10, 10);
    private final ProposalQueue queue = new ProposalQueue();
    private final AtomicBoolean running = new AtomicBoolean(true);

    private WorkerLoop loop(TileBounds tile, ProposalSource source) {
        return new WorkerLoop(3, tile, canvas, source, queue, running, NO_SLEEP, new Random(42));
    }

    @Test
    void requests_carry_tile_view_target_inside_tile_and_current_age() {
        var tile = new TileBounds(2, 6, 1, 4);
        canvas.incrementAge();
        canvas.incrementAge();
        List<ProposalRequest> seen = new ArrayList<>();
        var w = loop(tile, req -> {
            seen.add(req);
            return List.of();
        });

        for (int i = 0; i < 200; i++) {
            assertTrue(w.step());
        }

        assertEquals(200, seen.size());
        for (ProposalRequest r : seen) {
            assertEquals(3, r.workerId());
            assertEquals(2L, r.version());
            assertEquals(tile, r.view().bounds());
            assertTrue(tile.contains(r.target().x(), r.target().y()), "target outside tile: " + r.target());
        }
        assertEquals(200, w.stats().emptyResults());
        assertEquals(0, queue.size());
    }

    @Test
    void proposals_are_queued_and_counted() throws Exception {
        var w = loop(new TileBounds(0, 10, 0, 10), req -> List.of(req.proposeTarget(new Rgb(1, 2, 3), 0.5)));

        w.step();
        w.step();

        assertEquals(2, w.stats().proposalsOffered());
        List<Proposal> batch = queue.drain(Duration.ZERO);
        assertEquals(2, batch.size());
        assertEquals(3, batch.get(0).workerId());
    }

    @Test
    void empty_tile_idles_without_calling_the_source() {
        var calls = new AtomicInteger();
        var w = loop(TileBounds.EMPTY, req -> {
            calls.incrementAndGet();
            return List.of();
        });

        assertTrue(w.step());
        assertTrue(w.step());

        assertEquals(0, calls.get());
        assertEquals(2, w.stats().iterations());
        assertEquals(0, queue.size());
    }

    @Test
    void source_failure_is_contained_and_counted() {
        var calls = new AtomicInteger();
        var w = loop(new TileBounds(0, 10, 0, 10), req -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("model unavailable");
            }
            return List.of(req.proposeTarget(Rgb.BLACK, 1.0));
        });

        assertTrue(w.step());
        assertTrue(w.step());

        WorkerStats s = w.stats();
        assertEquals(1, s.errors());
        assertEquals(1, s.proposalsOffered());
        assertEquals(1, queue.size());
    }

    @Test
    void proposals_outside_the_canvas_are_dropped() throws Exception {
        var w = loop(new TileBounds(0, 10, 0, 10), req -> List.of(
                new Proposal(3, 10, 0, Rgb.BLACK, 1.0, 0),
                new Proposal(3, -1, 5, Rgb.BLACK, 1.0, 0),
                new Proposal(3, 9, 9, Rgb.BLACK, 1.0, 0)
        ));

        w.step();

        assertEquals(2, w.stats().proposalsDropped());
        assertEquals(1, w.stats().proposalsOffered());
        Proposal kept = queue.drain(Duration.ZERO).get(0);
        assertEquals(9, kept.x());
        assertEquals(9, kept.y());
    }

    @Test
    void proposals_offered_after_close_count_as_dropped() {
        queue.close();
        var w = loop(new TileBounds(0, 10, 0, 10), req -> List.of(req.proposeTarget(Rgb.BLACK, 1.0)));

        w.step();

        assertEquals(0, w.stats().proposalsOffered());
        assertEquals(1, w.stats().proposalsDropped());
    }

    @Test
    void interrupted_source_ends_the_loop() {
        var w = loop(new TileBounds(0, 10, 0, 10), req -> {
            throw new InterruptedException("shutdown");
        });
        try {
            assertFalse(w.step());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void run_exits_once_the_flag_is_cleared() throws Exception {
        var calls = new AtomicInteger();
        var w = loop(new TileBounds(0, 10, 0, 10), req -> {
            if (calls.incrementAndGet() == 5) {
                running.set(false);
            }
            return List.of();
        });

        Thread t = new Thread(w, "test-worker");
        t.start();
        t.join(5_000);

        assertFalse(t.isAlive());
        assertEquals(5, calls.get());
        assertEquals(5, w.stats().iterations());
    }
}
