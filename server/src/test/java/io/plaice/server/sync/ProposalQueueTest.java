package io.plaice.server.sync;

import io.plaice.core.Proposal;
import io.plaice.core.Rgb;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProposalQueueTest {

    private static Proposal p(int workerId, int x) {
        return new Proposal(workerId, x, 0, Rgb.BLACK, 1.0, 0);
    }

    @Test
    void drain_returns_everything_offered_and_clears() throws Exception {
        var q = new ProposalQueue();
        assertTrue(q.offer(List.of(p(0, 1), p(0, 2))));
        assertTrue(q.offer(List.of(p(1, 3))));
        assertEquals(3, q.size());

        List<Proposal> batch = q.drain(Duration.ZERO);
        assertEquals(List.of(p(0, 1), p(0, 2), p(1, 3)), batch);
        assertEquals(0, q.size());
        assertTrue(q.drain(Duration.ZERO).isEmpty());
    }

    @Test
    void drained_batch_is_unaffected_by_later_offers() throws Exception {
        var q = new ProposalQueue();
        q.offer(List.of(p(0, 1)));
        List<Proposal> first = q.drain(Duration.ZERO);

        q.offer(List.of(p(0, 2)));
        assertEquals(List.of(p(0, 1)), first);
        assertEquals(List.of(p(0, 2)), q.drain(Duration.ZERO));
        assertThrows(UnsupportedOperationException.class, () -> first.add(p(0, 9)));
    }

    @Test
    void drain_times_out_with_empty_batch() throws Exception {
        var q = new ProposalQueue();
        long start = System.nanoTime();
        List<Proposal> batch = q.drain(Duration.ofMillis(50));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(batch.isEmpty());
        assertTrue(elapsedMs >= 40, "waited only " + elapsedMs + "ms");
    }

    @Test
    void offer_wakes_a_waiting_consumer() throws Exception {
        var q = new ProposalQueue();
        var got = new ArrayList<Proposal>();
        var done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                got.addAll(q.drain(Duration.ofSeconds(10)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        Thread.sleep(50);
        q.offer(List.of(p(0, 7)));

        assertTrue(done.await(5, TimeUnit.SECONDS), "consumer was not woken");
        consumer.join();
        assertEquals(List.of(p(0, 7)), got);
    }

    @Test
    void close_rejects_offers_and_wakes_consumer() throws Exception {
        var q = new ProposalQueue();
        var done = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                q.drain(Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();

        Thread.sleep(50);
        q.close();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(q.isClosed());
        assertFalse(q.offer(List.of(p(0, 1))));
        assertEquals(0, q.size());
        consumer.join();
    }

    @Test
    void null_elements_are_rejected() {
        var q = new ProposalQueue();
        var withNull = new ArrayList<Proposal>();
        withNull.add(p(0, 1));
        withNull.add(null);

        assertThrows(NullPointerException.class, () -> q.offer(withNull));
        assertEquals(0, q.size());
    }

    @Test
    void concurrent_producers_never_lose_or_duplicate_proposals() throws Exception {
        var q = new ProposalQueue();
        int producers = 8;
        int perProducer = 2_000;
        var start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();

        for (int w = 0; w < producers; w++) {
            int id = w;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perProducer; i++) {
                    q.offer(List.of(p(id, i)));
                }
            });
            threads.add(t);
            t.start();
        }

        Set<Proposal> seen = new HashSet<>();
        int total = 0;
        start.countDown();
        while (total < producers * perProducer) {
            for (Proposal p : q.drain(Duration.ofMillis(20))) {
                assertTrue(seen.add(p), "returned twice: " + p);
                total++;
            }
        }
        for (Thread t : threads) {
            t.join();
        }

        assertEquals(producers * perProducer, total);
        assertTrue(q.drain(Duration.ZERO).isEmpty());
    }
}
