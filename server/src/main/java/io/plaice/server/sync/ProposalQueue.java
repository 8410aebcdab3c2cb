package io.plaice.server.sync;

import io.plaice.core.Proposal;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-producer / single-consumer proposal buffer with drain-and-clear semantics.
 * <p>
 * Two buffers alternate: producers append to {@code live}; the consumer swaps
 * {@code live} with the empty {@code spare} under the lock and walks away with
 * the full one. Producer critical sections are O(batch offered); the swap is
 * O(1) regardless of how many proposals piled up.
 * <p>
 * Guarantees:
 *  - a proposal is returned by exactly one drain,
 *  - proposals offered after a swap land in the next batch,
 *  - after {@link #close()} offers are rejected and a waiting consumer wakes up.
 * <p>
 * drain() must only be called from one thread at a time.
 */
public final class ProposalQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    // guarded by lock
    private ArrayList<Proposal> live = new ArrayList<>();
    private boolean closed;

    // consumer-owned between drains
    private volatile ArrayList<Proposal> spare = new ArrayList<>();

    /**
     * Append proposals and wake the consumer.
     *
     * @return false if the queue is closed; nothing is appended in that case.
     */
    public boolean offer(Collection<Proposal> proposals) {
        Objects.requireNonNull(proposals, "proposals");
        for (Proposal p : proposals) {
            Objects.requireNonNull(p, "proposal");
        }
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (proposals.isEmpty()) {
                return true;
            }
            live.addAll(proposals);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait up to {@code timeout} for proposals, then take everything queued so far.
     *
     * @return the batch (possibly empty on timeout or close); never null.
     */
    public List<Proposal> drain(Duration timeout) throws InterruptedException {
        long remaining = Math.max(0L, timeout.toNanos());
        ArrayList<Proposal> batch;
        lock.lock();
        try {
            while (live.isEmpty() && !closed && remaining > 0L) {
                remaining = notEmpty.awaitNanos(remaining);
            }
            batch = live;
            live = spare;
        } finally {
            lock.unlock();
        }
        List<Proposal> out = List.copyOf(batch);
        batch.clear();
        spare = batch;
        return out;
    }

    /** Reject further offers and wake the consumer. Idempotent. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Proposals waiting for the next drain. */
    public int size() {
        lock.lock();
        try {
            return live.size();
        } finally {
            lock.unlock();
        }
    }
}
