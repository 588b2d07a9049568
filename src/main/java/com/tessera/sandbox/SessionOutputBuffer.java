package com.tessera.sandbox;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded buffer of shell output chunks between a provider thread and at most one
 * attached consumer.
 * <p>
 * Without a consumer the oldest chunk is evicted when the buffer is full. With one
 * attached, the producer waits up to the stall timeout for space before evicting.
 * Output left unconsumed after a consumer detaches is discarded once the retention
 * window has elapsed.
 */
public class SessionOutputBuffer {

    private final int capacity;
    private final Duration retention;
    private final Duration stallTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Deque<byte[]> chunks = new ArrayDeque<>();

    private boolean attached;
    private boolean closed;
    private Instant detachedAt;
    private long dropped;

    public SessionOutputBuffer(int capacity, Duration retention, Duration stallTimeout, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.retention = retention;
        this.stallTimeout = stallTimeout;
        this.clock = clock;
    }

    public void append(byte[] data) {
        if (data == null || data.length == 0) {
            return;
        }
        lock.lock();
        try {
            if (closed) {
                return;
            }
            discardExpiredLocked();
            if (chunks.size() >= capacity && attached) {
                long remaining = stallTimeout.toNanos();
                while (chunks.size() >= capacity && attached && !closed && remaining > 0) {
                    remaining = notFull.awaitNanos(remaining);
                }
            }
            while (chunks.size() >= capacity) {
                chunks.removeFirst();
                dropped++;
            }
            chunks.addLast(data.clone());
            notEmpty.signalAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.unlock();
        }
    }

    /** No more output will arrive; the consumer drains what is left and then ends. */
    public void markClosed() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attaches the single consumer.
     *
     * @throws IllegalStateException if a consumer is already attached
     */
    public SessionOutput attach() {
        lock.lock();
        try {
            if (attached) {
                throw new IllegalStateException("Session output already has a consumer");
            }
            discardExpiredLocked();
            attached = true;
            detachedAt = null;
            return new SessionOutput(this);
        } finally {
            lock.unlock();
        }
    }

    void detach() {
        lock.lock();
        try {
            attached = false;
            detachedAt = clock.instant();
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next chunk; null waits indefinitely.
     *
     * @return the chunk, or null on timeout or once the output has ended
     */
    byte[] take(Duration timeout) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long remaining = timeout != null ? timeout.toNanos() : Long.MAX_VALUE;
            while (chunks.isEmpty() && !closed && attached) {
                if (timeout == null) {
                    notEmpty.await();
                } else {
                    if (remaining <= 0) {
                        return null;
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
            }
            byte[] chunk = chunks.pollFirst();
            if (chunk != null) {
                notFull.signalAll();
            }
            return chunk;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops unconsumed output once the retention window after a detach has elapsed.
     *
     * @return the number of chunks discarded
     */
    public int discardExpired() {
        lock.lock();
        try {
            return discardExpiredLocked();
        } finally {
            lock.unlock();
        }
    }

    private int discardExpiredLocked() {
        if (attached || detachedAt == null || chunks.isEmpty()) {
            return 0;
        }
        if (clock.instant().isBefore(detachedAt.plus(retention))) {
            return 0;
        }
        int count = chunks.size();
        dropped += count;
        chunks.clear();
        detachedAt = clock.instant();
        notFull.signalAll();
        return count;
    }

    public boolean isExhausted() {
        lock.lock();
        try {
            return closed && chunks.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isAttached() {
        lock.lock();
        try {
            return attached;
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return chunks.size();
        } finally {
            lock.unlock();
        }
    }

    /** Chunks lost to eviction or retention expiry. */
    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }
}
