package com.tessera.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bounded FIFO between the producer of an execution's events and its single consumer.
 * <p>
 * {@link #emit} blocks while the buffer is full; nothing is ever dropped.
 * {@link #terminate} appends the terminal event even when the buffer is full, refuses
 * every later emit and wakes blocked producers, so cancellation never waits on a
 * slow consumer. Sequence numbers are assigned under the channel lock, in delivery order.
 */
public class EventChannel {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private final String executionId;
    private final int capacity;
    private final Consumer<ExecutionEvent> recorder;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notFull = lock.newCondition();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<ExecutionEvent> buffer = new ArrayDeque<>();

    private long nextSequence = 1;
    private boolean terminated;
    private boolean terminalDelivered;
    private boolean consumerAttached;

    public EventChannel(String executionId, int capacity, Consumer<ExecutionEvent> recorder) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.executionId = executionId;
        this.capacity = capacity;
        this.recorder = recorder;
    }

    /**
     * Appends a non-terminal event, waiting for space if needed.
     *
     * @return false if the channel was terminated before the event could be added
     */
    public boolean emit(ExecutionEvent.Factory factory) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.size() >= capacity && !terminated) {
                notFull.await();
            }
            if (terminated) {
                return false;
            }
            ExecutionEvent event = factory.create(nextSequence++);
            if (event.isTerminal()) {
                throw new IllegalArgumentException("Terminal events go through terminate(): " + event.type());
            }
            append(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a non-terminal event only if there is room right now.
     *
     * @return false if the channel is full or terminated
     */
    public boolean tryEmit(ExecutionEvent.Factory factory) {
        lock.lock();
        try {
            if (terminated || buffer.size() >= capacity) {
                return false;
            }
            ExecutionEvent event = factory.create(nextSequence++);
            if (event.isTerminal()) {
                throw new IllegalArgumentException("Terminal events go through terminate(): " + event.type());
            }
            append(event);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the terminal event. Only the first call has an effect.
     *
     * @return true if this call terminated the channel
     */
    public boolean terminate(ExecutionEvent.Factory factory) {
        lock.lock();
        try {
            if (terminated) {
                return false;
            }
            ExecutionEvent event = factory.create(nextSequence++);
            if (!event.isTerminal()) {
                throw new IllegalArgumentException("Not a terminal event: " + event.type());
            }
            terminated = true;
            append(event);
            notFull.signalAll();
            log.debug("Event channel for {} terminated with {}", executionId, event.type());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminated() {
        lock.lock();
        try {
            return terminated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attaches the single consumer. A closed stream releases the slot; buffered
     * events stay queued for the next consumer.
     *
     * @throws IllegalStateException if a consumer is already attached
     */
    public EventStream attach() {
        lock.lock();
        try {
            if (consumerAttached) {
                throw new IllegalStateException("Execution " + executionId + " already has a subscriber");
            }
            consumerAttached = true;
            return new EventStream(this);
        } finally {
            lock.unlock();
        }
    }

    void detach() {
        lock.lock();
        try {
            consumerAttached = false;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event; a null timeout waits indefinitely.
     *
     * @return the next event, or null on timeout or once the terminal event was taken
     */
    ExecutionEvent take(Duration timeout) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
            while (buffer.isEmpty()) {
                if (terminalDelivered) {
                    return null;
                }
                if (timeout == null) {
                    notEmpty.await();
                } else {
                    if (remaining <= 0) {
                        return null;
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
            }
            ExecutionEvent event = buffer.removeFirst();
            if (event.isTerminal()) {
                terminalDelivered = true;
            }
            notFull.signal();
            return event;
        } finally {
            lock.unlock();
        }
    }

    boolean isExhausted() {
        lock.lock();
        try {
            return terminalDelivered && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    private void append(ExecutionEvent event) {
        buffer.addLast(event);
        if (recorder != null) {
            recorder.accept(event);
        }
        notEmpty.signal();
    }
}
