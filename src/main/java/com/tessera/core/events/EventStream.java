package com.tessera.core.events;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Blocking, single-pass view over an {@link EventChannel}. Iteration ends after the
 * terminal event. Closing releases the subscription without losing queued events.
 */
public class EventStream implements Iterator<ExecutionEvent>, AutoCloseable {

    private final EventChannel channel;
    private ExecutionEvent lookahead;
    private boolean closed;

    EventStream(EventChannel channel) {
        this.channel = channel;
    }

    /**
     * Blocks until an event is available or the stream has ended. If the calling
     * thread is interrupted the interrupt flag is restored and false is returned.
     */
    @Override
    public boolean hasNext() {
        if (lookahead != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        try {
            lookahead = channel.take(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return lookahead != null;
    }

    @Override
    public ExecutionEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Event stream ended");
        }
        ExecutionEvent event = lookahead;
        lookahead = null;
        return event;
    }

    /** Waits up to {@code timeout} for the next event. Empty on timeout or end of stream. */
    public Optional<ExecutionEvent> poll(Duration timeout) throws InterruptedException {
        if (lookahead != null) {
            ExecutionEvent event = lookahead;
            lookahead = null;
            return Optional.of(event);
        }
        if (closed) {
            return Optional.empty();
        }
        return Optional.ofNullable(channel.take(timeout));
    }

    /** True once the terminal event has been handed out. */
    public boolean isFinished() {
        return lookahead == null && channel.isExhausted();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            channel.detach();
        }
    }
}
