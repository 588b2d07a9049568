package com.tessera.sandbox;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Single-pass view over a session's output, in arrival order. Ends once the shell has
 * closed and everything buffered was read. Closing detaches the consumer; it cannot be
 * restarted, but a new consumer may attach to the session.
 */
public class SessionOutput implements Iterator<byte[]>, AutoCloseable {

    private final SessionOutputBuffer buffer;
    private byte[] lookahead;
    private boolean closed;

    SessionOutput(SessionOutputBuffer buffer) {
        this.buffer = buffer;
    }

    /**
     * Blocks until output is available or the session has ended. If the calling
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
            lookahead = buffer.take(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return lookahead != null;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Session output ended");
        }
        byte[] chunk = lookahead;
        lookahead = null;
        return chunk;
    }

    /** Waits up to {@code timeout} for the next chunk. Empty on timeout or end of output. */
    public Optional<byte[]> poll(Duration timeout) throws InterruptedException {
        if (lookahead != null) {
            byte[] chunk = lookahead;
            lookahead = null;
            return Optional.of(chunk);
        }
        if (closed) {
            return Optional.empty();
        }
        return Optional.ofNullable(buffer.take(timeout));
    }

    public boolean isFinished() {
        return closed || (lookahead == null && buffer.isExhausted());
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            buffer.detach();
        }
    }
}
