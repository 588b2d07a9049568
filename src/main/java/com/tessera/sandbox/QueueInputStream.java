package com.tessera.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Stdin for a docker exec: bytes offered by session input are read by the attach thread.
 * Closing delivers end-of-stream once everything offered before it was read.
 */
final class QueueInputStream extends InputStream {

    private static final byte[] EOF = new byte[0];

    private final LinkedBlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();
    private byte[] current;
    private int position;
    private volatile boolean closed;

    void offer(byte[] data) throws IOException {
        if (closed) {
            throw new IOException("stdin closed");
        }
        if (data.length > 0) {
            queue.add(data.clone());
        }
    }

    boolean isClosed() {
        return closed;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n < 0 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (current == EOF) {
            return -1;
        }
        if (current == null || position >= current.length) {
            try {
                current = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for input");
            }
            position = 0;
            if (current == EOF) {
                return -1;
            }
        }
        int n = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, n);
        position += n;
        return n;
    }

    @Override
    public int available() {
        if (current == null || current == EOF) {
            return 0;
        }
        return current.length - position;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.add(EOF);
        }
    }
}
