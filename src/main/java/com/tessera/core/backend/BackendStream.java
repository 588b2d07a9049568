package com.tessera.core.backend;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Lazy sequence of chunks from a reasoning backend. {@link #hasNext()} may block
 * while the backend is producing. Closing releases the connection and makes a
 * blocked {@code hasNext()} return or fail promptly.
 */
public interface BackendStream extends Iterator<BackendChunk>, AutoCloseable {

    @Override
    void close();

    static BackendStream of(Stream<BackendChunk> stream) {
        Iterator<BackendChunk> iterator = stream.iterator();
        return new BackendStream() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public BackendChunk next() {
                return iterator.next();
            }

            @Override
            public void close() {
                stream.close();
            }
        };
    }
}
