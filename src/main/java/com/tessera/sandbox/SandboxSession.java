package com.tessera.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * A live interactive shell bound to one sandbox target.
 * <p>
 * Input writes are serialized so that two senders never interleave at the byte level.
 */
public class SandboxSession {

    private static final Logger log = LoggerFactory.getLogger(SandboxSession.class);

    private final String sessionId;
    private final String targetId;
    private final Instant createdAt;
    private final SessionOutputBuffer output;
    private final Clock clock;
    private final Object inputLock = new Object();

    private volatile Instant lastActivityAt;
    private volatile TerminalSize dimensions;
    private volatile ShellChannel channel;
    private volatile boolean shellEnded;
    private volatile boolean closed;

    SandboxSession(String sessionId, String targetId, TerminalSize dimensions, SessionOutputBuffer output, Clock clock) {
        this.sessionId = sessionId;
        this.targetId = targetId;
        this.dimensions = dimensions;
        this.output = output;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivityAt = createdAt;
    }

    public String getSessionId() { return sessionId; }
    public String getTargetId() { return targetId; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public TerminalSize getDimensions() { return dimensions; }
    public boolean isClosed() { return closed; }

    /** True once the shell itself has exited or the connection dropped. */
    public boolean isShellEnded() { return shellEnded; }

    SessionOutputBuffer outputBuffer() {
        return output;
    }

    /** Sink handed to the provider; feeds the output buffer. */
    OutputSink sink() {
        return new OutputSink() {
            @Override
            public void onOutput(byte[] data) {
                output.append(data);
                touch();
            }

            @Override
            public void onClosed() {
                shellEnded = true;
                output.markClosed();
                log.debug("Shell of sandbox session {} ended", sessionId);
            }
        };
    }

    void bind(ShellChannel channel) {
        this.channel = channel;
    }

    void sendInput(byte[] data) throws IOException {
        synchronized (inputLock) {
            ShellChannel current = channel;
            if (closed || current == null || !current.isOpen()) {
                throw new IOException("Shell of session " + sessionId + " is not open");
            }
            current.write(data);
            touch();
        }
    }

    void signal(ShellSignal signal) throws IOException {
        synchronized (inputLock) {
            ShellChannel current = channel;
            if (closed || current == null || !current.isOpen()) {
                throw new IOException("Shell of session " + sessionId + " is not open");
            }
            current.signal(signal);
            touch();
        }
    }

    /** @return false if the size is unchanged */
    boolean resize(TerminalSize size) {
        if (size.equals(dimensions)) {
            return false;
        }
        dimensions = size;
        ShellChannel current = channel;
        if (current != null && current.isOpen()) {
            current.resize(size);
        }
        touch();
        return true;
    }

    SessionOutput attachOutput() {
        SessionOutput attached = output.attach();
        touch();
        return attached;
    }

    boolean isIdle(Duration idleTimeout) {
        return !lastActivityAt.plus(idleTimeout).isAfter(clock.instant());
    }

    /** Releases the shell. Idempotent. */
    void close() {
        synchronized (inputLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        ShellChannel current = channel;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                log.warn("Closing shell of sandbox session {} failed: {}", sessionId, e.getMessage(), e);
            }
        }
        output.markClosed();
    }

    private void touch() {
        lastActivityAt = clock.instant();
    }
}
