package com.tessera.core.events;

import com.tessera.core.model.ChangeView;
import com.tessera.core.model.ErrorKind;

import java.time.Instant;

/**
 * Typed notification emitted while an execution runs. Every execution's stream
 * ends with exactly one terminal event: {@link Completed}, {@link Cancelled} or
 * {@link Error}.
 */
public sealed interface ExecutionEvent permits
        ExecutionEvent.Started,
        ExecutionEvent.Progress,
        ExecutionEvent.FileRead,
        ExecutionEvent.Thinking,
        ExecutionEvent.CodeChangeProposed,
        ExecutionEvent.Completed,
        ExecutionEvent.Cancelled,
        ExecutionEvent.Error {

    String executionId();

    /** Position in the execution's event stream, starting at 1. */
    long sequence();

    Instant timestamp();

    /** Wire name used for SSE event names and console prefixes. */
    String type();

    default boolean isTerminal() {
        return false;
    }

    record Started(String executionId, long sequence, Instant timestamp, String verb, String argument)
            implements ExecutionEvent {
        public String type() { return "started"; }
    }

    record Progress(String executionId, long sequence, Instant timestamp, String stage, String message)
            implements ExecutionEvent {
        public String type() { return "progress"; }
    }

    record FileRead(String executionId, long sequence, Instant timestamp, String path, long bytes)
            implements ExecutionEvent {
        public String type() { return "file_read"; }
    }

    record Thinking(String executionId, long sequence, Instant timestamp, String text)
            implements ExecutionEvent {
        public String type() { return "thinking"; }
    }

    record CodeChangeProposed(String executionId, long sequence, Instant timestamp, ChangeView change)
            implements ExecutionEvent {
        public String type() { return "code_change_proposed"; }
    }

    record Completed(String executionId, long sequence, Instant timestamp, int changeCount, boolean truncated)
            implements ExecutionEvent {
        public String type() { return "completed"; }
        @Override public boolean isTerminal() { return true; }
    }

    record Cancelled(String executionId, long sequence, Instant timestamp)
            implements ExecutionEvent {
        public String type() { return "cancelled"; }
        @Override public boolean isTerminal() { return true; }
    }

    record Error(String executionId, long sequence, Instant timestamp, ErrorKind kind, String message)
            implements ExecutionEvent {
        public String type() { return "error"; }
        @Override public boolean isTerminal() { return true; }
    }

    /** Builds an event once the channel has assigned its sequence number. */
    @FunctionalInterface
    interface Factory {
        ExecutionEvent create(long sequence);
    }
}
