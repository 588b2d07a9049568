package com.tessera.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class EventChannelTest {

    private static final String EXEC = "exe-0001-000000";

    private List<ExecutionEvent> recorded;
    private EventChannel channel;

    @BeforeEach
    void setUp() {
        recorded = new ArrayList<>();
        channel = new EventChannel(EXEC, 2, recorded::add);
    }

    private static ExecutionEvent.Factory progress(String message) {
        return seq -> new ExecutionEvent.Progress(EXEC, seq, Instant.now(), "test", message);
    }

    private static ExecutionEvent.Factory completed() {
        return seq -> new ExecutionEvent.Completed(EXEC, seq, Instant.now(), 0, false);
    }

    @Nested
    @DisplayName("ordering")
    class OrderingTests {

        @Test
        @DisplayName("assigns increasing sequence numbers from 1")
        void sequences() throws Exception {
            channel.emit(progress("a"));
            channel.emit(progress("b"));

            try (EventStream stream = channel.attach()) {
                assertEquals(1, stream.next().sequence());
                assertEquals(2, stream.next().sequence());
            }
            assertEquals(2, recorded.size());
        }

        @Test
        @DisplayName("stream ends after the terminal event")
        void endsAfterTerminal() throws Exception {
            channel.emit(progress("a"));
            channel.terminate(completed());

            EventStream stream = channel.attach();
            assertInstanceOf(ExecutionEvent.Progress.class, stream.next());
            assertInstanceOf(ExecutionEvent.Completed.class, stream.next());
            assertFalse(stream.hasNext());
            assertTrue(stream.isFinished());
        }

        @Test
        @DisplayName("only the first terminate has an effect")
        void singleTerminal() {
            assertTrue(channel.terminate(completed()));
            assertFalse(channel.terminate(seq -> new ExecutionEvent.Cancelled(EXEC, seq, Instant.now())));
            assertEquals(1, recorded.size());
        }

        @Test
        @DisplayName("emit after terminate is refused")
        void emitAfterTerminate() throws Exception {
            channel.terminate(completed());
            assertFalse(channel.emit(progress("late")));
        }

        @Test
        @DisplayName("terminal events cannot be emitted")
        void terminalThroughEmitRejected() {
            assertThrows(IllegalArgumentException.class, () -> channel.emit(completed()));
        }
    }

    @Nested
    @DisplayName("backpressure")
    class BackpressureTests {

        @Test
        @DisplayName("emit blocks while the buffer is full and resumes when drained")
        void blocksWhenFull() throws Exception {
            channel.emit(progress("1"));
            channel.emit(progress("2"));

            var emitted = new CountDownLatch(1);
            Thread producer = new Thread(() -> {
                try {
                    channel.emit(progress("3"));
                    emitted.countDown();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            producer.start();
            assertFalse(emitted.await(200, TimeUnit.MILLISECONDS));

            EventStream stream = channel.attach();
            stream.next();
            assertTrue(emitted.await(2, TimeUnit.SECONDS));
            producer.join(2000);
        }

        @Test
        @DisplayName("tryEmit refuses instead of waiting when full or terminated")
        void tryEmitNeverWaits() {
            assertTrue(channel.tryEmit(progress("1")));
            assertTrue(channel.tryEmit(progress("2")));
            assertFalse(channel.tryEmit(progress("3")));

            channel.terminate(completed());
            assertFalse(channel.tryEmit(progress("4")));
            assertEquals(3, recorded.size());
            assertEquals(3, recorded.get(2).sequence());
        }

        @Test
        @DisplayName("terminate wakes a blocked producer and is appended despite a full buffer")
        void terminateUnblocks() throws Exception {
            channel.emit(progress("1"));
            channel.emit(progress("2"));

            var result = new AtomicBoolean(true);
            Thread producer = new Thread(() -> {
                try {
                    result.set(channel.emit(progress("3")));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            producer.start();
            Thread.sleep(100);

            assertTrue(channel.terminate(completed()));
            producer.join(2000);
            assertFalse(result.get());
            assertEquals(3, channel.buffered());
        }
    }

    @Nested
    @DisplayName("subscription")
    class SubscriptionTests {

        @Test
        @DisplayName("a second consumer is refused while one is attached")
        void singleConsumer() {
            channel.attach();
            assertThrows(IllegalStateException.class, () -> channel.attach());
        }

        @Test
        @DisplayName("closing a stream keeps queued events for the next consumer")
        void reattach() throws Exception {
            channel.emit(progress("a"));
            channel.emit(progress("b"));

            try (EventStream first = channel.attach()) {
                assertEquals("a", ((ExecutionEvent.Progress) first.next()).message());
            }
            try (EventStream second = channel.attach()) {
                assertEquals("b", ((ExecutionEvent.Progress) second.next()).message());
            }
        }

        @Test
        @DisplayName("poll returns empty on timeout")
        void pollTimeout() throws Exception {
            EventStream stream = channel.attach();
            assertTrue(stream.poll(Duration.ofMillis(50)).isEmpty());
            assertFalse(stream.isFinished());
        }
    }
}
