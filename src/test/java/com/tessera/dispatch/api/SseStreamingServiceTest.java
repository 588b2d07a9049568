package com.tessera.dispatch.api;

import com.tessera.core.events.EventBus;
import com.tessera.core.events.EventChannel;
import com.tessera.core.events.EventStream;
import com.tessera.core.events.ExecutionEvent;
import com.tessera.core.events.TesseraEvent;
import com.tessera.sandbox.SessionOutputBuffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SseStreamingService}.
 */
class SseStreamingServiceTest {

    private static final String EXEC = "exe-0001-aaaaaa";

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    @AfterEach
    void tearDown() {
        service.stopHeartbeat();
    }

    // -- Session notifications -------------------------------------------------

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitterTests {

        @Test
        @DisplayName("each call creates a distinct emitter and registration")
        void multipleEmittersForSameSession() {
            assertEquals(0, service.activeEmitterCount());

            SseEmitter first = service.createEmitter("ses-1");
            SseEmitter second = service.createEmitter("ses-1");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("publishing for other scopes does not disturb registrations")
        void noCrossDelivery() {
            service.createEmitter("ses-1");
            service.createEmitter("ses-2");

            eventBus.publish(TesseraEvent.of("execution.submitted", "ses-1", EXEC, Map.of("verb", "ask")));

            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent publishing does not throw")
        void concurrentPublishDoesNotThrow() throws InterruptedException {
            service.createEmitter("ses-1");

            int threadCount = 5;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                final int threadId = t;
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(TesseraEvent.of("event." + threadId + "." + i, "ses-1", null, Map.of()));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    // -- Execution streams ----------------------------------------------------

    @Nested
    @DisplayName("streamExecution")
    class StreamExecutionTests {

        @Test
        @DisplayName("registration is released after the terminal event")
        void releasesAfterTerminal() throws Exception {
            EventChannel channel = new EventChannel(EXEC, 16, e -> { });
            channel.emit(seq -> new ExecutionEvent.Progress(EXEC, seq, Instant.now(), "context", "Reading files"));
            channel.terminate(seq -> new ExecutionEvent.Completed(EXEC, seq, Instant.now(), 0, false));

            service.streamExecution(EXEC, channel.attach());

            awaitCondition(() -> service.activeEmitterCount() == 0);
        }

        @Test
        @DisplayName("the stream is detached afterwards so the execution can be subscribed again")
        void detachesStream() throws Exception {
            EventChannel channel = new EventChannel(EXEC, 16, e -> { });
            channel.terminate(seq -> new ExecutionEvent.Completed(EXEC, seq, Instant.now(), 0, false));

            service.streamExecution(EXEC, channel.attach());
            awaitCondition(() -> service.activeEmitterCount() == 0);

            try (EventStream again = channel.attach()) {
                assertNotNull(again);
            }
        }

        @Test
        @DisplayName("an unfinished execution keeps its registration")
        void staysWhileRunning() throws Exception {
            EventChannel channel = new EventChannel(EXEC, 16, e -> { });

            service.streamExecution(EXEC, channel.attach());
            Thread.sleep(100);
            assertEquals(1, service.activeEmitterCount());

            channel.terminate(seq -> new ExecutionEvent.Cancelled(EXEC, seq, Instant.now()));
            awaitCondition(() -> service.activeEmitterCount() == 0);
        }
    }

    // -- Sandbox output -------------------------------------------------------

    @Nested
    @DisplayName("streamOutput")
    class StreamOutputTests {

        @Test
        @DisplayName("registration is released once the shell ended and output drained")
        void releasesWhenDrained() throws Exception {
            var buffer = new SessionOutputBuffer(64, Duration.ofSeconds(30), Duration.ofSeconds(2), Clock.systemUTC());
            buffer.append("hello\n".getBytes(StandardCharsets.UTF_8));
            buffer.markClosed();

            service.streamOutput("sbx-00000001", buffer.attach());

            awaitCondition(() -> service.activeEmitterCount() == 0);
            assertFalse(buffer.isAttached());
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }
}
