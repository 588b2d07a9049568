package com.tessera.core.metrics;

import com.tessera.core.events.EventBus;
import com.tessera.core.events.TesseraEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;

/**
 * Centralised Micrometer metrics for Tessera, fed from {@link EventBus} notifications.
 */
@Service
public class EngineMetrics {

    private final MeterRegistry registry;
    private final EventBus.Subscription subscription;

    public EngineMetrics(MeterRegistry registry, EventBus eventBus) {
        this.registry = registry;
        this.subscription = eventBus.subscribeAll(this::onEvent);
    }

    void onEvent(TesseraEvent event) {
        switch (event.eventType()) {
            case "execution.submitted" -> recordSubmitted(text(event, "verb"));
            case "execution.finished" -> recordFinished(event);
            case "changes.applied" -> recordApplied(size(event, "paths"));
            case "changes.reverted" -> recordReverted(size(event, "ledgerIds"));
            case "session.opened" -> recordCommandSession("opened");
            case "session.closed" -> recordCommandSession("closed");
            case "sandbox.session.opened" -> recordSandboxSession("opened");
            case "sandbox.session.closed" -> recordSandboxSession("closed");
            default -> { }
        }
    }

    public void recordSubmitted(String verb) {
        Counter.builder("tessera.executions.submitted")
                .tag("verb", verb)
                .register(registry)
                .increment();
    }

    public void recordExecutionResult(String verb, String status) {
        Counter.builder("tessera.executions.total")
                .tag("verb", verb)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExecutionDuration(String verb, long ms) {
        Timer.builder("tessera.execution.duration")
                .tag("verb", verb)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordProposedChanges(int count) {
        DistributionSummary.builder("tessera.execution.changes")
                .description("Changes proposed per execution")
                .register(registry)
                .record(count);
    }

    public void recordFailure(String errorKind) {
        Counter.builder("tessera.executions.failures")
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }

    public void recordApplied(int files) {
        Counter.builder("tessera.changes.applied")
                .description("Files written by committed changes")
                .register(registry)
                .increment(files);
    }

    public void recordReverted(int entries) {
        Counter.builder("tessera.changes.reverted")
                .register(registry)
                .increment(entries);
    }

    public void recordCommandSession(String transition) {
        Counter.builder("tessera.sessions")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    public void recordSandboxSession(String transition) {
        Counter.builder("tessera.sandbox.sessions")
                .tag("transition", transition)
                .register(registry)
                .increment();
    }

    @PreDestroy
    public void close() {
        subscription.unsubscribe();
    }

    private void recordFinished(TesseraEvent event) {
        String verb = text(event, "verb");
        recordExecutionResult(verb, text(event, "status"));
        if (event.payload().get("durationMs") instanceof Number ms) {
            recordExecutionDuration(verb, ms.longValue());
        }
        if (event.payload().get("changes") instanceof Number changes) {
            recordProposedChanges(changes.intValue());
        }
        if (event.payload().get("errorKind") instanceof String kind) {
            recordFailure(kind);
        }
    }

    private static String text(TesseraEvent event, String key) {
        Object value = event.payload().get(key);
        return value != null ? value.toString() : "unknown";
    }

    private static int size(TesseraEvent event, String key) {
        return event.payload().get(key) instanceof Collection<?> values ? values.size() : 0;
    }
}
