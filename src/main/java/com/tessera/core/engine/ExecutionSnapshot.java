package com.tessera.core.engine;

import com.tessera.core.model.ChangeView;
import com.tessera.core.model.ExecutionFailure;
import com.tessera.core.model.ExecutionStatus;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time, immutable view of an {@link Execution}.
 */
public record ExecutionSnapshot(
        String executionId,
        String sessionId,
        String verb,
        String rawInput,
        ExecutionStatus status,
        Instant startedAt,
        Instant finishedAt,
        boolean truncated,
        ExecutionFailure failure,
        List<String> warnings,
        List<ChangeView> changes,
        String output
) {}
