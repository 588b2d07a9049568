package com.tessera.core.model;

/**
 * Immutable snapshot of a {@link Change}, safe to publish in events and API responses.
 */
public record ChangeView(
        String id,
        String executionId,
        String filePath,
        String description,
        ChangeKind kind,
        ChangeStatus status,
        int startLine,
        int endLine,
        String original,
        String modified,
        String userContent,
        boolean originalExisted
) {}
