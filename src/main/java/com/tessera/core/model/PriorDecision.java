package com.tessera.core.model;

/**
 * A decision recorded earlier in the same command session, fed back to the
 * reasoning backend as conversation memory.
 */
public record PriorDecision(String executionId, String changeId, String filePath, ChangeStatus outcome) {}
