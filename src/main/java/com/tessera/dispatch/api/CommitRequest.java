package com.tessera.dispatch.api;

/**
 * Optional JSON body for a commit; {@code message} is used for the git commit when enabled.
 */
public record CommitRequest(String message) {}
