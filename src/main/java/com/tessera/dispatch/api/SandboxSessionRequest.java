package com.tessera.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for opening a sandbox session. Zero or missing dimensions mean 80x24.
 */
public record SandboxSessionRequest(
    @JsonProperty("target_id") String targetId,
    int cols,
    int rows
) {}
