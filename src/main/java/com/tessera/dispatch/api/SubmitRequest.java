package com.tessera.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/executions.
 *
 * @param input       raw command line, e.g. "/refactor extract method @src/Main.java"
 * @param pinnedFiles files selected in the client; nullable
 */
public record SubmitRequest(
    String input,
    @JsonProperty("pinned_files") List<String> pinnedFiles
) {}
