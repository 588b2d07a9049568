package com.tessera.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param workspace workspace root directory; nullable, defaults to the server's working directory
 */
public record OpenSessionRequest(String workspace) {}
