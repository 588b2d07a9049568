package com.tessera.dispatch.api;

/**
 * Inbound JSON body for a change decision.
 *
 * @param decision accept, reject or edit
 * @param content  replacement content, required for edit
 */
public record DecisionRequest(String decision, String content) {}
