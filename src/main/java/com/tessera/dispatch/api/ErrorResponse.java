package com.tessera.dispatch.api;

/**
 * JSON body of every failed API call.
 *
 * @param error human-readable reason
 * @param kind  machine-readable category, e.g. BUSY, STALE_CHANGE, NOT_FOUND
 */
public record ErrorResponse(String error, String kind) {}
