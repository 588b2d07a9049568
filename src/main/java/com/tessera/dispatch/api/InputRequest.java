package com.tessera.dispatch.api;

/**
 * Keystrokes for a sandbox session: {@code text} as UTF-8, or {@code base64} for raw bytes.
 */
public record InputRequest(String text, String base64) {}
