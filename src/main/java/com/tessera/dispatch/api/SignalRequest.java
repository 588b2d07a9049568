package com.tessera.dispatch.api;

/** Body of a sandbox signal request; {@code signal} is a name such as INT or SIGTERM. */
public record SignalRequest(String signal) {}
