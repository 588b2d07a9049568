package com.tessera.dispatch.api;

public record ResizeRequest(int cols, int rows) {}
