package com.tessera.core.model;

public record ExecutionFailure(ErrorKind kind, String reason) {}
