package com.tessera.core.model;

/**
 * Why an execution failed. The first four come from context building, the rest
 * from streaming. BACKEND_UNREACHABLE can come from either.
 */
public enum ErrorKind {
    NOT_FOUND,
    PERMISSION_DENIED,
    TOO_LARGE,
    READ_FAILED,
    BACKEND_UNREACHABLE,
    BACKEND_PROTOCOL_ERROR,
    TIMEOUT,
    INTERNAL
}
