package com.tessera.core.command;

public enum ValidationFailure {
    UNKNOWN_VERB,
    MISSING_ARGUMENT,
    MALFORMED_FLAG
}
