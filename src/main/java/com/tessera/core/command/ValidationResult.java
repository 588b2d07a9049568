package com.tessera.core.command;

public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    Valid VALID = new Valid();

    default boolean isValid() {
        return this instanceof Valid;
    }

    record Valid() implements ValidationResult {}

    record Invalid(ValidationFailure reason, String message) implements ValidationResult {}
}
