package com.tessera.core.command;

/**
 * Thrown when submitted input does not validate. Nothing is created for the input.
 */
public class ParseException extends RuntimeException {

    private final ValidationResult.Invalid result;

    public ParseException(ValidationResult.Invalid result) {
        super(result.message());
        this.result = result;
    }

    public ValidationFailure getReason() {
        return result.reason();
    }

    public ValidationResult.Invalid getResult() {
        return result;
    }
}
