package com.tessera.core.context;

import com.tessera.core.model.ErrorKind;

/**
 * A mentioned or selected file could not be pulled into the context. Fatal to the
 * execution.
 */
public class ContextBuildException extends RuntimeException {

    public enum Kind {
        NOT_FOUND(ErrorKind.NOT_FOUND),
        PERMISSION_DENIED(ErrorKind.PERMISSION_DENIED),
        TOO_LARGE(ErrorKind.TOO_LARGE),
        READ_FAILED(ErrorKind.READ_FAILED),
        BACKEND_UNREACHABLE(ErrorKind.BACKEND_UNREACHABLE);

        private final ErrorKind errorKind;

        Kind(ErrorKind errorKind) {
            this.errorKind = errorKind;
        }

        public ErrorKind toErrorKind() {
            return errorKind;
        }
    }

    private final Kind kind;
    private final String path;

    public ContextBuildException(Kind kind, String path, String message) {
        super(message);
        this.kind = kind;
        this.path = path;
    }

    public ContextBuildException(Kind kind, String path, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.path = path;
    }

    public Kind getKind() {
        return kind;
    }

    public String getPath() {
        return path;
    }
}
