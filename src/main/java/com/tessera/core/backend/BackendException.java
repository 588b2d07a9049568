package com.tessera.core.backend;

import com.tessera.core.model.ErrorKind;

public class BackendException extends RuntimeException {

    public enum Kind {
        UNREACHABLE(ErrorKind.BACKEND_UNREACHABLE),
        PROTOCOL_ERROR(ErrorKind.BACKEND_PROTOCOL_ERROR);

        private final ErrorKind errorKind;

        Kind(ErrorKind errorKind) {
            this.errorKind = errorKind;
        }

        public ErrorKind toErrorKind() {
            return errorKind;
        }
    }

    private final Kind kind;

    public BackendException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
