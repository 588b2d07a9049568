package com.tessera.dispatch.api;

import com.tessera.core.command.ParseException;
import com.tessera.core.engine.BusyException;
import com.tessera.core.workspace.ApplyException;
import com.tessera.core.workspace.WorkspacePathException;
import com.tessera.sandbox.SessionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.NoSuchElementException;

/**
 * Maps engine and sandbox exceptions to HTTP status codes with {@link ErrorResponse} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(ParseException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), e.getReason().name());
    }

    @ExceptionHandler(BusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(BusyException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), "BUSY");
    }

    @ExceptionHandler(ApplyException.class)
    public ResponseEntity<ErrorResponse> handleApply(ApplyException e) {
        HttpStatus status = e.getKind() == ApplyException.Kind.IO_FAILURE
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.CONFLICT;
        return respond(status, e.getMessage(), e.getKind().name());
    }

    @ExceptionHandler(SessionException.class)
    public ResponseEntity<ErrorResponse> handleSandbox(SessionException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case TARGET_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case IO_FAILURE -> HttpStatus.GONE;
        };
        return respond(status, e.getMessage(), e.getKind().name());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), "NOT_FOUND");
    }

    @ExceptionHandler(WorkspacePathException.class)
    public ResponseEntity<ErrorResponse> handlePath(WorkspacePathException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "INVALID_PATH");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), "INVALID_REQUEST");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleConflict(IllegalStateException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage(), "INVALID_STATE");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, String kind) {
        log.debug("API error {} ({}): {}", status.value(), kind, message);
        return ResponseEntity.status(status).body(new ErrorResponse(message, kind));
    }
}
