package io.github.drompincen.folioagent.gateway.controller;

import io.github.drompincen.folioagent.runtime.agent.TurnCancelledException;
import io.github.drompincen.folioagent.runtime.agent.llm.ModelNotConfiguredException;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointConflictException;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStorageException;
import io.github.drompincen.folioagent.runtime.thread.AuthorizationException;
import io.github.drompincen.folioagent.runtime.thread.InvalidThreadIdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<Map<String, String>> handleAuthorization(AuthorizationException ex) {
        log.warn("Rejected thread access: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler({InvalidThreadIdException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException ex) {
        return error(HttpStatus.BAD_REQUEST, "Missing header " + ex.getHeaderName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid value for " + ex.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(ModelNotConfiguredException.class)
    public ResponseEntity<Map<String, String>> handleModelNotConfigured(ModelNotConfiguredException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(CheckpointConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(CheckpointConflictException ex) {
        log.warn("Checkpoint conflict surfaced to caller: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(CheckpointStorageException.class)
    public ResponseEntity<Map<String, String>> handleStorage(CheckpointStorageException ex) {
        log.error("Checkpoint storage failure", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Checkpoint storage unavailable");
    }

    @ExceptionHandler(TurnCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(TurnCancelledException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Turn cancelled");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex) {
        log.error("Unhandled error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
