package com.piperplatform.orchestrator.controller;

import com.piperplatform.common.exception.InvalidEventException;
import com.piperplatform.common.exception.SafetyGateException;
import com.piperplatform.orchestrator.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps the safety-gate exception taxonomy to HTTP status codes.
 */
@RestControllerAdvice
public class SafetyGateExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SafetyGateExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SessionNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidEventException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(SafetyGateException.class)
    public ResponseEntity<Map<String, String>> safetyGateFailure(SafetyGateException e) {
        log.error("Safety gate failure. component={}", e.getComponent(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : status.getReasonPhrase();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
