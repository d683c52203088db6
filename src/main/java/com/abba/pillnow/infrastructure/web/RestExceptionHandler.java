package com.abba.pillnow.infrastructure.web;

import com.abba.pillnow.domain.service.CloudSyncException;
import com.abba.pillnow.domain.service.VerifierUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({VerifierUnavailableException.class, CloudSyncException.class})
    public ResponseEntity<Map<String, Object>> badGateway(IllegalStateException e) {
        log.warn("Upstream failure: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> unexpected(RuntimeException e) {
        log.error("Unhandled request failure", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Something went wrong!");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("success", false, "message", message == null ? status.getReasonPhrase() : message));
    }
}
