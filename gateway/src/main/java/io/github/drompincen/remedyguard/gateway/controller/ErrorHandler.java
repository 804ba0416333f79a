package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.protocol.api.ErrorResponse;
import io.github.drompincen.remedyguard.protocol.error.DecisionErrorKind;
import io.github.drompincen.remedyguard.protocol.error.DecisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(DecisionException.class)
    public ResponseEntity<ErrorResponse> handleDecision(DecisionException ex) {
        HttpStatus status = statusFor(ex.kind());
        if (status.is5xxServerError()) {
            log.error("Decision failed with {}: {}", ex.kind(), ex.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.kind(), ex.getMessage(), ex.decision().orElse(null)));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.of(DecisionErrorKind.INPUT_ERROR,
                        "Malformed request body: " + ex.getMostSpecificCause().getMessage()));
    }

    static HttpStatus statusFor(DecisionErrorKind kind) {
        return switch (kind) {
            case CONFIRMATION_REQUIRED -> HttpStatus.BAD_REQUEST;
            case INPUT_ERROR -> HttpStatus.UNPROCESSABLE_ENTITY;
            case GENERATION_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case GENERATION_ERROR, AUDIT_WRITE_ERROR, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
