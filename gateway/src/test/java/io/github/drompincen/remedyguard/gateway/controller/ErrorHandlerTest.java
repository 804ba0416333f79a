package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.ErrorResponse;
import io.github.drompincen.remedyguard.protocol.error.AuditWriteException;
import io.github.drompincen.remedyguard.protocol.error.ConfirmationRequiredException;
import io.github.drompincen.remedyguard.protocol.error.DecisionErrorKind;
import io.github.drompincen.remedyguard.protocol.error.GenerationException;
import io.github.drompincen.remedyguard.protocol.error.GenerationTimeoutException;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorHandlerTest {

    private final ErrorHandler handler = new ErrorHandler();

    @Test
    void confirmationRequiredIs400WithDenial() {
        DecisionRecord denial = DecisionRecord.denied("malware-001", "Delete it.",
                "Destructive action denied: caller must confirm.", Instant.now());

        ResponseEntity<ErrorResponse> response = handler.handleDecision(new ConfirmationRequiredException(denial));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo(DecisionErrorKind.CONFIRMATION_REQUIRED);
        assertThat(response.getBody().decision()).isEqualTo(denial);
    }

    @Test
    void eachKindMapsToItsStatus() {
        assertThat(handler.handleDecision(new InputException("bad")).getStatusCode())
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(handler.handleDecision(new GenerationException("down")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(handler.handleDecision(new GenerationTimeoutException(Duration.ofSeconds(60))).getStatusCode())
                .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(handler.handleDecision(new AuditWriteException("disk full")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(ErrorHandler.statusFor(DecisionErrorKind.INTERNAL_ERROR))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void unreadableBodyIsInputError() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException("JSON parse error",
                new IllegalArgumentException("Unexpected character"), new MockHttpInputMessage(new byte[0]));

        ResponseEntity<ErrorResponse> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().code()).isEqualTo(DecisionErrorKind.INPUT_ERROR);
        assertThat(response.getBody().message()).contains("Unexpected character");
        assertThat(response.getBody().decision()).isNull();
    }
}
