package com.phillippitts.modelorchestrator.presentation.exception;

import com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException;
import com.phillippitts.modelorchestrator.exception.UnsupportedModelException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidRequestReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidRequest(
                new InvalidOrchestrationRequestException("Prompt must not be empty"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidOrchestrationRequestException")
                .contains("Prompt must not be empty");
    }

    @Test
    void unsupportedModelReturns400() {
        ResponseEntity<?> response = handler.handleUnsupportedModel(new UnsupportedModelException("llama"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("Unsupported model: llama");
    }

    @Test
    void unreadableBodyReturns400() {
        ResponseEntity<?> response = handler.handleUnreadable(
                new HttpMessageNotReadableException("JSON parse error", new MockHttpInputMessage(new byte[0])));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("MalformedRequest");
    }

    @Test
    void unexpectedReturns500WithoutInternals() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("db password: secret123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret123")
                .doesNotContain("IllegalStateException");
    }

    @Test
    void errorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleInvalidRequest(new InvalidOrchestrationRequestException("x"));
        String body = String.valueOf(response.getBody());

        assertThat(body).contains("errorCode=", "message=", "details=", "timestamp=");
    }
}
