package com.phillippitts.modelorchestrator.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassTest {

    @Test
    void configurationClassesAreNotRetryable() {
        assertThat(ErrorClass.AUTH_ERROR.isRetryable()).isFalse();
        assertThat(ErrorClass.INVALID_REQUEST_ERROR.isRetryable()).isFalse();
        assertThat(ErrorClass.NOT_FOUND_ERROR.isRetryable()).isFalse();
    }

    @Test
    void transientClassesAreRetryable() {
        assertThat(ErrorClass.RATE_LIMIT_ERROR.isRetryable()).isTrue();
        assertThat(ErrorClass.TIMEOUT_ERROR.isRetryable()).isTrue();
        assertThat(ErrorClass.UNKNOWN_ERROR.isRetryable()).isTrue();
    }

    @Test
    void looksUpByWireNameIgnoringCase() {
        assertThat(ErrorClass.fromWireName("not_found_error")).contains(ErrorClass.NOT_FOUND_ERROR);
        assertThat(ErrorClass.fromWireName(" Rate_Limit_Error ")).contains(ErrorClass.RATE_LIMIT_ERROR);
        assertThat(ErrorClass.fromWireName("overloaded_error")).isEmpty();
        assertThat(ErrorClass.fromWireName(null)).isEmpty();
    }
}
