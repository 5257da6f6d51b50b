package com.flow.sync.service.api.advice;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    @ParameterizedTest
    @CsvSource({
            "VALIDATION_ERROR, BAD_REQUEST",
            "FORBIDDEN, FORBIDDEN",
            "NOT_FOUND, NOT_FOUND",
            "CONFLICT, CONFLICT",
            "DUPLICATE_ID, CONFLICT",
            "CAPACITY_EXCEEDED, GONE",
            "REFERENTIAL_INTEGRITY, UNPROCESSABLE_ENTITY",
            "ACTOR_BUSY, TOO_MANY_REQUESTS",
            "WORKFLOW_UNAVAILABLE, SERVICE_UNAVAILABLE",
            "MUTATION_TIMEOUT, GATEWAY_TIMEOUT",
            "SOMETHING_ELSE, INTERNAL_SERVER_ERROR"
    })
    void statusFor_mapsErrorCodes(String errorCode, HttpStatus expected) {
        assertThat(GlobalExceptionHandler.statusFor(errorCode)).isEqualTo(expected);
    }
}
