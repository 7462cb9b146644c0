package com.keyco.exception;

import com.keyco.model.enums.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionTest {

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503, 504, 599})
    void shouldRetryThrottlingAndServerErrors(int status) {
        assertThat(ApiException.http(status, "").shouldRetry()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 400, 401, 403, 404, 422, 600})
    void shouldNotRetryOtherStatuses(int status) {
        assertThat(ApiException.http(status, "").shouldRetry()).isFalse();
    }

    @Test
    void shouldRetryTransportFailuresButNotCancellation() {
        assertThat(ApiException.network("reset", null).shouldRetry()).isTrue();
        assertThat(ApiException.of(ErrorKind.TIMEOUT).shouldRetry()).isTrue();
        assertThat(ApiException.cancelled().shouldRetry()).isFalse();
        assertThat(ApiException.cancelled().getKind()).isEqualTo(ErrorKind.NETWORK_ERROR);
    }

    @Test
    void shouldNeverRetryLocalOrParseFailures() {
        for (ErrorKind kind : new ErrorKind[]{ErrorKind.INVALID_REQUEST, ErrorKind.INVALID_RESPONSE,
                ErrorKind.NO_DATA, ErrorKind.NO_CONNECTIVITY, ErrorKind.CIRCUIT_OPEN, ErrorKind.BACKEND_UNAVAILABLE}) {
            assertThat(ApiException.of(kind).shouldRetry()).as(kind.name()).isFalse();
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "400|Couldn't process that. Please try again.",
            "401|Authentication problem. Please try again.",
            "403|Access denied. Please try again.",
            "404|Couldn't find that. Please try again.",
            "429|Too many requests. Please wait and try again.",
            "500|AI isn't responding. Please try again.",
            "502|AI isn't responding. Please try again.",
            "503|AI isn't responding. Please try again.",
            "504|Taking too long. Please try again.",
            "418|Something went wrong. Please try again."
    })
    void shouldMapStatusToUserMessage(int status, String expected) {
        assertThat(ApiException.http(status, "raw backend text").userMessage()).isEqualTo(expected);
    }

    @Test
    void shouldUseKindMessageForNonHttpErrors() {
        assertThat(ApiException.of(ErrorKind.NO_CONNECTIVITY).userMessage()).isEqualTo("No internet. Please try again.");
        assertThat(ApiException.of(ErrorKind.NO_DATA).userMessage()).isEqualTo("No response. Please try again.");
    }

    @Test
    void shouldAppendExhaustedSuffixWithoutLosingStatus() {
        // Act
        ApiException exhausted = ApiException.http(429, "slow down").withRetriesExhausted(3);

        // Assert
        assertThat(exhausted.getStatusCode()).isEqualTo(429);
        assertThat(exhausted.getDetail()).isEqualTo("slow down");
        assertThat(exhausted.userMessage())
                .isEqualTo("Too many requests. Please wait and try again. Retried 3 times without success.");
        assertThat(exhausted.getMessage()).contains("HTTP_ERROR(429)").contains("Retried 3 times");
    }
}
