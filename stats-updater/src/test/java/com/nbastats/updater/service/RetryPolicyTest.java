package com.nbastats.updater.service;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.exception.TaskCancelledException;
import com.nbastats.updater.service.RetryPolicy.FailureKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.from(new StatsUpdaterProperties.Api());

    @Test
    void should_ClassifyTooManyRequestsAsRateLimited() {
        assertThat(policy.classify(HttpClientErrorException.create(
                HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8)))
                .isEqualTo(FailureKind.RATE_LIMITED);
    }

    @Test
    void should_ClassifyServerErrorsAndIoAsTransient() {
        assertThat(policy.classify(new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE)))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new ResourceAccessException("read timed out", new SocketTimeoutException())))
                .isEqualTo(FailureKind.TRANSIENT);
        assertThat(policy.classify(new IllegalStateException("connection reset")))
                .isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void should_NotRetryClientErrorsOrBadPayloads() {
        assertThat(policy.isRetryable(new HttpClientErrorException(HttpStatus.BAD_REQUEST))).isFalse();
        assertThat(policy.isRetryable(new HttpClientErrorException(HttpStatus.NOT_FOUND))).isFalse();
        assertThat(policy.isRetryable(new PermanentDataException("no result sets"))).isFalse();
        assertThat(policy.isRetryable(new HttpMessageNotReadableException("bad json", (HttpInputMessage) null)))
                .isFalse();
    }

    @Test
    void should_NotRetry_When_ConversionFailureIsWrapped() {
        HttpMessageNotReadableException unreadable =
                new HttpMessageNotReadableException("JSON parse error", (HttpInputMessage) null);
        RestClientException extraction = new RestClientException(
                "Error while extracting response for type [StatsResponse]", unreadable);

        assertThat(policy.classify(extraction)).isEqualTo(FailureKind.PERMANENT);
        assertThat(policy.isRetryable(extraction)).isFalse();
        assertThat(policy.isRetryable(new RestClientException("I/O error", new SocketTimeoutException()))).isTrue();
    }

    @Test
    void should_NeverRetryCancellation() {
        assertThat(policy.classify(new TaskCancelledException("stop"))).isEqualTo(FailureKind.CANCELLED);
        assertThat(policy.isRetryable(new TaskCancelledException("stop"))).isFalse();
    }

    @Test
    void should_DoubleTransientBackoffWithBoundedJitter() {
        RuntimeException failure = new HttpServerErrorException(HttpStatus.BAD_GATEWAY);

        for (int i = 0; i < 20; i++) {
            assertThat(policy.backoff(0, failure).toMillis()).isBetween(2_000L, 3_000L);
            assertThat(policy.backoff(1, failure).toMillis()).isBetween(4_000L, 5_000L);
            assertThat(policy.backoff(2, failure).toMillis()).isBetween(8_000L, 9_000L);
        }
    }

    @Test
    void should_TripleRateLimitBackoffWithLongerJitter() {
        RuntimeException failure = new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS);

        for (int i = 0; i < 20; i++) {
            assertThat(policy.backoff(0, failure).toMillis()).isBetween(3_000L, 5_000L);
            assertThat(policy.backoff(1, failure).toMillis()).isBetween(7_000L, 9_000L);
            assertThat(policy.backoff(2, failure).toMillis()).isBetween(19_000L, 21_000L);
        }
    }

    @Test
    void should_CapExponentialTerm() {
        RuntimeException failure = new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS);

        assertThat(policy.backoff(6, failure).toMillis()).isBetween(31_000L, 33_000L);
    }

    @Test
    void should_UseExactDelays_When_JitterDisabled() {
        RetryPolicy exact = RetryPolicy.builder()
                .maxAttempts(3)
                .baseDelay(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(10))
                .minRequestDelay(Duration.ZERO)
                .rateLimitJitterMin(Duration.ZERO)
                .rateLimitJitterMax(Duration.ZERO)
                .transientJitterMax(Duration.ZERO)
                .build();

        assertThat(exact.backoff(2, new IllegalStateException())).isEqualTo(Duration.ofMillis(400));
        assertThat(exact.backoff(2, new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS)))
                .isEqualTo(Duration.ofMillis(900));
    }
}
