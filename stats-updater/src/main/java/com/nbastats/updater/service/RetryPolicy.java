package com.nbastats.updater.service;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.exception.TaskCancelledException;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.web.client.HttpStatusCodeException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry rules for calls to the stats provider: how many attempts, how long to back off,
 * and which failures are worth retrying at all.
 *
 * Backoff after failed attempt k (0-based):
 *   rate limited (429):  base * 3^k + uniform[rateLimitJitterMin, rateLimitJitterMax]
 *   other transient:     base * 2^k + uniform[0, transientJitterMax]
 * The exponential term never exceeds maxBackoff.
 */
@Value
@Builder
public class RetryPolicy {

    public enum FailureKind {
        RATE_LIMITED, TRANSIENT, PERMANENT, CANCELLED
    }

    private static final int MAX_CAUSE_DEPTH = 10;

    int maxAttempts;
    Duration baseDelay;
    Duration maxBackoff;
    Duration minRequestDelay;
    Duration rateLimitJitterMin;
    Duration rateLimitJitterMax;
    Duration transientJitterMax;

    public static RetryPolicy from(StatsUpdaterProperties.Api api) {
        return RetryPolicy.builder()
                .maxAttempts(Math.max(1, api.getMaxAttempts()))
                .baseDelay(Duration.ofMillis(api.getBackoffBaseMs()))
                .maxBackoff(Duration.ofMillis(api.getMaxBackoffMs()))
                .minRequestDelay(Duration.ofMillis(api.getMinRequestDelayMs()))
                .rateLimitJitterMin(Duration.ofMillis(api.getRateLimitJitterMinMs()))
                .rateLimitJitterMax(Duration.ofMillis(api.getRateLimitJitterMaxMs()))
                .transientJitterMax(Duration.ofMillis(api.getTransientJitterMaxMs()))
                .build();
    }

    public FailureKind classify(Throwable failure) {
        if (failure instanceof TaskCancelledException) {
            return FailureKind.CANCELLED;
        }
        if (failure instanceof PermanentDataException || isMalformedPayload(failure)) {
            return FailureKind.PERMANENT;
        }
        if (failure instanceof HttpStatusCodeException httpError) {
            int status = httpError.getStatusCode().value();
            if (status == 429) {
                return FailureKind.RATE_LIMITED;
            }
            return status >= 500 ? FailureKind.TRANSIENT : FailureKind.PERMANENT;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * RestTemplate reports an unreadable 2xx body as a plain RestClientException wrapping the
     * converter failure, so the whole cause chain is searched.
     */
    static boolean isMalformedPayload(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof HttpMessageConversionException || current instanceof JsonProcessingException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public boolean isRetryable(Throwable failure) {
        FailureKind kind = classify(failure);
        return kind == FailureKind.RATE_LIMITED || kind == FailureKind.TRANSIENT;
    }

    /**
     * @param failedAttempt 0 for the first failure
     */
    public Duration backoff(int failedAttempt, Throwable failure) {
        if (classify(failure) == FailureKind.RATE_LIMITED) {
            return exponential(3, failedAttempt)
                    .plus(jitter(rateLimitJitterMin, rateLimitJitterMax));
        }
        return exponential(2, failedAttempt)
                .plus(jitter(Duration.ZERO, transientJitterMax));
    }

    /**
     * Resilience4j configuration carrying this policy. The interval function receives the
     * 1-based number of attempts made so far.
     */
    public RetryConfig retryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .retryOnException(this::isRetryable)
                .intervalBiFunction((attempts, outcome) -> {
                    Throwable failure = outcome.isLeft() ? outcome.getLeft() : null;
                    return backoff(attempts - 1, failure).toMillis();
                })
                .build();
    }

    private Duration exponential(int factor, int failedAttempt) {
        long multiplier = (long) Math.pow(factor, Math.max(0, failedAttempt));
        long millis = baseDelay.toMillis() * multiplier;
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    private static Duration jitter(Duration min, Duration max) {
        long lo = min.toMillis();
        long hi = max.toMillis();
        if (hi <= lo) {
            return Duration.ofMillis(lo);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(lo, hi + 1));
    }
}
