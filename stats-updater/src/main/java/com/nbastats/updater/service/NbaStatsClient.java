package com.nbastats.updater.service;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.exception.TaskCancelledException;
import com.nbastats.updater.exception.TransientExternalException;
import com.nbastats.updater.model.StatsResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thin client over the stats.nba.com REST API.
 *
 * Rate limiting: the provider throttles aggressively and shares one budget across all
 * endpoints, so every fetch sleeps a fixed minimum delay before its first attempt.
 * Retries follow {@link RetryPolicy}; each fetch gets a fresh retry budget.
 *
 * The blocking HTTP call runs on the stats-fetch worker pool and is awaited with a
 * timeout, so a hung connection cannot stall the pipeline thread.
 */
@Service
@Slf4j
public class NbaStatsClient {

    private final RestTemplate restTemplate;
    private final AsyncTaskExecutor fetchExecutor;
    private final StatsUpdaterProperties.Api api;
    private final RetryPolicy retryPolicy;
    private final RetryConfig retryConfig;

    public NbaStatsClient(RestTemplate restTemplate,
                          @Qualifier("statsFetchExecutor") AsyncTaskExecutor fetchExecutor,
                          StatsUpdaterProperties properties) {
        this.restTemplate = restTemplate;
        this.fetchExecutor = fetchExecutor;
        this.api = properties.getApi();
        this.retryPolicy = RetryPolicy.from(api);
        this.retryConfig = retryPolicy.retryConfig();
    }

    /**
     * Fetch one endpoint, retrying transient failures.
     *
     * @throws TransientExternalException once the retry budget is exhausted
     * @throws PermanentDataException     for non-retryable rejections and empty payloads
     * @throws TaskCancelledException     if the calling thread is interrupted
     */
    public StatsResponse fetch(StatsRequest request) {
        URI uri = buildUri(request);
        HttpEntity<Void> entity = new HttpEntity<>(buildHeaders());
        AtomicInteger attempts = new AtomicInteger();

        Retry retry = Retry.of("nba-stats-" + request.endpoint(), retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Stats request {} failed (attempt {}/{}), retrying in {} ms: {}",
                request.endpoint(), event.getNumberOfRetryAttempts(), retryPolicy.getMaxAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        applyRateLimit(request);

        try {
            return retry.executeCheckedSupplier(() -> {
                attempts.incrementAndGet();
                return fetchOnce(request, uri, entity);
            });
        } catch (Throwable failure) {
            throw translate(request, failure, attempts.get());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private StatsResponse fetchOnce(StatsRequest request, URI uri, HttpEntity<Void> entity) {
        log.debug("Calling stats API: {}", uri);
        Future<ResponseEntity<StatsResponse>> future = fetchExecutor.submit(
                () -> restTemplate.exchange(uri, HttpMethod.GET, entity, StatsResponse.class));

        ResponseEntity<StatsResponse> response;
        try {
            response = future.get(api.getRequestTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ResourceAccessException("Request to " + request.endpoint()
                    + " timed out after " + api.getRequestTimeoutMs() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted while fetching " + request.endpoint(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Request to " + request.endpoint() + " failed", cause);
        }

        StatsResponse body = response.getBody();
        if (body == null || body.getResultSets() == null) {
            throw new PermanentDataException("Empty response from " + request.endpoint());
        }
        log.debug("Stats API returned {} result set(s) for {}", body.getResultSets().size(), request.endpoint());
        return body;
    }

    private RuntimeException translate(StatsRequest request, Throwable failure, int attempts) {
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure instanceof TaskCancelledException cancelled) {
            return cancelled;
        }
        if (Thread.currentThread().isInterrupted()) {
            return new TaskCancelledException("Interrupted while fetching " + request.endpoint(), failure);
        }

        if (!retryPolicy.isRetryable(failure)) {
            log.error("Stats request {} failed permanently: {}", request, failure.getMessage());
            if (failure instanceof PermanentDataException permanent) {
                return permanent;
            }
            if (RetryPolicy.isMalformedPayload(failure)) {
                return new PermanentDataException("Malformed response from " + request.endpoint()
                        + ": " + failure.getMessage(), failure);
            }
            return new PermanentDataException("Provider rejected " + request.endpoint()
                    + ": " + failure.getMessage(), failure);
        }

        log.error("Stats request {} failed after {} attempts: {}", request, attempts, failure.getMessage());
        return new TransientExternalException("Stats request " + request.endpoint() + " failed after "
                + attempts + " attempts: " + failure.getMessage(), attempts, failure);
    }

    private URI buildUri(StatsRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl() + "/" + request.endpoint());
        request.params().forEach((name, value) -> builder.queryParam(name, value));
        return builder.encode().build().toUri();
    }

    private HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN, MediaType.ALL));
        headers.set(HttpHeaders.USER_AGENT, api.getUserAgent());
        headers.set(HttpHeaders.REFERER, api.getReferer());
        headers.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9");
        headers.set(HttpHeaders.CACHE_CONTROL, "no-cache");
        headers.set("x-nba-stats-origin", "stats");
        headers.set("x-nba-stats-token", "true");
        return headers;
    }

    private void applyRateLimit(StatsRequest request) {
        long delayMs = retryPolicy.getMinRequestDelay().toMillis();
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException("Interrupted before fetching " + request.endpoint(), e);
        }
    }
}
