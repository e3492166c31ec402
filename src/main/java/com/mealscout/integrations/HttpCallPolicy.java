package com.mealscout.integrations;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Timeout and retry applied to every blocking call made through a {@code WebClient}.
 * Network errors, timeouts, 429 and 5xx responses are retried with backoff; everything
 * else fails immediately. Failures surface as {@link UpstreamException}.
 */
@Slf4j
public class HttpCallPolicy {

    private final String service;
    private final long timeoutMs;
    private final int retryMaxAttempts;
    private final long retryBackoffMs;

    public HttpCallPolicy(String service, long timeoutMs, int retryMaxAttempts, long retryBackoffMs) {
        this.service = service;
        this.timeoutMs = timeoutMs;
        this.retryMaxAttempts = retryMaxAttempts;
        this.retryBackoffMs = retryBackoffMs;
    }

    public <T> Mono<T> apply(Mono<T> call) {
        return call.timeout(requestTimeout()).retryWhen(retrySpec());
    }

    public <T> T await(Mono<T> call) {
        try {
            return apply(call).block();
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (Exceptions.isRetryExhausted(cause) && cause.getCause() != null) {
                cause = cause.getCause();
            }
            throw translate(cause);
        }
    }

    public String service() {
        return service;
    }

    private UpstreamException translate(Throwable cause) {
        if (cause instanceof UpstreamException upstream) {
            return upstream;
        }
        if (cause instanceof WebClientResponseException response) {
            log.warn("{} responded {} {}", service, response.getStatusCode().value(), response.getResponseBodyAsString());
            return new UpstreamException(service, service + " responded with status " + response.getStatusCode().value(), response);
        }
        if (cause instanceof TimeoutException) {
            return new UpstreamException(service, service + " did not respond within " + timeoutMs + " ms", cause);
        }
        log.warn("{} request failed", service, cause);
        return new UpstreamException(service, service + " request failed: " + cause.getMessage(), cause);
    }

    private boolean isRetryableError(Throwable throwable) {
        if (throwable instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return throwable instanceof WebClientRequestException || throwable instanceof TimeoutException;
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(Math.max(timeoutMs, 1000));
    }

    private Retry retrySpec() {
        int attempts = Math.max(retryMaxAttempts, 0);
        Duration backoff = Duration.ofMillis(Math.max(retryBackoffMs, 100));
        return Retry.backoff(attempts, backoff)
                .filter(this::isRetryableError);
    }
}
