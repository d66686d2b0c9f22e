package com.deepansh.collab.voice;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Retry and circuit breaker around the HTTP media client.
 *
 * Fallbacks rethrow as {@link MediaUnavailableException} so the caller can
 * tell the user voice credentials are unavailable without touching the
 * signaling state.
 */
@Component
@Primary
@Slf4j
public class ResilientMediaServiceClient implements MediaServiceClient {

    private final MediaServiceClient delegate;

    public ResilientMediaServiceClient(@Qualifier("httpMediaServiceClient") MediaServiceClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "mediaClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "mediaClient", fallbackMethod = "circuitBreakerFallback")
    public MediaGrant requestGrant(String channelName, String userId) {
        return delegate.requestGrant(channelName, userId);
    }

    public MediaGrant retryFallback(String channelName, String userId, Exception ex) {
        log.error("Media grant failed after all retries [channel={}, userId={}]: {}",
                channelName, userId, ex.getMessage());
        throw new MediaUnavailableException("Media service unreachable", ex);
    }

    public MediaGrant circuitBreakerFallback(String channelName, String userId, Exception ex) {
        log.error("Media circuit breaker is OPEN, rejecting grant [channel={}]: {}", channelName, ex.getMessage());
        throw new MediaUnavailableException("Media service temporarily unavailable", ex);
    }
}
