package org.lime.caddie.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

@Component
public class UpstreamCallPolicy {

    private static final Logger log = LoggerFactory.getLogger(UpstreamCallPolicy.class);

    private final GeoProperties properties;

    public UpstreamCallPolicy(GeoProperties properties) {
        this.properties = properties;
    }

    public <T> T execute(String operation, Mono<T> request) {
        try {
            return request
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .retryWhen(Retry.backoff(properties.getMaxRetries(), Duration.ofMillis(properties.getRetryBackoffMs()))
                            .filter(UpstreamCallPolicy::isRetryable))
                    .block();
        } catch (RuntimeException ex) {
            log.warn("[UpstreamCallPolicy] {} failed (max retries {}): {}", operation, properties.getMaxRetries(), ex.toString());
            throw new UpstreamUnavailableException(operation + " is unavailable", ex);
        }
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return true;
    }
}
