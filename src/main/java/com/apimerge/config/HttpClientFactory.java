package com.apimerge.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Creates the HTTP client used to fetch service documents.
 */
@Configuration
public class HttpClientFactory {

    private static final int MAX_DOCUMENT_BYTES = 16 * 1024 * 1024;

    /**
     * A {@link WebClient} that retries HTTP 429 and 503 responses with exponential backoff,
     * starting at 500ms and doubling, up to {@code merge.retrieval.max-attempts} attempts.
     * Large documents are accepted up to 16 MB.
     *
     * @param properties The merge settings supplying the attempt limit.
     * @return The configured client.
     */
    @Bean
    public WebClient webClient(MergeProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getRetrieval().getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2))
                .retryOnException(e -> e instanceof WebClientResponseException.ServiceUnavailable
                        || e instanceof WebClientResponseException.TooManyRequests)
                .build();

        Retry retry = RetryRegistry.of(config).retry("api-merge-http");

        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_DOCUMENT_BYTES))
                .filter((request, next) -> next.exchange(request)
                        .flatMap(HttpClientFactory::failOnRetryableStatus)
                        .transform(RetryOperator.of(retry)))
                .build();
    }

    private static Mono<ClientResponse> failOnRetryableStatus(ClientResponse response) {
        int status = response.statusCode().value();
        if (status == 429 || status == 503) {
            return response.createException().flatMap(Mono::error);
        }
        return Mono.just(response);
    }
}
