package com.apimerge.service.impl;

import com.apimerge.config.MergeProperties;
import com.apimerge.engine.DocumentCodec;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.RetrievalOutcome;
import com.apimerge.model.Source;
import com.apimerge.service.api.SchemaRetrievalService;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Fetches documents over HTTP with the shared {@link WebClient}, or from the local file system
 * for locations that are not {@code http(s)} URLs.
 * <p>
 * The response's {@code Content-Type} decides how the body is decoded (see {@link DocumentCodec});
 * for files the extension is used instead. {@link #fetchAll} fans out over all sources with
 * {@code merge.retrieval.concurrency} requests in flight and a {@code merge.retrieval.timeout}
 * limit per source.
 */
@Service
@Slf4j
public class SchemaRetrievalServiceImpl implements SchemaRetrievalService {

    private final WebClient webClient;
    private final DocumentCodec documentCodec;
    private final Duration timeout;
    private final int concurrency;

    public SchemaRetrievalServiceImpl(WebClient webClient, DocumentCodec documentCodec, MergeProperties properties) {
        this.webClient = webClient;
        this.documentCodec = documentCodec;
        this.timeout = properties.getRetrieval().getTimeout();
        this.concurrency = Math.max(1, properties.getRetrieval().getConcurrency());
    }

    @Override
    public JsonNode fetch(String location) {
        try {
            return fetchAsync(location).timeout(timeout).block();
        } catch (ApiMergeException e) {
            throw e;
        } catch (Exception e) {
            Throwable cause = Exceptions.unwrap(e);
            throw new ApiMergeException("Failed to fetch document from " + location + ": " + describe(cause), cause);
        }
    }

    @Override
    public List<RetrievalOutcome> fetchAll(List<Source> sources) {
        log.info("Fetching documents for {} sources", sources.size());
        return Flux.fromIterable(sources)
                .flatMapSequential(source -> fetchAsync(source.schemaLocation())
                        .timeout(timeout)
                        .map(document -> RetrievalOutcome.success(source, document))
                        .onErrorResume(e -> {
                            log.error("Error loading {} ({}): {}", source.name(), source.schemaLocation(), describe(e));
                            return Mono.just(RetrievalOutcome.failure(source, describe(e)));
                        }), concurrency)
                .collectList()
                .block();
    }

    private Mono<JsonNode> fetchAsync(String location) {
        if (location == null || location.isBlank()) {
            return Mono.error(new ApiMergeException("no schema location configured"));
        }
        if (isRemote(location)) {
            return webClient.get()
                    .uri(location)
                    .retrieve()
                    .toEntity(String.class)
                    .map(entity -> decode(location, entity.getBody(), contentTypeOf(entity)));
        }
        return Mono.fromCallable(() -> readFile(location))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private JsonNode readFile(String location) {
        Path path = Path.of(location);
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return decode(location, content, contentTypeForFile(path));
        } catch (IOException e) {
            throw new ApiMergeException("Cannot read " + location, e);
        }
    }

    private JsonNode decode(String location, String body, String contentType) {
        if (body == null || body.isBlank()) {
            throw new ApiMergeException("Document at " + location + " is empty");
        }
        JsonNode document = documentCodec.decode(body, contentType);
        if (document == null || document.isNull() || document.isMissingNode()) {
            throw new ApiMergeException("Document at " + location + " is empty");
        }
        log.debug("Decoded document from {} (content type: {})", location, contentType);
        return document;
    }

    private static boolean isRemote(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static String contentTypeOf(ResponseEntity<String> entity) {
        return entity.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
    }

    private static String contentTypeForFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return "application/yaml";
        }
        if (name.endsWith(".json")) {
            return "application/json";
        }
        return null;
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        if (e instanceof WebClientResponseException responseException) {
            return "HTTP " + responseException.getStatusCode().value();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
