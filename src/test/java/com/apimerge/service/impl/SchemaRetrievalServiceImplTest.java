package com.apimerge.service.impl;

import com.apimerge.config.HttpClientFactory;
import com.apimerge.config.MergeProperties;
import com.apimerge.engine.DocumentCodec;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.RetrievalOutcome;
import com.apimerge.model.Source;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaRetrievalServiceImplTest {

    private static final String JSON_DOCUMENT = """
            { "openapi": "3.0.0", "info": { "title": "Users", "version": "1" }, "paths": { "/users": {} } }
            """;
    private static final String YAML_DOCUMENT = """
            openapi: 3.0.0
            info:
              title: Orders
              version: "1"
            paths:
              /orders: {}
            """;

    private MockWebServer mockWebServer;
    private SchemaRetrievalServiceImpl retrievalService;
    private final AtomicInteger flakyCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String path = request.getPath() == null ? "" : request.getPath();
                return switch (path) {
                    case "/users.json" -> new MockResponse().setBody(JSON_DOCUMENT)
                            .addHeader("Content-Type", "application/json");
                    case "/orders" -> new MockResponse().setBody(YAML_DOCUMENT)
                            .addHeader("Content-Type", "application/json");
                    case "/orders.yaml" -> new MockResponse().setBody(YAML_DOCUMENT)
                            .addHeader("Content-Type", "application/yaml");
                    case "/slow" -> new MockResponse().setBody(JSON_DOCUMENT)
                            .addHeader("Content-Type", "application/json")
                            .setHeadersDelay(3, TimeUnit.SECONDS);
                    case "/flaky" -> flakyCalls.incrementAndGet() == 1
                            ? new MockResponse().setResponseCode(503)
                            : new MockResponse().setBody(JSON_DOCUMENT).addHeader("Content-Type", "application/json");
                    case "/empty" -> new MockResponse().setBody("").addHeader("Content-Type", "application/json");
                    default -> new MockResponse().setResponseCode(404);
                };
            }
        });
        mockWebServer.start();

        MergeProperties properties = new MergeProperties();
        properties.getRetrieval().setTimeout(Duration.ofMillis(1500));
        properties.getRetrieval().setConcurrency(4);
        retrievalService = new SchemaRetrievalServiceImpl(new HttpClientFactory().webClient(properties),
                new DocumentCodec(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private String url(String path) {
        return mockWebServer.url(path).toString();
    }

    @Test
    void fetch_shouldDecodeJsonResponse() {
        JsonNode document = retrievalService.fetch(url("/users.json"));

        assertThat(document.at("/info/title").asText()).isEqualTo("Users");
    }

    @Test
    void fetch_shouldDecodeYamlResponses() {
        assertThat(retrievalService.fetch(url("/orders.yaml")).at("/info/title").asText()).isEqualTo("Orders");
        assertThat(retrievalService.fetch(url("/orders")).at("/info/title").asText()).isEqualTo("Orders");
    }

    @Test
    void fetch_shouldRetryServiceUnavailable() {
        JsonNode document = retrievalService.fetch(url("/flaky"));

        assertThat(document.at("/info/title").asText()).isEqualTo("Users");
        assertThat(flakyCalls.get()).isEqualTo(2);
    }

    @Test
    void fetch_shouldFailForMissingAndEmptyDocuments() {
        assertThatThrownBy(() -> retrievalService.fetch(url("/missing")))
                .isInstanceOf(ApiMergeException.class)
                .hasMessageContaining("HTTP 404");
        assertThatThrownBy(() -> retrievalService.fetch(url("/empty")))
                .isInstanceOf(ApiMergeException.class)
                .hasMessageContaining("is empty");
    }

    @Test
    void fetch_shouldReadLocalFiles() throws Exception {
        URL resource = getClass().getClassLoader().getResource("orders-service.yaml");
        assertThat(resource).isNotNull();
        String path = Paths.get(resource.toURI()).toFile().getAbsolutePath();

        JsonNode document = retrievalService.fetch(path);

        assertThat(document.at("/info/title").asText()).isEqualTo("Orders");
    }

    @Test
    void fetchAll_shouldIsolateFailuresAndKeepOrder() {
        List<Source> sources = List.of(
                new Source("slow", "http://slow", url("/slow"), true),
                new Source("users", "http://users", url("/users.json"), true),
                new Source("missing", "http://missing", url("/missing"), true),
                new Source("nowhere", "http://nowhere", null, true),
                new Source("orders", "http://orders", url("/orders"), true));

        List<RetrievalOutcome> outcomes = retrievalService.fetchAll(sources);

        assertThat(outcomes).extracting(outcome -> outcome.source().name())
                .containsExactly("slow", "users", "missing", "nowhere", "orders");
        assertThat(outcomes).extracting(RetrievalOutcome::isSuccess)
                .containsExactly(false, true, false, false, true);
        assertThat(outcomes.get(0).error()).startsWith("timed out");
        assertThat(outcomes.get(2).error()).isEqualTo("HTTP 404");
        assertThat(outcomes.get(3).error()).isEqualTo("no schema location configured");
        assertThat(outcomes.get(4).document().at("/info/title").asText()).isEqualTo("Orders");
    }
}
