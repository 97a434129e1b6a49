package com.apimerge.cli;

import com.apimerge.config.MergeProperties;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.service.api.SchemaRetrievalService;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceCommandTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SchemaRetrievalService retrievalService;

    private MergeProperties properties;
    private SourceCommand sourceCommand;

    @BeforeEach
    void setUp() {
        properties = new MergeProperties();
        sourceCommand = new SourceCommand(properties, retrievalService);
    }

    @Test
    void sources_shouldListConfiguredSources() {
        MergeProperties.SourceProperties users = new MergeProperties.SourceProperties();
        users.setName("users");
        users.setUrl("http://users:8080");
        users.setSchema("http://users:8080/v3/api-docs");
        MergeProperties.SourceProperties legacy = new MergeProperties.SourceProperties();
        legacy.setName("legacy");
        legacy.setSchema("/specs/legacy.yaml");
        legacy.setEnabled(false);
        properties.setSources(List.of(users, legacy));

        String output = sourceCommand.sources();

        assertThat(output).contains("users").contains("http://users:8080/v3/api-docs");
        assertThat(output).contains("legacy").contains("(disabled)").contains("http://localhost");
    }

    @Test
    void sources_shouldReportMissingConfiguration() {
        assertThat(sourceCommand.sources()).contains("No sources configured");
    }

    @Test
    void validate_shouldReportValidDocument() throws Exception {
        when(retrievalService.fetch("http://users/openapi.json")).thenReturn(objectMapper.readTree("""
                { "openapi": "3.0.0", "info": { "title": "X", "version": "1" }, "paths": { "/a": {}, "/b": {} } }
                """));

        assertThat(sourceCommand.validate("http://users/openapi.json")).contains("Document is valid with 2 paths.");
    }

    @Test
    void validate_shouldReportProblemAndFetchFailure() throws Exception {
        when(retrievalService.fetch("bad.json")).thenReturn(objectMapper.readTree("{ \"openapi\": \"3.0.0\" }"));
        when(retrievalService.fetch("down.json")).thenThrow(new ApiMergeException("Cannot read down.json"));

        assertThat(sourceCommand.validate("bad.json")).contains("Invalid document: missing 'info' object");
        assertThat(sourceCommand.validate("down.json")).contains("Could not load down.json: Cannot read down.json");
    }

    @Test
    void safeName_shouldShowTokenOrExplainFallback() {
        assertThat(sourceCommand.safeName("My Service! 2.0")).contains("my_service_2_0");
        assertThat(sourceCommand.safeName("___")).contains("has no safe characters");
    }
}
