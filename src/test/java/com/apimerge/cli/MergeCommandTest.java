package com.apimerge.cli;

import com.apimerge.cli.ui.Spinner;
import com.apimerge.config.MergeProperties;
import com.apimerge.engine.DocumentCodec;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.DiagnosticType;
import com.apimerge.model.MergeDiagnostic;
import com.apimerge.model.MergeResult;
import com.apimerge.service.api.MergeService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeCommandTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private MergeService mergeService;
    @Mock
    private Spinner spinner;

    private MergeProperties properties;
    private MergeCommand mergeCommand;

    @BeforeEach
    void setUp() {
        properties = new MergeProperties();
        mergeCommand = new MergeCommand(mergeService, new DocumentCodec(), properties, spinner);
        when(spinner.spin(anyString(), any())).thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(1)).get());
    }

    private static MergeResult merged(MergeDiagnostic... diagnostics) throws Exception {
        ObjectNode document = (ObjectNode) objectMapper.readTree("""
                { "openapi": "3.0.3", "info": { "title": "Merged API" }, "paths": { "/users": {}, "/orders": {} } }
                """);
        return MergeResult.of(document, List.of(diagnostics));
    }

    @Test
    void merge_shouldPrintDocumentAndDiagnosticsWithoutOutputFile() throws Exception {
        when(mergeService.mergeConfigured(true)).thenReturn(merged(
                new MergeDiagnostic(DiagnosticType.RETRIEVAL_FAILED, "billing", null, "HTTP 500")));

        String output = mergeCommand.merge(null, null);

        assertThat(output).contains("[RETRIEVAL_FAILED] billing: HTTP 500");
        assertThat(output).contains("\"/users\"");
        verify(mergeService).mergeConfigured(true);
    }

    @Test
    void merge_shouldHonourGroupingOption() throws Exception {
        when(mergeService.mergeConfigured(false)).thenReturn(merged());

        mergeCommand.merge(false, null);

        verify(mergeService).mergeConfigured(false);
    }

    @Test
    void merge_shouldWriteYamlFile(@TempDir Path tempDir) throws Exception {
        when(mergeService.mergeConfigured(true)).thenReturn(merged());
        Path target = tempDir.resolve("merged.yaml");

        String output = mergeCommand.merge(null, target.toString());

        assertThat(output).contains("Merged document with 2 paths written to");
        assertThat(Files.readString(target)).contains("openapi:").contains("/users");
    }

    @Test
    void merge_shouldReportEmptySentinel() {
        when(mergeService.mergeConfigured(true)).thenReturn(MergeResult.emptyResult(List.of()));

        String output = mergeCommand.merge(null, null);

        assertThat(output).contains("Nothing to merge");
        assertThat(output).startsWith("\u001B[31m");
    }

    @Test
    void merge_shouldReportFatalErrors() {
        when(mergeService.mergeConfigured(true)).thenThrow(new ApiMergeException("Failed to parse document of source 'x'"));

        String output = mergeCommand.merge(null, null);

        assertThat(output).contains("Merge failed: Failed to parse document of source 'x'");
    }
}
