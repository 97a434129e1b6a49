package com.apimerge.service.impl;

import com.apimerge.config.MergeProperties;
import com.apimerge.engine.DocumentCodec;
import com.apimerge.engine.DocumentValidator;
import com.apimerge.engine.MergeEngine;
import com.apimerge.engine.MetadataUpdater;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.DiagnosticType;
import com.apimerge.model.MergeDiagnostic;
import com.apimerge.model.MergeResult;
import com.apimerge.model.RetrievalOutcome;
import com.apimerge.model.Source;
import com.apimerge.model.SourceDocument;
import com.apimerge.model.SourcePayload;
import com.apimerge.service.api.MergeService;
import com.apimerge.service.api.ProxyProbe;
import com.apimerge.service.api.SchemaRetrievalService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class MergeServiceImpl implements MergeService {

    private final SchemaRetrievalService retrievalService;
    private final ProxyProbe proxyProbe;
    private final MergeEngine mergeEngine;
    private final DocumentCodec documentCodec;
    private final MergeProperties properties;

    public MergeServiceImpl(SchemaRetrievalService retrievalService, ProxyProbe proxyProbe, MergeEngine mergeEngine,
                            DocumentCodec documentCodec, MergeProperties properties) {
        this.retrievalService = retrievalService;
        this.proxyProbe = proxyProbe;
        this.mergeEngine = mergeEngine;
        this.documentCodec = documentCodec;
        this.properties = properties;
    }

    @Override
    public MergeResult mergeConfigured(boolean grouping) {
        List<Source> enabled = properties.resolveSources().stream()
                .filter(Source::enabled)
                .toList();
        log.info("Merging {} enabled sources (grouping: {})", enabled.size(), grouping);

        List<MergeDiagnostic> diagnostics = new ArrayList<>();
        List<SourceDocument> documents = new ArrayList<>();
        for (RetrievalOutcome outcome : retrievalService.fetchAll(enabled)) {
            if (outcome.isSuccess()) {
                documents.add(new SourceDocument(outcome.source(), outcome.document()));
            } else {
                diagnostics.add(new MergeDiagnostic(DiagnosticType.RETRIEVAL_FAILED,
                        outcome.source().name(), null, outcome.error()));
            }
        }
        return gateAndMerge(documents, grouping, diagnostics);
    }

    @Override
    public MergeResult merge(List<SourceDocument> documents, boolean grouping) {
        List<SourceDocument> enabled = documents.stream()
                .filter(document -> document.source().enabled())
                .toList();
        return gateAndMerge(enabled, grouping, new ArrayList<>());
    }

    @Override
    public MergeResult mergePayloads(List<SourcePayload> payloads, boolean grouping) {
        List<SourceDocument> documents = new ArrayList<>();
        for (SourcePayload payload : payloads) {
            if (!payload.source().enabled()) {
                continue;
            }
            try {
                JsonNode document = documentCodec.decode(payload.payload(), payload.contentType());
                documents.add(new SourceDocument(payload.source(), document));
            } catch (ApiMergeException e) {
                throw new ApiMergeException("Failed to parse document of source '" + payload.source().name()
                        + "': " + e.getMessage(), e);
            }
        }
        return gateAndMerge(documents, grouping, new ArrayList<>());
    }

    private MergeResult gateAndMerge(List<SourceDocument> documents, boolean grouping,
                                     List<MergeDiagnostic> diagnostics) {
        List<SourceDocument> accepted = new ArrayList<>();
        for (SourceDocument document : documents) {
            Optional<String> problem = DocumentValidator.describeProblem(document.document());
            if (problem.isPresent()) {
                log.warn("Excluding {} from merge: {}", document.source().name(), problem.get());
                diagnostics.add(new MergeDiagnostic(DiagnosticType.INVALID_DOCUMENT,
                        document.source().name(), null, problem.get()));
            } else {
                accepted.add(document);
            }
        }

        boolean proxyMode = !accepted.isEmpty() && properties.getProxy().isEnabled() && proxyProbe.isAvailable();
        MergeResult result = mergeEngine.merge(accepted, grouping, proxyMode).withDiagnostics(diagnostics);
        if (result.empty()) {
            return result;
        }
        return result.withDocument(MetadataUpdater.apply(result.document(), properties.getSettings().toDocumentInfo()));
    }
}
