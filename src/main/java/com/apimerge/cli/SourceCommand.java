package com.apimerge.cli;

import com.apimerge.config.MergeProperties;
import com.apimerge.dto.response.CommandResponse;
import com.apimerge.engine.DocumentValidator;
import com.apimerge.engine.NameSanitizer;
import com.apimerge.model.Source;
import com.apimerge.service.api.SchemaRetrievalService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for inspecting configured sources and checking single documents.
 */
@ShellComponent
public class SourceCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private final MergeProperties properties;
    private final SchemaRetrievalService retrievalService;

    public SourceCommand(MergeProperties properties, SchemaRetrievalService retrievalService) {
        this.properties = properties;
        this.retrievalService = retrievalService;
    }

    @ShellMethod(key = "sources", value = "Lists the configured sources in merge order.")
    public String sources() {
        List<Source> sources = properties.resolveSources();
        if (sources.isEmpty()) {
            return CommandResponse.failed("No sources configured under 'merge.sources'.").toAnsiString();
        }
        StringBuilder out = new StringBuilder(ANSI_CYAN + "Configured sources:" + ANSI_RESET);
        for (Source source : sources) {
            out.append(System.lineSeparator())
                    .append("-".repeat(50)).append(System.lineSeparator())
                    .append(ANSI_GREEN).append(source.name()).append(ANSI_RESET)
                    .append(source.enabled() ? "" : ANSI_YELLOW + " (disabled)" + ANSI_RESET)
                    .append(System.lineSeparator())
                    .append("  Service URL: ").append(source.url()).append(System.lineSeparator())
                    .append("  Document:    ").append(source.schemaLocation());
        }
        return out.toString();
    }

    /**
     * Fetches one document and reports whether it may take part in a merge.
     *
     * @param location URL or file path of the document.
     * @return The colored verdict.
     */
    @ShellMethod(key = "validate", value = "Fetches a document and checks that it can be merged.")
    public String validate(@ShellOption(value = {"--location", "-l"}, help = "URL or file path of the document.") String location) {
        JsonNode document;
        try {
            document = retrievalService.fetch(location);
        } catch (Exception e) {
            return CommandResponse.failed("Could not load " + location + ": " + e.getMessage()).toAnsiString();
        }
        Optional<String> problem = DocumentValidator.describeProblem(document);
        int pathCount = document.path("paths").size();
        return problem
                .map(p -> CommandResponse.failed("Invalid document: " + p))
                .orElseGet(() -> CommandResponse.ok("Document is valid with " + pathCount + " paths."))
                .toAnsiString();
    }

    @ShellMethod(key = "safe-name", value = "Shows the proxy path token for a service name.")
    public String safeName(@ShellOption(value = {"--name", "-n"}, help = "The service name.") String name) {
        String safe = NameSanitizer.safeName(name);
        if (safe.isEmpty()) {
            return CommandResponse.failed("'" + name + "' has no safe characters; a generated name would be used.").toAnsiString();
        }
        return CommandResponse.ok(safe).toAnsiString();
    }
}
