package com.apimerge.cli;

import com.apimerge.cli.ui.Spinner;
import com.apimerge.config.MergeProperties;
import com.apimerge.dto.response.CommandResponse;
import com.apimerge.engine.DocumentCodec;
import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.MergeDiagnostic;
import com.apimerge.model.MergeResult;
import com.apimerge.model.OutputFormat;
import com.apimerge.service.api.MergeService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell command that merges the documents of all configured sources.
 */
@ShellComponent
public class MergeCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_CYAN = "\u001B[36m";

    private final MergeService mergeService;
    private final DocumentCodec documentCodec;
    private final MergeProperties properties;
    private final Spinner spinner;

    public MergeCommand(MergeService mergeService, DocumentCodec documentCodec, MergeProperties properties,
                        Spinner spinner) {
        this.mergeService = mergeService;
        this.documentCodec = documentCodec;
        this.properties = properties;
        this.spinner = spinner;
    }

    /**
     * Fetches every enabled source, merges the documents and writes the result.
     * <p>
     * Diagnostics (unreachable or invalid sources, renamed keys) are printed before the
     * outcome. Without {@code --output} the merged document is printed as JSON.
     *
     * @param grouping Namespace tags per source; {@code merge.grouping} when not given.
     * @param output   File to write, YAML for {@code .yaml}/{@code .yml}, JSON otherwise.
     * @return The colored outcome, or the merged document when printing to the terminal.
     */
    @ShellMethod(key = "merge", value = "Merges the OpenAPI documents of all configured sources.")
    public String merge(
            @ShellOption(value = {"--grouping", "-g"}, help = "Prefix tags with service names.", defaultValue = ShellOption.NULL) Boolean grouping,
            @ShellOption(value = {"--output", "-o"}, help = "File to write the merged document to.", defaultValue = ShellOption.NULL) String output
    ) {
        boolean group = grouping != null ? grouping : properties.isGrouping();
        MergeResult result;
        try {
            result = spinner.spin("Merging...", () -> mergeService.mergeConfigured(group));
        } catch (Exception e) {
            return CommandResponse.failed("Merge failed: " + e.getMessage()).toAnsiString();
        }

        StringBuilder report = new StringBuilder();
        for (MergeDiagnostic diagnostic : result.diagnostics()) {
            report.append(diagnostic.isWarning() ? ANSI_YELLOW : ANSI_CYAN)
                    .append(diagnostic)
                    .append(ANSI_RESET)
                    .append(System.lineSeparator());
        }

        if (result.empty()) {
            return report + CommandResponse.failed("Nothing to merge: no source produced a valid document.").toAnsiString();
        }

        try {
            if (output == null) {
                return report + documentCodec.encode(result.document(), OutputFormat.JSON);
            }
            Path target = Path.of(output);
            Files.writeString(target, documentCodec.encode(result.document(), OutputFormat.fromFileName(output)),
                    StandardCharsets.UTF_8);
            int paths = result.document().path("paths").size();
            return report + CommandResponse.ok("Merged document with " + paths + " paths written to " + target.toAbsolutePath()).toAnsiString();
        } catch (IOException | ApiMergeException e) {
            return report + CommandResponse.failed("Failed to write merged document: " + e.getMessage()).toAnsiString();
        }
    }
}
