package com.apimerge.config;

import com.apimerge.model.DocumentInfo;
import com.apimerge.model.Source;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code merge.*} section of {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "merge")
public class MergeProperties {

    /**
     * Services whose documents are merged, in merge order.
     */
    private List<SourceProperties> sources = new ArrayList<>();

    /**
     * Applied to sources that do not set {@code enabled} themselves.
     */
    private boolean enabledByDefault = true;

    /**
     * Prefix tags with service names and emit a combined top-level tag list.
     */
    private boolean grouping = true;

    private Settings settings = new Settings();
    private Proxy proxy = new Proxy();
    private Retrieval retrieval = new Retrieval();

    /**
     * Resolves the configured sources, generating names and default URLs where missing.
     */
    public List<Source> resolveSources() {
        List<Source> resolved = new ArrayList<>();
        for (SourceProperties source : sources) {
            boolean enabled = source.getEnabled() != null ? source.getEnabled() : enabledByDefault;
            resolved.add(Source.of(source.getName(), source.getUrl(), source.getSchema(), enabled));
        }
        return resolved;
    }

    @Data
    public static class SourceProperties {
        private String name;
        private String url;
        /**
         * URL or file path of the service's OpenAPI document.
         */
        private String schema;
        private Boolean enabled;
    }

    @Data
    public static class Settings {
        private String title = DocumentInfo.DEFAULT.title();
        private String description = DocumentInfo.DEFAULT.description();
        private String version = DocumentInfo.DEFAULT.version();

        public DocumentInfo toDocumentInfo() {
            return new DocumentInfo(title, description, version);
        }
    }

    @Data
    public static class Proxy {
        /**
         * Rewrite injected servers to {@code /proxy/<service>} when the proxy is reachable.
         */
        private boolean enabled = false;
        private String host = "127.0.0.1";
        private int port = 80;
        private Duration connectTimeout = Duration.ofSeconds(2);
        /**
         * Skips the connection check and reports this value instead. Meant for tests.
         */
        private Boolean availableOverride;
    }

    @Data
    public static class Retrieval {
        private Duration timeout = Duration.ofSeconds(10);
        private int concurrency = 8;
        private int maxAttempts = 3;
    }
}
