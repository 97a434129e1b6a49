package com.apimerge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds the owning service's origin to the {@code servers} list of every operation, so that
 * each operation of the merged document still points at the service that defines it.
 */
@Slf4j
public final class ServerInjector {

    static final String PROXY_PREFIX = "/proxy/";

    private ServerInjector() {
    }

    /**
     * Ensures every operation in {@code document} has a server entry for the service.
     * <p>
     * In direct mode the entry is {@code {url}}. In proxy mode it is
     * {@code {url: "/proxy/<safe-name>", description: "Proxied to <url>"}}. An operation is left
     * alone when one of its servers already has {@code url} equal to the raw service URL. The
     * check always uses the raw URL, so a proxy-mode run over a document that was injected in
     * direct mode adds a second entry. A {@code servers} value that is not an array is left as is.
     *
     * @param document    The document to modify in place.
     * @param url         The service's origin URL.
     * @param serviceName The service name, sanitized for the proxy path.
     * @param proxyMode   Whether proxying is enabled and the proxy is reachable.
     * @return The number of operations that received a new entry.
     */
    public static int inject(ObjectNode document, String url, String serviceName, boolean proxyMode) {
        String proxyPath = proxyMode ? PROXY_PREFIX + NameSanitizer.safeNameOrGenerated(serviceName) : null;
        int[] injected = {0};
        OperationWalker.forEachOperation(document, operation -> {
            JsonNode servers = operation.get("servers");
            if (servers == null) {
                servers = operation.putArray("servers");
            }
            if (!servers.isArray() || containsUrl((ArrayNode) servers, url)) {
                return;
            }
            ObjectNode server = ((ArrayNode) servers).addObject();
            if (proxyMode) {
                server.put("url", proxyPath);
                server.put("description", "Proxied to " + url);
            } else {
                server.put("url", url);
            }
            injected[0]++;
        });
        log.debug("Injected server for '{}' into {} operations (proxy: {})", serviceName, injected[0], proxyMode);
        return injected[0];
    }

    private static boolean containsUrl(ArrayNode servers, String url) {
        for (JsonNode server : servers) {
            JsonNode existing = server.path("url");
            if (existing.isTextual() && existing.asText().equals(url)) {
                return true;
            }
        }
        return false;
    }
}
