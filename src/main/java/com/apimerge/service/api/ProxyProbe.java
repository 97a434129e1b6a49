package com.apimerge.service.api;

/**
 * Tells whether the reverse-proxy frontend can currently accept traffic.
 */
public interface ProxyProbe {

    /**
     * @return {@code true} if the proxy is reachable. Never throws.
     */
    boolean isAvailable();
}
