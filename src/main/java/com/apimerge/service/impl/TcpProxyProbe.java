package com.apimerge.service.impl;

import com.apimerge.config.MergeProperties;
import com.apimerge.service.api.ProxyProbe;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Checks proxy reachability by opening a TCP connection to {@code merge.proxy.host:port}.
 * When {@code merge.proxy.available-override} is set, that value is returned without connecting.
 */
@Service
@Slf4j
public class TcpProxyProbe implements ProxyProbe {

    private final MergeProperties.Proxy proxy;

    public TcpProxyProbe(MergeProperties properties) {
        this.proxy = properties.getProxy();
    }

    @Override
    public boolean isAvailable() {
        if (proxy.getAvailableOverride() != null) {
            return proxy.getAvailableOverride();
        }
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(proxy.getHost(), proxy.getPort()),
                    (int) proxy.getConnectTimeout().toMillis());
            return true;
        } catch (IOException e) {
            log.debug("Proxy at {}:{} is not reachable: {}", proxy.getHost(), proxy.getPort(), e.getMessage());
            return false;
        }
    }
}
