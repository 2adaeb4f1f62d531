package fun.fengwk.mph.core.configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Proxy configuration for listing page requests.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "mph.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port, socks5://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port, socks5://host:port or host:port.
     */
    private String httpsProxy;

    @PostConstruct
    public void init() {
        if (parseProxy(httpProxy) != null) {
            log.info("http proxy configured: {}", httpProxy);
        }
        if (parseProxy(httpsProxy) != null) {
            log.info("https proxy configured: {}", httpsProxy);
        }
    }

    /**
     * Proxy selector routing https targets through the https proxy and the rest through the http proxy,
     * falling back to the other one when only one is set. Null when no proxy is configured.
     */
    public ProxySelector toProxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        if (http == null && https == null) {
            return null;
        }
        return new SchemeProxySelector(http == null ? https : http, https == null ? http : https);
    }

    private Proxy parseProxy(String proxyStr) {
        if (StringUtils.isBlank(proxyStr)) {
            return null;
        }
        try {
            String uriStr = proxyStr.trim();
            if (!uriStr.contains("://")) {
                uriStr = "http://" + uriStr;
            }
            URI uri = new URI(uriStr);
            String scheme = uri.getScheme();
            Proxy.Type type = scheme != null && scheme.toLowerCase(Locale.ROOT).startsWith("socks")
                ? Proxy.Type.SOCKS
                : Proxy.Type.HTTP;
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                String[] parts = proxyStr.trim().split(":");
                host = parts[0];
                port = parts.length > 1 ? Integer.parseInt(parts[1]) : 80;
            }
            if (port == -1) {
                port = 80;
            }
            return new Proxy(type, InetSocketAddress.createUnresolved(host, port));
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    static class SchemeProxySelector extends ProxySelector {

        private final Proxy httpProxy;
        private final Proxy httpsProxy;

        SchemeProxySelector(Proxy httpProxy, Proxy httpsProxy) {
            this.httpProxy = httpProxy;
            this.httpsProxy = httpsProxy;
        }

        @Override
        public List<Proxy> select(URI uri) {
            boolean secure = uri != null && "https".equalsIgnoreCase(uri.getScheme());
            return List.of(secure ? httpsProxy : httpProxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
