package fun.fengwk.mph.core.configuration;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class HttpClientProxyPropertiesTest {

    @Test
    public void shouldReturnNullWithoutProxy() {
        assertThat(new HttpClientProxyProperties().toProxySelector()).isNull();
    }

    @Test
    public void shouldRouteBySchemeWhenBothAreSet() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpProxy("http://127.0.0.1:8080");
        properties.setHttpsProxy("127.0.0.1:3128");

        ProxySelector selector = properties.toProxySelector();

        assertThat(port(selector.select(URI.create("https://shop.example.com")).get(0))).isEqualTo(3128);
        assertThat(port(selector.select(URI.create("http://shop.example.com")).get(0))).isEqualTo(8080);
    }

    @Test
    public void shouldUseSingleProxyForBothSchemes() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpProxy("http://127.0.0.1:8080");

        ProxySelector selector = properties.toProxySelector();

        assertThat(port(selector.select(URI.create("https://shop.example.com")).get(0))).isEqualTo(8080);
    }

    @Test
    public void shouldSupportSocksProxy() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpsProxy("socks5://127.0.0.1:1080");

        Proxy proxy = properties.toProxySelector().select(URI.create("https://shop.example.com")).get(0);

        assertThat(proxy.type()).isEqualTo(Proxy.Type.SOCKS);
        assertThat(port(proxy)).isEqualTo(1080);
    }

    @Test
    public void shouldRejectMalformedProxy() {
        HttpClientProxyProperties properties = new HttpClientProxyProperties();
        properties.setHttpProxy("http://127.0.0.1:notaport");

        assertThatThrownBy(properties::toProxySelector).isInstanceOf(IllegalArgumentException.class);
    }

    private static int port(Proxy proxy) {
        return ((InetSocketAddress) proxy.address()).getPort();
    }

}
