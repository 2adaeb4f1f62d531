package fun.fengwk.mph.core.provider.listing;

import fun.fengwk.mph.core.configuration.HttpClientProxyProperties;
import fun.fengwk.mph.core.provider.ProviderFetchException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ProxySelector;
import java.util.concurrent.TimeUnit;

/**
 * Fetches listing pages over HTTP.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ListingPageFetcher {

    private final ListingProperties listingProperties;
    private final OkHttpClient httpClient;

    @Autowired
    public ListingPageFetcher(ListingProperties listingProperties, HttpClientProxyProperties proxyProperties) {
        this(listingProperties, buildHttpClient(listingProperties, proxyProperties));
    }

    ListingPageFetcher(ListingProperties listingProperties, OkHttpClient httpClient) {
        this.listingProperties = listingProperties;
        this.httpClient = httpClient;
    }

    /**
     * GET the page and return its body.
     *
     * @throws ProviderFetchException on non-2xx status or I/O failure
     * @throws InterruptedException when the calling thread is interrupted, e.g. the fetch timed out
     */
    public String fetch(String url, int timeoutMs) throws InterruptedException {
        if (StringUtils.isBlank(url)) {
            throw new IllegalArgumentException("url is blank");
        }
        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
            .header("Accept-Language", listingProperties.getAcceptLanguage())
            .header("User-Agent", listingProperties.getUserAgent())
            .build();
        Call call = httpClient.newCall(request);
        call.timeout().timeout(Math.max(1, timeoutMs), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            int statusCode = response.code();
            if (!response.isSuccessful()) {
                log.warn("listing request rejected, url={}, statusCode={}", url, statusCode);
                throw new ProviderFetchException("listing request rejected with status " + statusCode);
            }
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        } catch (InterruptedIOException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("listing request interrupted");
            }
            throw new ProviderFetchException("listing request timed out: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ProviderFetchException("listing request failed: " + ex.getMessage(), ex);
        }
    }

    private static OkHttpClient buildHttpClient(ListingProperties listingProperties, HttpClientProxyProperties proxyProperties) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder()
            .followRedirects(true)
            .connectTimeout(Math.max(1, listingProperties.getConnectTimeoutMs()), TimeUnit.MILLISECONDS);
        ProxySelector proxySelector = proxyProperties == null ? null : proxyProperties.toProxySelector();
        if (proxySelector != null) {
            builder.proxySelector(proxySelector);
        }
        return builder.build();
    }

}
