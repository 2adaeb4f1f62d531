package fun.fengwk.mph.core.provider.listing;

import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.provider.listing.ListingSourceDefinition.ListingMarket;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Provider that searches one listing site described by a {@link ListingSourceDefinition}.
 *
 * @author fengwk
 */
@Slf4j
public class HtmlListingProvider implements PriceProvider {

    private static final String QUERY_PLACEHOLDER = "{query}";

    private final ListingSourceDefinition definition;
    private final ListingPageFetcher pageFetcher;
    private final ListingPageParser pageParser;

    /**
     * Guarded by {@code this}.
     */
    private long lastRequestAt;

    public HtmlListingProvider(ListingSourceDefinition definition, ListingPageFetcher pageFetcher, ListingPageParser pageParser) {
        if (definition == null || StringUtils.isBlank(definition.getName())) {
            throw new IllegalArgumentException("listing source name is blank");
        }
        if (definition.getMarkets().isEmpty()) {
            throw new IllegalArgumentException("listing source has no market: " + definition.getName());
        }
        this.definition = definition;
        this.pageFetcher = pageFetcher;
        this.pageParser = pageParser;
    }

    @Override
    public String getName() {
        return definition.getName();
    }

    @Override
    public boolean supports(String country) {
        return findMarket(country) != null;
    }

    @Override
    public int priority(String country) {
        return supports(country) ? definition.getPriority() : UNSUPPORTED_PRIORITY;
    }

    @Override
    public List<RawOffer> fetch(String query, String country) throws InterruptedException {
        ListingMarket market = findMarket(country);
        if (market == null) {
            throw new IllegalArgumentException("unsupported country: " + country);
        }
        String url = buildSearchUrl(market, query);
        awaitRequestSlot();
        log.info("listing search, source={}, url={}", definition.getName(), url);
        String html = pageFetcher.fetch(url, definition.getRequestTimeoutMs());
        List<RawOffer> offers = pageParser.parse(html, url, definition, market);
        log.info("listing search finished, source={}, offers={}", definition.getName(), offers.size());
        return offers;
    }

    String buildSearchUrl(ListingMarket market, String query) {
        if (StringUtils.isBlank(market.getSearchUrl()) || !market.getSearchUrl().contains(QUERY_PLACEHOLDER)) {
            throw new IllegalStateException("search url template must contain " + QUERY_PLACEHOLDER + ": " + definition.getName());
        }
        String encoded = URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
        return market.getSearchUrl().replace(QUERY_PLACEHOLDER, encoded);
    }

    private ListingMarket findMarket(String country) {
        if (StringUtils.isBlank(country)) {
            return null;
        }
        return definition.getMarkets().get(country.trim().toUpperCase(Locale.ROOT));
    }

    private synchronized void awaitRequestSlot() throws InterruptedException {
        long interval = definition.getMinRequestIntervalMs();
        if (interval > 0) {
            long waitMs = lastRequestAt + interval - System.currentTimeMillis();
            if (waitMs > 0) {
                log.debug("listing throttled, source={}, waitMs={}", definition.getName(), waitMs);
                Thread.sleep(waitMs);
            }
        }
        lastRequestAt = System.currentTimeMillis();
    }

}
