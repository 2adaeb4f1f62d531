package fun.fengwk.mph.core.facade.search.impl;

import fun.fengwk.mph.core.facade.search.SearchProperties;
import fun.fengwk.mph.core.facade.search.dispatch.ProviderDispatcher;
import fun.fengwk.mph.core.facade.search.model.SearchRequest;
import fun.fengwk.mph.core.facade.search.model.SearchResponse;
import fun.fengwk.mph.core.facade.search.model.SearchResultItem;
import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.ProviderRegistry;
import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.consolidate.OfferDeduplicator;
import fun.fengwk.mph.core.service.consolidate.OfferRanker;
import fun.fengwk.mph.core.service.consolidate.RankingProperties;
import fun.fengwk.mph.core.service.consolidate.ResultConsolidator;
import fun.fengwk.mph.core.service.matching.FeatureExtractor;
import fun.fengwk.mph.core.service.matching.MatchingProperties;
import fun.fengwk.mph.core.service.matching.ProductSimilarityScorer;
import fun.fengwk.mph.core.service.pricing.PriceNormalizer;
import fun.fengwk.mph.core.service.pricing.PriceParser;
import fun.fengwk.mph.core.service.pricing.currency.StaticRateCurrencyConverter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class PriceSearchFacadeImplTest {

    private static final String QUERY = "iPhone 16 Pro";

    private ProviderRegistry registry;
    private ProviderDispatcher dispatcher;
    private ResultConsolidator consolidator;
    private SearchProperties searchProperties;
    private PriceSearchFacadeImpl facade;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        searchProperties = new SearchProperties();
        dispatcher = new ProviderDispatcher(searchProperties.getMaxConcurrent());
        PriceParser priceParser = new PriceParser();
        ProductSimilarityScorer scorer = new ProductSimilarityScorer(new FeatureExtractor(), new MatchingProperties());
        PriceNormalizer normalizer = new PriceNormalizer(priceParser,
            new StaticRateCurrencyConverter("EUR", Map.of("USD", 1.1, "GBP", 0.85)));
        consolidator = new ResultConsolidator(normalizer, scorer, new OfferDeduplicator(scorer),
            new OfferRanker(new RankingProperties(), priceParser));
        facade = new PriceSearchFacadeImpl(registry, dispatcher, consolidator, searchProperties);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    public void shouldReturnEmptyResponseWhenNoProviderSupportsCountry() {
        registry.register(new FakeProvider("amazon", Set.of("US"), 1,
            List.of(offer("Apple iPhone 16 Pro 128GB", "$999", "amazon"))));

        SearchResponse response = facade.search(request("FR").build());

        assertThat(response.getTotalResults()).isZero();
        assertThat(response.getResults()).isEmpty();
        assertThat(response.getSourcesUsed()).isEmpty();
        assertThat(response.getCountry()).isEqualTo("FR");
        assertThat(response.getTimestamp()).isNotNull();
    }

    @Test
    public void shouldAbsorbFailingProvider() {
        registry.register(new FakeProvider("amazon", Set.of("US"), 1,
            List.of(offer("Apple iPhone 16 Pro 128GB - Natural Titanium", "$999.00", "amazon"))));
        registry.register(new FakeProvider("broken", Set.of("US"), 1, null));
        registry.register(new FakeProvider("bestbuy", Set.of("US"), 2,
            List.of(offer("Apple iPhone 16 Pro Max 256GB Desert Titanium", "$1,399.00", "bestbuy"))));

        SearchResponse response = facade.search(request("US").build());

        assertThat(response.getSourcesUsed()).containsExactly("amazon", "bestbuy");
        assertThat(response.getFailedSources()).containsOnlyKeys("broken");
        assertThat(response.getResults()).extracting(SearchResultItem::getSource)
            .containsExactlyInAnyOrder("amazon", "bestbuy");
        assertThat(response.getCollectedOffers()).isEqualTo(2);
    }

    @Test
    public void shouldMergeDuplicatesAcrossProviders() {
        registry.register(new FakeProvider("x", Set.of("US"), 1,
            List.of(offer("Apple iPhone 16 Pro 128GB - Natural Titanium", "$999", "x"))));
        registry.register(new FakeProvider("y", Set.of("US"), 1,
            List.of(offer("iPhone 16 Pro 128GB Natural Titanium (Unlocked)", "$1,049", "y"))));

        SearchResponse response = facade.search(request("US").build());

        assertThat(response.getResults()).hasSize(1);
        SearchResultItem item = response.getResults().get(0);
        assertThat(item.getRank()).isEqualTo(1);
        assertThat(item.getDuplicateGroup()).hasSize(8);
        assertThat(response.getSourcesUsed()).containsExactly("x", "y");
    }

    @Test
    public void shouldReportConvertedPriceAndSourceCurrencyFallback() {
        registry.register(new FakeProvider("uk", Set.of("GB"), 1, List.of(
            offer("Apple iPhone 16 Pro 128GB", "£850", "uk"),
            offer("Samsung Galaxy S24 Ultra 256GB", "₹1,29,999", "uk"))));

        SearchResponse response = facade.search(request("GB").targetCurrency("usd").build());

        assertThat(response.getResults()).hasSize(2);
        SearchResultItem converted = response.getResults().stream()
            .filter(item -> item.getProductName().startsWith("Apple")).findFirst().orElseThrow();
        assertThat(converted.getCurrency()).isEqualTo("USD");
        assertThat(converted.getPrice()).isEqualTo("1100.00");
        SearchResultItem fallback = response.getResults().stream()
            .filter(item -> item.getProductName().startsWith("Samsung")).findFirst().orElseThrow();
        assertThat(fallback.getCurrency()).isEqualTo("INR");
        assertThat(fallback.getPrice()).isEqualTo("129999.00");
    }

    @Test
    public void shouldApplyIncludeAndExcludeFilters() {
        registry.register(new FakeProvider("Amazon", Set.of("US"), 1, List.of()));
        registry.register(new FakeProvider("eBay", Set.of("US"), 2, List.of()));
        registry.register(new FakeProvider("Walmart", Set.of("US"), 3, List.of()));

        assertThat(facade.selectProviders("US", List.of("amazon", "WALMART"), List.of("walmart")))
            .extracting(PriceProvider::getName).containsExactly("Amazon");
        assertThat(facade.selectProviders("US", null, List.of("EBAY")))
            .extracting(PriceProvider::getName).containsExactly("Amazon", "Walmart");
        assertThat(facade.selectProviders("US", List.of(), null))
            .extracting(PriceProvider::getName).containsExactly("Amazon", "eBay", "Walmart");
    }

    @Test
    public void shouldTruncateToMaxResults() {
        List<RawOffer> offers = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            offers.add(offer("Gadget model " + (char) ('A' + i) + " edition " + i, "$" + (100 * (i + 1)), "shop"));
        }
        registry.register(new FakeProvider("shop", Set.of("US"), 1, offers));

        SearchResponse response = facade.search(request("US").maxResults(3).build());

        assertThat(response.getResults()).hasSize(3);
        assertThat(response.getTotalResults()).isEqualTo(3);
        assertThat(response.getResults()).extracting(SearchResultItem::getRank).containsExactly(1, 2, 3);
    }

    @Test
    public void shouldSplitBudgetEvenlyAcrossSelectedProviders() {
        ProviderDispatcher mockDispatcher = mock(ProviderDispatcher.class);
        when(mockDispatcher.dispatch(anyList(), anyString(), anyString(), anyLong())).thenReturn(List.of());
        PriceSearchFacadeImpl mockedFacade = new PriceSearchFacadeImpl(registry, mockDispatcher, consolidator, searchProperties);
        registry.register(new FakeProvider("a", Set.of("US"), 1, List.of()));
        registry.register(new FakeProvider("b", Set.of("US"), 1, List.of()));
        registry.register(new FakeProvider("c", Set.of("US"), 1, List.of()));
        registry.register(new FakeProvider("d", Set.of("US"), 1, List.of()));

        mockedFacade.search(request("US").timeout(Duration.ofSeconds(60)).build());

        verify(mockDispatcher).dispatch(anyList(), eq(QUERY), eq("US"), eq(15000L));
    }

    @Test
    public void shouldRejectInvalidRequests() {
        assertThatThrownBy(() -> facade.search(SearchRequest.builder().query(" ").country("US").build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("query is blank");
        assertThatThrownBy(() -> facade.search(request("USA").build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("country is invalid");
        assertThatThrownBy(() -> facade.search(request("US").maxResults(-1).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("maxResults must be >= 0");
        assertThatThrownBy(() -> facade.search(request("US").timeout(Duration.ZERO).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("timeout must be positive");
        assertThatThrownBy(() -> facade.search(request("US").targetCurrency("dollar").build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessage("targetCurrency is invalid");
    }

    @Test
    public void shouldFormatPriceWithTwoDecimals() {
        assertThat(PriceSearchFacadeImpl.formatPrice(999)).isEqualTo("999.00");
        assertThat(PriceSearchFacadeImpl.formatPrice(1049.995)).isEqualTo("1050.00");
    }

    private static SearchRequest.SearchRequestBuilder request(String country) {
        return SearchRequest.builder()
            .query(QUERY)
            .country(country)
            .timeout(Duration.ofSeconds(10));
    }

    private static RawOffer offer(String name, String price, String source) {
        return RawOffer.builder()
            .link("https://" + source + ".example.com/p/" + Math.abs(name.hashCode()))
            .price(price)
            .productName(name)
            .source(source)
            .build();
    }

    /**
     * Returns fixed offers, or fails when the offers are null.
     */
    private static class FakeProvider implements PriceProvider {

        private final String name;
        private final Set<String> countries;
        private final int priority;
        private final List<RawOffer> offers;

        FakeProvider(String name, Set<String> countries, int priority, List<RawOffer> offers) {
            this.name = name;
            this.countries = countries;
            this.priority = priority;
            this.offers = offers;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean supports(String country) {
            return countries.contains(country);
        }

        @Override
        public int priority(String country) {
            return supports(country) ? priority : UNSUPPORTED_PRIORITY;
        }

        @Override
        public List<RawOffer> fetch(String query, String country) {
            if (offers == null) {
                throw new IllegalStateException("source unavailable");
            }
            return offers;
        }

    }

}
