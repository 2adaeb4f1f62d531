package fun.fengwk.mph.core.mcp;

import fun.fengwk.mph.core.CoreTestApplication;
import fun.fengwk.mph.core.facade.search.SearchProperties;
import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.ProviderRegistry;
import fun.fengwk.mph.core.provider.RawOffer;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
@Slf4j
@SpringBootTest(classes = {CoreTestApplication.class, PriceMcpContextTest.TestProviderConfiguration.class})
public class PriceMcpContextTest {

    @Autowired
    private PriceMcp priceMcp;

    @Autowired
    private ProviderRegistry providerRegistry;

    @Autowired
    private SearchProperties searchProperties;

    @Test
    public void shouldBindConfiguration() {
        assertThat(searchProperties.getMaxConcurrent()).isEqualTo(4);
        assertThat(providerRegistry.getProviders()).extracting(PriceProvider::getName).containsExactly("test-shop");
    }

    @Test
    public void shouldSearchThroughTool() {
        String result = priceMcp.priceSearch("iPhone 16 Pro", "us", null, "EUR", 5, null, null);
        log.info("price_search result:\n{}", result);

        assertThat(result).contains("1. ");
        assertThat(result).contains("EUR");
        assertThat(result).contains("source: test-shop");
        assertThat(result).contains("sources used: test-shop");
    }

    @Test
    public void shouldReportInvalidRequest() {
        assertThat(priceMcp.priceSearch(" ", "US", null, null, null, null, null)).isEqualTo("Error: query is blank");
    }

    @Test
    public void shouldListSources() {
        assertThat(priceMcp.priceSources("US")).contains("1. test-shop (priority 1)");
        assertThat(priceMcp.priceSources("JP")).contains("No sources.");
    }

    @TestConfiguration
    static class TestProviderConfiguration {

        @Bean
        public PriceProvider testShopProvider() {
            return new PriceProvider() {
                @Override
                public String getName() {
                    return "test-shop";
                }

                @Override
                public boolean supports(String country) {
                    return "US".equals(country);
                }

                @Override
                public int priority(String country) {
                    return supports(country) ? 1 : UNSUPPORTED_PRIORITY;
                }

                @Override
                public List<RawOffer> fetch(String query, String country) {
                    return List.of(
                        RawOffer.builder()
                            .link("https://test-shop.example.com/p/1")
                            .price("$999.00")
                            .currency("USD")
                            .productName("Apple iPhone 16 Pro 128GB - Natural Titanium")
                            .rating(4.6)
                            .reviewsCount(320)
                            .shippingCost("Free")
                            .source(getName())
                            .build(),
                        RawOffer.builder()
                            .link("https://test-shop.example.com/p/2")
                            .price("$1,049.00")
                            .currency("USD")
                            .productName("iPhone 16 Pro 128GB Natural Titanium (Unlocked)")
                            .source(getName())
                            .build());
                }
            };
        }

    }

}
