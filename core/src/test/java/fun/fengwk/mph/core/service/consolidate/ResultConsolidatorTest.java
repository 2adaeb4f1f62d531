package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.matching.FeatureExtractor;
import fun.fengwk.mph.core.service.matching.MatchingProperties;
import fun.fengwk.mph.core.service.matching.ProductSimilarityScorer;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import fun.fengwk.mph.core.service.pricing.PriceNormalizer;
import fun.fengwk.mph.core.service.pricing.PriceParser;
import fun.fengwk.mph.core.service.pricing.currency.CurrencyConversionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ResultConsolidatorTest {

    private ResultConsolidator consolidator;

    @BeforeEach
    void setUp() {
        PriceParser priceParser = new PriceParser();
        ProductSimilarityScorer scorer = new ProductSimilarityScorer(new FeatureExtractor(), new MatchingProperties());
        PriceNormalizer normalizer = new PriceNormalizer(priceParser, (amount, from, to) -> {
            throw new CurrencyConversionException("no rates offline");
        });
        consolidator = new ResultConsolidator(normalizer, scorer, new OfferDeduplicator(scorer),
            new OfferRanker(new RankingProperties(), priceParser));
    }

    @Test
    public void shouldNormalizeDeduplicateAndRank() {
        List<RawOffer> offers = List.of(
            raw("Apple iPhone 16 Pro 128GB - Natural Titanium", "$999.00", "amazon"),
            raw("iPhone 16 Pro 128GB Natural Titanium (Unlocked)", "$1,049.00", "ebay"),
            raw("Apple iPhone 16 Pro 128GB - Natural Titanium", "price on request", "walmart"),
            raw("Apple iPhone 16 Pro Max 256GB Desert Titanium", "$1,399.00", "bestbuy")
        );

        ConsolidationResult result = consolidator.consolidate(offers, "iPhone 16 Pro", "USD");

        assertThat(result.droppedOffers()).isEqualTo(1);
        assertThat(result.groupCount()).isEqualTo(2);
        assertThat(result.ranked()).hasSize(2);
        assertThat(result.ranked()).extracting(NormalizedOffer::getFinalRank).containsExactly(1, 2);
        assertThat(result.ranked()).extracting(NormalizedOffer::getSource).contains("bestbuy");
        assertThat(result.ranked()).allMatch(offer -> offer.getDuplicateGroupId() != null);
    }

    @Test
    public void shouldReportOfferInSourceCurrencyWhenConversionFails() {
        ConsolidationResult result = consolidator.consolidate(
            List.of(raw("Apple iPhone 16 Pro 128GB", "£899", "currys")), "iPhone 16 Pro", "USD");

        assertThat(result.ranked()).hasSize(1);
        NormalizedOffer offer = result.ranked().get(0);
        assertThat(offer.getNormalizedCurrency()).isEqualTo("GBP");
        assertThat(offer.getNormalizedPrice()).isEqualTo(899.0);
    }

    @Test
    public void shouldReturnEmptyForNoOffers() {
        ConsolidationResult result = consolidator.consolidate(List.of(), "iPhone 16 Pro", "USD");

        assertThat(result.ranked()).isEmpty();
        assertThat(result.droppedOffers()).isZero();
    }

    private static RawOffer raw(String name, String price, String source) {
        return RawOffer.builder()
            .link("https://" + source + ".example.com/p")
            .price(price)
            .productName(name)
            .source(source)
            .build();
    }

}
