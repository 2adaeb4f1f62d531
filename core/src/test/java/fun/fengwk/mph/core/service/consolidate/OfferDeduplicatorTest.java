package fun.fengwk.mph.core.service.consolidate;

import fun.fengwk.mph.core.provider.RawOffer;
import fun.fengwk.mph.core.service.matching.FeatureExtractor;
import fun.fengwk.mph.core.service.matching.MatchingProperties;
import fun.fengwk.mph.core.service.matching.ProductSimilarityScorer;
import fun.fengwk.mph.core.service.pricing.NormalizedOffer;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class OfferDeduplicatorTest {

    private static final String QUERY = "iPhone 16 Pro";
    private static final String NAME_X = "Apple iPhone 16 Pro 128GB - Natural Titanium";
    private static final String NAME_Y = "iPhone 16 Pro 128GB Natural Titanium (Unlocked)";

    private final ProductSimilarityScorer scorer =
        new ProductSimilarityScorer(new FeatureExtractor(), new MatchingProperties());
    private final OfferDeduplicator deduplicator = new OfferDeduplicator(scorer);

    @Test
    public void shouldMergeSameProductWithClosePrices() {
        NormalizedOffer x = offer(NAME_X, 999, "x", 0.9);
        NormalizedOffer y = offer(NAME_Y, 1049, "y", 0.8);

        List<DuplicateGroup> groups = deduplicator.group(List.of(x, y), QUERY);

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).representative()).isSameAs(x);
        assertThat(groups.get(0).members()).containsExactly(x, y);
        assertThat(x.getDuplicateGroupId()).isEqualTo(y.getDuplicateGroupId());
        assertThat(x.getDuplicateGroupId()).isEqualTo(DigestUtils.md5Hex(NAME_X).substring(0, 8));
    }

    @Test
    public void shouldKeepSameProductWithDistantPricesApart() {
        NormalizedOffer x = offer(NAME_X, 999, "x", 0.9);
        NormalizedOffer y = offer(NAME_Y, 2000, "y", 0.8);

        List<DuplicateGroup> groups = deduplicator.group(List.of(x, y), QUERY);

        assertThat(groups).hasSize(2);
        assertThat(x.getDuplicateGroupId()).isNotEqualTo(y.getDuplicateGroupId());
    }

    @Test
    public void shouldPickMostRelevantThenCheapestRepresentative() {
        NormalizedOffer first = offer(NAME_X, 1049, "a", 0.7);
        NormalizedOffer cheaper = offer(NAME_Y, 999, "b", 0.9);
        NormalizedOffer pricier = offer(NAME_Y, 1029, "c", 0.9);

        List<DuplicateGroup> groups = deduplicator.group(List.of(first, pricier, cheaper), QUERY);

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).representative()).isSameAs(cheaper);
        assertThat(groups.get(0).members()).containsExactly(first, pricier, cheaper);
    }

    @Test
    public void shouldPartitionAllOffers() {
        List<NormalizedOffer> offers = List.of(
            offer(NAME_X, 999, "a", 0.9),
            offer("Samsung Galaxy S24 Ultra 256GB Titanium Black", 1499, "b", 0.3),
            offer(NAME_Y, 1049, "c", 0.8),
            offer("Google Pixel 9 Pro 128GB Obsidian", 499, "d", 0.3),
            offer("Samsung Galaxy S24 Ultra 256GB Titanium Black (Unlocked)", 1479, "e", 0.3)
        );

        List<DuplicateGroup> groups = deduplicator.group(offers, QUERY);

        int members = groups.stream().mapToInt(group -> group.members().size()).sum();
        Set<NormalizedOffer> seen = new HashSet<>();
        groups.forEach(group -> seen.addAll(group.members()));
        assertThat(members).isEqualTo(offers.size());
        assertThat(seen).hasSize(offers.size());
        assertThat(groups).hasSize(3);
        assertThat(groups.stream().map(DuplicateGroup::id).distinct().count()).isEqualTo(3);
        for (DuplicateGroup group : groups) {
            assertThat(group.members()).allMatch(member -> group.id().equals(member.getDuplicateGroupId()));
        }
    }

    @Test
    public void shouldSuffixCollidingGroupIds() {
        NormalizedOffer cheap = offer(NAME_X, 100, "a", 0.9);
        NormalizedOffer expensive = offer(NAME_X, 1000, "b", 0.9);

        List<DuplicateGroup> groups = deduplicator.group(List.of(cheap, expensive), QUERY);

        String baseId = DigestUtils.md5Hex(NAME_X).substring(0, 8);
        assertThat(groups).extracting(DuplicateGroup::id).containsExactly(baseId, baseId + "-2");
    }

    static NormalizedOffer offer(String name, double price, String source, double relevance) {
        RawOffer raw = RawOffer.builder()
            .link("https://" + source + ".example.com/p")
            .price(String.valueOf(price))
            .currency("USD")
            .productName(name)
            .source(source)
            .build();
        NormalizedOffer offer = NormalizedOffer.builder()
            .rawOffer(raw)
            .normalizedPrice(price)
            .normalizedCurrency("USD")
            .originalAmount(price)
            .originalCurrency("USD")
            .build();
        offer.setSimilarityScore(relevance);
        return offer;
    }

}
